package com.affiliate.autopilot.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionType {
    COMMENT,
    POST;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionType fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return COMMENT;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
