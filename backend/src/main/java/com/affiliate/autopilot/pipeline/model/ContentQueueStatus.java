package com.affiliate.autopilot.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContentQueueStatus {
    PENDING,
    SCHEDULED,
    POSTED,
    FAILED;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ContentQueueStatus fromDbValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
