package com.affiliate.autopilot.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActivityType {
    POST_SCHEDULED,
    POST_UNSCHEDULED,
    POST_PUBLISHED,
    POST_FAILED,
    OPPORTUNITIES_QUEUED,
    OPPORTUNITY_PROCESSED,
    OPPORTUNITY_REJECTED,
    OPPORTUNITY_STATUS_CHANGED,
    SYSTEM;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
