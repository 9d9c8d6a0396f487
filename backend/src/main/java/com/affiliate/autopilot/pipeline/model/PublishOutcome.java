package com.affiliate.autopilot.pipeline.model;

public enum PublishOutcome {
    PUBLISHED,
    FAILED,
    RATE_LIMITED,
    SKIPPED
}
