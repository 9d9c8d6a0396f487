package com.affiliate.autopilot.pipeline.model;

public record ProcessingSummary(
    int considered,
    int processed,
    int rejected,
    int failed
) {
}
