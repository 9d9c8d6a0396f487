package com.affiliate.autopilot.pipeline.model;

public record RecoverySweepSummary(
    int due,
    int published,
    int failed,
    int skipped
) {
}
