package com.affiliate.autopilot.pipeline.model;

import java.time.Instant;

public record Keyword(
    long id,
    String keyword,
    String status,
    Long campaignId,
    Long affiliateProgramId,
    Instant lastScannedAt,
    Instant dateAdded
) {
    public boolean isActive() {
        return "active".equalsIgnoreCase(status);
    }
}
