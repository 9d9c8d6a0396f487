package com.affiliate.autopilot.pipeline.model;

import java.time.Instant;
import java.util.Map;

public record Activity(
    long id,
    Long campaignId,
    String type,
    String message,
    Map<String, Object> details,
    Instant createdAt
) {
}
