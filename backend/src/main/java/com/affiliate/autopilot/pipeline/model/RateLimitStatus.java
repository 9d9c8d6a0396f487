package com.affiliate.autopilot.pipeline.model;

import java.time.Instant;

public record RateLimitStatus(
    int used,
    int limit,
    Instant resetTime,
    double remainingPercent
) {
}
