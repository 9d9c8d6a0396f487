package com.affiliate.autopilot.pipeline.model;

import java.time.Instant;

public record SchedulerStatusResponse(
    boolean running,
    int activeJobs,
    Instant nextFireAt,
    RateLimitStatus rateLimit
) {
}
