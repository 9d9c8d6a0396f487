package com.affiliate.autopilot.pipeline.model;

import java.time.Instant;

public record ScheduledPostView(
    long id,
    String title,
    Instant scheduledTime,
    String community,
    Long campaignId
) {
}
