package com.affiliate.autopilot.pipeline.model;

import java.time.Instant;

public record ContentQueueItem(
    long id,
    Long opportunityId,
    Long campaignId,
    ActionType itemType,
    String community,
    String targetUrl,
    String content,
    Instant scheduledFor,
    ContentQueueStatus status,
    String externalPostId,
    Instant dateCreated,
    Instant datePosted
) {
}
