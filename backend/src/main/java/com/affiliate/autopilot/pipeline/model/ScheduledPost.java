package com.affiliate.autopilot.pipeline.model;

import java.time.Instant;

public record ScheduledPost(
    long id,
    Long campaignId,
    String community,
    String title,
    String content,
    String postType,
    PostStatus status,
    String externalPostId,
    Instant scheduledTime,
    Instant postedTime,
    int upvotes,
    int downvotes,
    int commentCount,
    String lastError
) {
}
