package com.affiliate.autopilot.pipeline.model;

public record EngagementStats(
    int upvotes,
    int downvotes,
    int commentCount
) {
}
