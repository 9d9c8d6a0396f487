package com.affiliate.autopilot.pipeline.model;

import java.time.Instant;

public record Opportunity(
    long id,
    long keywordId,
    String keyword,
    String url,
    String title,
    String snippet,
    String community,
    int discoveryRank,
    ThreadIntent intent,
    int opportunityScore,
    ActionType actionType,
    OpportunityStatus status,
    Long affiliateProgramId,
    Instant dateDiscovered,
    Instant dateProcessed
) {
}
