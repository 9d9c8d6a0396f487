package com.affiliate.autopilot.pipeline.model;

public record NewOpportunity(
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
    Long affiliateProgramId
) {
}
