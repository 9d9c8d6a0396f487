package com.affiliate.autopilot.pipeline.model;

public record OpportunityRanking(
    Opportunity opportunity,
    int affinityScore,
    boolean categoryMatch,
    String bestApproach,
    int urgency,
    String sentiment,
    String rationale
) {
}
