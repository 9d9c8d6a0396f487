package com.affiliate.autopilot.pipeline.model;

public record KeywordScanSummary(
    int keywordsProcessed,
    int opportunitiesCreated,
    int duplicatesSkipped,
    int keywordsFailed
) {
}
