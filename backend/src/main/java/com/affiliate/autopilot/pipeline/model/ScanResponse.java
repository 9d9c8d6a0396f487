package com.affiliate.autopilot.pipeline.model;

public record ScanResponse(
    boolean success,
    KeywordScanSummary scan,
    int queuedCount
) {
}
