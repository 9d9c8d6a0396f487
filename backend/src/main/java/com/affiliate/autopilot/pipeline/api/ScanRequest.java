package com.affiliate.autopilot.pipeline.api;

public record ScanRequest(Integer keywordLimit) {
}
