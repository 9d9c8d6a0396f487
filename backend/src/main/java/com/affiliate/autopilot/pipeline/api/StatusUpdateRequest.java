package com.affiliate.autopilot.pipeline.api;

public record StatusUpdateRequest(String status) {
}
