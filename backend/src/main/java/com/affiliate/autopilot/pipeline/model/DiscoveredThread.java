package com.affiliate.autopilot.pipeline.model;

public record DiscoveredThread(
    String url,
    String title,
    String snippet,
    int rank
) {
}
