package com.affiliate.autopilot.pipeline.model;

import java.util.List;

public record DiscoveryResult(
    List<Opportunity> created,
    int duplicatesSkipped
) {
}
