package com.affiliate.autopilot.pipeline.model;

import java.util.List;

public record AffiliateProgram(
    long id,
    String name,
    String category,
    List<String> tags,
    boolean active
) {
}
