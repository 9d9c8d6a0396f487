package com.affiliate.autopilot.pipeline.model;

import com.affiliate.autopilot.pipeline.schedule.PostingSchedule;

import java.time.Instant;
import java.util.List;

public record Campaign(
    long id,
    String name,
    Long affiliateProgramId,
    String status,
    Instant startDate,
    List<String> targetCommunities,
    PostingSchedule schedule
) {
    public boolean isActive() {
        return "active".equalsIgnoreCase(status);
    }

    public boolean targets(String community) {
        String wanted = CommunityNames.normalize(community);
        if (wanted.isEmpty() || targetCommunities == null) {
            return false;
        }
        return targetCommunities.stream()
            .map(CommunityNames::normalize)
            .anyMatch(wanted::equals);
    }
}
