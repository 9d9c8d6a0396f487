package com.affiliate.autopilot.pipeline.api;

import java.util.List;

public record CampaignScheduleRequest(List<Long> postIds) {
}
