package com.affiliate.autopilot.pipeline.api;

import java.time.Instant;

public record PostScheduleResponse(long postId, boolean success, Instant scheduledTime) {
}
