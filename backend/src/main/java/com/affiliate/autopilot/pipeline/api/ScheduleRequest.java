package com.affiliate.autopilot.pipeline.api;

import java.time.Instant;

public record ScheduleRequest(Instant scheduledTime) {
}
