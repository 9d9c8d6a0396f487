package com.affiliate.autopilot.pipeline.service;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * An armed publish timer. {@code generation} tells a firing timer whether it is still the
 * registered job for its post.
 */
record ScheduledJob(long postId, Instant fireAt, ScheduledFuture<?> future, long generation) {

    void cancel() {
        future.cancel(false);
    }
}
