package com.affiliate.autopilot.pipeline.ratelimit;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.model.RateLimitStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Shared token bucket for outbound platform calls. The bucket refills to capacity once the
 * interval since the last reset has elapsed; {@link #tryAcquire()} never blocks.
 */
@Component
public class TokenBucketRateLimiter {
    private final int capacity;
    private final Duration interval;
    private final Clock clock;

    private int tokens;
    private Instant resetAt;

    @Autowired
    public TokenBucketRateLimiter(AutopilotProperties properties, Clock clock) {
        this(properties.getRateLimit().getCapacity(), properties.getRateLimit().getInterval(), clock);
    }

    public TokenBucketRateLimiter(int capacity, Duration interval, Clock clock) {
        this.capacity = Math.max(1, capacity);
        this.interval = interval;
        this.clock = clock;
        this.tokens = this.capacity;
        this.resetAt = clock.instant().plus(interval);
    }

    public synchronized boolean tryAcquire() {
        refillIfDue();
        if (tokens <= 0) {
            return false;
        }
        tokens--;
        return true;
    }

    public synchronized RateLimitStatus status() {
        refillIfDue();
        int used = capacity - tokens;
        double remainingPercent = Math.round(tokens * 1000.0 / capacity) / 10.0;
        return new RateLimitStatus(used, capacity, resetAt, remainingPercent);
    }

    public synchronized int availableTokens() {
        refillIfDue();
        return tokens;
    }

    private void refillIfDue() {
        Instant now = clock.instant();
        if (now.isBefore(resetAt)) {
            return;
        }
        tokens = capacity;
        resetAt = now.plus(interval);
    }
}
