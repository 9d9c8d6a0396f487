package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.pipeline.model.ActivityType;
import com.affiliate.autopilot.pipeline.model.PostStatus;
import com.affiliate.autopilot.pipeline.model.PublishOutcome;
import com.affiliate.autopilot.pipeline.model.PublishResult;
import com.affiliate.autopilot.pipeline.model.ScheduledPost;
import com.affiliate.autopilot.pipeline.persistence.ActivityRepository;
import com.affiliate.autopilot.pipeline.persistence.ScheduledPostRepository;
import com.affiliate.autopilot.pipeline.platform.PlatformClient;
import com.affiliate.autopilot.pipeline.ratelimit.TokenBucketRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes one scheduled post. Timers and the recovery sweep both come through
 * {@link #executePublish(long)}; a post already being published is skipped.
 */
@Service
public class PostPublisher {
    private static final Logger log = LoggerFactory.getLogger(PostPublisher.class);
    static final String RATE_LIMITED_ERROR = "rate_limited";

    private final ScheduledPostRepository postRepository;
    private final ActivityRepository activityRepository;
    private final PlatformClient platformClient;
    private final TokenBucketRateLimiter rateLimiter;
    private final Clock clock;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public PostPublisher(
        ScheduledPostRepository postRepository,
        ActivityRepository activityRepository,
        PlatformClient platformClient,
        TokenBucketRateLimiter rateLimiter,
        Clock clock
    ) {
        this.postRepository = postRepository;
        this.activityRepository = activityRepository;
        this.platformClient = platformClient;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    public PublishOutcome executePublish(long postId) {
        if (!inFlight.add(postId)) {
            log.debug("Post {} is already being published", postId);
            return PublishOutcome.SKIPPED;
        }
        try {
            ScheduledPost post = postRepository.findById(postId);
            if (post == null || post.status() != PostStatus.SCHEDULED) {
                log.debug("Post {} is no longer scheduled; skipping publish", postId);
                return PublishOutcome.SKIPPED;
            }
            if (!rateLimiter.tryAcquire()) {
                fail(post, RATE_LIMITED_ERROR);
                return PublishOutcome.RATE_LIMITED;
            }
            PublishResult result = callPlatform(post);
            if (!result.success()) {
                fail(post, formatError(result));
                return PublishOutcome.FAILED;
            }
            postRepository.markPosted(postId, result.externalId(), clock.instant());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("postId", postId);
            details.put("externalPostId", result.externalId());
            details.put("community", post.community());
            activityRepository.record(post.campaignId(), ActivityType.POST_PUBLISHED, "Published \"" + post.title() + "\"", details);
            log.info("Published post {} to r/{} as {}", postId, post.community(), result.externalId());
            return PublishOutcome.PUBLISHED;
        } finally {
            inFlight.remove(postId);
        }
    }

    private PublishResult callPlatform(ScheduledPost post) {
        try {
            return platformClient.createPost(post.community(), post.title(), post.content());
        } catch (RuntimeException e) {
            log.warn("Platform call for post {} threw", post.id(), e);
            return PublishResult.failure("platform_error", e.getMessage());
        }
    }

    private void fail(ScheduledPost post, String error) {
        postRepository.markFailed(post.id(), error);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("postId", post.id());
        details.put("error", error);
        activityRepository.record(post.campaignId(), ActivityType.POST_FAILED, "Failed to publish \"" + post.title() + "\"", details);
        log.warn("Publishing post {} failed: {}", post.id(), error);
    }

    private static String formatError(PublishResult result) {
        String code = result.errorCode() == null ? "publish_failed" : result.errorCode();
        if (result.error() == null || result.error().isBlank()) {
            return code;
        }
        return code + ": " + result.error();
    }
}
