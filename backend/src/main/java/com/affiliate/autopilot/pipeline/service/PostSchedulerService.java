package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.model.ActivityType;
import com.affiliate.autopilot.pipeline.model.Campaign;
import com.affiliate.autopilot.pipeline.model.PostStatus;
import com.affiliate.autopilot.pipeline.model.PublishOutcome;
import com.affiliate.autopilot.pipeline.model.RecoverySweepSummary;
import com.affiliate.autopilot.pipeline.model.ScheduledPost;
import com.affiliate.autopilot.pipeline.model.ScheduledPostView;
import com.affiliate.autopilot.pipeline.model.SchedulerStatusResponse;
import com.affiliate.autopilot.pipeline.persistence.ActivityRepository;
import com.affiliate.autopilot.pipeline.persistence.CampaignRepository;
import com.affiliate.autopilot.pipeline.persistence.ScheduledPostRepository;
import com.affiliate.autopilot.pipeline.ratelimit.TokenBucketRateLimiter;
import com.affiliate.autopilot.pipeline.schedule.PostingSlotCalculator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Arms one publish timer per scheduled post and runs the periodic recovery sweep and
 * engagement refresh. Timers live in memory only; the recovery sweep picks up anything
 * that was due while no timer existed.
 */
@Service
public class PostSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(PostSchedulerService.class);

    private final ScheduledPostRepository postRepository;
    private final CampaignRepository campaignRepository;
    private final ActivityRepository activityRepository;
    private final PostPublisher publisher;
    private final EngagementRefreshService engagementRefreshService;
    private final TokenBucketRateLimiter rateLimiter;
    private final PostingSlotCalculator slotCalculator;
    private final ScheduledExecutorService executor;
    private final AutopilotProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final Object jobLock = new Object();
    private final Map<Long, ScheduledJob> jobs = new HashMap<>();
    private final List<ScheduledFuture<?>> periodicTasks = new ArrayList<>();
    private long nextGeneration;

    public PostSchedulerService(
        ScheduledPostRepository postRepository,
        CampaignRepository campaignRepository,
        ActivityRepository activityRepository,
        PostPublisher publisher,
        EngagementRefreshService engagementRefreshService,
        TokenBucketRateLimiter rateLimiter,
        PostingSlotCalculator slotCalculator,
        @Qualifier("postSchedulerExecutor") ScheduledExecutorService executor,
        AutopilotProperties properties,
        Clock clock
    ) {
        this.postRepository = postRepository;
        this.campaignRepository = campaignRepository;
        this.activityRepository = activityRepository;
        this.publisher = publisher;
        this.engagementRefreshService = engagementRefreshService;
        this.rateLimiter = rateLimiter;
        this.slotCalculator = slotCalculator;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            AutopilotProperties.Scheduler config = properties.getScheduler();
            periodicTasks.add(executor.scheduleAtFixedRate(
                () -> runSafely("recovery sweep", this::runRecoverySweep),
                config.getInitialRecoveryDelaySeconds(),
                config.getRecoveryIntervalSeconds(),
                TimeUnit.SECONDS
            ));
            periodicTasks.add(executor.scheduleAtFixedRate(
                () -> runSafely("engagement refresh", engagementRefreshService::refreshAll),
                config.getStatsIntervalSeconds(),
                config.getStatsIntervalSeconds(),
                TimeUnit.SECONDS
            ));
            running.set(true);
            log.info(
                "Post scheduler started: recovery every {}s, engagement refresh every {}s",
                config.getRecoveryIntervalSeconds(),
                config.getStatsIntervalSeconds()
            );
        }
    }

    /**
     * Cancels the periodic tasks along with every timer armed so far.
     * Posts scheduled afterwards still get their own timer; {@code running} only describes
     * the periodic tasks.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            periodicTasks.forEach(task -> task.cancel(false));
            periodicTasks.clear();
            synchronized (jobLock) {
                jobs.values().forEach(ScheduledJob::cancel);
                jobs.clear();
            }
            log.info("Post scheduler stopped");
        }
    }

    /**
     * Arms a publish timer for a post, replacing any existing one. Times in the past fire
     * immediately.
     *
     * @return false when the post does not exist or was already posted
     */
    public boolean schedulePost(long postId, Instant scheduledTime) {
        if (scheduledTime == null) {
            throw new IllegalArgumentException("scheduledTime is required");
        }
        ScheduledPost post = postRepository.findById(postId);
        if (post == null || post.status() == PostStatus.POSTED) {
            return false;
        }
        synchronized (jobLock) {
            ScheduledJob existing = jobs.remove(postId);
            if (existing != null) {
                existing.cancel();
            }
            if (postRepository.markScheduled(postId, scheduledTime) == 0) {
                return false;
            }
            arm(postId, scheduledTime);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("postId", postId);
        details.put("scheduledTime", scheduledTime.toString());
        activityRepository.record(post.campaignId(), ActivityType.POST_SCHEDULED, "Scheduled \"" + post.title() + "\"", details);
        log.info("Scheduled post {} for {}", postId, scheduledTime);
        return true;
    }

    /**
     * @return false when the post does not exist or has no armed timer
     */
    public boolean cancelScheduledPost(long postId) {
        ScheduledPost post = postRepository.findById(postId);
        if (post == null) {
            return false;
        }
        synchronized (jobLock) {
            ScheduledJob job = jobs.remove(postId);
            if (job == null) {
                return false;
            }
            job.cancel();
            postRepository.markDraft(postId);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("postId", postId);
        activityRepository.record(post.campaignId(), ActivityType.POST_UNSCHEDULED, "Unscheduled \"" + post.title() + "\"", details);
        log.info("Cancelled schedule for post {}", postId);
        return true;
    }

    public boolean reschedulePost(long postId, Instant newTime) {
        cancelScheduledPost(postId);
        return schedulePost(postId, newTime);
    }

    public List<ScheduledPostView> getScheduledPosts() {
        return postRepository.findScheduled().stream()
            .map(post -> new ScheduledPostView(
                post.id(),
                post.title(),
                post.scheduledTime(),
                post.community(),
                post.campaignId()
            ))
            .toList();
    }

    /**
     * Spreads posts over a campaign's posting slots in the given order. Returns -1 when the
     * campaign does not exist.
     */
    public int scheduleCampaignPosts(long campaignId, List<Long> postIds) {
        Campaign campaign = campaignRepository.findById(campaignId);
        if (campaign == null) {
            return -1;
        }
        int scheduled = 0;
        for (Long postId : postIds == null ? List.<Long>of() : postIds) {
            if (postId == null) {
                continue;
            }
            Instant slot = slotCalculator.nextSlot(campaign, scheduled);
            if (schedulePost(postId, slot)) {
                scheduled++;
            }
        }
        return scheduled;
    }

    /**
     * Publishes every scheduled post whose time has passed, oldest first, dropping any timer
     * still armed for it.
     */
    public RecoverySweepSummary runRecoverySweep() {
        List<ScheduledPost> due = postRepository.findDueScheduled(clock.instant());
        int published = 0;
        int failed = 0;
        int skipped = 0;
        for (ScheduledPost post : due) {
            synchronized (jobLock) {
                ScheduledJob job = jobs.remove(post.id());
                if (job != null) {
                    job.cancel();
                }
            }
            PublishOutcome outcome = publisher.executePublish(post.id());
            if (outcome == PublishOutcome.PUBLISHED) {
                published++;
            } else if (outcome == PublishOutcome.SKIPPED) {
                skipped++;
            } else {
                failed++;
            }
        }
        if (!due.isEmpty()) {
            log.info("Recovery sweep handled {} due posts: {} published, {} failed", due.size(), published, failed);
        }
        return new RecoverySweepSummary(due.size(), published, failed, skipped);
    }

    public int refreshEngagement() {
        return engagementRefreshService.refreshAll();
    }

    public SchedulerStatusResponse getStatus() {
        int activeJobs;
        Instant nextFireAt;
        synchronized (jobLock) {
            activeJobs = jobs.size();
            nextFireAt = jobs.values().stream()
                .map(ScheduledJob::fireAt)
                .min(Instant::compareTo)
                .orElse(null);
        }
        return new SchedulerStatusResponse(running.get(), activeJobs, nextFireAt, rateLimiter.status());
    }

    public boolean hasJob(long postId) {
        synchronized (jobLock) {
            return jobs.containsKey(postId);
        }
    }

    public int activeJobCount() {
        synchronized (jobLock) {
            return jobs.size();
        }
    }

    // Caller holds jobLock.
    private void arm(long postId, Instant fireAt) {
        long generation = ++nextGeneration;
        long delayMs = Math.max(0L, Duration.between(clock.instant(), fireAt).toMillis());
        ScheduledFuture<?> future = executor.schedule(
            () -> fire(postId, generation),
            delayMs,
            TimeUnit.MILLISECONDS
        );
        jobs.put(postId, new ScheduledJob(postId, fireAt, future, generation));
    }

    private void fire(long postId, long generation) {
        synchronized (jobLock) {
            ScheduledJob current = jobs.get(postId);
            if (current == null || current.generation() != generation) {
                return;
            }
            jobs.remove(postId);
        }
        try {
            PublishOutcome outcome = publisher.executePublish(postId);
            log.debug("Timer for post {} finished with {}", postId, outcome);
        } catch (Exception e) {
            log.warn("Scheduled publish failed for post {}", postId, e);
        }
    }

    private void runSafely(String taskName, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.warn("Post scheduler {} failed", taskName, e);
        }
    }
}
