package com.affiliate.autopilot.pipeline.api;

import com.affiliate.autopilot.pipeline.model.Activity;
import com.affiliate.autopilot.pipeline.model.RateLimitStatus;
import com.affiliate.autopilot.pipeline.model.RecoverySweepSummary;
import com.affiliate.autopilot.pipeline.model.ScheduledPostView;
import com.affiliate.autopilot.pipeline.model.SchedulerStatusResponse;
import com.affiliate.autopilot.pipeline.persistence.ActivityRepository;
import com.affiliate.autopilot.pipeline.ratelimit.TokenBucketRateLimiter;
import com.affiliate.autopilot.pipeline.service.PostSchedulerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class SchedulerController {
    private final PostSchedulerService schedulerService;
    private final TokenBucketRateLimiter rateLimiter;
    private final ActivityRepository activityRepository;

    public SchedulerController(
        PostSchedulerService schedulerService,
        TokenBucketRateLimiter rateLimiter,
        ActivityRepository activityRepository
    ) {
        this.schedulerService = schedulerService;
        this.rateLimiter = rateLimiter;
        this.activityRepository = activityRepository;
    }

    @GetMapping("/scheduled-posts")
    public List<ScheduledPostView> scheduledPosts() {
        return schedulerService.getScheduledPosts();
    }

    @PostMapping("/posts/{id}/schedule")
    public PostScheduleResponse schedule(@PathVariable("id") long id, @RequestBody(required = false) ScheduleRequest request) {
        Instant time = requireTime(request);
        if (!schedulerService.schedulePost(id, time)) {
            throw new ResponseStatusException(NOT_FOUND, "Post not found or already posted: " + id);
        }
        return new PostScheduleResponse(id, true, time);
    }

    @PostMapping("/posts/{id}/cancel-schedule")
    public PostScheduleResponse cancel(@PathVariable("id") long id) {
        if (!schedulerService.cancelScheduledPost(id)) {
            throw new ResponseStatusException(NOT_FOUND, "No scheduled job for post: " + id);
        }
        return new PostScheduleResponse(id, true, null);
    }

    @PostMapping("/posts/{id}/reschedule")
    public PostScheduleResponse reschedule(@PathVariable("id") long id, @RequestBody(required = false) ScheduleRequest request) {
        Instant time = requireTime(request);
        if (!schedulerService.reschedulePost(id, time)) {
            throw new ResponseStatusException(NOT_FOUND, "Post not found or already posted: " + id);
        }
        return new PostScheduleResponse(id, true, time);
    }

    @PostMapping("/campaigns/{id}/schedule-posts")
    public Map<String, Integer> scheduleCampaignPosts(
        @PathVariable("id") long campaignId,
        @RequestBody(required = false) CampaignScheduleRequest request
    ) {
        if (request == null || request.postIds() == null || request.postIds().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "postIds are required");
        }
        int scheduled = schedulerService.scheduleCampaignPosts(campaignId, request.postIds());
        if (scheduled < 0) {
            throw new ResponseStatusException(NOT_FOUND, "Campaign not found: " + campaignId);
        }
        return Map.of("scheduledCount", scheduled);
    }

    @GetMapping("/rate-limit")
    public RateLimitStatus rateLimit() {
        return rateLimiter.status();
    }

    @GetMapping("/scheduler/status")
    public SchedulerStatusResponse status() {
        return schedulerService.getStatus();
    }

    @PostMapping("/scheduler/start")
    public SchedulerStatusResponse start() {
        schedulerService.start();
        return schedulerService.getStatus();
    }

    @PostMapping("/scheduler/stop")
    public SchedulerStatusResponse stop() {
        schedulerService.stop();
        return schedulerService.getStatus();
    }

    @PostMapping("/scheduler/recover")
    public RecoverySweepSummary recover() {
        return schedulerService.runRecoverySweep();
    }

    @GetMapping("/activities")
    public List<Activity> activities(@RequestParam(name = "limit", required = false) Integer limit) {
        int safeLimit = limit == null || limit <= 0 ? 20 : Math.min(limit, 200);
        return activityRepository.findRecent(safeLimit);
    }

    private Instant requireTime(ScheduleRequest request) {
        if (request == null || request.scheduledTime() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "scheduledTime is required");
        }
        return request.scheduledTime();
    }
}
