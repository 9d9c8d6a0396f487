package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.pipeline.model.EngagementStats;
import com.affiliate.autopilot.pipeline.model.ScheduledPost;
import com.affiliate.autopilot.pipeline.persistence.ScheduledPostRepository;
import com.affiliate.autopilot.pipeline.platform.PlatformClient;
import com.affiliate.autopilot.pipeline.ratelimit.TokenBucketRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class EngagementRefreshService {
    private static final Logger log = LoggerFactory.getLogger(EngagementRefreshService.class);

    private final ScheduledPostRepository postRepository;
    private final PlatformClient platformClient;
    private final TokenBucketRateLimiter rateLimiter;

    public EngagementRefreshService(
        ScheduledPostRepository postRepository,
        PlatformClient platformClient,
        TokenBucketRateLimiter rateLimiter
    ) {
        this.postRepository = postRepository;
        this.platformClient = platformClient;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Refreshes counters for every published post. Each read costs one rate-limit token and
     * the pass stops as soon as the bucket is empty.
     *
     * @return number of posts whose counters were updated
     */
    public int refreshAll() {
        List<ScheduledPost> posts = postRepository.findPostedWithExternalId();
        int refreshed = 0;
        for (ScheduledPost post : posts) {
            if (!rateLimiter.tryAcquire()) {
                log.info("Rate limit reached; engagement refresh stopped after {} of {} posts", refreshed, posts.size());
                break;
            }
            try {
                EngagementStats stats = platformClient.fetchEngagement(post.externalPostId());
                if (stats != null) {
                    postRepository.updateEngagement(post.id(), stats);
                    refreshed++;
                }
            } catch (DataAccessResourceFailureException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Engagement refresh failed for post {}", post.id(), e);
            }
        }
        log.info("Engagement refresh updated {} posts", refreshed);
        return refreshed;
    }
}
