package com.affiliate.autopilot.pipeline.platform;

import com.affiliate.autopilot.pipeline.model.EngagementStats;
import com.affiliate.autopilot.pipeline.model.PublishResult;

/**
 * Outbound calls to the discussion platform.
 */
public interface PlatformClient {

    PublishResult createPost(String community, String title, String content);

    /**
     * @return current counters for a published post, or null when the platform has no data
     */
    EngagementStats fetchEngagement(String externalId);
}
