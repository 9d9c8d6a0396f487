package com.affiliate.autopilot.pipeline.discovery;

import com.affiliate.autopilot.pipeline.model.DiscoveredThread;

import java.util.List;

public interface DiscoveryClient {

    /**
     * Threads matching {@code keyword}, ranked from 1. Upstream failures yield an empty list.
     */
    List<DiscoveredThread> search(String keyword);
}
