package com.affiliate.autopilot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "autopilot")
public class AutopilotProperties {
    private static final String DEFAULT_USER_AGENT = "affiliate-autopilot/0.1 (+contact)";

    private String zone = "UTC";
    private Platform platform = new Platform();
    private Discovery discovery = new Discovery();
    private RateLimit rateLimit = new RateLimit();
    private Scheduler scheduler = new Scheduler();
    private Pipeline pipeline = new Pipeline();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = (zone == null || zone.isBlank()) ? "UTC" : zone.trim();
    }

    public ZoneId zoneId() {
        return ZoneId.of(getZone());
    }

    public Platform getPlatform() {
        return platform;
    }

    public void setPlatform(Platform platform) {
        this.platform = platform;
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Platform {
        private String baseUrl = "https://oauth.reddit.com";
        private String accessToken;
        private String userAgent;
        private int requestTimeoutSeconds = 20;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Discovery {
        private String searchUrl = "https://www.google.com/search";
        private String siteFilter = "reddit.com";
        private int resultsPerKeyword = 10;

        public String getSearchUrl() {
            return searchUrl;
        }

        public void setSearchUrl(String searchUrl) {
            this.searchUrl = searchUrl;
        }

        public String getSiteFilter() {
            return siteFilter;
        }

        public void setSiteFilter(String siteFilter) {
            this.siteFilter = siteFilter;
        }

        public int getResultsPerKeyword() {
            return Math.max(1, resultsPerKeyword);
        }

        public void setResultsPerKeyword(int resultsPerKeyword) {
            this.resultsPerKeyword = Math.max(1, resultsPerKeyword);
        }
    }

    public static class RateLimit {
        private int capacity = 100;
        private Duration interval = Duration.ofHours(1);

        public int getCapacity() {
            return Math.max(1, capacity);
        }

        public void setCapacity(int capacity) {
            this.capacity = Math.max(1, capacity);
        }

        public Duration getInterval() {
            if (interval == null || interval.isNegative() || interval.isZero()) {
                return Duration.ofSeconds(1);
            }
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int workerThreads = 2;
        private int initialRecoveryDelaySeconds = 5;
        private int recoveryIntervalSeconds = 300;
        private int statsIntervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerThreads() {
            return Math.max(1, workerThreads);
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = Math.max(1, workerThreads);
        }

        public int getInitialRecoveryDelaySeconds() {
            return Math.max(0, initialRecoveryDelaySeconds);
        }

        public void setInitialRecoveryDelaySeconds(int initialRecoveryDelaySeconds) {
            this.initialRecoveryDelaySeconds = Math.max(0, initialRecoveryDelaySeconds);
        }

        public int getRecoveryIntervalSeconds() {
            return Math.max(1, recoveryIntervalSeconds);
        }

        public void setRecoveryIntervalSeconds(int recoveryIntervalSeconds) {
            this.recoveryIntervalSeconds = Math.max(1, recoveryIntervalSeconds);
        }

        public int getStatsIntervalSeconds() {
            return Math.max(1, statsIntervalSeconds);
        }

        public void setStatsIntervalSeconds(int statsIntervalSeconds) {
            this.statsIntervalSeconds = Math.max(1, statsIntervalSeconds);
        }
    }

    public static class Pipeline {
        private String scanCron = "0 0 3 * * *";
        private String processCron = "0 0 4 * * *";
        private int keywordScanLimit = 20;
        private int defaultManualScanLimit = 10;
        private int promoteLimit = 10;
        private int postActionThreshold = 75;
        private int keywordDelayMs = 2000;

        public String getScanCron() {
            return scanCron;
        }

        public void setScanCron(String scanCron) {
            this.scanCron = scanCron;
        }

        public String getProcessCron() {
            return processCron;
        }

        public void setProcessCron(String processCron) {
            this.processCron = processCron;
        }

        public int getKeywordScanLimit() {
            return Math.max(1, keywordScanLimit);
        }

        public void setKeywordScanLimit(int keywordScanLimit) {
            this.keywordScanLimit = Math.max(1, keywordScanLimit);
        }

        public int getDefaultManualScanLimit() {
            return Math.max(1, defaultManualScanLimit);
        }

        public void setDefaultManualScanLimit(int defaultManualScanLimit) {
            this.defaultManualScanLimit = Math.max(1, defaultManualScanLimit);
        }

        public int getPromoteLimit() {
            return Math.max(1, promoteLimit);
        }

        public void setPromoteLimit(int promoteLimit) {
            this.promoteLimit = Math.max(1, promoteLimit);
        }

        public int getPostActionThreshold() {
            return Math.max(0, Math.min(100, postActionThreshold));
        }

        public void setPostActionThreshold(int postActionThreshold) {
            this.postActionThreshold = Math.max(0, Math.min(100, postActionThreshold));
        }

        public int getKeywordDelayMs() {
            return Math.max(0, keywordDelayMs);
        }

        public void setKeywordDelayMs(int keywordDelayMs) {
            this.keywordDelayMs = Math.max(0, keywordDelayMs);
        }
    }
}
