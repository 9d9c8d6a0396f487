package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.model.KeywordScanSummary;
import com.affiliate.autopilot.pipeline.model.ProcessingSummary;
import com.affiliate.autopilot.pipeline.model.ScanResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Entry points for the discovery pipeline, both on demand and on the nightly schedule.
 */
@Service
public class OpportunityPipelineService {
    private static final Logger log = LoggerFactory.getLogger(OpportunityPipelineService.class);

    private final KeywordScanService keywordScanService;
    private final OpportunityQueueService queueService;
    private final AutopilotProperties properties;

    public OpportunityPipelineService(
        KeywordScanService keywordScanService,
        OpportunityQueueService queueService,
        AutopilotProperties properties
    ) {
        this.keywordScanService = keywordScanService;
        this.queueService = queueService;
        this.properties = properties;
    }

    /**
     * Scans keywords and, when anything new turned up, promotes the best opportunities.
     */
    public ScanResponse scanAndPromote(int keywordLimit) {
        KeywordScanSummary summary = keywordScanService.scanKeywords(keywordLimit);
        int queued = summary.opportunitiesCreated() > 0 ? queueService.promoteTopOpportunities() : 0;
        return new ScanResponse(true, summary, queued);
    }

    public ProcessingSummary processQueue() {
        return queueService.processQueuedOpportunities();
    }

    @Scheduled(cron = "${autopilot.pipeline.scan-cron:0 0 3 * * *}", zone = "${autopilot.zone:UTC}")
    public void scheduledKeywordScan() {
        try {
            ScanResponse response = scanAndPromote(properties.getPipeline().getKeywordScanLimit());
            log.info("Nightly keyword scan queued {} opportunities", response.queuedCount());
        } catch (Exception e) {
            log.error("Nightly keyword scan failed", e);
        }
    }

    @Scheduled(cron = "${autopilot.pipeline.process-cron:0 0 4 * * *}", zone = "${autopilot.zone:UTC}")
    public void scheduledQueueProcessing() {
        try {
            ProcessingSummary summary = processQueue();
            log.info("Nightly queue processing finished: {}", summary);
        } catch (Exception e) {
            log.error("Nightly queue processing failed", e);
        }
    }
}
