package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.model.DiscoveryResult;
import com.affiliate.autopilot.pipeline.model.Keyword;
import com.affiliate.autopilot.pipeline.model.KeywordScanSummary;
import com.affiliate.autopilot.pipeline.persistence.KeywordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class KeywordScanService {
    private static final Logger log = LoggerFactory.getLogger(KeywordScanService.class);

    private final KeywordRepository keywordRepository;
    private final OpportunityDiscoveryService discoveryService;
    private final AutopilotProperties properties;

    public KeywordScanService(
        KeywordRepository keywordRepository,
        OpportunityDiscoveryService discoveryService,
        AutopilotProperties properties
    ) {
        this.keywordRepository = keywordRepository;
        this.discoveryService = discoveryService;
        this.properties = properties;
    }

    /**
     * Runs discovery for up to {@code limit} active keywords, least recently scanned first.
     * A failing keyword is logged and skipped; a storage outage aborts the batch.
     */
    public KeywordScanSummary scanKeywords(int limit) {
        List<Keyword> keywords = keywordRepository.findActiveForScan(limit);
        int processed = 0;
        int created = 0;
        int duplicates = 0;
        int failed = 0;
        int delayMs = properties.getPipeline().getKeywordDelayMs();
        for (int i = 0; i < keywords.size(); i++) {
            Keyword keyword = keywords.get(i);
            try {
                DiscoveryResult result = discoveryService.discover(keyword);
                created += result.created().size();
                duplicates += result.duplicatesSkipped();
                processed++;
            } catch (DataAccessResourceFailureException e) {
                throw e;
            } catch (Exception e) {
                failed++;
                log.warn("Keyword scan failed for '{}'", keyword.keyword(), e);
            }
            if (i < keywords.size() - 1 && !pause(delayMs)) {
                log.info("Keyword scan interrupted after {} keywords", i + 1);
                break;
            }
        }
        KeywordScanSummary summary = new KeywordScanSummary(processed, created, duplicates, failed);
        log.info("Keyword scan finished: {}", summary);
        return summary;
    }

    private boolean pause(int delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
