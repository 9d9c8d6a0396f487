package com.affiliate.autopilot.pipeline.api;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.model.Opportunity;
import com.affiliate.autopilot.pipeline.model.OpportunityRanking;
import com.affiliate.autopilot.pipeline.model.OpportunityStatus;
import com.affiliate.autopilot.pipeline.model.ProcessingSummary;
import com.affiliate.autopilot.pipeline.model.ScanResponse;
import com.affiliate.autopilot.pipeline.service.OpportunityPipelineService;
import com.affiliate.autopilot.pipeline.service.OpportunityQueueService;
import com.affiliate.autopilot.pipeline.service.OpportunityRankingService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/opportunities")
public class OpportunityController {
    private static final int DEFAULT_LIST_LIMIT = 50;
    private static final int MAX_LIST_LIMIT = 500;

    private final OpportunityPipelineService pipelineService;
    private final OpportunityQueueService queueService;
    private final OpportunityRankingService rankingService;
    private final AutopilotProperties properties;

    public OpportunityController(
        OpportunityPipelineService pipelineService,
        OpportunityQueueService queueService,
        OpportunityRankingService rankingService,
        AutopilotProperties properties
    ) {
        this.pipelineService = pipelineService;
        this.queueService = queueService;
        this.rankingService = rankingService;
        this.properties = properties;
    }

    @PostMapping("/scan")
    public ScanResponse scan(@RequestBody(required = false) ScanRequest request) {
        Integer requested = request == null ? null : request.keywordLimit();
        int limit = requested == null || requested <= 0
            ? properties.getPipeline().getDefaultManualScanLimit()
            : requested;
        return pipelineService.scanAndPromote(limit);
    }

    @PostMapping("/promote")
    public Map<String, Integer> promote() {
        return Map.of("queuedCount", queueService.promoteTopOpportunities());
    }

    @PostMapping("/process")
    public ProcessingSummary process() {
        return pipelineService.processQueue();
    }

    @GetMapping
    public List<Opportunity> list(
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return queueService.list(parseStatus(status), clampLimit(limit));
    }

    @GetMapping("/top")
    public List<Opportunity> top(@RequestParam(name = "limit", required = false) Integer limit) {
        return queueService.top(limit == null ? 10 : clampLimit(limit));
    }

    @PatchMapping("/{id}/status")
    public Opportunity updateStatus(@PathVariable("id") long id, @RequestBody StatusUpdateRequest request) {
        OpportunityStatus target = parseStatus(request == null ? null : request.status());
        if (target == null) {
            throw new ResponseStatusException(BAD_REQUEST, "status is required");
        }
        Opportunity updated = queueService.transition(id, target);
        if (updated == null) {
            throw new ResponseStatusException(NOT_FOUND, "Opportunity not found: " + id);
        }
        return updated;
    }

    @GetMapping("/rank/{campaignId}")
    public List<OpportunityRanking> rank(
        @PathVariable("campaignId") long campaignId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        List<OpportunityRanking> rankings = rankingService.rankForCampaign(campaignId, limit == null ? 10 : clampLimit(limit));
        if (rankings == null) {
            throw new ResponseStatusException(NOT_FOUND, "Campaign not found: " + campaignId);
        }
        return rankings;
    }

    private OpportunityStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return OpportunityStatus.fromDbValue(status);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported status value: " + status);
        }
    }

    private int clampLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIST_LIMIT;
        }
        return Math.min(limit, MAX_LIST_LIMIT);
    }
}
