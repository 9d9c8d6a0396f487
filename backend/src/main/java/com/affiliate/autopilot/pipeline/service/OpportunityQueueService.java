package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.model.ActivityType;
import com.affiliate.autopilot.pipeline.model.Campaign;
import com.affiliate.autopilot.pipeline.model.ContentQueueStatus;
import com.affiliate.autopilot.pipeline.model.Opportunity;
import com.affiliate.autopilot.pipeline.model.OpportunityStatus;
import com.affiliate.autopilot.pipeline.model.ProcessingSummary;
import com.affiliate.autopilot.pipeline.persistence.ActivityRepository;
import com.affiliate.autopilot.pipeline.persistence.CampaignRepository;
import com.affiliate.autopilot.pipeline.persistence.ContentQueueRepository;
import com.affiliate.autopilot.pipeline.persistence.OpportunityRepository;
import com.affiliate.autopilot.pipeline.schedule.PostingSlotCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves opportunities through their lifecycle: promotion of the best new ones into the
 * queue, matching queued ones to campaigns, and manual status changes.
 */
@Service
public class OpportunityQueueService {
    private static final Logger log = LoggerFactory.getLogger(OpportunityQueueService.class);
    private static final int PROCESS_BATCH_LIMIT = 500;
    private static final String PLACEHOLDER_CONTENT = "Content pending generation";

    private final OpportunityRepository opportunityRepository;
    private final CampaignRepository campaignRepository;
    private final ContentQueueRepository contentQueueRepository;
    private final ActivityRepository activityRepository;
    private final PostingSlotCalculator slotCalculator;
    private final TransactionTemplate transactionTemplate;
    private final AutopilotProperties properties;
    private final Clock clock;

    public OpportunityQueueService(
        OpportunityRepository opportunityRepository,
        CampaignRepository campaignRepository,
        ContentQueueRepository contentQueueRepository,
        ActivityRepository activityRepository,
        PostingSlotCalculator slotCalculator,
        TransactionTemplate transactionTemplate,
        AutopilotProperties properties,
        Clock clock
    ) {
        this.opportunityRepository = opportunityRepository;
        this.campaignRepository = campaignRepository;
        this.contentQueueRepository = contentQueueRepository;
        this.activityRepository = activityRepository;
        this.slotCalculator = slotCalculator;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Queues the highest scoring {@code new} opportunities. Running it again without new
     * discoveries promotes nothing.
     *
     * @return number of opportunities moved to {@code queued}
     */
    public int promoteTopOpportunities() {
        int limit = properties.getPipeline().getPromoteLimit();
        List<Opportunity> candidates = opportunityRepository.findByStatus(OpportunityStatus.NEW, limit);
        int promoted = 0;
        for (Opportunity opportunity : candidates) {
            promoted += opportunityRepository.updateStatus(
                opportunity.id(),
                OpportunityStatus.NEW,
                OpportunityStatus.QUEUED,
                null
            );
        }
        if (promoted > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("count", promoted);
            activityRepository.record(null, ActivityType.OPPORTUNITIES_QUEUED, "Queued " + promoted + " top opportunities", details);
        }
        log.info("Promoted {} of {} new opportunities", promoted, candidates.size());
        return promoted;
    }

    public ProcessingSummary processQueuedOpportunities() {
        List<Opportunity> queued = opportunityRepository.findByStatus(OpportunityStatus.QUEUED, PROCESS_BATCH_LIMIT);
        if (queued.isEmpty()) {
            return new ProcessingSummary(0, 0, 0, 0);
        }
        List<Campaign> campaigns = campaignRepository.findActive();
        Map<Long, Integer> createdPerCampaign = new HashMap<>();
        int processed = 0;
        int rejected = 0;
        int failed = 0;
        for (Opportunity opportunity : queued) {
            try {
                Campaign campaign = transactionTemplate.execute(
                    status -> processOne(opportunity, campaigns, createdPerCampaign)
                );
                if (campaign == null) {
                    rejected++;
                } else {
                    createdPerCampaign.merge(campaign.id(), 1, Integer::sum);
                    processed++;
                }
            } catch (DataAccessResourceFailureException e) {
                throw e;
            } catch (Exception e) {
                failed++;
                log.warn("Failed to process opportunity {}", opportunity.id(), e);
            }
        }
        ProcessingSummary summary = new ProcessingSummary(queued.size(), processed, rejected, failed);
        log.info("Processed queued opportunities: {}", summary);
        return summary;
    }

    /**
     * @return the campaign the opportunity was assigned to, or null when it was rejected
     */
    private Campaign processOne(Opportunity opportunity, List<Campaign> campaigns, Map<Long, Integer> createdPerCampaign) {
        Instant now = clock.instant();
        Campaign campaign = campaigns.stream()
            .filter(candidate -> candidate.targets(opportunity.community()))
            .findFirst()
            .orElse(null);
        if (campaign == null) {
            requireTransition(opportunity, OpportunityStatus.REJECTED, now);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("opportunityId", opportunity.id());
            details.put("community", opportunity.community());
            activityRepository.record(
                null,
                ActivityType.OPPORTUNITY_REJECTED,
                "No active campaign targets r/" + opportunity.community(),
                details
            );
            return null;
        }

        int offset = createdPerCampaign.getOrDefault(campaign.id(), 0);
        Instant scheduledFor = slotCalculator.nextSlot(campaign, offset);
        long itemId = contentQueueRepository.insert(
            opportunity.id(),
            campaign.id(),
            opportunity.actionType(),
            opportunity.community(),
            opportunity.url(),
            PLACEHOLDER_CONTENT,
            scheduledFor,
            ContentQueueStatus.SCHEDULED
        );
        requireTransition(opportunity, OpportunityStatus.PROCESSED, now);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("opportunityId", opportunity.id());
        details.put("contentQueueId", itemId);
        details.put("scheduledFor", scheduledFor.toString());
        details.put("actionType", opportunity.actionType().dbValue());
        activityRepository.record(
            campaign.id(),
            ActivityType.OPPORTUNITY_PROCESSED,
            "Scheduled " + opportunity.actionType().dbValue() + " for r/" + opportunity.community(),
            details
        );
        return campaign;
    }

    /**
     * Applies a user or system status change. Returns null when the opportunity does not
     * exist.
     *
     * @throws IllegalOpportunityTransitionException when the lifecycle forbids the change
     */
    public Opportunity transition(long opportunityId, OpportunityStatus target) {
        Opportunity opportunity = opportunityRepository.findById(opportunityId);
        if (opportunity == null) {
            return null;
        }
        if (!opportunity.status().canTransitionTo(target)) {
            throw new IllegalOpportunityTransitionException(opportunityId, opportunity.status(), target);
        }
        requireTransition(opportunity, target, clock.instant());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("opportunityId", opportunityId);
        details.put("from", opportunity.status().dbValue());
        details.put("to", target.dbValue());
        activityRepository.record(
            null,
            ActivityType.OPPORTUNITY_STATUS_CHANGED,
            "Opportunity " + opportunityId + " marked " + target.dbValue(),
            details
        );
        return opportunityRepository.findById(opportunityId);
    }

    public List<Opportunity> list(OpportunityStatus status, int limit) {
        if (status == null) {
            return opportunityRepository.findRecent(limit);
        }
        return opportunityRepository.findByStatus(status, limit);
    }

    public List<Opportunity> top(int limit) {
        return opportunityRepository.findTopActionable(limit);
    }

    private void requireTransition(Opportunity opportunity, OpportunityStatus target, Instant now) {
        OpportunityStatus current = opportunity.status();
        if (!current.canTransitionTo(target)) {
            throw new IllegalOpportunityTransitionException(opportunity.id(), current, target);
        }
        Instant processedAt = target == OpportunityStatus.PROCESSED || target == OpportunityStatus.REJECTED ? now : null;
        int updated = opportunityRepository.updateStatus(opportunity.id(), current, target, processedAt);
        if (updated == 0) {
            throw new IllegalOpportunityTransitionException(opportunity.id(), current, target);
        }
    }
}
