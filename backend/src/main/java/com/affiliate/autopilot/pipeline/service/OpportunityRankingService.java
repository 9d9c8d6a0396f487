package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.pipeline.model.AffiliateProgram;
import com.affiliate.autopilot.pipeline.model.Campaign;
import com.affiliate.autopilot.pipeline.model.CommunityNames;
import com.affiliate.autopilot.pipeline.model.Opportunity;
import com.affiliate.autopilot.pipeline.model.OpportunityRanking;
import com.affiliate.autopilot.pipeline.persistence.AffiliateProgramRepository;
import com.affiliate.autopilot.pipeline.persistence.CampaignRepository;
import com.affiliate.autopilot.pipeline.persistence.CommunityRepository;
import com.affiliate.autopilot.pipeline.persistence.OpportunityRepository;
import com.affiliate.autopilot.pipeline.scoring.OpportunityAnalyzer;
import com.affiliate.autopilot.pipeline.scoring.OpportunityScorer;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Service
public class OpportunityRankingService {
    private static final int CANDIDATE_LIMIT = 200;

    private final CampaignRepository campaignRepository;
    private final AffiliateProgramRepository programRepository;
    private final CommunityRepository communityRepository;
    private final OpportunityRepository opportunityRepository;
    private final OpportunityScorer scorer;
    private final OpportunityAnalyzer analyzer;

    public OpportunityRankingService(
        CampaignRepository campaignRepository,
        AffiliateProgramRepository programRepository,
        CommunityRepository communityRepository,
        OpportunityRepository opportunityRepository,
        OpportunityScorer scorer,
        OpportunityAnalyzer analyzer
    ) {
        this.campaignRepository = campaignRepository;
        this.programRepository = programRepository;
        this.communityRepository = communityRepository;
        this.opportunityRepository = opportunityRepository;
        this.scorer = scorer;
        this.analyzer = analyzer;
    }

    /**
     * Ranks the actionable opportunities in a campaign's target communities by affinity to
     * the campaign's program. Returns null when the campaign does not exist.
     */
    public List<OpportunityRanking> rankForCampaign(long campaignId, int limit) {
        Campaign campaign = campaignRepository.findById(campaignId);
        if (campaign == null) {
            return null;
        }
        AffiliateProgram program = campaign.affiliateProgramId() == null
            ? null
            : programRepository.findById(campaign.affiliateProgramId());
        List<String> communities = campaign.targetCommunities().stream()
            .map(CommunityNames::normalize)
            .filter(name -> !name.isEmpty())
            .distinct()
            .toList();
        return opportunityRepository.findByCommunities(communities, CANDIDATE_LIMIT).stream()
            .map(opportunity -> rank(opportunity, program))
            .sorted(Comparator.comparingInt(OpportunityRanking::affinityScore).reversed())
            .limit(Math.max(1, limit))
            .toList();
    }

    OpportunityRanking rank(Opportunity opportunity, AffiliateProgram program) {
        boolean categoryMatch = categoryMatches(opportunity.community(), program);
        String text = opportunity.title() + " " + (opportunity.snippet() == null ? "" : opportunity.snippet());
        int affinity = scorer.affinity(
            opportunity.opportunityScore(),
            opportunity.intent(),
            categoryMatch,
            program,
            text
        );
        return new OpportunityRanking(
            opportunity,
            affinity,
            categoryMatch,
            analyzer.bestApproach(opportunity),
            analyzer.urgency(opportunity.title(), opportunity.snippet()),
            analyzer.sentiment(opportunity.title(), opportunity.snippet()),
            analyzer.rationale(opportunity, program, categoryMatch)
        );
    }

    private boolean categoryMatches(String community, AffiliateProgram program) {
        if (program == null || program.category() == null || program.category().isBlank()) {
            return false;
        }
        String category = communityRepository.findCategory(community);
        return category != null
            && category.trim().toLowerCase(Locale.ROOT).equals(program.category().trim().toLowerCase(Locale.ROOT));
    }
}
