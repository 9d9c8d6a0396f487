package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.pipeline.discovery.DiscoveryClient;
import com.affiliate.autopilot.pipeline.model.ActionType;
import com.affiliate.autopilot.pipeline.model.AffiliateProgram;
import com.affiliate.autopilot.pipeline.model.CommunityNames;
import com.affiliate.autopilot.pipeline.model.DiscoveredThread;
import com.affiliate.autopilot.pipeline.model.DiscoveryResult;
import com.affiliate.autopilot.pipeline.model.Keyword;
import com.affiliate.autopilot.pipeline.model.NewOpportunity;
import com.affiliate.autopilot.pipeline.model.Opportunity;
import com.affiliate.autopilot.pipeline.model.ThreadIntent;
import com.affiliate.autopilot.pipeline.persistence.AffiliateProgramRepository;
import com.affiliate.autopilot.pipeline.persistence.KeywordRepository;
import com.affiliate.autopilot.pipeline.persistence.OpportunityRepository;
import com.affiliate.autopilot.pipeline.scoring.IntentClassifier;
import com.affiliate.autopilot.pipeline.scoring.OpportunityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns search hits for one keyword into scored opportunities in status {@code new}.
 * A thread URL is stored at most once.
 */
@Service
public class OpportunityDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(OpportunityDiscoveryService.class);

    private final DiscoveryClient discoveryClient;
    private final KeywordRepository keywordRepository;
    private final OpportunityRepository opportunityRepository;
    private final AffiliateProgramRepository programRepository;
    private final IntentClassifier intentClassifier;
    private final OpportunityScorer scorer;
    private final AffiliateProgramMatcher programMatcher;
    private final Clock clock;

    public OpportunityDiscoveryService(
        DiscoveryClient discoveryClient,
        KeywordRepository keywordRepository,
        OpportunityRepository opportunityRepository,
        AffiliateProgramRepository programRepository,
        IntentClassifier intentClassifier,
        OpportunityScorer scorer,
        AffiliateProgramMatcher programMatcher,
        Clock clock
    ) {
        this.discoveryClient = discoveryClient;
        this.keywordRepository = keywordRepository;
        this.opportunityRepository = opportunityRepository;
        this.programRepository = programRepository;
        this.intentClassifier = intentClassifier;
        this.scorer = scorer;
        this.programMatcher = programMatcher;
        this.clock = clock;
    }

    public DiscoveryResult discover(String keywordText) {
        if (keywordText == null || keywordText.isBlank()) {
            throw new IllegalArgumentException("keyword is required");
        }
        return discover(keywordRepository.findOrCreate(keywordText.trim()));
    }

    public DiscoveryResult discover(Keyword keyword) {
        List<DiscoveredThread> threads = discoveryClient.search(keyword.keyword());
        List<AffiliateProgram> programs = keyword.affiliateProgramId() == null ? programRepository.findActive() : List.of();
        List<Opportunity> created = new ArrayList<>();
        int duplicates = 0;
        for (DiscoveredThread thread : threads) {
            if (opportunityRepository.existsByUrl(thread.url())) {
                duplicates++;
                continue;
            }
            NewOpportunity candidate = toOpportunity(keyword, thread, programs);
            try {
                long id = opportunityRepository.insert(candidate, clock.instant());
                created.add(opportunityRepository.findById(id));
            } catch (DuplicateKeyException e) {
                duplicates++;
                log.debug("Skipping already stored thread {}", thread.url());
            }
        }
        keywordRepository.touchLastScanned(keyword.id(), clock.instant());
        log.info(
            "Keyword '{}' yielded {} results, {} new opportunities, {} duplicates",
            keyword.keyword(),
            threads.size(),
            created.size(),
            duplicates
        );
        return new DiscoveryResult(created, duplicates);
    }

    private NewOpportunity toOpportunity(Keyword keyword, DiscoveredThread thread, List<AffiliateProgram> programs) {
        ThreadIntent intent = intentClassifier.classify(thread.title(), thread.snippet());
        int score = scorer.score(thread.rank(), intent, thread.title(), thread.snippet());
        ActionType actionType = scorer.actionType(score, intent, thread.title(), thread.snippet());
        Long programId = keyword.affiliateProgramId() != null
            ? keyword.affiliateProgramId()
            : programMatcher.bestMatch(programs, thread.title(), thread.snippet());
        return new NewOpportunity(
            keyword.id(),
            keyword.keyword(),
            thread.url(),
            thread.title(),
            thread.snippet(),
            CommunityNames.fromThreadUrl(thread.url()),
            thread.rank(),
            intent,
            score,
            actionType,
            programId
        );
    }
}
