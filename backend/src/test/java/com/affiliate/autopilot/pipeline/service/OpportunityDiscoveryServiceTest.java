package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.pipeline.discovery.DiscoveryClient;
import com.affiliate.autopilot.pipeline.model.DiscoveredThread;
import com.affiliate.autopilot.pipeline.model.DiscoveryResult;
import com.affiliate.autopilot.pipeline.model.Keyword;
import com.affiliate.autopilot.pipeline.model.Opportunity;
import com.affiliate.autopilot.pipeline.model.OpportunityStatus;
import com.affiliate.autopilot.pipeline.model.ScanResponse;
import com.affiliate.autopilot.pipeline.persistence.AffiliateProgramRepository;
import com.affiliate.autopilot.pipeline.persistence.KeywordRepository;
import com.affiliate.autopilot.pipeline.persistence.OpportunityRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class OpportunityDiscoveryServiceTest {
    private static final Instant NOW = Instant.parse("2024-03-04T12:00:00Z");
    private static final String TRACKER_URL = "https://www.reddit.com/r/Fitness/comments/aa11/best_tracker/";
    private static final String BLENDER_URL = "https://www.reddit.com/r/Cooking/comments/bb22/blender_died/";

    @Autowired
    private OpportunityDiscoveryService discoveryService;
    @Autowired
    private OpportunityPipelineService pipelineService;
    @Autowired
    private KeywordRepository keywordRepository;
    @Autowired
    private OpportunityRepository opportunityRepository;
    @Autowired
    private AffiliateProgramRepository programRepository;

    @Test
    void discoveredThreadsAreStoredOnceWithScoreAndProgram() {
        long programId = programRepository.insert("FitTrack", "fitness", List.of("wearable"), true);
        String keywordText = "fitness tracker " + UUID.randomUUID().toString().substring(0, 6);

        DiscoveryResult first = discoveryService.discover(keywordText);

        assertThat(first.created()).hasSize(2);
        assertThat(first.duplicatesSkipped()).isZero();
        Opportunity tracker = first.created().stream()
            .filter(opportunity -> opportunity.url().equals(TRACKER_URL))
            .findFirst()
            .orElseThrow();
        assertThat(tracker.status()).isEqualTo(OpportunityStatus.NEW);
        assertThat(tracker.community()).isEqualTo("Fitness");
        assertThat(tracker.discoveryRank()).isEqualTo(1);
        assertThat(tracker.opportunityScore()).isBetween(0, 100);
        assertThat(tracker.affiliateProgramId()).isEqualTo(programId);
        assertThat(tracker.dateDiscovered()).isEqualTo(NOW);

        Keyword keyword = keywordRepository.findByKeyword(keywordText);
        assertThat(keyword).isNotNull();
        assertThat(keyword.lastScannedAt()).isEqualTo(NOW);

        DiscoveryResult second = discoveryService.discover(keywordText);

        assertThat(second.created()).isEmpty();
        assertThat(second.duplicatesSkipped()).isEqualTo(2);
        assertThat(opportunityRepository.existsByUrl(BLENDER_URL)).isTrue();
    }

    @Test
    void blankKeywordIsRejected() {
        assertThatThrownBy(() -> discoveryService.discover("  "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scanPromotesOnlyWhenSomethingNewWasFound() {
        keywordRepository.insert("blender " + UUID.randomUUID().toString().substring(0, 6), "active", null, null);

        ScanResponse first = pipelineService.scanAndPromote(500);

        assertThat(first.success()).isTrue();
        assertThat(first.scan().opportunitiesCreated()).isEqualTo(2);
        assertThat(first.queuedCount()).isEqualTo(2);
        assertThat(opportunityRepository.findByStatus(OpportunityStatus.QUEUED, 10))
            .extracting(Opportunity::url)
            .contains(TRACKER_URL, BLENDER_URL);

        ScanResponse second = pipelineService.scanAndPromote(500);

        assertThat(second.scan().opportunitiesCreated()).isZero();
        assertThat(second.queuedCount()).isZero();
    }

    @TestConfiguration
    static class StubDiscoveryConfig {
        @Bean
        @Primary
        DiscoveryClient stubDiscoveryClient() {
            return keyword -> List.of(
                new DiscoveredThread(
                    TRACKER_URL,
                    "Best FitTrack alternative for running?",
                    "I need a wearable that tracks pace accurately, any recommendations?",
                    1
                ),
                new DiscoveredThread(
                    BLENDER_URL,
                    "My blender died after two years",
                    "Looking at replacements",
                    2
                )
            );
        }

        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }
}
