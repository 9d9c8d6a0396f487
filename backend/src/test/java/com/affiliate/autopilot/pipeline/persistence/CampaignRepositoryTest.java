package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.Campaign;
import com.affiliate.autopilot.pipeline.model.Keyword;
import com.affiliate.autopilot.pipeline.schedule.TimeRange;
import com.affiliate.autopilot.pipeline.schedule.WeeklySchedule;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CampaignRepositoryTest {

    @Autowired
    private CampaignRepository campaignRepository;
    @Autowired
    private KeywordRepository keywordRepository;
    @Autowired
    private CommunityRepository communityRepository;

    @Test
    void campaignKeepsTargetOrderAndSchedule() {
        WeeklySchedule schedule = new WeeklySchedule(
            List.of(DayOfWeek.TUESDAY, DayOfWeek.THURSDAY),
            List.of(TimeRange.parse("09:30-10:30"))
        );
        Instant start = Instant.parse("2024-04-01T00:00:00Z");

        long id = campaignRepository.insert("Desk setup", null, "active", start, List.of("r/homeoffice", "battlestations"), schedule);

        Campaign campaign = campaignRepository.findById(id);
        assertThat(campaign.name()).isEqualTo("Desk setup");
        assertThat(campaign.startDate()).isEqualTo(start);
        assertThat(campaign.targetCommunities()).containsExactly("r/homeoffice", "battlestations");
        assertThat(campaign.schedule()).isEqualTo(schedule);
        assertThat(campaign.targets("HomeOffice")).isTrue();
    }

    @Test
    void onlyActiveCampaignsAreListed() {
        long active = campaignRepository.insert("Running", null, "active", null, List.of("running"), null);
        long paused = campaignRepository.insert("Cycling", null, "paused", null, List.of("cycling"), null);

        assertThat(campaignRepository.findActive())
            .extracting(Campaign::id)
            .contains(active)
            .doesNotContain(paused);
        assertThat(campaignRepository.findById(active).schedule()).isNull();
    }

    @Test
    void findOrCreateKeywordIsIdempotent() {
        String text = "trail shoes " + UUID.randomUUID().toString().substring(0, 6);

        Keyword first = keywordRepository.findOrCreate(text);
        Keyword second = keywordRepository.findOrCreate(text);

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(first.isActive()).isTrue();
    }

    @Test
    void neverScannedKeywordsComeFirst() {
        String suffix = UUID.randomUUID().toString().substring(0, 6);
        long scanned = keywordRepository.insert("scanned " + suffix, "active", null, null);
        long fresh = keywordRepository.insert("fresh " + suffix, "active", null, null);
        keywordRepository.touchLastScanned(scanned, Instant.parse("2024-03-01T00:00:00Z"));

        List<Long> order = keywordRepository.findActiveForScan(500).stream().map(Keyword::id).toList();

        assertThat(order.indexOf(fresh)).isLessThan(order.indexOf(scanned));
    }

    @Test
    void communityCategoryIsLookedUpByNormalizedName() {
        communityRepository.upsert("r/HomeGym", "fitness");

        assertThat(communityRepository.findCategory("homegym")).isEqualTo("fitness");
        assertThat(communityRepository.findCategory("r/unknownplace")).isNull();
    }
}
