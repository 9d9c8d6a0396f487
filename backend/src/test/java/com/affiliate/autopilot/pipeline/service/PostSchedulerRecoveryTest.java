package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.pipeline.model.PostStatus;
import com.affiliate.autopilot.pipeline.model.RecoverySweepSummary;
import com.affiliate.autopilot.pipeline.model.ScheduledPost;
import com.affiliate.autopilot.pipeline.persistence.ScheduledPostRepository;
import com.affiliate.autopilot.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PostSchedulerRecoveryTest {
    private static final Instant NOW = Instant.parse("2024-03-04T12:00:00Z");

    @Autowired
    private PostSchedulerService schedulerService;
    @Autowired
    private ScheduledPostRepository postRepository;
    @Autowired
    private MutableClock clock;

    @AfterEach
    void resetClock() {
        clock.set(NOW);
    }

    @Test
    void cancelledPostIsNotPublishedByALaterSweep() {
        long id = postRepository.insertDraft(null, "fitness", "Cancelled launch post", "Body", "text");
        Instant fireAt = NOW.plus(Duration.ofHours(1));

        assertThat(schedulerService.schedulePost(id, fireAt)).isTrue();
        assertThat(postRepository.findById(id).status()).isEqualTo(PostStatus.SCHEDULED);
        assertThat(schedulerService.cancelScheduledPost(id)).isTrue();

        clock.set(fireAt.plusSeconds(60));
        RecoverySweepSummary summary = schedulerService.runRecoverySweep();

        assertThat(summary.due()).isZero();
        assertThat(summary.published()).isZero();
        ScheduledPost post = postRepository.findById(id);
        assertThat(post.status()).isEqualTo(PostStatus.DRAFT);
        assertThat(post.scheduledTime()).isNull();
        assertThat(post.externalPostId()).isNull();
        assertThat(schedulerService.hasJob(id)).isFalse();
    }

    @TestConfiguration
    static class MutableClockConfig {
        @Bean
        @Primary
        MutableClock mutableClock() {
            return new MutableClock(NOW);
        }
    }
}
