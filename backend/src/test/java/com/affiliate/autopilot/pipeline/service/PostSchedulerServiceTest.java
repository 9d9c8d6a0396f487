package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.model.ActivityType;
import com.affiliate.autopilot.pipeline.model.Campaign;
import com.affiliate.autopilot.pipeline.model.PostStatus;
import com.affiliate.autopilot.pipeline.model.PublishOutcome;
import com.affiliate.autopilot.pipeline.model.RecoverySweepSummary;
import com.affiliate.autopilot.pipeline.model.ScheduledPost;
import com.affiliate.autopilot.pipeline.model.SchedulerStatusResponse;
import com.affiliate.autopilot.pipeline.persistence.ActivityRepository;
import com.affiliate.autopilot.pipeline.persistence.CampaignRepository;
import com.affiliate.autopilot.pipeline.persistence.ScheduledPostRepository;
import com.affiliate.autopilot.pipeline.ratelimit.TokenBucketRateLimiter;
import com.affiliate.autopilot.pipeline.schedule.DailySchedule;
import com.affiliate.autopilot.pipeline.schedule.PostingSlotCalculator;
import com.affiliate.autopilot.pipeline.schedule.TimeRange;
import com.affiliate.autopilot.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostSchedulerServiceTest {
    private static final Instant NOW = Instant.parse("2024-03-04T12:00:00Z");

    @Mock(strictness = Mock.Strictness.LENIENT)
    private ScheduledPostRepository postRepository;
    @Mock
    private CampaignRepository campaignRepository;
    @Mock
    private ActivityRepository activityRepository;
    @Mock
    private PostPublisher publisher;
    @Mock
    private EngagementRefreshService engagementRefreshService;

    private final MutableClock clock = new MutableClock(NOW);
    private ScheduledThreadPoolExecutor executor;
    private PostSchedulerService service;

    @BeforeEach
    void setUp() {
        executor = new ScheduledThreadPoolExecutor(2);
        executor.setRemoveOnCancelPolicy(true);
        AutopilotProperties properties = new AutopilotProperties();
        properties.setZone("UTC");
        service = new PostSchedulerService(
            postRepository,
            campaignRepository,
            activityRepository,
            publisher,
            engagementRefreshService,
            new TokenBucketRateLimiter(10, Duration.ofHours(1), clock),
            new PostingSlotCalculator(properties, clock),
            executor,
            properties,
            clock
        );
    }

    @AfterEach
    void tearDown() {
        service.stop();
        executor.shutdownNow();
    }

    @Test
    void reschedulingKeepsASingleTimerPerPost() {
        when(postRepository.findById(1L)).thenReturn(post(1, PostStatus.DRAFT));
        when(postRepository.markScheduled(eq(1L), any())).thenReturn(1);
        when(postRepository.markDraft(1L)).thenReturn(1);

        assertThat(service.schedulePost(1, NOW.plus(Duration.ofHours(2)))).isTrue();
        assertThat(service.schedulePost(1, NOW.plus(Duration.ofHours(3)))).isTrue();
        assertThat(service.reschedulePost(1, NOW.plus(Duration.ofHours(1)))).isTrue();

        assertThat(service.activeJobCount()).isEqualTo(1);
        assertThat(service.hasJob(1)).isTrue();
        assertThat(service.getStatus().nextFireAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
        assertThat(executor.getQueue()).hasSize(1);
    }

    @Test
    void missingOrPostedPostsAreNotScheduled() {
        when(postRepository.findById(2L)).thenReturn(post(2, PostStatus.POSTED));

        assertThat(service.schedulePost(2, NOW.plusSeconds(60))).isFalse();
        assertThat(service.schedulePost(3, NOW.plusSeconds(60))).isFalse();

        verify(postRepository, never()).markScheduled(anyLong(), any());
        assertThat(service.activeJobCount()).isZero();
    }

    @Test
    void scheduleRequiresATime() {
        assertThatThrownBy(() -> service.schedulePost(1, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelSucceedsOnceAndReturnsPostToDraft() {
        when(postRepository.findById(4L)).thenReturn(post(4, PostStatus.DRAFT));
        when(postRepository.markScheduled(eq(4L), any())).thenReturn(1);
        when(postRepository.markDraft(4L)).thenReturn(1);
        service.schedulePost(4, NOW.plus(Duration.ofDays(1)));

        assertThat(service.cancelScheduledPost(4)).isTrue();
        assertThat(service.cancelScheduledPost(4)).isFalse();

        assertThat(service.hasJob(4)).isFalse();
        verify(postRepository, times(1)).markDraft(4L);
        verify(activityRepository).record(eq(10L), eq(ActivityType.POST_UNSCHEDULED), anyString(), any());
        verify(publisher, never()).executePublish(anyLong());
    }

    @Test
    void pastTimeFiresImmediately() {
        when(postRepository.findById(5L)).thenReturn(post(5, PostStatus.DRAFT));
        when(postRepository.markScheduled(eq(5L), any())).thenReturn(1);
        when(publisher.executePublish(5L)).thenReturn(PublishOutcome.PUBLISHED);

        assertThat(service.schedulePost(5, NOW.minusSeconds(30))).isTrue();

        verify(publisher, timeout(2000)).executePublish(5L);
        assertThat(service.hasJob(5)).isFalse();
    }

    @Test
    void recoverySweepPublishesDuePostsOldestFirstAndDropsTheirTimers() {
        when(postRepository.findById(1L)).thenReturn(post(1, PostStatus.DRAFT));
        when(postRepository.markScheduled(eq(1L), any())).thenReturn(1);
        service.schedulePost(1, NOW.plus(Duration.ofHours(1)));
        assertThat(service.hasJob(1)).isTrue();

        when(postRepository.findDueScheduled(NOW)).thenReturn(List.of(
            post(1, PostStatus.SCHEDULED),
            post(2, PostStatus.SCHEDULED)
        ));
        when(publisher.executePublish(1L)).thenReturn(PublishOutcome.PUBLISHED);
        when(publisher.executePublish(2L)).thenReturn(PublishOutcome.RATE_LIMITED);

        RecoverySweepSummary summary = service.runRecoverySweep();

        assertThat(summary).isEqualTo(new RecoverySweepSummary(2, 1, 1, 0));
        assertThat(service.hasJob(1)).isFalse();
        InOrder order = inOrder(publisher);
        order.verify(publisher).executePublish(1L);
        order.verify(publisher).executePublish(2L);
    }

    @Test
    void campaignPostsAreSpreadOverScheduleSlots() {
        Campaign campaign = new Campaign(
            3L,
            "Spring push",
            null,
            "active",
            null,
            List.of("fitness"),
            new DailySchedule(List.of(TimeRange.parse("15:00-16:00")))
        );
        when(campaignRepository.findById(3L)).thenReturn(campaign);
        when(postRepository.findById(21L)).thenReturn(post(21, PostStatus.DRAFT));
        when(postRepository.findById(23L)).thenReturn(post(23, PostStatus.DRAFT));
        when(postRepository.markScheduled(anyLong(), any())).thenReturn(1);

        int scheduled = service.scheduleCampaignPosts(3, Arrays.asList(21L, null, 22L, 23L));

        assertThat(scheduled).isEqualTo(2);
        verify(postRepository).markScheduled(21L, Instant.parse("2024-03-04T15:00:00Z"));
        verify(postRepository).markScheduled(23L, Instant.parse("2024-03-05T15:00:00Z"));
    }

    @Test
    void unknownCampaignReportsMinusOne() {
        assertThat(service.scheduleCampaignPosts(404, List.of(1L))).isEqualTo(-1);
    }

    @Test
    void stopClearsTimersAndStatusReflectsLifecycle() {
        when(postRepository.findById(6L)).thenReturn(post(6, PostStatus.DRAFT));
        when(postRepository.markScheduled(eq(6L), any())).thenReturn(1);

        service.start();
        service.schedulePost(6, NOW.plus(Duration.ofHours(1)));
        SchedulerStatusResponse running = service.getStatus();
        assertThat(running.running()).isTrue();
        assertThat(running.activeJobs()).isEqualTo(1);
        assertThat(running.rateLimit().limit()).isEqualTo(10);

        service.stop();

        SchedulerStatusResponse stopped = service.getStatus();
        assertThat(stopped.running()).isFalse();
        assertThat(stopped.activeJobs()).isZero();
        assertThat(stopped.nextFireAt()).isNull();
    }

    @Test
    void postsScheduledAfterStopStillGetTheirOwnTimer() {
        when(postRepository.findById(7L)).thenReturn(post(7, PostStatus.DRAFT));
        when(postRepository.findById(8L)).thenReturn(post(8, PostStatus.DRAFT));
        when(postRepository.markScheduled(anyLong(), any())).thenReturn(1);
        when(publisher.executePublish(8L)).thenReturn(PublishOutcome.PUBLISHED);
        service.start();
        service.stop();

        assertThat(service.schedulePost(7, NOW.plus(Duration.ofHours(1)))).isTrue();
        assertThat(service.schedulePost(8, NOW.minusSeconds(5))).isTrue();

        verify(publisher, timeout(2000)).executePublish(8L);
        SchedulerStatusResponse status = service.getStatus();
        assertThat(status.running()).isFalse();
        assertThat(status.activeJobs()).isEqualTo(1);
        assertThat(status.nextFireAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
        verify(engagementRefreshService, never()).refreshAll();
    }

    private static ScheduledPost post(long id, PostStatus status) {
        return new ScheduledPost(
            id,
            10L,
            "fitness",
            "Post " + id,
            "Body",
            "text",
            status,
            status == PostStatus.POSTED ? "t3_" + id : null,
            status == PostStatus.SCHEDULED ? NOW.minusSeconds(id * 60) : null,
            null,
            0,
            0,
            0,
            null
        );
    }
}
