package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.EngagementStats;
import com.affiliate.autopilot.pipeline.model.PostStatus;
import com.affiliate.autopilot.pipeline.model.ScheduledPost;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScheduledPostRepositoryTest {
    private static final Instant NOW = Instant.parse("2024-03-04T12:00:00Z");

    @Autowired
    private ScheduledPostRepository repository;

    @Test
    void dueScheduledPostsComeBackOldestFirst() {
        long later = repository.insertDraft(null, "fitness", "Later", "Body", null);
        long earlier = repository.insertDraft(null, "fitness", "Earlier", "Body", null);
        long future = repository.insertDraft(null, "fitness", "Future", "Body", null);
        repository.markScheduled(later, NOW.minusSeconds(60));
        repository.markScheduled(earlier, NOW.minusSeconds(600));
        repository.markScheduled(future, NOW.plusSeconds(600));

        assertThat(repository.findDueScheduled(NOW))
            .extracting(ScheduledPost::id)
            .containsExactly(earlier, later);
        assertThat(repository.findScheduled())
            .extracting(ScheduledPost::id)
            .containsSubsequence(earlier, later, future);
    }

    @Test
    void draftRevertOnlyAppliesToScheduledPosts() {
        long id = repository.insertDraft(null, "fitness", "Title", "Body", "text");

        assertThat(repository.markDraft(id)).isZero();

        repository.markScheduled(id, NOW);
        assertThat(repository.markDraft(id)).isEqualTo(1);
        ScheduledPost draft = repository.findById(id);
        assertThat(draft.status()).isEqualTo(PostStatus.DRAFT);
        assertThat(draft.scheduledTime()).isNull();
    }

    @Test
    void postedPostCannotBeScheduledAgain() {
        long id = repository.insertDraft(null, "fitness", "Title", "Body", "text");
        repository.markScheduled(id, NOW);
        repository.markPosted(id, "t3_abc", NOW.plusSeconds(5));

        assertThat(repository.markScheduled(id, NOW.plusSeconds(3600))).isZero();
        ScheduledPost posted = repository.findById(id);
        assertThat(posted.status()).isEqualTo(PostStatus.POSTED);
        assertThat(posted.externalPostId()).isEqualTo("t3_abc");
        assertThat(posted.postedTime()).isEqualTo(NOW.plusSeconds(5));
        assertThat(repository.findPostedWithExternalId()).extracting(ScheduledPost::id).contains(id);
    }

    @Test
    void failureAndEngagementAreStored() {
        long failed = repository.insertDraft(null, "fitness", "Failing", "Body", "text");
        repository.markScheduled(failed, NOW);
        repository.markFailed(failed, "rate_limited");
        assertThat(repository.findById(failed).status()).isEqualTo(PostStatus.FAILED);
        assertThat(repository.findById(failed).lastError()).isEqualTo("rate_limited");

        long posted = repository.insertDraft(null, "fitness", "Posted", "Body", "text");
        repository.markPosted(posted, "t3_def", NOW);
        repository.updateEngagement(posted, new EngagementStats(15, 2, 6));
        ScheduledPost reloaded = repository.findById(posted);
        assertThat(reloaded.upvotes()).isEqualTo(15);
        assertThat(reloaded.downvotes()).isEqualTo(2);
        assertThat(reloaded.commentCount()).isEqualTo(6);
    }
}
