package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.EngagementStats;
import com.affiliate.autopilot.pipeline.model.PostStatus;
import com.affiliate.autopilot.pipeline.model.ScheduledPost;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.affiliate.autopilot.pipeline.persistence.SqlValues.nullableLong;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.toInstant;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.toTimestamp;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.truncate;

@Repository
public class ScheduledPostRepository {
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final String COLUMNS = """
        id, campaign_id, community, title, content, post_type, status, external_post_id,
        scheduled_time, posted_time, upvotes, downvotes, comment_count, last_error
        """;

    private static final RowMapper<ScheduledPost> POST_MAPPER = (rs, rowNum) -> new ScheduledPost(
        rs.getLong("id"),
        nullableLong(rs, "campaign_id"),
        rs.getString("community"),
        rs.getString("title"),
        rs.getString("content"),
        rs.getString("post_type"),
        PostStatus.fromDbValue(rs.getString("status")),
        rs.getString("external_post_id"),
        toInstant(rs.getTimestamp("scheduled_time")),
        toInstant(rs.getTimestamp("posted_time")),
        rs.getInt("upvotes"),
        rs.getInt("downvotes"),
        rs.getInt("comment_count"),
        rs.getString("last_error")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public ScheduledPostRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertDraft(Long campaignId, String community, String title, String content, String postType) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("campaignId", campaignId)
            .addValue("community", community)
            .addValue("title", title)
            .addValue("content", content)
            .addValue("postType", postType == null ? "text" : postType)
            .addValue("status", PostStatus.DRAFT.dbValue());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scheduled_posts (campaign_id, community, title, content, post_type, status)
                VALUES (:campaignId, :community, :title, :content, :postType, :status)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public ScheduledPost findById(long id) {
        List<ScheduledPost> results = jdbc.query(
            "SELECT " + COLUMNS + " FROM scheduled_posts WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            POST_MAPPER
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public List<ScheduledPost> findScheduled() {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM scheduled_posts
                WHERE status = 'scheduled'
                  AND scheduled_time IS NOT NULL
                ORDER BY scheduled_time ASC, id ASC
                """,
            new MapSqlParameterSource(),
            POST_MAPPER
        );
    }

    /**
     * Scheduled posts whose time has come, oldest first.
     */
    public List<ScheduledPost> findDueScheduled(Instant now) {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM scheduled_posts
                WHERE status = 'scheduled'
                  AND scheduled_time IS NOT NULL
                  AND scheduled_time <= :now
                ORDER BY scheduled_time ASC, id ASC
                """,
            new MapSqlParameterSource().addValue("now", toTimestamp(now)),
            POST_MAPPER
        );
    }

    public List<ScheduledPost> findPostedWithExternalId() {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM scheduled_posts
                WHERE status = 'posted'
                  AND external_post_id IS NOT NULL
                ORDER BY posted_time ASC, id ASC
                """,
            new MapSqlParameterSource(),
            POST_MAPPER
        );
    }

    public int markScheduled(long id, Instant scheduledTime) {
        return jdbc.update(
            """
                UPDATE scheduled_posts
                SET status = 'scheduled',
                    scheduled_time = :scheduledTime,
                    last_error = NULL
                WHERE id = :id
                  AND status <> 'posted'
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("scheduledTime", toTimestamp(scheduledTime))
        );
    }

    public int markDraft(long id) {
        return jdbc.update(
            """
                UPDATE scheduled_posts
                SET status = 'draft',
                    scheduled_time = NULL
                WHERE id = :id
                  AND status = 'scheduled'
                """,
            new MapSqlParameterSource().addValue("id", id)
        );
    }

    public int markPosted(long id, String externalPostId, Instant postedTime) {
        return jdbc.update(
            """
                UPDATE scheduled_posts
                SET status = 'posted',
                    external_post_id = :externalPostId,
                    posted_time = :postedTime,
                    last_error = NULL
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("externalPostId", externalPostId)
                .addValue("postedTime", toTimestamp(postedTime))
        );
    }

    public int markFailed(long id, String error) {
        return jdbc.update(
            """
                UPDATE scheduled_posts
                SET status = 'failed',
                    last_error = :lastError
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("lastError", truncate(error, MAX_ERROR_LENGTH))
        );
    }

    public int updateEngagement(long id, EngagementStats stats) {
        return jdbc.update(
            """
                UPDATE scheduled_posts
                SET upvotes = :upvotes,
                    downvotes = :downvotes,
                    comment_count = :commentCount
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("upvotes", stats.upvotes())
                .addValue("downvotes", stats.downvotes())
                .addValue("commentCount", stats.commentCount())
        );
    }
}
