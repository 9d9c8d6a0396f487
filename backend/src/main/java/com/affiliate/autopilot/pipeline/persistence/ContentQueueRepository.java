package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.ActionType;
import com.affiliate.autopilot.pipeline.model.ContentQueueItem;
import com.affiliate.autopilot.pipeline.model.ContentQueueStatus;
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

@Repository
public class ContentQueueRepository {
    private static final RowMapper<ContentQueueItem> ITEM_MAPPER = (rs, rowNum) -> new ContentQueueItem(
        rs.getLong("id"),
        nullableLong(rs, "opportunity_id"),
        nullableLong(rs, "campaign_id"),
        ActionType.fromDbValue(rs.getString("item_type")),
        rs.getString("community"),
        rs.getString("target_url"),
        rs.getString("content"),
        toInstant(rs.getTimestamp("scheduled_for")),
        ContentQueueStatus.fromDbValue(rs.getString("status")),
        rs.getString("external_post_id"),
        toInstant(rs.getTimestamp("date_created")),
        toInstant(rs.getTimestamp("date_posted"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public ContentQueueRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insert(
        long opportunityId,
        long campaignId,
        ActionType itemType,
        String community,
        String targetUrl,
        String content,
        Instant scheduledFor,
        ContentQueueStatus status
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("opportunityId", opportunityId)
            .addValue("campaignId", campaignId)
            .addValue("itemType", itemType.dbValue())
            .addValue("community", community)
            .addValue("targetUrl", targetUrl)
            .addValue("content", content)
            .addValue("scheduledFor", toTimestamp(scheduledFor))
            .addValue("status", status.dbValue())
            .addValue("now", toTimestamp(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO content_queue (
                    opportunity_id, campaign_id, item_type, community, target_url, content,
                    scheduled_for, status, date_created
                )
                VALUES (
                    :opportunityId, :campaignId, :itemType, :community, :targetUrl, :content,
                    :scheduledFor, :status, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public List<ContentQueueItem> findByOpportunityId(long opportunityId) {
        return jdbc.query(
            """
                SELECT id, opportunity_id, campaign_id, item_type, community, target_url, content,
                       scheduled_for, status, external_post_id, date_created, date_posted
                FROM content_queue
                WHERE opportunity_id = :opportunityId
                ORDER BY id ASC
                """,
            new MapSqlParameterSource().addValue("opportunityId", opportunityId),
            ITEM_MAPPER
        );
    }

    public List<ContentQueueItem> findByCampaignId(long campaignId) {
        return jdbc.query(
            """
                SELECT id, opportunity_id, campaign_id, item_type, community, target_url, content,
                       scheduled_for, status, external_post_id, date_created, date_posted
                FROM content_queue
                WHERE campaign_id = :campaignId
                ORDER BY scheduled_for ASC, id ASC
                """,
            new MapSqlParameterSource().addValue("campaignId", campaignId),
            ITEM_MAPPER
        );
    }
}
