package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.Campaign;
import com.affiliate.autopilot.pipeline.schedule.PostingSchedule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.affiliate.autopilot.pipeline.persistence.SqlValues.nullableLong;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.toInstant;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.toTimestamp;

/**
 * Read access to campaigns and their target communities. Campaign CRUD lives outside this
 * service; {@link #insert} exists for seeding.
 */
@Repository
public class CampaignRepository {
    private static final Logger log = LoggerFactory.getLogger(CampaignRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CampaignRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insert(
        String name,
        Long affiliateProgramId,
        String status,
        Instant startDate,
        List<String> targetCommunities,
        PostingSchedule schedule
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("affiliateProgramId", affiliateProgramId)
            .addValue("status", status == null ? "active" : status)
            .addValue("startDate", toTimestamp(startDate))
            .addValue("scheduleJson", writeSchedule(schedule));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO campaigns (name, affiliate_program_id, status, start_date, schedule_json)
                VALUES (:name, :affiliateProgramId, :status, :startDate, :scheduleJson)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        long campaignId = key == null ? 0L : key.longValue();
        if (targetCommunities != null) {
            int position = 0;
            for (String community : targetCommunities) {
                jdbc.update(
                    """
                        INSERT INTO campaign_target_communities (campaign_id, community, position)
                        VALUES (:campaignId, :community, :position)
                        """,
                    new MapSqlParameterSource()
                        .addValue("campaignId", campaignId)
                        .addValue("community", community)
                        .addValue("position", position++)
                );
            }
        }
        return campaignId;
    }

    public Campaign findById(long id) {
        List<Campaign> campaigns = load(
            """
                SELECT id, name, affiliate_program_id, status, start_date, schedule_json
                FROM campaigns
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id)
        );
        return campaigns.isEmpty() ? null : campaigns.get(0);
    }

    /**
     * Active campaigns in id order, so "first matching campaign" is stable.
     */
    public List<Campaign> findActive() {
        return load(
            """
                SELECT id, name, affiliate_program_id, status, start_date, schedule_json
                FROM campaigns
                WHERE status = 'active'
                ORDER BY id ASC
                """,
            new MapSqlParameterSource()
        );
    }

    private List<Campaign> load(String sql, MapSqlParameterSource params) {
        List<CampaignRow> rows = jdbc.query(sql, params, (rs, rowNum) -> new CampaignRow(
            rs.getLong("id"),
            rs.getString("name"),
            nullableLong(rs, "affiliate_program_id"),
            rs.getString("status"),
            toInstant(rs.getTimestamp("start_date")),
            rs.getString("schedule_json")
        ));
        if (rows.isEmpty()) {
            return List.of();
        }
        Map<Long, List<String>> communities = loadTargetCommunities(rows.stream().map(CampaignRow::id).toList());
        List<Campaign> campaigns = new ArrayList<>(rows.size());
        for (CampaignRow row : rows) {
            campaigns.add(new Campaign(
                row.id(),
                row.name(),
                row.affiliateProgramId(),
                row.status(),
                row.startDate(),
                communities.getOrDefault(row.id(), List.of()),
                readSchedule(row.id(), row.scheduleJson())
            ));
        }
        return campaigns;
    }

    private Map<Long, List<String>> loadTargetCommunities(List<Long> campaignIds) {
        Map<Long, List<String>> result = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT campaign_id, community
                FROM campaign_target_communities
                WHERE campaign_id IN (:ids)
                ORDER BY campaign_id ASC, position ASC
                """,
            new MapSqlParameterSource().addValue("ids", campaignIds),
            rs -> {
                result.computeIfAbsent(rs.getLong("campaign_id"), ignored -> new ArrayList<>())
                    .add(rs.getString("community"));
            }
        );
        return result;
    }

    private PostingSchedule readSchedule(long campaignId, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, PostingSchedule.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Campaign {} has an unreadable posting schedule; using the default slot", campaignId, e);
            return null;
        }
    }

    private String writeSchedule(PostingSchedule schedule) {
        if (schedule == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(schedule);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Posting schedule cannot be serialized", e);
        }
    }

    private record CampaignRow(
        long id,
        String name,
        Long affiliateProgramId,
        String status,
        Instant startDate,
        String scheduleJson
    ) {
    }
}
