package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.Activity;
import com.affiliate.autopilot.pipeline.model.ActivityType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.affiliate.autopilot.pipeline.persistence.SqlValues.nullableLong;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.toInstant;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.toTimestamp;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.truncate;

/**
 * Append-only activity log.
 */
@Repository
public class ActivityRepository {
    private static final Logger log = LoggerFactory.getLogger(ActivityRepository.class);
    private static final TypeReference<Map<String, Object>> DETAILS = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ActivityRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public void record(Long campaignId, ActivityType type, String message, Map<String, Object> details) {
        jdbc.update(
            """
                INSERT INTO activities (campaign_id, type, message, details_json, created_at)
                VALUES (:campaignId, :type, :message, :detailsJson, :createdAt)
                """,
            new MapSqlParameterSource()
                .addValue("campaignId", campaignId)
                .addValue("type", type.dbValue())
                .addValue("message", truncate(message, 1000))
                .addValue("detailsJson", writeDetails(details))
                .addValue("createdAt", toTimestamp(Instant.now()))
        );
    }

    public List<Activity> findRecent(int limit) {
        return jdbc.query(
            """
                SELECT id, campaign_id, type, message, details_json, created_at
                FROM activities
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            (rs, rowNum) -> new Activity(
                rs.getLong("id"),
                nullableLong(rs, "campaign_id"),
                rs.getString("type"),
                rs.getString("message"),
                readDetails(rs.getString("details_json")),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
    }

    public int countByType(ActivityType type) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM activities WHERE type = :type",
            new MapSqlParameterSource().addValue("type", type.dbValue()),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    private String writeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return truncate(objectMapper.writeValueAsString(details), 4000);
        } catch (JsonProcessingException e) {
            log.warn("Activity details could not be serialized", e);
            return null;
        }
    }

    private Map<String, Object> readDetails(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> details = objectMapper.readValue(json, DETAILS);
            return details == null ? Map.of() : details;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable activity details", e);
            return Map.of();
        }
    }
}
