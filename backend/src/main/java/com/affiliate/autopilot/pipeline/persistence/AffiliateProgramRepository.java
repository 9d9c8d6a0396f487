package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.AffiliateProgram;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class AffiliateProgramRepository {
    private static final Logger log = LoggerFactory.getLogger(AffiliateProgramRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<AffiliateProgram> programMapper;

    public AffiliateProgramRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.programMapper = (rs, rowNum) -> new AffiliateProgram(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("category"),
            readTags(rs.getString("tags_json")),
            rs.getBoolean("active")
        );
    }

    public long insert(String name, String category, List<String> tags, boolean active) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("category", category)
            .addValue("tagsJson", writeTags(tags))
            .addValue("active", active);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO affiliate_programs (name, category, tags_json, active)
                VALUES (:name, :category, :tagsJson, :active)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public AffiliateProgram findById(long id) {
        List<AffiliateProgram> results = jdbc.query(
            """
                SELECT id, name, category, tags_json, active
                FROM affiliate_programs
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id),
            programMapper
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public List<AffiliateProgram> findActive() {
        return jdbc.query(
            """
                SELECT id, name, category, tags_json, active
                FROM affiliate_programs
                WHERE active = TRUE
                ORDER BY id ASC
                """,
            new MapSqlParameterSource(),
            programMapper
        );
    }

    private List<String> readTags(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<String> tags = objectMapper.readValue(json, STRING_LIST);
            return tags == null ? List.of() : tags;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable affiliate program tags: {}", json, e);
            return List.of();
        }
    }

    private String writeTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tags cannot be serialized", e);
        }
    }
}
