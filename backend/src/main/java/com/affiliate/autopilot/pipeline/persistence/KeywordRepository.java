package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.Keyword;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
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
public class KeywordRepository {
    private static final Logger log = LoggerFactory.getLogger(KeywordRepository.class);
    private static final RowMapper<Keyword> KEYWORD_MAPPER = (rs, rowNum) -> new Keyword(
        rs.getLong("id"),
        rs.getString("keyword"),
        rs.getString("status"),
        nullableLong(rs, "campaign_id"),
        nullableLong(rs, "affiliate_program_id"),
        toInstant(rs.getTimestamp("last_scanned_at")),
        toInstant(rs.getTimestamp("date_added"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public KeywordRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insert(String keyword, String status, Long campaignId, Long affiliateProgramId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("keyword", keyword.trim())
            .addValue("status", status == null ? "active" : status)
            .addValue("campaignId", campaignId)
            .addValue("affiliateProgramId", affiliateProgramId)
            .addValue("now", toTimestamp(Instant.now()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO keywords (keyword, status, campaign_id, affiliate_program_id, date_added)
                VALUES (:keyword, :status, :campaignId, :affiliateProgramId, :now)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public Keyword findById(long id) {
        List<Keyword> results = jdbc.query(
            """
                SELECT id, keyword, status, campaign_id, affiliate_program_id, last_scanned_at, date_added
                FROM keywords
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id),
            KEYWORD_MAPPER
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public Keyword findByKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return null;
        }
        List<Keyword> results = jdbc.query(
            """
                SELECT id, keyword, status, campaign_id, affiliate_program_id, last_scanned_at, date_added
                FROM keywords
                WHERE keyword = :keyword
                """,
            new MapSqlParameterSource().addValue("keyword", keyword.trim()),
            KEYWORD_MAPPER
        );
        return results.isEmpty() ? null : results.get(0);
    }

    /**
     * Returns the keyword row for {@code keyword}, inserting an active one when missing.
     */
    public Keyword findOrCreate(String keyword) {
        Keyword existing = findByKeyword(keyword);
        if (existing != null) {
            return existing;
        }
        try {
            insert(keyword, "active", null, null);
        } catch (DuplicateKeyException e) {
            log.debug("Keyword '{}' was inserted concurrently", keyword);
        }
        return findByKeyword(keyword);
    }

    /**
     * Active keywords, never-scanned first, then least recently scanned.
     */
    public List<Keyword> findActiveForScan(int limit) {
        return jdbc.query(
            """
                SELECT id, keyword, status, campaign_id, affiliate_program_id, last_scanned_at, date_added
                FROM keywords
                WHERE status = 'active'
                ORDER BY last_scanned_at ASC NULLS FIRST, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            KEYWORD_MAPPER
        );
    }

    public void touchLastScanned(long id, Instant scannedAt) {
        jdbc.update(
            """
                UPDATE keywords
                SET last_scanned_at = :scannedAt
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("scannedAt", toTimestamp(scannedAt))
        );
    }
}
