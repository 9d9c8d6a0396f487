package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.ActionType;
import com.affiliate.autopilot.pipeline.model.NewOpportunity;
import com.affiliate.autopilot.pipeline.model.Opportunity;
import com.affiliate.autopilot.pipeline.model.OpportunityStatus;
import com.affiliate.autopilot.pipeline.model.ThreadIntent;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.Instant;
import java.util.List;

import static com.affiliate.autopilot.pipeline.persistence.SqlValues.nullableLong;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.toInstant;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.toTimestamp;
import static com.affiliate.autopilot.pipeline.persistence.SqlValues.truncate;

@Repository
public class OpportunityRepository {
    private static final String COLUMNS = """
        id, keyword_id, keyword, url, title, snippet, community, discovery_rank, intent,
        opportunity_score, action_type, status, affiliate_program_id, date_discovered, date_processed
        """;

    private static final RowMapper<Opportunity> OPPORTUNITY_MAPPER = (rs, rowNum) -> new Opportunity(
        rs.getLong("id"),
        rs.getLong("keyword_id"),
        rs.getString("keyword"),
        rs.getString("url"),
        rs.getString("title"),
        rs.getString("snippet"),
        rs.getString("community"),
        rs.getInt("discovery_rank"),
        ThreadIntent.valueOf(rs.getString("intent")),
        rs.getInt("opportunity_score"),
        ActionType.fromDbValue(rs.getString("action_type")),
        OpportunityStatus.fromDbValue(rs.getString("status")),
        nullableLong(rs, "affiliate_program_id"),
        toInstant(rs.getTimestamp("date_discovered")),
        toInstant(rs.getTimestamp("date_processed"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public OpportunityRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean existsByUrl(String url) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM opportunities
                WHERE url = :url
                """,
            new MapSqlParameterSource().addValue("url", url),
            Integer.class
        );
        return count != null && count > 0;
    }

    /**
     * Inserts a new opportunity in status {@code new}. A second insert for the same URL
     * raises {@link org.springframework.dao.DuplicateKeyException}.
     */
    public long insert(NewOpportunity opportunity, Instant discoveredAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("keywordId", opportunity.keywordId())
            .addValue("keyword", opportunity.keyword())
            .addValue("url", opportunity.url())
            .addValue("title", truncate(opportunity.title(), 1024))
            .addValue("snippet", truncate(opportunity.snippet(), 4000))
            .addValue("community", opportunity.community())
            .addValue("discoveryRank", opportunity.discoveryRank())
            .addValue("intent", opportunity.intent().name())
            .addValue("score", opportunity.opportunityScore())
            .addValue("actionType", opportunity.actionType().dbValue())
            .addValue("status", OpportunityStatus.NEW.dbValue())
            .addValue("affiliateProgramId", opportunity.affiliateProgramId())
            .addValue("discoveredAt", toTimestamp(discoveredAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO opportunities (
                    keyword_id, keyword, url, title, snippet, community, discovery_rank, intent,
                    opportunity_score, action_type, status, affiliate_program_id, date_discovered
                )
                VALUES (
                    :keywordId, :keyword, :url, :title, :snippet, :community, :discoveryRank, :intent,
                    :score, :actionType, :status, :affiliateProgramId, :discoveredAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public Opportunity findById(long id) {
        List<Opportunity> results = jdbc.query(
            "SELECT " + COLUMNS + " FROM opportunities WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            OPPORTUNITY_MAPPER
        );
        return results.isEmpty() ? null : results.get(0);
    }

    /**
     * Opportunities in {@code status}, best score first; equal scores keep discovery order.
     */
    public List<Opportunity> findByStatus(OpportunityStatus status, int limit) {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM opportunities
                WHERE status = :status
                ORDER BY opportunity_score DESC, date_discovered ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("status", status.dbValue())
                .addValue("limit", Math.max(1, limit)),
            OPPORTUNITY_MAPPER
        );
    }

    public List<Opportunity> findRecent(int limit) {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM opportunities
                ORDER BY date_discovered DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            OPPORTUNITY_MAPPER
        );
    }

    /**
     * Highest scoring opportunities that are still actionable ({@code new} or {@code queued}).
     */
    public List<Opportunity> findTopActionable(int limit) {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM opportunities
                WHERE status IN ('new', 'queued')
                ORDER BY opportunity_score DESC, date_discovered ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            OPPORTUNITY_MAPPER
        );
    }

    public List<Opportunity> findByCommunities(List<String> communities, int limit) {
        if (communities == null || communities.isEmpty()) {
            return List.of();
        }
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM opportunities
                WHERE LOWER(community) IN (:communities)
                  AND status IN ('new', 'queued')
                ORDER BY opportunity_score DESC, date_discovered ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("communities", communities)
                .addValue("limit", Math.max(1, limit)),
            OPPORTUNITY_MAPPER
        );
    }

    /**
     * Moves an opportunity from {@code expected} to {@code target}. Zero rows means the
     * opportunity was missing or no longer in {@code expected}.
     */
    public int updateStatus(long id, OpportunityStatus expected, OpportunityStatus target, Instant dateProcessed) {
        return jdbc.update(
            """
                UPDATE opportunities
                SET status = :target,
                    date_processed = COALESCE(:dateProcessed, date_processed)
                WHERE id = :id
                  AND status = :expected
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("expected", expected.dbValue())
                .addValue("target", target.dbValue())
                .addValue("dateProcessed", toTimestamp(dateProcessed), Types.TIMESTAMP)
        );
    }

    public int countByStatus(OpportunityStatus status) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM opportunities
                WHERE status = :status
                """,
            new MapSqlParameterSource().addValue("status", status.dbValue()),
            Integer.class
        );
        return count == null ? 0 : count;
    }
}
