package com.affiliate.autopilot.pipeline.persistence;

import com.affiliate.autopilot.pipeline.model.CommunityNames;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class CommunityRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public CommunityRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void upsert(String name, String category) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", CommunityNames.normalize(name))
            .addValue("category", category);
        int updated = jdbc.update(
            """
                UPDATE communities
                SET category = :category
                WHERE name = :name
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO communities (name, category)
                    VALUES (:name, :category)
                    """,
                params
            );
        }
    }

    /**
     * Category of a community, matched on its normalized name; null when unknown.
     */
    public String findCategory(String community) {
        String normalized = CommunityNames.normalize(community);
        if (normalized.isEmpty()) {
            return null;
        }
        List<String> results = jdbc.query(
            """
                SELECT category
                FROM communities
                WHERE name = :name
                """,
            new MapSqlParameterSource().addValue("name", normalized),
            (rs, rowNum) -> rs.getString("category")
        );
        return results.isEmpty() ? null : results.get(0);
    }
}
