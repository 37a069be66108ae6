package com.di.pgproof.recommendation;

import com.di.pgproof.sql.JsonColumns;
import com.di.pgproof.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Reads recommendations from the metadata database and writes back their apply state.
 */
@Component
@ConditionalOnProperty(name = "pgproof.store.persistence-enabled", havingValue = "true")
public class JdbcRecommendationStore implements RecommendationStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final RowMapper<Recommendation> rowMapper;

    public JdbcRecommendationStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, JsonColumns json) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.rowMapper = (rs, rowNum) -> {
            Timestamp appliedAt = rs.getTimestamp("applied_at");
            return Recommendation.builder()
                    .id(rs.getString("id"))
                    .title(rs.getString("title"))
                    .sqlFix(rs.getString("sql_fix"))
                    .rollbackSql(rs.getString("rollback_sql"))
                    .originalSql(rs.getString("original_sql"))
                    .patchSql(rs.getString("patch_sql"))
                    .tables(json.readStringList(rs.getString("tables")))
                    .applied(rs.getBoolean("applied"))
                    .appliedAt(appliedAt != null ? appliedAt.toInstant() : null)
                    .status(rs.getString("status"))
                    .riskLevel(rs.getString("risk_level"))
                    .build();
        };
    }

    @Override
    public Optional<Recommendation> get(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        List<Recommendation> rows = jdbc.query(sql.getRecommendation().getFindById(), rowMapper, id);
        return rows.stream().findFirst();
    }

    @Override
    public boolean update(String id, RecommendationUpdate update) {
        int updated = jdbc.update(sql.getRecommendation().getUpdateApplyState(),
                update.isApplied(),
                update.getAppliedAt() != null ? Timestamp.from(update.getAppliedAt()) : null,
                update.getStatus(),
                id);
        return updated > 0;
    }
}
