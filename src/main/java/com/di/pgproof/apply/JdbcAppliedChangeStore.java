package com.di.pgproof.apply;

import com.di.pgproof.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Applied changes in {@code pgproof_applied_changes}, so rollback eligibility survives a restart.
 */
@Component
@ConditionalOnProperty(name = "pgproof.store.persistence-enabled", havingValue = "true")
public class JdbcAppliedChangeStore implements AppliedChangeStore {

    private static final RowMapper<AppliedChange> ROW_MAPPER = (rs, rowNum) -> AppliedChange.builder()
            .recommendationId(rs.getString("recommendation_id"))
            .sqlExecuted(rs.getString("sql_executed"))
            .schemaName(rs.getString("schema_name"))
            .appliedAt(toInstant(rs.getTimestamp("applied_at")))
            .rollbackSql(rs.getString("rollback_sql"))
            .status(ChangeStatus.fromCode(rs.getString("status")))
            .rolledBackAt(toInstant(rs.getTimestamp("rolled_back_at")))
            .build();

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcAppliedChangeStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    @Override
    public void save(AppliedChange change) {
        jdbc.update(sql.getAppliedChange().getUpsert(),
                change.getRecommendationId(),
                change.getSqlExecuted(),
                change.getSchemaName(),
                toTimestamp(change.getAppliedAt()),
                change.getRollbackSql(),
                change.getStatus().getCode(),
                toTimestamp(change.getRolledBackAt()));
    }

    @Override
    public Optional<AppliedChange> find(String recommendationId) {
        if (recommendationId == null) return Optional.empty();
        return jdbc.query(sql.getAppliedChange().getFindByRecommendation(), ROW_MAPPER, recommendationId)
                .stream().findFirst();
    }

    @Override
    public List<AppliedChange> findAll() {
        return jdbc.query(sql.getAppliedChange().getFindAll(), ROW_MAPPER);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
