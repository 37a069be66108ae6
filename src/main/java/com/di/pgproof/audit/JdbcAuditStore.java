package com.di.pgproof.audit;

import com.di.pgproof.sql.JsonColumns;
import com.di.pgproof.sql.SqlQueriesProperties;
import com.di.pgproof.util.InputValidator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Audit trail in the {@code pgproof_audit_log} table of the metadata database.
 */
@Component
@ConditionalOnProperty(name = "pgproof.store.persistence-enabled", havingValue = "true")
public class JdbcAuditStore implements AuditStore {

    private static final int MAX_LIMIT = 1000;

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final JsonColumns json;
    private final RowMapper<AuditLogEntry> rowMapper;

    public JdbcAuditStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, JsonColumns json) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> {
            Timestamp ts = rs.getTimestamp("created_at");
            return AuditLogEntry.builder()
                    .id(rs.getLong("id"))
                    .actionType(AuditActionType.fromCode(rs.getString("action_type")))
                    .recommendationId(rs.getString("recommendation_id"))
                    .details(json.readMap(rs.getString("details")))
                    .riskLevel(rs.getString("risk_level"))
                    .status(AuditStatus.fromCode(rs.getString("status")))
                    .createdAt(ts != null ? ts.toInstant() : null)
                    .build();
        };
    }

    @Override
    public AuditLogEntry append(AuditLogEntry entry) {
        Instant createdAt = entry.getCreatedAt() != null ? entry.getCreatedAt() : Instant.now();
        Long id = jdbc.queryForObject(
                sql.getAudit().getInsert(),
                Long.class,
                entry.getActionType().getCode(),
                entry.getRecommendationId(),
                json.write(entry.getDetails()),
                entry.getRiskLevel(),
                entry.getStatus().getCode(),
                Timestamp.from(createdAt));
        return entry.toBuilder().id(id).createdAt(createdAt).build();
    }

    @Override
    public List<AuditLogEntry> findRecent(int limit) {
        return jdbc.query(sql.getAudit().getFindRecent(), rowMapper, InputValidator.clampLimit(limit, MAX_LIMIT));
    }

    @Override
    public List<AuditLogEntry> findByRecommendation(String recommendationId, int limit) {
        if (recommendationId == null || recommendationId.isBlank()) return List.of();
        return jdbc.query(sql.getAudit().getFindByRecommendation(), rowMapper,
                recommendationId, InputValidator.clampLimit(limit, MAX_LIMIT));
    }
}
