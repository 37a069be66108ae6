package com.di.pgproof.apply;

import com.di.pgproof.audit.AuditActionType;
import com.di.pgproof.audit.AuditLogEntry;
import com.di.pgproof.audit.AuditRecorder;
import com.di.pgproof.audit.AuditStatus;
import com.di.pgproof.audit.AuditStore;
import com.di.pgproof.exception.ApplyExecutionException;
import com.di.pgproof.exception.BenchmarkUnavailableException;
import com.di.pgproof.exception.ErrorCategory;
import com.di.pgproof.exception.PreconditionViolationException;
import com.di.pgproof.exception.PreconditionViolationException.Reason;
import com.di.pgproof.recommendation.Recommendation;
import com.di.pgproof.recommendation.RecommendationStore;
import com.di.pgproof.recommendation.RecommendationUpdate;
import com.di.pgproof.target.BenchmarkTarget;
import com.di.pgproof.target.OperationClass;
import com.di.pgproof.target.TargetSelector;
import com.di.pgproof.util.CancellationToken;
import com.di.pgproof.util.InputValidator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies vetted recommendation statements and rolls them back.
 *
 * <p>Only statements passing {@link SqlSafetyPolicy} are executed. Statements PostgreSQL will not run
 * in a transaction block ({@code CONCURRENTLY} index DDL, {@code ALTER SYSTEM}) run under autocommit;
 * everything else runs in a single transaction together with its namespace setup.
 *
 * <p>Every attempt that passes the preconditions leaves exactly one audit entry: completed, failed, or
 * partial when the statement ran but recording its outcome did not. At most one apply or rollback runs
 * per recommendation at a time; a second caller is refused with {@link Reason#IN_PROGRESS}.
 */
@Slf4j
@Service
public class ApplyManager {

    private static final String SCHEMAS_LIKE_SQL =
            "SELECT schema_name FROM information_schema.schemata WHERE schema_name LIKE ?";

    private final RecommendationStore recommendations;
    private final AppliedChangeStore appliedChanges;
    private final AuditRecorder auditRecorder;
    private final AuditStore auditStore;
    private final TargetSelector targetSelector;
    private final ApplyProperties properties;
    private final Clock clock;
    /** Recommendation id to the operation currently running for it in this process. */
    private final Map<String, String> inFlight = new ConcurrentHashMap<>();

    public ApplyManager(RecommendationStore recommendations, AppliedChangeStore appliedChanges,
                        AuditRecorder auditRecorder, AuditStore auditStore, TargetSelector targetSelector,
                        ApplyProperties properties, Clock clock) {
        this.recommendations = recommendations;
        this.appliedChanges = appliedChanges;
        this.auditRecorder = auditRecorder;
        this.auditStore = auditStore;
        this.targetSelector = targetSelector;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean validateSafety(String sql) {
        return SqlSafetyPolicy.isAllowed(sql);
    }

    public Optional<String> deriveRollback(Recommendation recommendation) {
        return RollbackDeriver.derive(recommendation);
    }

    public ApplyResult apply(String recommendationId) {
        return apply(recommendationId, CancellationToken.none());
    }

    /**
     * @throws PreconditionViolationException if the recommendation is unknown, already applied or being
     *                                        changed, has no statement or an unsafe one
     * @throws ApplyExecutionException        if the statement fails on the database or its outcome
     *                                        cannot be recorded
     */
    public ApplyResult apply(String recommendationId, CancellationToken token) {
        claim(recommendationId, "apply");
        try {
            return doApply(recommendationId, token);
        } finally {
            unclaim(recommendationId);
        }
    }

    private ApplyResult doApply(String recommendationId, CancellationToken token) {
        Recommendation rec = recommendations.get(recommendationId)
                .orElseThrow(() -> PreconditionViolationException.recommendationNotFound(recommendationId));
        if (rec.isApplied() || isCurrentlyApplied(recommendationId)) {
            throw new PreconditionViolationException(Reason.ALREADY_APPLIED,
                    "Recommendation " + recommendationId + " is already applied");
        }
        String sqlFix = rec.getSqlFix() != null ? rec.getSqlFix().trim() : "";
        if (sqlFix.isEmpty()) {
            throw new PreconditionViolationException(Reason.MISSING_SQL,
                    "Recommendation " + recommendationId + " has no SQL fix");
        }
        if (!validateSafety(sqlFix)) {
            throw new PreconditionViolationException(Reason.UNSAFE_SQL,
                    "SQL fix for recommendation " + recommendationId + " is not on the allow-list");
        }

        String rollbackSql = deriveRollback(rec).orElse(null);
        Instant startedAt = clock.instant();
        String schemaName = ApplySchemaNames.forRecommendation(recommendationId, startedAt.getEpochSecond());
        boolean autocommit = SqlSafetyPolicy.requiresAutocommit(sqlFix);

        Connection conn = null;
        try {
            conn = mutatePool().getConnection();
            if (autocommit) {
                conn.setAutoCommit(false);
                execute(conn, token, "CREATE SCHEMA IF NOT EXISTS " + InputValidator.quoteIdentifier(schemaName));
                conn.commit();
                conn.setAutoCommit(true);
                execute(conn, token, "SET search_path TO " + InputValidator.quoteIdentifier(schemaName) + ", public");
                execute(conn, token, sqlFix);
            } else {
                conn.setAutoCommit(false);
                execute(conn, token, "CREATE SCHEMA IF NOT EXISTS " + InputValidator.quoteIdentifier(schemaName));
                execute(conn, token, "SET LOCAL search_path TO " + InputValidator.quoteIdentifier(schemaName) + ", public");
                execute(conn, token, sqlFix);
                conn.commit();
            }
        } catch (SQLException | RuntimeException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sql_attempted", sqlFix);
            details.put("schema_name", schemaName);
            details.put("error", ErrorCategory.rootMessage(e));
            details.put("error_category", ErrorCategory.categorize(e).name());
            auditRecorder.record(AuditActionType.RECOMMENDATION_APPLY_FAILED, recommendationId,
                    AuditStatus.FAILED, rec.getRiskLevel(), details);
            log.error("[APPLY] Apply failed for recommendation {}: {}", recommendationId, ErrorCategory.describe(e));
            throw new ApplyExecutionException("apply", recommendationId, e);
        } finally {
            release(conn);
        }

        Instant appliedAt = clock.instant();
        AppliedChange change = AppliedChange.builder()
                .recommendationId(recommendationId)
                .sqlExecuted(sqlFix)
                .schemaName(schemaName)
                .appliedAt(appliedAt)
                .rollbackSql(rollbackSql)
                .status(ChangeStatus.APPLIED)
                .build();
        try {
            appliedChanges.save(change);
            recommendations.update(recommendationId, RecommendationUpdate.applied(appliedAt));
        } catch (RuntimeException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sql_executed", sqlFix);
            details.put("rollback_sql", rollbackSql);
            details.put("schema_name", schemaName);
            details.put("error", ErrorCategory.rootMessage(e));
            details.put("error_category", ErrorCategory.categorize(e).name());
            auditRecorder.record(AuditActionType.RECOMMENDATION_APPLY_FAILED, recommendationId,
                    AuditStatus.PARTIAL, rec.getRiskLevel(), details);
            log.error("[APPLY] Recommendation {} was applied in {} but recording it failed: {}",
                    recommendationId, schemaName, ErrorCategory.describe(e));
            throw new ApplyExecutionException("record applied", recommendationId, e);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sql_executed", sqlFix);
        details.put("rollback_sql", rollbackSql);
        details.put("schema_name", schemaName);
        details.put("transactional", !autocommit);
        auditRecorder.record(AuditActionType.RECOMMENDATION_APPLIED, recommendationId,
                AuditStatus.COMPLETED, rec.getRiskLevel(), details);
        log.info("[APPLY] Applied recommendation {} in {} (rollback {})", recommendationId, schemaName,
                rollbackSql != null ? "available" : "not available");

        return ApplyResult.builder()
                .success(true)
                .recommendationId(recommendationId)
                .sqlExecuted(sqlFix)
                .schemaName(schemaName)
                .appliedAt(appliedAt)
                .rollbackSql(rollbackSql)
                .rollbackAvailable(change.isRollbackAvailable())
                .build();
    }

    public RollbackResult rollback(String recommendationId) {
        return rollback(recommendationId, CancellationToken.none());
    }

    /**
     * @throws PreconditionViolationException if nothing is applied for the recommendation, a change is
     *                                        in progress, or the recorded rollback is missing or unsafe
     * @throws ApplyExecutionException        if the rollback statement fails on the database or its
     *                                        outcome cannot be recorded
     */
    public RollbackResult rollback(String recommendationId, CancellationToken token) {
        claim(recommendationId, "rollback");
        try {
            return doRollback(recommendationId, token);
        } finally {
            unclaim(recommendationId);
        }
    }

    private RollbackResult doRollback(String recommendationId, CancellationToken token) {
        AppliedChange change = appliedChanges.find(recommendationId)
                .filter(c -> c.getStatus() == ChangeStatus.APPLIED)
                .orElseThrow(() -> new PreconditionViolationException(Reason.NOT_APPLIED,
                        "Recommendation " + recommendationId + " has no applied change to roll back"));
        String rollbackSql = change.getRollbackSql() != null ? change.getRollbackSql().trim() : "";
        if (rollbackSql.isEmpty()) {
            throw new PreconditionViolationException(Reason.MISSING_ROLLBACK,
                    "No rollback SQL recorded for recommendation " + recommendationId);
        }
        if (!validateSafety(rollbackSql)) {
            throw new PreconditionViolationException(Reason.UNSAFE_SQL,
                    "Rollback SQL for recommendation " + recommendationId + " is not on the allow-list");
        }
        String riskLevel = recommendations.get(recommendationId).map(Recommendation::getRiskLevel).orElse(null);
        boolean autocommit = SqlSafetyPolicy.requiresAutocommit(rollbackSql);

        Connection conn = null;
        try {
            conn = mutatePool().getConnection();
            conn.setAutoCommit(autocommit);
            if (change.getSchemaName() != null) {
                // Same name resolution the forward statement had.
                execute(conn, token, (autocommit ? "SET" : "SET LOCAL") + " search_path TO "
                        + InputValidator.quoteIdentifier(change.getSchemaName()) + ", public");
            }
            execute(conn, token, rollbackSql);
            if (!autocommit) {
                conn.commit();
            }
        } catch (SQLException | RuntimeException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sql_attempted", rollbackSql);
            details.put("original_sql", change.getSqlExecuted());
            details.put("error", ErrorCategory.rootMessage(e));
            details.put("error_category", ErrorCategory.categorize(e).name());
            auditRecorder.record(AuditActionType.RECOMMENDATION_ROLLBACK_FAILED, recommendationId,
                    AuditStatus.FAILED, riskLevel, details);
            log.error("[APPLY] Rollback failed for recommendation {}: {}", recommendationId, ErrorCategory.describe(e));
            throw new ApplyExecutionException("roll back", recommendationId, e);
        } finally {
            release(conn);
        }

        Instant rolledBackAt = clock.instant();
        try {
            appliedChanges.save(change.toBuilder()
                    .status(ChangeStatus.ROLLED_BACK)
                    .rolledBackAt(rolledBackAt)
                    .build());
            recommendations.update(recommendationId, RecommendationUpdate.rolledBack());
        } catch (RuntimeException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sql_executed", rollbackSql);
            details.put("original_sql", change.getSqlExecuted());
            details.put("schema_name", change.getSchemaName());
            details.put("error", ErrorCategory.rootMessage(e));
            details.put("error_category", ErrorCategory.categorize(e).name());
            auditRecorder.record(AuditActionType.RECOMMENDATION_ROLLBACK_FAILED, recommendationId,
                    AuditStatus.PARTIAL, riskLevel, details);
            log.error("[APPLY] Recommendation {} was rolled back but recording it failed: {}",
                    recommendationId, ErrorCategory.describe(e));
            throw new ApplyExecutionException("record rollback of", recommendationId, e);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sql_executed", rollbackSql);
        details.put("original_sql", change.getSqlExecuted());
        details.put("schema_name", change.getSchemaName());
        auditRecorder.record(AuditActionType.RECOMMENDATION_ROLLED_BACK, recommendationId,
                AuditStatus.COMPLETED, riskLevel, details);
        log.info("[APPLY] Rolled back recommendation {}", recommendationId);

        return RollbackResult.builder()
                .success(true)
                .recommendationId(recommendationId)
                .sqlExecuted(rollbackSql)
                .schemaName(change.getSchemaName())
                .rolledBackAt(rolledBackAt)
                .build();
    }

    public List<AuditLogEntry> auditTrail(int limit) {
        return auditStore.findRecent(InputValidator.clampLimit(limit, properties.getAuditTrailMaxLimit()));
    }

    public List<AuditLogEntry> auditTrail(String recommendationId, int limit) {
        return auditStore.findByRecommendation(recommendationId,
                InputValidator.clampLimit(limit, properties.getAuditTrailMaxLimit()));
    }

    public List<AppliedChange> appliedChanges() {
        return appliedChanges.findAll();
    }

    public Optional<AppliedChange> changeStatus(String recommendationId) {
        return appliedChanges.find(recommendationId);
    }

    /**
     * Drops {@code apply_*} namespaces whose embedded timestamp is older than {@code maxAge}.
     * Each drop is audited as {@code cleanup}; names without a parseable timestamp are left alone.
     *
     * @return number of namespaces dropped
     */
    public int reapOldSandboxes(Duration maxAge) {
        List<String> names;
        DataSource pool;
        try {
            pool = mutatePool();
            names = listApplySchemas(pool);
        } catch (SQLException | BenchmarkUnavailableException e) {
            log.warn("[APPLY] Apply sandbox scan failed: {}", e.getMessage());
            return 0;
        }
        long cutoff = clock.instant().minus(maxAge).getEpochSecond();
        int dropped = 0;
        for (String name : names) {
            OptionalLong createdAt = ApplySchemaNames.parseEpochSeconds(name);
            if (createdAt.isEmpty()) {
                log.warn("[APPLY] Skipping apply namespace with unparseable name: {}", name);
                continue;
            }
            if (createdAt.getAsLong() >= cutoff) {
                continue;
            }
            try (Connection conn = pool.getConnection(); Statement st = conn.createStatement()) {
                conn.setAutoCommit(true);
                st.execute("DROP SCHEMA IF EXISTS " + InputValidator.quoteIdentifier(name) + " CASCADE");
                dropped++;
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("schema_name", name);
                details.put("age_seconds", clock.instant().getEpochSecond() - createdAt.getAsLong());
                auditRecorder.record(AuditActionType.CLEANUP, null, AuditStatus.COMPLETED, null, details);
                log.info("[APPLY] Dropped old apply namespace {}", name);
            } catch (SQLException | RuntimeException e) {
                log.warn("[APPLY] Failed to drop apply namespace {}: {}", name, e.getMessage());
            }
        }
        return dropped;
    }

    @PreDestroy
    void reapOnShutdown() {
        if (!properties.isReapOnShutdown()) {
            return;
        }
        int dropped = reapOldSandboxes(properties.getSandboxMaxAge());
        if (dropped > 0) {
            log.info("[APPLY] Dropped {} old apply namespace(s) on shutdown", dropped);
        }
    }

    private boolean isCurrentlyApplied(String recommendationId) {
        return appliedChanges.find(recommendationId)
                .map(c -> c.getStatus() == ChangeStatus.APPLIED)
                .orElse(false);
    }

    private List<String> listApplySchemas(DataSource pool) throws SQLException {
        try (Connection conn = pool.getConnection();
             PreparedStatement ps = conn.prepareStatement(SCHEMAS_LIKE_SQL)) {
            ps.setString(1, ApplySchemaNames.LIKE_PATTERN);
            List<String> names = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
            return names;
        }
    }

    private static void execute(Connection conn, CancellationToken token, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            token.execute(st, s -> s.execute(sql));
        }
    }

    /** Rolls back any open transaction and resets session state before the connection returns to the pool. */
    private void claim(String recommendationId, String operation) {
        if (recommendationId == null) {
            return;
        }
        String running = inFlight.putIfAbsent(recommendationId, operation);
        if (running != null) {
            throw new PreconditionViolationException(Reason.IN_PROGRESS,
                    "Recommendation " + recommendationId + " already has a " + running + " in progress");
        }
    }

    private void unclaim(String recommendationId) {
        if (recommendationId != null) {
            inFlight.remove(recommendationId);
        }
    }

    private static void release(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (!conn.getAutoCommit()) {
                conn.rollback();
                conn.setAutoCommit(true);
            }
            try (Statement st = conn.createStatement()) {
                st.execute("RESET ALL");
            }
        } catch (SQLException e) {
            log.warn("[APPLY] Failed to reset connection: {}", e.getMessage());
        } finally {
            try {
                conn.close();
            } catch (SQLException e) {
                log.warn("[APPLY] Failed to close connection: {}", e.getMessage());
            }
        }
    }

    private DataSource mutatePool() {
        BenchmarkTarget target = targetSelector.selectTarget(OperationClass.MUTATE);
        if (!target.isAvailable()) {
            throw new BenchmarkUnavailableException("No replica available for apply operations");
        }
        return target.getPool();
    }
}
