package com.di.pgproof.sandbox;

import com.di.pgproof.exception.BenchmarkUnavailableException;
import com.di.pgproof.exception.SandboxException;
import com.di.pgproof.target.BenchmarkTarget;
import com.di.pgproof.target.OperationClass;
import com.di.pgproof.target.TargetSelector;
import com.di.pgproof.util.CancellationToken;
import com.di.pgproof.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates, uses and tears down per-job sandbox namespaces on the replica.
 *
 * <p>Every sandbox created by {@link #createSandbox} must be dropped by its owner with
 * {@link #destroySandbox}; {@link #reapOrphans()} drops the ones a crashed process left behind.
 * Each call acquires its own connection and releases it before returning.
 */
@Slf4j
@Service
public class SchemaManager {

    private static final String COLUMNS_SQL =
            "SELECT column_name, data_type, udt_schema, udt_name, character_maximum_length, "
                    + "numeric_precision, numeric_scale, is_nullable "
                    + "FROM information_schema.columns WHERE table_schema = ? AND table_name = ? "
                    + "ORDER BY ordinal_position";
    private static final String TABLE_TYPE_SQL =
            "SELECT table_type FROM information_schema.tables WHERE table_schema = ? AND table_name = ?";
    private static final String IO_COUNTERS_SQL =
            "SELECT blks_hit, blks_read, temp_files, temp_bytes, blk_read_time, blk_write_time "
                    + "FROM pg_stat_database WHERE datname = current_database()";
    private static final String SCHEMAS_LIKE_SQL =
            "SELECT schema_name FROM information_schema.schemata WHERE schema_name LIKE ?";

    private final TargetSelector targetSelector;
    private final SandboxRegistry registry;
    private final SandboxProperties properties;
    private final Clock clock;

    public SchemaManager(TargetSelector targetSelector, SandboxRegistry registry,
                         SandboxProperties properties, Clock clock) {
        this.targetSelector = targetSelector;
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates {@code benchmark_job_<jobId>} and copies each table into it: a
     * {@code TABLESAMPLE SYSTEM} sample for base tables when {@code samplePercent < 100}, a full copy
     * otherwise. Tables that cannot be introspected or copied are skipped with a warning.
     *
     * @return the sandbox schema name
     * @throws SandboxException              if the namespace itself cannot be created
     * @throws BenchmarkUnavailableException if no replica can host it
     */
    public String createSandbox(String jobId, List<String> tables, double samplePercent, CancellationToken token) {
        String schemaName = SandboxNaming.schemaNameFor(jobId);
        double percent = InputValidator.validateSamplePercent(samplePercent);
        DataSource pool = sandboxPool();

        // Owned before it exists, so a concurrent orphan reap never sees it unowned.
        TempSchema.TempSchemaBuilder record = TempSchema.builder()
                .jobId(jobId)
                .schemaName(schemaName)
                .samplePercent(percent)
                .createdAt(clock.instant());
        registry.register(record.build());

        boolean schemaCreated = false;
        try (Connection conn = pool.getConnection()) {
            conn.setAutoCommit(true);
            execute(conn, token, "CREATE SCHEMA IF NOT EXISTS " + InputValidator.quoteIdentifier(schemaName));
            schemaCreated = true;

            for (String table : tables) {
                token.throwIfCancelled();
                try {
                    copyTable(conn, schemaName, table, percent, token).ifPresent(record::sampledTable);
                } catch (SQLException | IllegalArgumentException e) {
                    log.warn("[SANDBOX] Skipping table {} in {}: {}", table, schemaName, e.getMessage());
                }
            }
            TempSchema created = record.build();
            registry.register(created);
            log.info("[SANDBOX] Created {} with {}/{} table(s) at {}%", schemaName,
                    created.getSampledTables().size(), tables.size(), InputValidator.formatPercent(percent));
            return schemaName;
        } catch (SQLException e) {
            throw new SandboxException("Failed to create sandbox " + schemaName + ": " + e.getMessage(), e);
        } finally {
            if (!schemaCreated) {
                registry.remove(jobId);
            }
        }
    }

    public String createSandbox(String jobId, List<String> tables, double samplePercent) {
        return createSandbox(jobId, tables, samplePercent, CancellationToken.none());
    }

    /**
     * Runs one statement with the sandbox first on the search path, measuring wall-clock time and
     * the {@code pg_stat_database} delta around it.
     */
    public QueryMeasurement runInSandbox(String schemaName, String sql, List<?> params, CancellationToken token) {
        InputValidator.validateIdentifier(schemaName, "sandbox schema name");
        try (Connection conn = sandboxPool().getConnection()) {
            conn.setAutoCommit(true);
            setSearchPath(conn, schemaName, token);
            try {
                IoMetrics before = readIoCounters(conn, token);
                long start = System.nanoTime();
                long rows;
                if (params == null || params.isEmpty()) {
                    try (Statement st = conn.createStatement()) {
                        applyTimeout(st);
                        rows = token.execute(st, s -> countRows(s, s.execute(sql)));
                    }
                } else {
                    try (PreparedStatement ps = conn.prepareStatement(sql)) {
                        applyTimeout(ps);
                        for (int i = 0; i < params.size(); i++) {
                            ps.setObject(i + 1, params.get(i));
                        }
                        rows = token.execute(ps, s -> countRows(s, s.execute()));
                    }
                }
                double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
                IoMetrics after = readIoCounters(conn, token);
                log.debug("[SANDBOX] {} | {} ms | {} row(s)", schemaName, elapsedMs, rows);
                return new QueryMeasurement(elapsedMs, rows, after.minus(before));
            } finally {
                resetSession(conn);
            }
        } catch (SQLException e) {
            throw new SandboxException("Statement failed in " + schemaName + ": " + e.getMessage(), e);
        }
    }

    public QueryMeasurement runInSandbox(String schemaName, String sql) {
        return runInSandbox(schemaName, sql, List.of(), CancellationToken.none());
    }

    /**
     * Runs a DDL statement inside the sandbox. A database error is reported as {@code false} so the
     * caller can continue with baseline-only numbers; cancellation still propagates.
     */
    public boolean runDdlInSandbox(String schemaName, String ddl, CancellationToken token) {
        InputValidator.validateIdentifier(schemaName, "sandbox schema name");
        try (Connection conn = sandboxPool().getConnection()) {
            conn.setAutoCommit(true);
            setSearchPath(conn, schemaName, token);
            try {
                execute(conn, token, ddl);
            } finally {
                resetSession(conn);
            }
            log.info("[SANDBOX] DDL applied in {}", schemaName);
            return true;
        } catch (SQLException e) {
            log.warn("[SANDBOX] DDL failed in {}: {}", schemaName, e.getMessage());
            return false;
        }
    }

    public boolean runDdlInSandbox(String schemaName, String ddl) {
        return runDdlInSandbox(schemaName, ddl, CancellationToken.none());
    }

    /**
     * Drops the job's sandbox. Dropping a namespace that is already gone is not an error.
     * The owner record is removed even when the drop fails; {@link #reapOrphans()} retries later.
     *
     * @return true if the drop statement succeeded
     */
    public boolean destroySandbox(String jobId) {
        String schemaName = SandboxNaming.schemaNameFor(jobId);
        try {
            dropSchema(schemaName);
            log.info("[SANDBOX] Dropped {}", schemaName);
            return true;
        } catch (SQLException | BenchmarkUnavailableException e) {
            log.warn("[SANDBOX] Failed to drop {}: {}", schemaName, e.getMessage());
            return false;
        } finally {
            registry.remove(jobId);
        }
    }

    public List<TempSchema> listActive() {
        return registry.snapshot();
    }

    public Optional<TempSchema> sandboxFor(String jobId) {
        return registry.get(jobId);
    }

    /**
     * Drops every {@code benchmark_job_*} namespace that has no live owner record.
     *
     * @return number of namespaces dropped
     */
    public int reapOrphans() {
        List<String> candidates;
        try {
            candidates = listSchemas(SandboxNaming.LIKE_PATTERN);
        } catch (SQLException | BenchmarkUnavailableException e) {
            log.warn("[SANDBOX] Orphan scan failed: {}", e.getMessage());
            return 0;
        }
        int dropped = 0;
        for (String schemaName : candidates) {
            if (!SandboxNaming.isSandboxSchema(schemaName) || registry.ownsSchema(schemaName)) {
                continue;
            }
            try {
                dropSchema(schemaName);
                dropped++;
                log.info("[SANDBOX] Reaped orphan {}", schemaName);
            } catch (SQLException | RuntimeException e) {
                log.warn("[SANDBOX] Failed to reap orphan {}: {}", schemaName, e.getMessage());
            }
        }
        if (dropped > 0) {
            log.info("[SANDBOX] Reaped {} orphan sandbox(es)", dropped);
        }
        return dropped;
    }

    private Optional<SampledTable> copyTable(Connection conn, String schemaName, String table, double percent,
                                             CancellationToken token) throws SQLException {
        String[] ref = InputValidator.splitTableName(table, properties.getSourceSchema());
        String sourceSchema = ref[0];
        String tableName = ref[1];

        List<ColumnDefinition> columns = loadColumns(conn, sourceSchema, tableName, token);
        if (columns.isEmpty()) {
            log.warn("[SANDBOX] Table {}.{} not found; skipping", sourceSchema, tableName);
            return Optional.empty();
        }
        String target = InputValidator.qualify(schemaName, tableName);
        String source = InputValidator.qualify(sourceSchema, tableName);
        List<String> defs = new ArrayList<>(columns.size());
        for (ColumnDefinition column : columns) {
            defs.add(column.toSql());
        }
        execute(conn, token, "CREATE TABLE " + target + " (" + String.join(", ", defs) + ")");

        boolean sampled = percent < 100.0 && isBaseTable(conn, sourceSchema, tableName, token);
        String copy = "INSERT INTO " + target + " SELECT * FROM " + source
                + (sampled ? " TABLESAMPLE SYSTEM (" + InputValidator.formatPercent(percent) + ")" : "");
        execute(conn, token, copy);

        long rowCount;
        try (Statement st = conn.createStatement()) {
            rowCount = token.execute(st, s -> {
                try (ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM " + target)) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            });
        }
        double effectivePercent = sampled ? percent : 100.0;
        log.debug("[SANDBOX] Copied {} -> {} ({} rows, {}%)", source, target, rowCount, effectivePercent);
        return Optional.of(new SampledTable(tableName, rowCount, effectivePercent));
    }

    private List<ColumnDefinition> loadColumns(Connection conn, String schema, String table,
                                               CancellationToken token) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(COLUMNS_SQL)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            return token.execute(ps, s -> {
                List<ColumnDefinition> columns = new ArrayList<>();
                try (ResultSet rs = s.executeQuery()) {
                    while (rs.next()) {
                        columns.add(ColumnDefinition.builder()
                                .name(rs.getString("column_name"))
                                .dataType(rs.getString("data_type"))
                                .udtSchema(rs.getString("udt_schema"))
                                .udtName(rs.getString("udt_name"))
                                .characterMaximumLength(nullableInt(rs, "character_maximum_length"))
                                .numericPrecision(nullableInt(rs, "numeric_precision"))
                                .numericScale(nullableInt(rs, "numeric_scale"))
                                .nullable(!"NO".equals(rs.getString("is_nullable")))
                                .build());
                    }
                }
                return columns;
            });
        }
    }

    private boolean isBaseTable(Connection conn, String schema, String table, CancellationToken token) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(TABLE_TYPE_SQL)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            return token.execute(ps, s -> {
                try (ResultSet rs = s.executeQuery()) {
                    return rs.next() && "BASE TABLE".equals(rs.getString(1));
                }
            });
        }
    }

    /**
     * Reads the current database's counters. Falls back to zeros when the view is not readable,
     * which turns the I/O delta into zeros rather than failing the measurement.
     */
    private IoMetrics readIoCounters(Connection conn, CancellationToken token) {
        try (Statement st = conn.createStatement()) {
            return token.execute(st, s -> {
                try (ResultSet rs = s.executeQuery(IO_COUNTERS_SQL)) {
                    if (!rs.next()) {
                        return IoMetrics.ZERO;
                    }
                    return IoMetrics.builder()
                            .sharedBuffersHit(rs.getLong("blks_hit"))
                            .sharedBuffersRead(rs.getLong("blks_read"))
                            .tempFiles(rs.getLong("temp_files"))
                            .tempBytes(rs.getLong("temp_bytes"))
                            .blkReadTimeMs(rs.getDouble("blk_read_time"))
                            .blkWriteTimeMs(rs.getDouble("blk_write_time"))
                            .build();
                }
            });
        } catch (SQLException e) {
            log.warn("[SANDBOX] pg_stat_database not readable, I/O counters reported as zero: {}", e.getMessage());
            return IoMetrics.ZERO;
        }
    }

    private List<String> listSchemas(String likePattern) throws SQLException {
        try (Connection conn = sandboxPool().getConnection();
             PreparedStatement ps = conn.prepareStatement(SCHEMAS_LIKE_SQL)) {
            ps.setString(1, likePattern);
            List<String> names = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
            return names;
        }
    }

    private void dropSchema(String schemaName) throws SQLException {
        try (Connection conn = sandboxPool().getConnection()) {
            conn.setAutoCommit(true);
            execute(conn, CancellationToken.none(), "DROP SCHEMA IF EXISTS " + InputValidator.quoteIdentifier(schemaName) + " CASCADE");
        }
    }

    private void setSearchPath(Connection conn, String schemaName, CancellationToken token) throws SQLException {
        execute(conn, token, "SET search_path TO " + InputValidator.quoteIdentifier(schemaName) + ", public");
    }

    /** Pooled connections must not carry the sandbox search_path to their next borrower. */
    private static void resetSession(Connection conn) {
        try (Statement st = conn.createStatement()) {
            st.execute("RESET ALL");
        } catch (SQLException e) {
            log.warn("[SANDBOX] Failed to reset session state: {}", e.getMessage());
        }
    }

    private void execute(Connection conn, CancellationToken token, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            token.execute(st, s -> s.execute(sql));
        }
    }

    private void applyTimeout(Statement st) throws SQLException {
        long seconds = properties.getStatementTimeout().getSeconds();
        if (seconds > 0) {
            st.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, seconds));
        }
    }

    private DataSource sandboxPool() {
        BenchmarkTarget target = targetSelector.selectTarget(OperationClass.MUTATE);
        if (!target.isAvailable()) {
            throw new BenchmarkUnavailableException("No replica available to host sandbox schemas");
        }
        return target.getPool();
    }

    private static long countRows(Statement st, boolean hasResultSet) throws SQLException {
        if (!hasResultSet) {
            return Math.max(0, st.getUpdateCount());
        }
        long rows = 0;
        try (ResultSet rs = st.getResultSet()) {
            while (rs.next()) {
                rows++;
            }
        }
        return rows;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
