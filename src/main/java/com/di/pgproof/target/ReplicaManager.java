package com.di.pgproof.target;

import com.di.pgproof.config.DataSourcesProperties;
import com.di.pgproof.config.DbConfigSnapshot;
import com.di.pgproof.util.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Routes benchmark and apply work to a database.
 *
 * <p>{@link OperationClass#MUTATE} is served by the replica or by nothing at all.
 * {@link OperationClass#READ} prefers a healthy replica and falls back to the primary.
 *
 * <p>Replica health is probed with {@code SELECT 1} and {@code pg_is_in_recovery()}, at most once per
 * {@code pgproof.replica.health-check-interval}. A failed probe marks the replica unhealthy and the
 * next {@link #selectTarget} rebuilds the pool and probes again immediately.
 */
@Slf4j
@Service
public class ReplicaManager implements TargetSelector {

    private final DataSourcesProperties dataSources;
    private final ReplicaProperties properties;
    private final ConnectionPoolFactory pools;
    private final Clock clock;

    private final Object lock = new Object();
    private DataSource replicaPool;
    private boolean healthy;
    private Instant lastCheckedAt;
    private boolean reinitRequired;

    public ReplicaManager(DataSourcesProperties dataSources, ReplicaProperties properties,
                          ConnectionPoolFactory pools, Clock clock) {
        this.dataSources = dataSources;
        this.properties = properties;
        this.pools = pools;
        this.clock = clock;
    }

    @Override
    public BenchmarkTarget selectTarget(OperationClass operationClass) {
        switch (operationClass) {
            case MUTATE: {
                DataSource replica = healthyReplica();
                if (replica == null) {
                    log.warn("[REPLICA] No healthy replica for mutating work; benchmarking unavailable");
                    return BenchmarkTarget.none();
                }
                return BenchmarkTarget.of(TargetKind.REPLICA, replica);
            }
            case READ: {
                DataSource replica = healthyReplica();
                if (replica != null) {
                    return BenchmarkTarget.of(TargetKind.REPLICA, replica);
                }
                DataSource primary = primaryPool();
                if (primary != null) {
                    log.debug("[REPLICA] Replica unavailable; serving read from primary");
                    return BenchmarkTarget.of(TargetKind.PRIMARY, primary);
                }
                return BenchmarkTarget.none();
            }
            default:
                throw new IllegalArgumentException("Unsupported operation class: " + operationClass);
        }
    }

    /**
     * Debounced health check. Returns the cached verdict while it is younger than the configured interval.
     */
    public boolean isHealthy() {
        synchronized (lock) {
            if (!isReplicaConfigured()) {
                return false;
            }
            if (replicaPool == null && !initReplica()) {
                return false;
            }
            Instant now = clock.instant();
            if (lastCheckedAt != null
                    && Duration.between(lastCheckedAt, now).compareTo(properties.getHealthCheckInterval()) < 0) {
                return healthy;
            }
            healthy = probe(replicaPool);
            lastCheckedAt = now;
            if (!healthy) {
                reinitRequired = true;
            }
            return healthy;
        }
    }

    public ReplicaStatus status() {
        synchronized (lock) {
            return ReplicaStatus.builder()
                    .enabled(properties.isEnabled())
                    .configured(dataSources.getReplica().isConfigured())
                    .healthy(healthy)
                    .primaryConfigured(dataSources.getPrimary().isConfigured())
                    .lastCheckedAt(lastCheckedAt)
                    .healthCheckInterval(properties.getHealthCheckInterval())
                    .build();
        }
    }

    private DataSource healthyReplica() {
        synchronized (lock) {
            if (!isReplicaConfigured()) {
                return null;
            }
            if (reinitRequired || replicaPool == null) {
                if (!initReplica()) {
                    return null;
                }
            }
            return isHealthy() ? replicaPool : null;
        }
    }

    private boolean isReplicaConfigured() {
        return properties.isEnabled() && dataSources.getReplica().isConfigured();
    }

    /**
     * (Re)builds the replica pool and forces the next health check to probe.
     */
    private boolean initReplica() {
        DbConfigSnapshot snapshot = dataSources.getReplica().toSnapshot("replica");
        try {
            if (replicaPool != null) {
                log.info("[REPLICA] Re-initialising replica pool for {}", HikariDataSource.sanitizeUrl(snapshot.jdbcUrl()));
                pools.evict(snapshot);
            }
            replicaPool = pools.getOrCreate(snapshot);
            reinitRequired = false;
            lastCheckedAt = null;
            return true;
        } catch (RuntimeException e) {
            log.warn("[REPLICA] Could not create replica pool for {}: {}",
                    HikariDataSource.sanitizeUrl(snapshot.jdbcUrl()), e.getMessage());
            replicaPool = null;
            healthy = false;
            reinitRequired = true;
            return false;
        }
    }

    private DataSource primaryPool() {
        if (!dataSources.getPrimary().isConfigured()) {
            return null;
        }
        try {
            return pools.getOrCreate(dataSources.getPrimary().toSnapshot("primary"));
        } catch (RuntimeException e) {
            log.warn("[REPLICA] Could not create primary pool: {}", e.getMessage());
            return null;
        }
    }

    private boolean probe(DataSource pool) {
        int timeoutSeconds = (int) Math.max(1, properties.getProbeTimeout().getSeconds());
        try (Connection conn = pool.getConnection();
             Statement st = conn.createStatement()) {
            st.setQueryTimeout(timeoutSeconds);
            try (ResultSet rs = st.executeQuery("SELECT 1")) {
                if (!rs.next()) {
                    log.warn("[REPLICA] Health probe returned no row");
                    return false;
                }
            }
            boolean inRecovery;
            try (ResultSet rs = st.executeQuery("SELECT pg_is_in_recovery()")) {
                inRecovery = rs.next() && rs.getBoolean(1);
            }
            if (!inRecovery) {
                if (properties.isRequireRecoveryMode()) {
                    log.warn("[REPLICA] Replica is not in recovery mode and require-recovery-mode is set; treating as unhealthy");
                    return false;
                }
                log.debug("[REPLICA] Replica is not in recovery mode; accepted as writable sandbox host");
            }
            log.debug("[REPLICA] Health probe OK (in_recovery={})", inRecovery);
            return true;
        } catch (SQLException e) {
            log.warn("[REPLICA] Health probe failed: {} (SQLState {})", e.getMessage(), e.getSQLState());
            return false;
        }
    }
}
