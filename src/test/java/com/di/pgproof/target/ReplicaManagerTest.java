package com.di.pgproof.target;

import com.di.pgproof.config.DataSourcesProperties;
import com.di.pgproof.config.DbConfigSnapshot;
import com.di.pgproof.support.FakePostgres;
import com.di.pgproof.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReplicaManager Tests")
class ReplicaManagerTest {

    private FakePostgres replica;
    private FakePostgres primary;
    private DataSourcesProperties dataSources;
    private ReplicaProperties properties;
    private MutableClock clock;
    private AtomicInteger evictions;
    private ReplicaManager manager;

    @BeforeEach
    void setUp() {
        replica = new FakePostgres();
        primary = new FakePostgres();
        dataSources = new DataSourcesProperties();
        dataSources.getReplica().setJdbcUrl("jdbc:postgresql://replica:5432/app");
        dataSources.getPrimary().setJdbcUrl("jdbc:postgresql://primary:5432/app");
        properties = new ReplicaProperties();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        evictions = new AtomicInteger();
        ConnectionPoolFactory pools = new ConnectionPoolFactory() {
            @Override
            public DataSource getOrCreate(DbConfigSnapshot snapshot) {
                return "primary".equals(snapshot.role()) ? primary.dataSource() : replica.dataSource();
            }

            @Override
            public void evict(DbConfigSnapshot snapshot) {
                evictions.incrementAndGet();
            }
        };
        manager = new ReplicaManager(dataSources, properties, pools, clock);
    }

    private long probes() {
        return replica.executedSql().stream().filter("SELECT 1"::equals).count();
    }

    // ============================================================================
    // Routing
    // ============================================================================

    @Test
    @DisplayName("Mutating work goes to a healthy replica")
    void testSelectTarget_MutateOnReplica() {
        BenchmarkTarget target = manager.selectTarget(OperationClass.MUTATE);
        assertEquals(TargetKind.REPLICA, target.getKind());
        assertNotNull(target.getPool());
    }

    @Test
    @DisplayName("Mutating work is never routed to the primary")
    void testSelectTarget_MutateNeverPrimary() {
        replica.setDown(true);

        BenchmarkTarget target = manager.selectTarget(OperationClass.MUTATE);

        assertEquals(TargetKind.NONE, target.getKind());
        assertFalse(target.isAvailable());
        assertNull(target.getPool());
        assertTrue(primary.executed().isEmpty());
    }

    @Test
    @DisplayName("Reads fall back to the primary when the replica is down")
    void testSelectTarget_ReadFallsBackToPrimary() {
        replica.setDown(true);
        assertEquals(TargetKind.PRIMARY, manager.selectTarget(OperationClass.READ).getKind());
    }

    @Test
    @DisplayName("Reads report NONE when neither database is configured")
    void testSelectTarget_NothingConfigured() {
        dataSources.getReplica().setJdbcUrl("");
        dataSources.getPrimary().setJdbcUrl(null);
        assertEquals(TargetKind.NONE, manager.selectTarget(OperationClass.READ).getKind());
        assertEquals(TargetKind.NONE, manager.selectTarget(OperationClass.MUTATE).getKind());
    }

    @Test
    @DisplayName("A disabled replica is treated as absent")
    void testSelectTarget_ReplicaDisabled() {
        properties.setEnabled(false);
        assertEquals(TargetKind.NONE, manager.selectTarget(OperationClass.MUTATE).getKind());
        assertEquals(TargetKind.PRIMARY, manager.selectTarget(OperationClass.READ).getKind());
        assertTrue(replica.executed().isEmpty());
    }

    // ============================================================================
    // Health checks
    // ============================================================================

    @Test
    @DisplayName("Health checks are debounced by the configured interval")
    void testIsHealthy_Debounced() {
        assertTrue(manager.isHealthy());
        assertEquals(1, probes());

        clock.advance(Duration.ofSeconds(10));
        assertTrue(manager.isHealthy());
        manager.selectTarget(OperationClass.MUTATE);
        assertEquals(1, probes());

        clock.advance(Duration.ofSeconds(25));
        assertTrue(manager.isHealthy());
        assertEquals(2, probes());
    }

    @Test
    @DisplayName("A failed probe forces a pool rebuild and an immediate re-probe")
    void testSelectTarget_ReinitAfterFailure() {
        assertTrue(manager.isHealthy());

        replica.setDown(true);
        clock.advance(Duration.ofMinutes(1));
        assertFalse(manager.isHealthy());
        assertFalse(manager.status().isHealthy());

        replica.setDown(false);
        BenchmarkTarget target = manager.selectTarget(OperationClass.MUTATE);

        assertEquals(TargetKind.REPLICA, target.getKind());
        assertEquals(1, evictions.get());
        assertTrue(manager.status().isHealthy());
    }

    @Test
    @DisplayName("Recovery mode is only required when configured")
    void testIsHealthy_RecoveryMode() {
        replica.setInRecovery(false);
        assertTrue(manager.isHealthy());

        properties.setRequireRecoveryMode(true);
        clock.advance(Duration.ofMinutes(1));
        assertFalse(manager.isHealthy());

        replica.setInRecovery(true);
        clock.advance(Duration.ofMinutes(1));
        assertTrue(manager.isHealthy());
    }

    @Test
    @DisplayName("Status reflects configuration and last probe")
    void testStatus() {
        manager.isHealthy();
        ReplicaStatus status = manager.status();
        assertTrue(status.isEnabled());
        assertTrue(status.isConfigured());
        assertTrue(status.isPrimaryConfigured());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), status.getLastCheckedAt());
        assertEquals(Duration.ofSeconds(30), status.getHealthCheckInterval());
    }
}
