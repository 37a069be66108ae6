package com.di.pgproof.apply;

import com.di.pgproof.audit.AuditActionType;
import com.di.pgproof.audit.AuditLogEntry;
import com.di.pgproof.audit.AuditRecorder;
import com.di.pgproof.audit.AuditStatus;
import com.di.pgproof.audit.AuditStore;
import com.di.pgproof.audit.InMemoryAuditStore;
import com.di.pgproof.exception.ApplyExecutionException;
import com.di.pgproof.exception.ErrorCategory;
import com.di.pgproof.exception.PreconditionViolationException;
import com.di.pgproof.exception.PreconditionViolationException.Reason;
import com.di.pgproof.recommendation.InMemoryRecommendationStore;
import com.di.pgproof.recommendation.Recommendation;
import com.di.pgproof.recommendation.RecommendationUpdate;
import com.di.pgproof.support.FakePostgres;
import com.di.pgproof.support.MutableClock;
import com.di.pgproof.target.BenchmarkTarget;
import com.di.pgproof.target.TargetKind;
import com.di.pgproof.util.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ApplyManager Tests")
class ApplyManagerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final String INDEX_FIX = "CREATE INDEX CONCURRENTLY idx_orders_customer ON orders(customer_name)";

    private FakePostgres db;
    private MutableClock clock;
    private InMemoryRecommendationStore recommendations;
    private InMemoryAppliedChangeStore changes;
    private InMemoryAuditStore auditStore;
    private ApplyManager applyManager;

    @BeforeEach
    void setUp() {
        db = new FakePostgres().withTable("public", "orders", 1_000);
        clock = new MutableClock(NOW);
        recommendations = new InMemoryRecommendationStore();
        changes = new InMemoryAppliedChangeStore();
        auditStore = new InMemoryAuditStore();
        applyManager = newManager(new AuditRecorder(auditStore, clock, "sandbox"));
    }

    @AfterEach
    void noLeakedConnections() {
        assertEquals(0, db.openConnections());
    }

    private ApplyManager newManager(AuditRecorder recorder) {
        return new ApplyManager(recommendations, changes, recorder, auditStore,
                op -> BenchmarkTarget.of(TargetKind.REPLICA, db.dataSource()), new ApplyProperties(), clock);
    }

    private void recommend(String id, String sqlFix) {
        recommendations.save(Recommendation.builder()
                .id(id)
                .sqlFix(sqlFix)
                .riskLevel("low")
                .status(Recommendation.STATUS_PENDING)
                .build());
    }

    /** Recommendation store whose status updates can be made to fail. */
    private static final class FlakyRecommendationStore extends InMemoryRecommendationStore {
        private volatile boolean failUpdates;

        @Override
        public boolean update(String id, RecommendationUpdate update) {
            if (failUpdates) {
                throw new IllegalStateException("metadata db down");
            }
            return super.update(id, update);
        }
    }

    private List<AuditLogEntry> audits(String recommendationId) {
        return auditStore.findByRecommendation(recommendationId, 100);
    }

    // ============================================================================
    // apply
    // ============================================================================

    @Test
    @DisplayName("Concurrent index DDL runs under autocommit after a committed namespace setup")
    void testApply_AutocommitPath() {
        recommend("rec-1", INDEX_FIX);

        ApplyResult result = applyManager.apply("rec-1");

        assertTrue(result.isSuccess());
        assertEquals("apply_rec_1_" + NOW.getEpochSecond(), result.getSchemaName());
        assertEquals("DROP INDEX CONCURRENTLY idx_orders_customer;", result.getRollbackSql());
        assertTrue(result.isRollbackAvailable());
        assertTrue(db.hasIndex("idx_orders_customer"));
        assertTrue(db.hasSchema(result.getSchemaName()));

        assertFalse(db.executedMatching("CREATE SCHEMA").get(0).autoCommit());
        assertTrue(db.executedMatching(INDEX_FIX).get(0).autoCommit());
        assertThat(db.executedSql()).contains("RESET ALL");

        assertEquals(ChangeStatus.APPLIED, applyManager.changeStatus("rec-1").orElseThrow().getStatus());
        Recommendation rec = recommendations.get("rec-1").orElseThrow();
        assertTrue(rec.isApplied());
        assertEquals(Recommendation.STATUS_APPLIED, rec.getStatus());

        List<AuditLogEntry> entries = audits("rec-1");
        assertEquals(1, entries.size());
        AuditLogEntry entry = entries.get(0);
        assertEquals(AuditActionType.RECOMMENDATION_APPLIED, entry.getActionType());
        assertEquals(AuditStatus.COMPLETED, entry.getStatus());
        assertEquals("low", entry.getRiskLevel());
        assertEquals(INDEX_FIX, entry.getDetails().get("sql_executed"));
        assertEquals(false, entry.getDetails().get("transactional"));
        assertEquals("sandbox", entry.getDetails().get("environment"));
    }

    @Test
    @DisplayName("Session settings run in one transaction with the namespace setup")
    void testApply_TransactionalPath() {
        recommend("rec-2", "SET work_mem = '64MB'");

        ApplyResult result = applyManager.apply("rec-2");

        assertEquals("SET work_mem = '4MB';", result.getRollbackSql());
        assertThat(db.executedMatching("SET work_mem")).allMatch(e -> !e.autoCommit());
        assertThat(db.executedSql()).contains("SET LOCAL search_path TO \"" + result.getSchemaName() + "\", public");
        assertTrue(db.hasSchema(result.getSchemaName()));
        assertEquals(true, audits("rec-2").get(0).getDetails().get("transactional"));
    }

    @Test
    @DisplayName("A transactional failure leaves no namespace behind and audits once")
    void testApply_TransactionalFailure() {
        recommend("rec-3", "SET work_mem = '64MB'");
        db.failOn("SET work_mem", "42704");

        ApplyExecutionException ex = assertThrows(ApplyExecutionException.class, () -> applyManager.apply("rec-3"));

        assertEquals(ErrorCategory.UNDEFINED_OBJECT, ex.getCategory());
        assertThat(db.schemas()).noneMatch(s -> s.startsWith("apply_"));
        assertTrue(applyManager.changeStatus("rec-3").isEmpty());
        assertFalse(recommendations.get("rec-3").orElseThrow().isApplied());

        List<AuditLogEntry> entries = audits("rec-3");
        assertEquals(1, entries.size());
        assertEquals(AuditActionType.RECOMMENDATION_APPLY_FAILED, entries.get(0).getActionType());
        assertEquals(AuditStatus.FAILED, entries.get(0).getStatus());
        assertEquals("UNDEFINED_OBJECT", entries.get(0).getDetails().get("error_category"));
        assertEquals("SET work_mem = '64MB'", entries.get(0).getDetails().get("sql_attempted"));
    }

    @Test
    @DisplayName("An autocommit failure is audited and the recommendation stays unapplied")
    void testApply_AutocommitFailure() {
        recommend("rec-4", INDEX_FIX);
        db.failOn("idx_orders_customer", "42P07");

        assertThrows(ApplyExecutionException.class, () -> applyManager.apply("rec-4"));

        assertFalse(db.hasIndex("idx_orders_customer"));
        assertFalse(recommendations.get("rec-4").orElseThrow().isApplied());
        assertEquals(AuditActionType.RECOMMENDATION_APPLY_FAILED, audits("rec-4").get(0).getActionType());
        assertEquals(1, audits("rec-4").size());
    }

    @Test
    @DisplayName("A cancelled apply is audited as a failure")
    void testApply_Cancelled() {
        recommend("rec-5", INDEX_FIX);
        CancellationToken token = CancellationToken.none();
        token.cancel();

        ApplyExecutionException ex = assertThrows(ApplyExecutionException.class, () -> applyManager.apply("rec-5", token));

        assertEquals(ErrorCategory.CANCELLED, ex.getCategory());
        assertEquals(1, audits("rec-5").size());
    }

    @Test
    @DisplayName("Preconditions are checked before any statement runs and are not audited")
    void testApply_Preconditions() {
        recommend("unsafe", "DROP TABLE orders");
        recommend("empty", "   ");

        assertEquals(Reason.NOT_FOUND,
                assertThrows(PreconditionViolationException.class, () -> applyManager.apply("missing")).getReason());
        assertEquals(Reason.UNSAFE_SQL,
                assertThrows(PreconditionViolationException.class, () -> applyManager.apply("unsafe")).getReason());
        assertEquals(Reason.MISSING_SQL,
                assertThrows(PreconditionViolationException.class, () -> applyManager.apply("empty")).getReason());

        assertTrue(db.executed().isEmpty());
        assertTrue(auditStore.findRecent(100).isEmpty());
    }

    @Test
    @DisplayName("An applied recommendation cannot be applied again")
    void testApply_AlreadyApplied() {
        recommend("rec-6", INDEX_FIX);
        applyManager.apply("rec-6");

        PreconditionViolationException ex = assertThrows(PreconditionViolationException.class,
                () -> applyManager.apply("rec-6"));

        assertEquals(Reason.ALREADY_APPLIED, ex.getReason());
        assertEquals(1, audits("rec-6").size());
    }

    @Test
    @DisplayName("A fix that ran but could not be recorded is audited once as partial")
    void testApply_RecordingFailureIsPartial() {
        FlakyRecommendationStore flaky = new FlakyRecommendationStore();
        flaky.save(Recommendation.builder().id("rec-20").sqlFix(INDEX_FIX).riskLevel("low").build());
        flaky.failUpdates = true;
        ApplyManager manager = new ApplyManager(flaky, changes, new AuditRecorder(auditStore, clock, "sandbox"),
                auditStore, op -> BenchmarkTarget.of(TargetKind.REPLICA, db.dataSource()), new ApplyProperties(), clock);

        ApplyExecutionException ex = assertThrows(ApplyExecutionException.class, () -> manager.apply("rec-20"));

        assertThat(ex.getMessage()).contains("metadata db down");
        assertTrue(db.hasIndex("idx_orders_customer"));
        List<AuditLogEntry> entries = audits("rec-20");
        assertEquals(1, entries.size());
        AuditLogEntry entry = entries.get(0);
        assertEquals(AuditActionType.RECOMMENDATION_APPLY_FAILED, entry.getActionType());
        assertEquals(AuditStatus.PARTIAL, entry.getStatus());
        assertEquals(INDEX_FIX, entry.getDetails().get("sql_executed"));
        assertEquals("DROP INDEX CONCURRENTLY idx_orders_customer;", entry.getDetails().get("rollback_sql"));
        assertEquals("metadata db down", entry.getDetails().get("error"));
    }

    @Test
    @DisplayName("A second apply or rollback is refused while an apply is still running")
    void testApply_ConcurrentCallerRefused() throws Exception {
        recommend("rec-21", INDEX_FIX);
        db.blockOn(INDEX_FIX);
        CancellationToken token = CancellationToken.none();
        CompletableFuture<ApplyResult> first = CompletableFuture.supplyAsync(() -> applyManager.apply("rec-21", token));
        assertTrue(db.awaitBlocked(5, TimeUnit.SECONDS));

        assertEquals(Reason.IN_PROGRESS,
                assertThrows(PreconditionViolationException.class, () -> applyManager.apply("rec-21")).getReason());
        assertEquals(Reason.IN_PROGRESS,
                assertThrows(PreconditionViolationException.class, () -> applyManager.rollback("rec-21")).getReason());

        token.cancel();
        ExecutionException ex = assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
        assertThat(ex.getCause()).isInstanceOf(ApplyExecutionException.class);
        assertEquals(1, audits("rec-21").size());
        assertEquals(Reason.NOT_APPLIED,
                assertThrows(PreconditionViolationException.class, () -> applyManager.rollback("rec-21")).getReason());
    }

    @Test
    @DisplayName("A failing audit store never changes the apply outcome")
    void testApply_AuditStoreFailureSwallowed() {
        AuditStore broken = mock(AuditStore.class);
        when(broken.append(any())).thenThrow(new IllegalStateException("audit table missing"));
        ApplyManager manager = newManager(new AuditRecorder(broken, clock, "sandbox"));
        recommend("rec-7", "SET work_mem = '64MB'");

        ApplyResult result = manager.apply("rec-7");

        assertTrue(result.isSuccess());
        assertEquals(ChangeStatus.APPLIED, changes.find("rec-7").orElseThrow().getStatus());
    }

    // ============================================================================
    // rollback
    // ============================================================================

    @Test
    @DisplayName("Rollback runs the recorded statement and allows a later re-apply")
    void testRollback_StateMachine() {
        recommend("rec-8", INDEX_FIX);
        applyManager.apply("rec-8");

        RollbackResult result = applyManager.rollback("rec-8");

        assertTrue(result.isSuccess());
        assertEquals("DROP INDEX CONCURRENTLY idx_orders_customer;", result.getSqlExecuted());
        assertFalse(db.hasIndex("idx_orders_customer"));
        assertTrue(db.executedMatching("DROP INDEX CONCURRENTLY").get(0).autoCommit());

        AppliedChange change = changes.find("rec-8").orElseThrow();
        assertEquals(ChangeStatus.ROLLED_BACK, change.getStatus());
        assertEquals(NOW, change.getRolledBackAt());
        assertFalse(change.isRollbackAvailable());
        Recommendation rec = recommendations.get("rec-8").orElseThrow();
        assertFalse(rec.isApplied());
        assertEquals(Recommendation.STATUS_ROLLED_BACK, rec.getStatus());

        assertEquals(Reason.NOT_APPLIED,
                assertThrows(PreconditionViolationException.class, () -> applyManager.rollback("rec-8")).getReason());

        clock.advance(Duration.ofMinutes(5));
        ApplyResult again = applyManager.apply("rec-8");
        assertTrue(again.isSuccess());
        assertThat(audits("rec-8")).extracting(AuditLogEntry::getActionType).containsExactly(
                AuditActionType.RECOMMENDATION_APPLIED,
                AuditActionType.RECOMMENDATION_ROLLED_BACK,
                AuditActionType.RECOMMENDATION_APPLIED);
    }

    @Test
    @DisplayName("Rollback of a transactional change commits")
    void testRollback_Transactional() {
        recommend("rec-9", "SET work_mem = '64MB'");
        applyManager.apply("rec-9");

        applyManager.rollback("rec-9");

        assertFalse(db.executedMatching("SET work_mem = '4MB';").get(0).autoCommit());
    }

    @Test
    @DisplayName("Rollback resolves names against the change's namespace first")
    void testRollback_SetsSearchPath() {
        recommend("rec-22", INDEX_FIX);
        recommend("rec-23", "SET work_mem = '64MB'");
        String indexSchema = applyManager.apply("rec-22").getSchemaName();
        clock.advance(Duration.ofSeconds(1));
        String settingSchema = applyManager.apply("rec-23").getSchemaName();

        applyManager.rollback("rec-22");
        applyManager.rollback("rec-23");

        List<FakePostgres.Executed> indexPath =
                db.executedMatching("SET search_path TO \"" + indexSchema + "\", public");
        assertThat(indexPath).hasSize(2);
        assertTrue(indexPath.get(1).autoCommit());
        assertThat(db.executedMatching("SET LOCAL search_path TO \"" + settingSchema + "\", public")).hasSize(2);
    }

    @Test
    @DisplayName("A rollback that ran but could not be recorded is audited as partial")
    void testRollback_RecordingFailureIsPartial() {
        FlakyRecommendationStore flaky = new FlakyRecommendationStore();
        flaky.save(Recommendation.builder().id("rec-24").sqlFix(INDEX_FIX).riskLevel("low").build());
        ApplyManager manager = new ApplyManager(flaky, changes, new AuditRecorder(auditStore, clock, "sandbox"),
                auditStore, op -> BenchmarkTarget.of(TargetKind.REPLICA, db.dataSource()), new ApplyProperties(), clock);
        manager.apply("rec-24");
        flaky.failUpdates = true;

        assertThrows(ApplyExecutionException.class, () -> manager.rollback("rec-24"));

        assertFalse(db.hasIndex("idx_orders_customer"));
        List<AuditLogEntry> entries = audits("rec-24");
        assertEquals(2, entries.size());
        assertThat(entries).filteredOn(e -> e.getStatus() == AuditStatus.PARTIAL)
                .extracting(AuditLogEntry::getActionType)
                .containsExactly(AuditActionType.RECOMMENDATION_ROLLBACK_FAILED);
    }

    @Test
    @DisplayName("Rollback without a recorded statement is refused")
    void testRollback_MissingRollback() {
        recommend("rec-10", "ALTER SYSTEM SET work_mem = '64MB'");
        ApplyResult result = applyManager.apply("rec-10");
        assertFalse(result.isRollbackAvailable());
        assertTrue(db.executedMatching("ALTER SYSTEM").get(0).autoCommit());

        assertEquals(Reason.MISSING_ROLLBACK,
                assertThrows(PreconditionViolationException.class, () -> applyManager.rollback("rec-10")).getReason());
        assertEquals(1, audits("rec-10").size());
    }

    @Test
    @DisplayName("A failed rollback keeps the change applied and is audited")
    void testRollback_Failure() {
        recommend("rec-11", INDEX_FIX);
        applyManager.apply("rec-11");
        db.failOn("DROP INDEX CONCURRENTLY");

        assertThrows(ApplyExecutionException.class, () -> applyManager.rollback("rec-11"));

        assertEquals(ChangeStatus.APPLIED, changes.find("rec-11").orElseThrow().getStatus());
        assertEquals(AuditActionType.RECOMMENDATION_ROLLBACK_FAILED, audits("rec-11").get(0).getActionType());
        assertEquals(2, audits("rec-11").size());
    }

    // ============================================================================
    // cleanup and queries
    // ============================================================================

    @Test
    @DisplayName("Old apply namespaces are dropped and audited; others are left alone")
    void testReapOldSandboxes() {
        long old = NOW.minus(Duration.ofDays(3)).getEpochSecond();
        long recent = NOW.minus(Duration.ofMinutes(10)).getEpochSecond();
        db.withSchema("apply_old_" + old).withSchema("apply_recent_" + recent).withSchema("apply_garbage");

        assertEquals(1, applyManager.reapOldSandboxes(Duration.ofHours(24)));

        assertFalse(db.hasSchema("apply_old_" + old));
        assertTrue(db.hasSchema("apply_recent_" + recent));
        assertTrue(db.hasSchema("apply_garbage"));

        List<AuditLogEntry> cleanup = auditStore.findRecent(10);
        assertEquals(1, cleanup.size());
        assertEquals(AuditActionType.CLEANUP, cleanup.get(0).getActionType());
        assertEquals("apply_old_" + old, cleanup.get(0).getDetails().get("schema_name"));
        assertEquals(Duration.ofDays(3).getSeconds(), cleanup.get(0).getDetails().get("age_seconds"));
    }

    @Test
    @DisplayName("Cleanup without a replica drops nothing")
    void testReapOldSandboxes_NoTarget() {
        ApplyManager manager = new ApplyManager(recommendations, changes, new AuditRecorder(auditStore, clock, "sandbox"),
                auditStore, op -> BenchmarkTarget.none(), new ApplyProperties(), clock);
        assertEquals(0, manager.reapOldSandboxes(Duration.ofHours(24)));
    }

    @Test
    @DisplayName("Audit trail limits are clamped")
    void testAuditTrail_Clamped() {
        recommend("a", "SET work_mem = '64MB'");
        recommend("b", "SET work_mem = '32MB'");
        applyManager.apply("a");
        applyManager.apply("b");

        assertEquals(1, applyManager.auditTrail(0).size());
        assertEquals(2, applyManager.auditTrail(5000).size());
        assertEquals("b", applyManager.auditTrail(10).get(0).getRecommendationId());
        assertEquals(1, applyManager.auditTrail("a", 10).size());
        assertEquals(2, applyManager.appliedChanges().size());
    }
}
