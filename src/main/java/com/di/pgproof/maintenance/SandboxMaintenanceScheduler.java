package com.di.pgproof.maintenance;

import com.di.pgproof.apply.ApplyManager;
import com.di.pgproof.job.JobManager;
import com.di.pgproof.sandbox.SchemaManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drops orphaned benchmark sandboxes and old apply namespaces, and removes finished jobs past retention.
 * Each step is independent; one failing does not skip the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pgproof.maintenance.enabled", havingValue = "true", matchIfMissing = true)
public class SandboxMaintenanceScheduler {

    private final SchemaManager schemaManager;
    private final ApplyManager applyManager;
    private final JobManager jobManager;
    private final MaintenanceProperties properties;

    @Scheduled(fixedDelayString = "${pgproof.maintenance.interval:PT15M}",
            initialDelayString = "${pgproof.maintenance.initial-delay:PT1M}")
    public void runMaintenance() {
        MaintenanceReport report = runOnce();
        if (report.total() > 0) {
            log.info("[MAINTENANCE] Reaped {} orphan sandbox(es), {} apply namespace(s), {} job(s)",
                    report.orphanSandboxes(), report.applyNamespaces(), report.jobs());
        } else {
            log.debug("[MAINTENANCE] Nothing to clean up");
        }
    }

    MaintenanceReport runOnce() {
        int orphans = 0;
        int applyNamespaces = 0;
        int jobs = 0;
        try {
            orphans = schemaManager.reapOrphans();
        } catch (RuntimeException e) {
            log.warn("[MAINTENANCE] Orphan sandbox reaping failed: {}", e.getMessage());
        }
        try {
            applyNamespaces = applyManager.reapOldSandboxes(properties.getApplySandboxMaxAge());
        } catch (RuntimeException e) {
            log.warn("[MAINTENANCE] Apply namespace cleanup failed: {}", e.getMessage());
        }
        try {
            jobs = jobManager.cleanupOlderThan(properties.getJobRetention());
        } catch (RuntimeException e) {
            log.warn("[MAINTENANCE] Job retention cleanup failed: {}", e.getMessage());
        }
        return new MaintenanceReport(orphans, applyNamespaces, jobs);
    }

    record MaintenanceReport(int orphanSandboxes, int applyNamespaces, int jobs) {
        int total() {
            return orphanSandboxes + applyNamespaces + jobs;
        }
    }
}
