package com.di.pgproof.maintenance;

import com.di.pgproof.apply.ApplyManager;
import com.di.pgproof.exception.SandboxException;
import com.di.pgproof.job.JobManager;
import com.di.pgproof.sandbox.SchemaManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SandboxMaintenanceScheduler Tests")
class SandboxMaintenanceSchedulerTest {

    @Mock
    private SchemaManager schemaManager;
    @Mock
    private ApplyManager applyManager;
    @Mock
    private JobManager jobManager;

    private MaintenanceProperties properties;
    private SandboxMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new MaintenanceProperties();
        properties.setApplySandboxMaxAge(Duration.ofHours(6));
        properties.setJobRetention(Duration.ofDays(7));
        scheduler = new SandboxMaintenanceScheduler(schemaManager, applyManager, jobManager, properties);
    }

    @Test
    @DisplayName("Should run every cleanup step with the configured ages")
    void testRunOnce_AllSteps() {
        when(schemaManager.reapOrphans()).thenReturn(2);
        when(applyManager.reapOldSandboxes(Duration.ofHours(6))).thenReturn(1);
        when(jobManager.cleanupOlderThan(Duration.ofDays(7))).thenReturn(4);

        SandboxMaintenanceScheduler.MaintenanceReport report = scheduler.runOnce();

        assertEquals(2, report.orphanSandboxes());
        assertEquals(1, report.applyNamespaces());
        assertEquals(4, report.jobs());
        assertEquals(7, report.total());
    }

    @Test
    @DisplayName("A failing step does not skip the remaining ones")
    void testRunOnce_StepFailureIsolated() {
        when(schemaManager.reapOrphans()).thenThrow(new SandboxException("replica unreachable", null));
        when(applyManager.reapOldSandboxes(Duration.ofHours(6))).thenThrow(new IllegalStateException("boom"));
        when(jobManager.cleanupOlderThan(Duration.ofDays(7))).thenReturn(3);

        SandboxMaintenanceScheduler.MaintenanceReport report = scheduler.runOnce();

        assertEquals(0, report.orphanSandboxes());
        assertEquals(0, report.applyNamespaces());
        assertEquals(3, report.total());
        verify(jobManager).cleanupOlderThan(Duration.ofDays(7));
    }

    @Test
    @DisplayName("Scheduled entry point tolerates an idle run")
    void testRunMaintenance_NothingToDo() {
        scheduler.runMaintenance();

        verify(schemaManager).reapOrphans();
        verify(applyManager).reapOldSandboxes(Duration.ofHours(6));
        verify(jobManager).cleanupOlderThan(Duration.ofDays(7));
    }
}
