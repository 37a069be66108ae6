package com.di.pgproof.job;

import com.di.pgproof.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryJobStore Tests")
class InMemoryJobStoreTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryJobStore(clock);
    }

    @Test
    @DisplayName("New jobs are PENDING with a unique id")
    void testCreate() {
        Job a = store.create("rec-1", JobType.BENCHMARK);
        Job b = store.create("rec-1", JobType.APPLY);

        assertNotEquals(a.getId(), b.getId());
        assertEquals(JobStatus.PENDING, a.getStatus());
        assertEquals(START, a.getCreatedAt());
        assertNull(a.getStartedAt());
        assertEquals(a, store.get(a.getId()).orElseThrow());
    }

    @Test
    @DisplayName("Status transitions stamp start and completion")
    void testUpdateStatus_Stamps() {
        Job job = store.create("rec-1", JobType.BENCHMARK);

        clock.advance(Duration.ofSeconds(2));
        assertTrue(store.updateStatus(job.getId(), JobStatus.RUNNING, null, null));
        clock.advance(Duration.ofSeconds(3));
        assertTrue(store.updateStatus(job.getId(), JobStatus.COMPLETED, Map.of("ok", true), null));

        Job done = store.get(job.getId()).orElseThrow();
        assertEquals(START.plusSeconds(2), done.getStartedAt());
        assertEquals(START.plusSeconds(5), done.getCompletedAt());
        assertEquals(Duration.ofSeconds(3), done.duration());
        assertEquals(Map.of("ok", true), done.getResult());

        assertFalse(store.updateStatus("nope", JobStatus.RUNNING, null, null));
    }

    @Test
    @DisplayName("Listing is newest first, filtered and limited")
    void testList() {
        Job first = store.create("rec-1", JobType.BENCHMARK);
        Job second = store.create("rec-2", JobType.BENCHMARK);
        Job third = store.create("rec-1", JobType.APPLY);
        store.updateStatus(second.getId(), JobStatus.ERROR, null, "boom");

        assertThat(store.list(JobFilter.of(null, 10))).extracting(Job::getId)
                .containsExactly(third.getId(), second.getId(), first.getId());
        assertThat(store.list(JobFilter.of(JobStatus.PENDING, 10))).extracting(Job::getId)
                .containsExactly(third.getId(), first.getId());
        assertThat(store.list(JobFilter.of(null, 1))).extracting(Job::getId).containsExactly(third.getId());
        assertThat(store.findByRecommendation("rec-1")).extracting(Job::getId)
                .containsExactly(third.getId(), first.getId());
    }

    @Test
    @DisplayName("Deletion only removes finished jobs older than the cutoff")
    void testDeleteOlderThan() {
        Job oldDone = store.create("rec-1", JobType.BENCHMARK);
        Job oldPending = store.create("rec-2", JobType.BENCHMARK);
        store.updateStatus(oldDone.getId(), JobStatus.COMPLETED, null, null);
        clock.advance(Duration.ofHours(30));
        Job recentDone = store.create("rec-3", JobType.BENCHMARK);
        store.updateStatus(recentDone.getId(), JobStatus.CANCELLED, null, null);

        assertEquals(1, store.deleteOlderThan(Duration.ofHours(24)));

        assertTrue(store.get(oldDone.getId()).isEmpty());
        assertTrue(store.get(oldPending.getId()).isPresent());
        assertTrue(store.get(recentDone.getId()).isPresent());
        assertEquals(2, store.list(JobFilter.of(null, 10)).size());
    }

    @Test
    @DisplayName("Statistics count by status and average completed durations")
    void testStatistics() {
        assertEquals(0, store.statistics().getTotal());
        assertNull(store.statistics().getAverageDurationMs());
        assertNull(store.statistics().getLastActivity());

        Job a = store.create("rec-1", JobType.BENCHMARK);
        store.create("rec-2", JobType.BENCHMARK);
        store.updateStatus(a.getId(), JobStatus.RUNNING, null, null);
        clock.advance(Duration.ofMillis(400));
        store.updateStatus(a.getId(), JobStatus.COMPLETED, null, null);

        JobStatistics stats = store.statistics();
        assertEquals(2, stats.getTotal());
        assertEquals(1, stats.count(JobStatus.COMPLETED));
        assertEquals(1, stats.count(JobStatus.PENDING));
        assertEquals(0, stats.count(JobStatus.ERROR));
        assertEquals(400.0, stats.getAverageDurationMs());
        assertEquals(START.plusMillis(400), stats.getLastActivity());
    }
}
