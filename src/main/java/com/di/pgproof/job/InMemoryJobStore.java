package com.di.pgproof.job;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of JobStore. Suitable for single-node and testing.
 * When pgproof.store.persistence-enabled=true, JdbcJobStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "pgproof.store.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryJobStore implements JobStore {

    private final Clock clock;
    private final Map<String, Job> jobsById = new ConcurrentHashMap<>();
    private final List<String> insertionOrder = new ArrayList<>();

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Job create(String recommendationId, JobType jobType) {
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .recommendationId(recommendationId)
                .jobType(jobType)
                .status(JobStatus.PENDING)
                .createdAt(clock.instant())
                .build();
        jobsById.put(job.getId(), job);
        synchronized (insertionOrder) {
            insertionOrder.add(job.getId());
        }
        return job;
    }

    @Override
    public boolean updateStatus(String jobId, JobStatus status, Map<String, Object> result, String errorMessage) {
        if (jobId == null) return false;
        Instant now = clock.instant();
        Job updated = jobsById.computeIfPresent(jobId, (id, job) -> {
            Job.JobBuilder b = job.toBuilder().status(status);
            if (status == JobStatus.RUNNING) {
                b.startedAt(now);
            }
            if (status.isTerminal()) {
                b.completedAt(now).result(result).errorMessage(errorMessage);
            }
            return b.build();
        });
        return updated != null;
    }

    @Override
    public Optional<Job> get(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobsById.get(jobId));
    }

    @Override
    public List<Job> list(JobFilter filter) {
        List<Job> out = new ArrayList<>();
        synchronized (insertionOrder) {
            for (int i = insertionOrder.size() - 1; i >= 0 && out.size() < filter.getLimit(); i--) {
                Job job = jobsById.get(insertionOrder.get(i));
                if (job != null && (filter.getStatus() == null || filter.getStatus() == job.getStatus())) {
                    out.add(job);
                }
            }
        }
        return out;
    }

    @Override
    public List<Job> findByRecommendation(String recommendationId) {
        List<Job> out = new ArrayList<>();
        synchronized (insertionOrder) {
            for (int i = insertionOrder.size() - 1; i >= 0; i--) {
                Job job = jobsById.get(insertionOrder.get(i));
                if (job != null && job.getRecommendationId() != null && job.getRecommendationId().equals(recommendationId)) {
                    out.add(job);
                }
            }
        }
        return out;
    }

    @Override
    public int deleteOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int deleted = 0;
        synchronized (insertionOrder) {
            for (Job job : new ArrayList<>(jobsById.values())) {
                Instant finishedAt = job.getCompletedAt() != null ? job.getCompletedAt() : job.getCreatedAt();
                if (job.getStatus().isTerminal() && finishedAt.isBefore(cutoff)) {
                    jobsById.remove(job.getId());
                    insertionOrder.remove(job.getId());
                    deleted++;
                }
            }
        }
        return deleted;
    }

    @Override
    public JobStatistics statistics() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        Instant lastActivity = null;
        long completedCount = 0;
        double completedMillis = 0;
        for (Job job : jobsById.values()) {
            counts.merge(job.getStatus(), 1L, Long::sum);
            lastActivity = latest(lastActivity, job.getCreatedAt());
            lastActivity = latest(lastActivity, job.getStartedAt());
            lastActivity = latest(lastActivity, job.getCompletedAt());
            if (job.getStatus() == JobStatus.COMPLETED && job.duration() != null) {
                completedCount++;
                completedMillis += job.duration().toMillis();
            }
        }
        return JobStatistics.builder()
                .total(jobsById.size())
                .countsByStatus(counts)
                .lastActivity(lastActivity)
                .averageDurationMs(completedCount > 0 ? completedMillis / completedCount : null)
                .build();
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return b.isAfter(a) ? b : a;
    }
}
