package com.di.pgproof.job;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Jobs submitted to this manager instance that have not finished yet, queued or running.
 */
final class ActiveJobRegistry {

    private final Map<String, ActiveJob> jobs = new ConcurrentHashMap<>();

    void register(ActiveJob job) {
        jobs.put(job.getItem().getJobId(), job);
    }

    Optional<ActiveJob> get(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobs.get(jobId));
    }

    void remove(String jobId) {
        jobs.remove(jobId);
    }

    boolean contains(String jobId) {
        return jobId != null && jobs.containsKey(jobId);
    }

    int runningCount() {
        return (int) jobs.values().stream().filter(j -> j.getState() == ActiveJob.State.RUNNING).count();
    }

    List<ActiveJob> snapshot() {
        return new ArrayList<>(jobs.values());
    }
}
