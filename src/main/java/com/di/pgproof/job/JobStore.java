package com.di.pgproof.job;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable job records. The manager writes every transition here so job state survives restarts.
 */
public interface JobStore {

    /** Persists a new PENDING job with a generated id. */
    Job create(String recommendationId, JobType jobType);

    /**
     * Moves a job to {@code status}. RUNNING stamps {@code startedAt}; terminal statuses stamp
     * {@code completedAt} and store {@code result} / {@code errorMessage}.
     *
     * @return false if no job has this id
     */
    boolean updateStatus(String jobId, JobStatus status, Map<String, Object> result, String errorMessage);

    Optional<Job> get(String jobId);

    /** Newest first. */
    List<Job> list(JobFilter filter);

    /** Newest first. */
    List<Job> findByRecommendation(String recommendationId);

    /**
     * Deletes terminal jobs that finished more than {@code age} ago. PENDING and RUNNING jobs are kept.
     *
     * @return number of jobs deleted
     */
    int deleteOlderThan(Duration age);

    JobStatistics statistics();
}
