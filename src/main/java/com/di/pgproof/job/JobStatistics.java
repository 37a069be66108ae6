package com.di.pgproof.job;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class JobStatistics {
    long total;
    @Singular("countByStatus")
    Map<JobStatus, Long> countsByStatus;
    /** Most recent creation, start or completion; null when there are no jobs. */
    Instant lastActivity;
    /** Mean start-to-completion time of COMPLETED jobs; null when there are none. */
    Double averageDurationMs;

    public long count(JobStatus status) {
        return countsByStatus.getOrDefault(status, 0L);
    }
}
