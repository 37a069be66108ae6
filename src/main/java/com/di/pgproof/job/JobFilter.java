package com.di.pgproof.job;

import lombok.Builder;
import lombok.Value;

/**
 * Listing criteria; a null status matches every status.
 */
@Value
@Builder
public class JobFilter {
    JobStatus status;
    @Builder.Default
    int limit = 50;

    public static JobFilter of(JobStatus status, int limit) {
        return JobFilter.builder().status(status).limit(limit).build();
    }
}
