package com.di.pgproof.job;

import lombok.Value;

/**
 * Queue entry. The persisted {@link Job} stays the source of truth for status.
 */
@Value
public class WorkItem {
    String jobId;
    String recommendationId;
    JobType jobType;

    static WorkItem of(Job job) {
        return new WorkItem(job.getId(), job.getRecommendationId(), job.getJobType());
    }
}
