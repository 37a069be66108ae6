package com.di.pgproof.job;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class JobManagerStatus {
    boolean running;
    /** Items waiting in the queue and the overflow list. */
    int queueSize;
    /** Jobs executing on a worker right now. */
    int activeJobs;
    int maxConcurrency;
    JobStatistics statistics;
}
