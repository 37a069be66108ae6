package com.di.pgproof.job;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class Job {
    String id;
    String recommendationId;
    JobType jobType;
    JobStatus status;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    Map<String, Object> result;
    String errorMessage;

    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }
}
