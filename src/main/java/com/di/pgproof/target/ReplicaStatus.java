package com.di.pgproof.target;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class ReplicaStatus {
    boolean enabled;
    boolean configured;
    boolean healthy;
    boolean primaryConfigured;
    Instant lastCheckedAt;
    Duration healthCheckInterval;
}
