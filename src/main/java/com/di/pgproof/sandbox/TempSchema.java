package com.di.pgproof.sandbox;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * In-memory owner record of a sandbox namespace. Its presence in {@link SandboxRegistry} is what
 * distinguishes a live sandbox from an orphan.
 */
@Value
@Builder(toBuilder = true)
public class TempSchema {
    String jobId;
    String schemaName;
    @Singular
    List<SampledTable> sampledTables;
    double samplePercent;
    Instant createdAt;
}
