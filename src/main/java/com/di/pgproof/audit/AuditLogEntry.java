package com.di.pgproof.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit record. {@code details} carries the executed SQL, rollback SQL, sandbox
 * schema, environment tag and, for failures, the error.
 */
@Value
@Builder(toBuilder = true)
public class AuditLogEntry {
    Long id;
    AuditActionType actionType;
    String recommendationId;
    Map<String, Object> details;
    String riskLevel;
    AuditStatus status;
    Instant createdAt;
}
