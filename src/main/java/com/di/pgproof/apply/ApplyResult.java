package com.di.pgproof.apply;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class ApplyResult {
    boolean success;
    String recommendationId;
    String sqlExecuted;
    String schemaName;
    Instant appliedAt;
    String rollbackSql;
    boolean rollbackAvailable;

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", success);
        payload.put("sql_executed", sqlExecuted);
        payload.put("schema_name", schemaName);
        payload.put("applied_at", appliedAt != null ? appliedAt.toString() : null);
        payload.put("rollback_available", rollbackAvailable);
        return payload;
    }
}
