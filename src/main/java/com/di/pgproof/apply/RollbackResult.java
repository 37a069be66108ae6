package com.di.pgproof.apply;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class RollbackResult {
    boolean success;
    String recommendationId;
    String sqlExecuted;
    String schemaName;
    Instant rolledBackAt;

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", success);
        payload.put("sql_executed", sqlExecuted);
        payload.put("schema_name", schemaName);
        payload.put("rolled_back_at", rolledBackAt != null ? rolledBackAt.toString() : null);
        payload.put("rollback_available", false);
        return payload;
    }
}
