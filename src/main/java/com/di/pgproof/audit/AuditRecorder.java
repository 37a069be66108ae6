package com.di.pgproof.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record-and-continue sink for audit entries. A failed write is logged and dropped; it never
 * reaches the caller, so it cannot change the outcome of the operation being recorded.
 */
@Slf4j
@Component
public class AuditRecorder {

    private final AuditStore store;
    private final Clock clock;
    private final String environment;

    public AuditRecorder(AuditStore store, Clock clock,
                         @Value("${pgproof.audit.environment:sandbox}") String environment) {
        this.store = store;
        this.clock = clock;
        this.environment = environment;
    }

    public void record(AuditActionType actionType, String recommendationId, AuditStatus status,
                       String riskLevel, Map<String, Object> details) {
        Map<String, Object> enriched = new LinkedHashMap<>();
        if (details != null) {
            enriched.putAll(details);
        }
        enriched.putIfAbsent("environment", environment);
        try {
            store.append(AuditLogEntry.builder()
                    .actionType(actionType)
                    .recommendationId(recommendationId)
                    .details(enriched)
                    .riskLevel(riskLevel)
                    .status(status)
                    .createdAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("[AUDIT] Failed to record {} for recommendation {}: {}",
                    actionType.getCode(), recommendationId, e.getMessage());
        }
    }
}
