package com.di.pgproof.audit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory audit trail. Used when {@code pgproof.store.persistence-enabled} is false (the default)
 * and in tests.
 */
@Component
@ConditionalOnProperty(name = "pgproof.store.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryAuditStore implements AuditStore {

    private final AtomicLong ids = new AtomicLong();
    private final List<AuditLogEntry> entries = new ArrayList<>();

    @Override
    public AuditLogEntry append(AuditLogEntry entry) {
        AuditLogEntry stored = entry.toBuilder().id(ids.incrementAndGet()).build();
        synchronized (entries) {
            entries.add(stored);
        }
        return stored;
    }

    @Override
    public List<AuditLogEntry> findRecent(int limit) {
        return collect(null, limit);
    }

    @Override
    public List<AuditLogEntry> findByRecommendation(String recommendationId, int limit) {
        if (recommendationId == null) return List.of();
        return collect(recommendationId, limit);
    }

    private List<AuditLogEntry> collect(String recommendationId, int limit) {
        List<AuditLogEntry> out = new ArrayList<>();
        synchronized (entries) {
            for (int i = entries.size() - 1; i >= 0 && out.size() < limit; i--) {
                AuditLogEntry e = entries.get(i);
                if (recommendationId == null || recommendationId.equals(e.getRecommendationId())) {
                    out.add(e);
                }
            }
        }
        return out;
    }
}
