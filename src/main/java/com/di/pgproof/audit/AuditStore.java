package com.di.pgproof.audit;

import java.util.List;

/**
 * Append-only audit persistence. Entries are never updated or deleted.
 */
public interface AuditStore {

    /**
     * @return the stored entry with its generated id
     */
    AuditLogEntry append(AuditLogEntry entry);

    /** Newest first. */
    List<AuditLogEntry> findRecent(int limit);

    /** Newest first. */
    List<AuditLogEntry> findByRecommendation(String recommendationId, int limit);
}
