package com.di.pgproof.apply;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Record of a change executed for a recommendation. Rollback is permitted only while
 * {@code status} is {@link ChangeStatus#APPLIED}.
 */
@Value
@Builder(toBuilder = true)
public class AppliedChange {
    String recommendationId;
    String sqlExecuted;
    String schemaName;
    Instant appliedAt;
    String rollbackSql;
    ChangeStatus status;
    Instant rolledBackAt;

    public boolean isRollbackAvailable() {
        return status == ChangeStatus.APPLIED && rollbackSql != null && !rollbackSql.isBlank();
    }
}
