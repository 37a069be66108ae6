package com.di.pgproof.recommendation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A proposed tuning change, produced elsewhere. Only {@code applied}, {@code appliedAt} and
 * {@code status} are ever written back.
 */
@Value
@Builder(toBuilder = true)
public class Recommendation {
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_APPLIED = "applied";
    public static final String STATUS_ROLLED_BACK = "rolled_back";

    String id;
    String title;
    /** Statement to apply for real, e.g. {@code CREATE INDEX CONCURRENTLY ...}. */
    String sqlFix;
    /** Author-supplied undo statement; derived when absent. */
    String rollbackSql;
    /** Query whose performance the change should improve. */
    String originalSql;
    /** Candidate to benchmark: an index to build in the sandbox or a rewritten read-only query. */
    String patchSql;
    @Singular
    List<String> tables;
    boolean applied;
    Instant appliedAt;
    String status;
    String riskLevel;
}
