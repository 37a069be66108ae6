package com.di.pgproof.target;

import lombok.Value;

import javax.sql.DataSource;

/**
 * Result of target selection. {@code pool} is null exactly when {@code kind} is {@link TargetKind#NONE}.
 */
@Value
public class BenchmarkTarget {

    TargetKind kind;
    DataSource pool;

    public static BenchmarkTarget of(TargetKind kind, DataSource pool) {
        if (kind == TargetKind.NONE || pool == null) {
            return none();
        }
        return new BenchmarkTarget(kind, pool);
    }

    public static BenchmarkTarget none() {
        return new BenchmarkTarget(TargetKind.NONE, null);
    }

    public boolean isAvailable() {
        return kind != TargetKind.NONE;
    }
}
