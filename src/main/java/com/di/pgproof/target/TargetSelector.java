package com.di.pgproof.target;

/**
 * Chooses the database that may serve an operation class.
 * Implementations must never return {@link TargetKind#PRIMARY} for {@link OperationClass#MUTATE}.
 */
@FunctionalInterface
public interface TargetSelector {

    BenchmarkTarget selectTarget(OperationClass operationClass);
}
