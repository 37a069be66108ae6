package com.di.pgproof.target;

/**
 * What an operation does to the database it runs on.
 */
public enum OperationClass {
    /** Read-only; may run against the primary. */
    READ,
    /** Creates or changes schema or data; never routed to the primary. */
    MUTATE
}
