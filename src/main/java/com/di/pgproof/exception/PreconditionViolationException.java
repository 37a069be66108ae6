package com.di.pgproof.exception;

/**
 * A request that cannot proceed in the current state: unknown recommendation, already applied,
 * change already in progress, unsafe statement, nothing to roll back. Never retried.
 */
public class PreconditionViolationException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        ALREADY_APPLIED,
        NOT_APPLIED,
        MISSING_SQL,
        UNSAFE_SQL,
        MISSING_ROLLBACK,
        MISSING_TABLES,
        IN_PROGRESS
    }

    private final Reason reason;

    public PreconditionViolationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public static PreconditionViolationException recommendationNotFound(String recommendationId) {
        return new PreconditionViolationException(Reason.NOT_FOUND, "Recommendation " + recommendationId + " not found");
    }
}
