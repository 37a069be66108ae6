package com.di.pgproof.exception;

/**
 * No target may serve the requested operation class. For mutating work this means no healthy
 * replica; the primary is never offered as a substitute.
 */
public class BenchmarkUnavailableException extends RuntimeException {

    public BenchmarkUnavailableException(String message) {
        super(message);
    }
}
