package com.di.pgproof.util;

import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-job cancellation flag that also knows the statement currently executing on the job's
 * behalf. {@link #cancel()} flips the flag and calls {@link Statement#cancel()} on that statement,
 * so a job blocked in a long query returns promptly instead of waiting for the server.
 *
 * <p>Every JDBC round trip made for a job goes through {@link #execute(Statement, StatementCall)}.
 */
@Slf4j
public final class CancellationToken {

    @FunctionalInterface
    public interface StatementCall<S extends Statement, T> {
        T call(S statement) throws SQLException;
    }

    private volatile boolean cancelled;
    private final AtomicReference<Statement> inFlight = new AtomicReference<>();

    /**
     * A token that is never cancelled, for callers outside a job (maintenance, cleanup).
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if {@link #cancel()} has been called
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Job cancelled");
        }
    }

    /**
     * Runs {@code call} against {@code statement}, registering it as the in-flight statement
     * for the duration. A failure caused by cancellation surfaces as {@link CancellationException}.
     */
    public <S extends Statement, T> T execute(S statement, StatementCall<S, T> call) throws SQLException {
        throwIfCancelled();
        inFlight.set(statement);
        try {
            if (cancelled) {
                throw new CancellationException("Job cancelled");
            }
            return call.call(statement);
        } catch (SQLException e) {
            if (cancelled) {
                CancellationException ce = new CancellationException("Statement cancelled: " + e.getMessage());
                ce.initCause(e);
                throw ce;
            }
            throw e;
        } finally {
            inFlight.compareAndSet(statement, null);
        }
    }

    /**
     * Marks the token cancelled and cancels the in-flight statement, if any.
     *
     * @return false if the token was already cancelled
     */
    public boolean cancel() {
        if (cancelled) {
            return false;
        }
        cancelled = true;
        Statement statement = inFlight.get();
        if (statement != null) {
            try {
                statement.cancel();
            } catch (SQLException e) {
                log.warn("[JOB] Statement cancel failed: {}", e.getMessage());
            }
        }
        return true;
    }
}
