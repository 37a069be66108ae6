package com.di.pgproof.job;

import com.di.pgproof.util.CancellationToken;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime handle of a submitted job. The state transitions decide, exactly once, whether the
 * worker or a cancel request writes the final status.
 */
final class ActiveJob {

    enum State { QUEUED, RUNNING, CANCELLING, FINISHED }

    private final WorkItem item;
    private final CancellationToken token = new CancellationToken();
    private final AtomicReference<State> state = new AtomicReference<>(State.QUEUED);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Future<?> future;

    ActiveJob(WorkItem item) {
        this.item = item;
    }

    WorkItem getItem() {
        return item;
    }

    CancellationToken getToken() {
        return token;
    }

    State getState() {
        return state.get();
    }

    void attach(Future<?> future) {
        this.future = future;
    }

    Future<?> getFuture() {
        return future;
    }

    /** Worker side: claim the job. Fails if it was cancelled while queued. */
    boolean markRunning() {
        return state.compareAndSet(State.QUEUED, State.RUNNING);
    }

    /** Worker side: claim the right to record the natural outcome. Fails if a cancel got there first. */
    boolean markFinished() {
        return state.compareAndSet(State.RUNNING, State.FINISHED);
    }

    boolean cancelQueued() {
        return state.compareAndSet(State.QUEUED, State.CANCELLING);
    }

    boolean cancelRunning() {
        return state.compareAndSet(State.RUNNING, State.CANCELLING);
    }

    void markDone() {
        done.countDown();
    }

    boolean awaitDone(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }
}
