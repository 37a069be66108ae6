package com.di.pgproof.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Carries SLF4J MDC (e.g. {@code job_id}, {@code recommendation_id}) onto worker threads so
 * job logs stay correlated after they leave the submitting thread.
 * <ul>
 *   <li>Wrap the executor once: {@code ExecutorService withMdc = MdcPropagation.wrapExecutor(pool);}</li>
 *   <li>Run with an explicit context on a worker: {@code MdcPropagation.runWithMdcContext(ctx, () -> work());}</li>
 * </ul>
 */
public final class MdcPropagation {

    public static final String JOB_ID = "job_id";
    public static final String RECOMMENDATION_ID = "recommendation_id";

    private MdcPropagation() {
    }

    /**
     * Captures the caller's MDC and returns a Runnable that restores it around {@code task}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> runWithMdcContext(contextMap, task);
    }

    /**
     * Same as {@link #wrapRunnable(Runnable)} for callables.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Runs {@code task} on the current thread with {@code contextMap} set, removing those keys afterwards.
     */
    public static void runWithMdcContext(Map<String, String> contextMap, Runnable task) {
        setMdc(contextMap);
        try {
            task.run();
        } finally {
            clearMdc(contextMap);
        }
    }

    /**
     * Returns an executor that propagates the submitting thread's MDC into every task.
     */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /**
     * @return copy of the current MDC; never null
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach((k, v) -> {
                if (v != null) {
                    MDC.put(k, v);
                }
            });
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
