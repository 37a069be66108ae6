package com.di.pgproof.job;

import com.di.pgproof.apply.ApplyManager;
import com.di.pgproof.benchmark.BenchmarkJobRunner;
import com.di.pgproof.exception.ErrorCategory;
import com.di.pgproof.exception.PreconditionViolationException;
import com.di.pgproof.util.CancellationToken;
import com.di.pgproof.util.InputValidator;
import com.di.pgproof.util.MdcPropagation;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asynchronous job pipeline: a bounded queue, one dispatch thread and a fixed worker pool.
 *
 * <p>Jobs are persisted PENDING before they are queued and start in submission order. Every job
 * that reaches a worker ends in a terminal status in the {@link JobStore}; jobs still queued at
 * {@link #stop()} stay PENDING and are picked up again by the restart recovery of {@link #start()}.
 */
@Slf4j
@Service
public class JobManager {

    private final JobStore store;
    private final JobProperties properties;
    private final BenchmarkJobRunner benchmarkRunner;
    private final ApplyManager applyManager;

    private final ActiveJobRegistry active = new ActiveJobRegistry();
    private final BlockingQueue<WorkItem> queue;
    /** Submissions that did not fit in {@link #queue}; guarded by itself. */
    private final Deque<WorkItem> overflow = new ArrayDeque<>();
    private final Object lifecycleLock = new Object();

    private volatile boolean running;
    private Thread dispatcher;
    private ExecutorService workers;

    public JobManager(JobStore store, JobProperties properties, BenchmarkJobRunner benchmarkRunner,
                      ApplyManager applyManager) {
        this.store = store;
        this.properties = properties;
        this.benchmarkRunner = benchmarkRunner;
        this.applyManager = applyManager;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, properties.getQueueCapacity()));
    }

    /**
     * Persists a PENDING job and queues it. Never blocks: when the queue is full the item waits in the
     * overflow list and keeps its place in line.
     *
     * @return the generated job id
     */
    public String submit(String recommendationId, JobType jobType) {
        if (recommendationId == null || recommendationId.isBlank()) {
            throw new IllegalArgumentException("Recommendation id cannot be null or empty");
        }
        if (jobType == null) {
            throw new IllegalArgumentException("Job type cannot be null");
        }
        Job job = store.create(recommendationId.trim(), jobType);
        enqueue(WorkItem.of(job));
        log.info("[JOB] Submitted {} job {} for recommendation {}", jobType.getCode(), job.getId(), job.getRecommendationId());
        return job.getId();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            if (properties.isRecoverOnStart()) {
                recover();
            }
            workers = MdcPropagation.wrapExecutor(
                    Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrency()), namedThreads("pgproof-job-")));
            running = true;
            dispatcher = namedThreads("pgproof-dispatch-").newThread(this::dispatchLoop);
            dispatcher.start();
            log.info("[JOB] Job manager started (max-concurrency={}, queue-capacity={})",
                    properties.getMaxConcurrency(), properties.getQueueCapacity());
        }
    }

    /**
     * Stops the dispatch loop, cancels every running job and waits for the workers to finish their cleanup.
     */
    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            dispatcher.interrupt();
            try {
                dispatcher.join(properties.getCancelAwaitTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            for (ActiveJob job : active.snapshot()) {
                if (job.getState() == ActiveJob.State.QUEUED && job.getFuture() != null) {
                    job.getFuture().cancel(false);
                }
            }
            // Signal every running job first so their cleanups overlap, then share one deadline.
            List<ActiveJob> cancelling = new ArrayList<>();
            for (ActiveJob job : active.snapshot()) {
                if (job.cancelRunning()) {
                    interrupt(job);
                    cancelling.add(job);
                }
            }
            long deadline = System.nanoTime() + properties.getCancelAwaitTimeout().toNanos();
            for (ActiveJob job : cancelling) {
                awaitCancelled(job, Math.max(0L, deadline - System.nanoTime()));
            }
            workers.shutdown();
            try {
                if (!workers.awaitTermination(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                    log.warn("[JOB] Workers did not terminate within {}", properties.getCancelAwaitTimeout());
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
            // Anything not yet handed to a worker is still PENDING in the store; forget the runtime handles.
            for (ActiveJob job : active.snapshot()) {
                if (job.getState() == ActiveJob.State.QUEUED) {
                    active.remove(job.getItem().getJobId());
                }
            }
            queue.clear();
            synchronized (overflow) {
                overflow.clear();
            }
            log.info("[JOB] Job manager stopped");
        }
    }

    public boolean isRunning() {
        return running;
    }

    public Optional<Job> status(String jobId) {
        return store.get(jobId);
    }

    /** True while the job is queued or running in this process. */
    public boolean isActive(String jobId) {
        return active.contains(jobId);
    }

    /**
     * Cancels a queued or running job. A running job has its in-flight statement cancelled and its
     * worker interrupted; this call returns after the job's cleanup has run or the await timeout expired.
     *
     * @return true if the job was active and is now CANCELLED; false for unknown or finished jobs
     */
    public boolean cancel(String jobId) {
        Optional<ActiveJob> found = active.get(jobId);
        if (found.isEmpty()) {
            return false;
        }
        ActiveJob job = found.get();
        if (job.cancelQueued()) {
            job.getToken().cancel();
            store.updateStatus(jobId, JobStatus.CANCELLED, null, "Cancelled before start");
            active.remove(jobId);
            job.markDone();
            log.info("[JOB] Cancelled queued job {}", jobId);
            return true;
        }
        if (!job.cancelRunning()) {
            return false;
        }
        interrupt(job);
        awaitCancelled(job, properties.getCancelAwaitTimeout().toNanos());
        return true;
    }

    private static void interrupt(ActiveJob job) {
        job.getToken().cancel();
        if (job.getFuture() != null) {
            job.getFuture().cancel(true);
        }
    }

    /** Waits for the worker's cleanup, then records CANCELLED unless the worker already wrote a final status. */
    private void awaitCancelled(ActiveJob job, long timeoutNanos) {
        String jobId = job.getItem().getJobId();
        try {
            if (!job.awaitDone(timeoutNanos, TimeUnit.NANOSECONDS)) {
                log.warn("[JOB] Job {} did not finish cleanup within {}", jobId, properties.getCancelAwaitTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        boolean terminal = store.get(jobId).map(j -> j.getStatus().isTerminal()).orElse(true);
        if (!terminal) {
            store.updateStatus(jobId, JobStatus.CANCELLED, null, "Cancelled");
        }
        log.info("[JOB] Cancelled running job {}", jobId);
    }

    /** Newest first; a null status lists every status. */
    public List<Job> list(JobStatus status, int limit) {
        return store.list(JobFilter.of(status, InputValidator.clampLimit(limit, properties.getMaxListLimit())));
    }

    public List<Job> findByRecommendation(String recommendationId) {
        return store.findByRecommendation(recommendationId);
    }

    /**
     * @return number of terminal jobs deleted
     */
    public int cleanupOlderThan(Duration age) {
        int deleted = store.deleteOlderThan(age);
        if (deleted > 0) {
            log.info("[JOB] Removed {} job(s) finished more than {} ago", deleted, age);
        }
        return deleted;
    }

    public JobManagerStatus managerStatus() {
        int waiting;
        synchronized (overflow) {
            waiting = queue.size() + overflow.size();
        }
        return JobManagerStatus.builder()
                .running(running)
                .queueSize(waiting)
                .activeJobs(active.runningCount())
                .maxConcurrency(properties.getMaxConcurrency())
                .statistics(store.statistics())
                .build();
    }

    private void enqueue(WorkItem item) {
        active.register(new ActiveJob(item));
        synchronized (overflow) {
            if (!overflow.isEmpty() || !queue.offer(item)) {
                overflow.addLast(item);
                log.warn("[JOB] Queue full, job {} parked in overflow ({} waiting)", item.getJobId(), overflow.size());
            }
        }
    }

    private void drainOverflow() {
        synchronized (overflow) {
            while (!overflow.isEmpty() && queue.offer(overflow.peekFirst())) {
                overflow.pollFirst();
            }
        }
    }

    private void dispatchLoop() {
        while (running) {
            try {
                drainOverflow();
                WorkItem item = queue.poll(properties.getPollTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (item == null) {
                    continue;
                }
                Optional<ActiveJob> job = active.get(item.getJobId());
                if (job.isEmpty() || job.get().getState() != ActiveJob.State.QUEUED) {
                    continue;
                }
                job.get().attach(workers.submit(() -> execute(job.get())));
            } catch (InterruptedException e) {
                if (!running) {
                    break;
                }
                log.warn("[JOB] Dispatch loop interrupted while running; continuing");
            } catch (RuntimeException e) {
                log.error("[JOB] Dispatch loop error: {}", e.getMessage(), e);
                backOff();
            }
        }
    }

    private void backOff() {
        try {
            Thread.sleep(properties.getLoopBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void execute(ActiveJob job) {
        WorkItem item = job.getItem();
        if (!job.markRunning()) {
            return;
        }
        MdcPropagation.runWithMdcContext(Map.of(
                MdcPropagation.JOB_ID, item.getJobId(),
                MdcPropagation.RECOMMENDATION_ID, item.getRecommendationId()), () -> run(job));
    }

    private void run(ActiveJob job) {
        WorkItem item = job.getItem();
        JobStatus outcome;
        Map<String, Object> result = null;
        String error = null;
        try {
            store.updateStatus(item.getJobId(), JobStatus.RUNNING, null, null);
            log.info("[JOB] Running {} job {}", item.getJobType().getCode(), item.getJobId());
            result = dispatch(item, job.getToken());
            outcome = JobStatus.COMPLETED;
        } catch (PreconditionViolationException e) {
            outcome = JobStatus.FAILED;
            error = e.getMessage();
        } catch (CancellationException e) {
            outcome = JobStatus.CANCELLED;
            error = "Cancelled";
        } catch (Exception e) {
            outcome = job.getToken().isCancelled() ? JobStatus.CANCELLED : JobStatus.ERROR;
            error = job.getToken().isCancelled() ? "Cancelled" : ErrorCategory.describe(e);
            if (outcome == JobStatus.ERROR) {
                log.error("[JOB] Job {} failed: {}", item.getJobId(), error, e);
            }
        } finally {
            // A cancel interrupts the worker; the status write must still get a connection.
            Thread.interrupted();
        }
        try {
            if (!job.markFinished()) {
                outcome = JobStatus.CANCELLED;
                result = null;
                error = "Cancelled";
            }
            store.updateStatus(item.getJobId(), outcome, result, error);
            log.info("[JOB] Job {} finished: {}", item.getJobId(), outcome.getCode());
        } catch (RuntimeException e) {
            log.error("[JOB] Failed to record outcome {} for job {}: {}", outcome.getCode(), item.getJobId(), e.getMessage());
        } finally {
            active.remove(item.getJobId());
            job.markDone();
        }
    }

    private Map<String, Object> dispatch(WorkItem item, CancellationToken token) {
        switch (item.getJobType()) {
            case BENCHMARK:
                return benchmarkRunner.run(item.getJobId(), item.getRecommendationId(), token).toPayload();
            case APPLY:
                return applyManager.apply(item.getRecommendationId(), token).toPayload();
            case ROLLBACK:
                return applyManager.rollback(item.getRecommendationId(), token).toPayload();
            default:
                throw new IllegalStateException("Unsupported job type: " + item.getJobType());
        }
    }

    /**
     * Jobs left RUNNING belonged to a process that died or a stop that timed out; they cannot be
     * resumed. PENDING jobs not already queued here are queued again in creation order.
     */
    private void recover() {
        int limit = properties.getMaxListLimit();
        List<Job> interrupted = store.list(JobFilter.of(JobStatus.RUNNING, limit));
        for (Job job : interrupted) {
            store.updateStatus(job.getId(), JobStatus.ERROR, null, "Interrupted by restart");
        }
        List<Job> pending = store.list(JobFilter.of(JobStatus.PENDING, limit));
        pending.stream()
                .filter(job -> !active.contains(job.getId()))
                .sorted(Comparator.comparing(Job::getCreatedAt))
                .forEach(job -> enqueue(WorkItem.of(job)));
        if (!interrupted.isEmpty() || !pending.isEmpty()) {
            log.info("[JOB] Recovery: {} interrupted job(s) marked error, {} pending job(s) re-queued",
                    interrupted.size(), pending.size());
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
