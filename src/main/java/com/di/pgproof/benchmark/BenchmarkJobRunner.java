package com.di.pgproof.benchmark;

import com.di.pgproof.exception.BenchmarkUnavailableException;
import com.di.pgproof.exception.PreconditionViolationException;
import com.di.pgproof.exception.PreconditionViolationException.Reason;
import com.di.pgproof.job.JobProperties;
import com.di.pgproof.recommendation.Recommendation;
import com.di.pgproof.recommendation.RecommendationStore;
import com.di.pgproof.sandbox.QueryMeasurement;
import com.di.pgproof.sandbox.SampledTable;
import com.di.pgproof.sandbox.SchemaManager;
import com.di.pgproof.sandbox.TempSchema;
import com.di.pgproof.target.BenchmarkTarget;
import com.di.pgproof.target.OperationClass;
import com.di.pgproof.target.TargetSelector;
import com.di.pgproof.util.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Runs one benchmark job: sandbox with sampled tables, baseline measurement of the original query,
 * candidate applied or run, second measurement, improvement. The sandbox is dropped on every exit path,
 * cancellation included.
 */
@Slf4j
@Service
public class BenchmarkJobRunner {

    private final RecommendationStore recommendations;
    private final SchemaManager schemaManager;
    private final TargetSelector targetSelector;
    private final JobProperties jobProperties;
    private final Clock clock;

    public BenchmarkJobRunner(RecommendationStore recommendations, SchemaManager schemaManager,
                              TargetSelector targetSelector, JobProperties jobProperties, Clock clock) {
        this.recommendations = recommendations;
        this.schemaManager = schemaManager;
        this.targetSelector = targetSelector;
        this.jobProperties = jobProperties;
        this.clock = clock;
    }

    public BenchmarkResult run(String jobId, String recommendationId, CancellationToken token) {
        Recommendation rec = recommendations.get(recommendationId)
                .orElseThrow(() -> PreconditionViolationException.recommendationNotFound(recommendationId));
        String originalSql = rec.getOriginalSql() != null ? rec.getOriginalSql().trim() : "";
        if (originalSql.isEmpty()) {
            throw new PreconditionViolationException(Reason.MISSING_SQL,
                    "Recommendation " + recommendationId + " has no original query to benchmark");
        }
        if (rec.getTables() == null || rec.getTables().isEmpty()) {
            throw new PreconditionViolationException(Reason.MISSING_TABLES,
                    "Recommendation " + recommendationId + " names no tables to sample");
        }

        BenchmarkTarget readTarget = targetSelector.selectTarget(OperationClass.READ);
        BenchmarkTarget sandboxTarget = targetSelector.selectTarget(OperationClass.MUTATE);
        if (!sandboxTarget.isAvailable()) {
            throw new BenchmarkUnavailableException("No replica available to host the benchmark sandbox");
        }
        String benchmarkTarget = readTarget.getKind().getCode() + "+" + sandboxTarget.getKind().getCode();
        double samplePercent = jobProperties.getSamplePercent();
        log.info("[JOB] Benchmarking recommendation {} on {} at {}%", recommendationId, benchmarkTarget, samplePercent);

        try {
            String schemaName = schemaManager.createSandbox(jobId, rec.getTables(), samplePercent, token);
            List<SampledTable> sampled = schemaManager.sandboxFor(jobId)
                    .map(TempSchema::getSampledTables)
                    .orElse(List.of());

            QueryMeasurement baseline = schemaManager.runInSandbox(schemaName, originalSql, List.of(), token);
            QueryMeasurement optimized = baseline;
            boolean patchApplied = false;

            BenchmarkCandidate candidate = BenchmarkCandidate.from(rec);
            switch (candidate.getKind()) {
                case INDEX:
                    patchApplied = schemaManager.runDdlInSandbox(schemaName, candidate.getSql(), token);
                    if (patchApplied) {
                        optimized = schemaManager.runInSandbox(schemaName, originalSql, List.of(), token);
                    } else {
                        log.warn("[JOB] Candidate index failed in {}; reporting baseline only", schemaName);
                    }
                    break;
                case QUERY:
                    optimized = schemaManager.runInSandbox(schemaName, candidate.getSql(), List.of(), token);
                    patchApplied = true;
                    break;
                default:
                    log.info("[JOB] Recommendation {} has no candidate that can run in a sandbox; reporting baseline only",
                            recommendationId);
                    break;
            }

            Improvement improvement = ImprovementCalculator.compare(baseline, optimized);
            log.info("[JOB] Benchmark for recommendation {}: {}% time, {}% I/O", recommendationId,
                    improvement.getTimeImprovementPercent(), improvement.getIoImprovementPercent());

            return BenchmarkResult.builder()
                    .jobId(jobId)
                    .recommendationId(recommendationId)
                    .benchmarkTarget(benchmarkTarget)
                    .schemaName(schemaName)
                    .samplePercent(samplePercent)
                    .tablesSampled(sampled)
                    .tablesAnalyzed(rec.getTables())
                    .baseline(baseline)
                    .optimized(optimized)
                    .improvement(improvement)
                    .patchApplied(patchApplied)
                    .completedAt(clock.instant())
                    .build();
        } finally {
            cleanup(jobId);
        }
    }

    /**
     * Drops the sandbox with the interrupt flag cleared, so a cancelled job can still borrow a
     * connection for the drop. The flag is restored afterwards.
     */
    private void cleanup(String jobId) {
        boolean interrupted = Thread.interrupted();
        try {
            schemaManager.destroySandbox(jobId);
        } catch (RuntimeException e) {
            log.warn("[JOB] Sandbox cleanup failed for job {}: {}", jobId, e.getMessage());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
