package com.di.pgproof.benchmark;

import com.di.pgproof.sandbox.QueryMeasurement;
import com.di.pgproof.sandbox.SampledTable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class BenchmarkResult {
    public static final String BENCHMARK_TYPE = "sandbox_sampled";

    String jobId;
    String recommendationId;
    /** {@code <read target>+<sandbox target>}, e.g. {@code replica+replica}. */
    String benchmarkTarget;
    String schemaName;
    double samplePercent;
    @Singular("tableSampled")
    List<SampledTable> tablesSampled;
    @Singular("tableAnalyzed")
    List<String> tablesAnalyzed;
    QueryMeasurement baseline;
    QueryMeasurement optimized;
    Improvement improvement;
    boolean patchApplied;
    Instant completedAt;

    /** JSON-ready job result. */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", jobId);
        payload.put("recommendation_id", recommendationId);
        payload.put("benchmark_type", BENCHMARK_TYPE);
        payload.put("benchmark_target", benchmarkTarget);
        payload.put("schema_name", schemaName);
        payload.put("sample_percent", samplePercent);
        List<Map<String, Object>> sampled = new ArrayList<>();
        for (SampledTable t : tablesSampled) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", t.getName());
            row.put("row_count", t.getRowCount());
            row.put("sample_percent", t.getSamplePercent());
            sampled.add(row);
        }
        payload.put("tables_sampled", sampled);
        payload.put("baseline_metrics", baseline.toMap());
        payload.put("optimized_metrics", optimized.toMap());
        payload.put("improvement", improvement.toMap());
        payload.put("patch_applied", patchApplied);
        payload.put("tables_analyzed", new ArrayList<>(tablesAnalyzed));
        payload.put("completed_at", completedAt != null ? completedAt.toString() : null);
        return payload;
    }
}
