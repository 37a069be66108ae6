package com.di.pgproof.sandbox;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wall-clock time, result size and I/O delta of one statement run in a sandbox.
 */
@Value
public class QueryMeasurement {
    double elapsedMs;
    long rowsReturned;
    IoMetrics io;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("execution_time_ms", elapsedMs);
        map.put("rows_returned", rowsReturned);
        map.putAll(io.toMap());
        return map;
    }
}
