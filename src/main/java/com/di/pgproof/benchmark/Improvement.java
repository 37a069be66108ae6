package com.di.pgproof.benchmark;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optimized run relative to baseline. Positive percentages mean the candidate is better.
 */
@Value
public class Improvement {
    double timeImprovementPercent;
    double timeSavedMs;
    double ioImprovementPercent;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("time_improvement_percent", timeImprovementPercent);
        map.put("time_saved_ms", timeSavedMs);
        map.put("io_improvement_percent", ioImprovementPercent);
        return map;
    }
}
