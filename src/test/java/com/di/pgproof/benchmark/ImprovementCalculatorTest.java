package com.di.pgproof.benchmark;

import com.di.pgproof.sandbox.IoMetrics;
import com.di.pgproof.sandbox.QueryMeasurement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImprovementCalculator Tests")
class ImprovementCalculatorTest {

    private static QueryMeasurement measured(double ms, long hit, long read) {
        return new QueryMeasurement(ms, 10, IoMetrics.builder().sharedBuffersHit(hit).sharedBuffersRead(read).build());
    }

    @Test
    @DisplayName("Should compute time and I/O improvement as percentages of the baseline")
    void testCompare_Faster() {
        Improvement improvement = ImprovementCalculator.compare(measured(200, 100, 100), measured(50, 40, 10));

        assertEquals(75.0, improvement.getTimeImprovementPercent());
        assertEquals(150.0, improvement.getTimeSavedMs());
        assertEquals(75.0, improvement.getIoImprovementPercent());
    }

    @Test
    @DisplayName("Should report regressions as negative improvement")
    void testCompare_Slower() {
        Improvement improvement = ImprovementCalculator.compare(measured(100, 50, 50), measured(150, 100, 50));

        assertEquals(-50.0, improvement.getTimeImprovementPercent());
        assertEquals(-50.0, improvement.getTimeSavedMs());
        assertEquals(-50.0, improvement.getIoImprovementPercent());
    }

    @Test
    @DisplayName("Should not divide by a zero baseline")
    void testCompare_ZeroBaseline() {
        Improvement improvement = ImprovementCalculator.compare(measured(0, 0, 0), measured(5, 10, 10));

        assertEquals(0.0, improvement.getTimeImprovementPercent());
        assertEquals(0.0, improvement.getIoImprovementPercent());
    }

    @Test
    @DisplayName("Should round to two decimals")
    void testCompare_Rounding() {
        Improvement improvement = ImprovementCalculator.compare(measured(3, 3, 0), measured(2, 2, 0));

        assertEquals(33.33, improvement.getTimeImprovementPercent());
        assertEquals(33.33, improvement.getIoImprovementPercent());
        assertEquals(33.33, improvement.toMap().get("time_improvement_percent"));
    }
}
