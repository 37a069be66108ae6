package com.di.pgproof.benchmark;

import com.di.pgproof.sandbox.QueryMeasurement;

final class ImprovementCalculator {

    private ImprovementCalculator() {
    }

    /**
     * Time and I/O improvement of {@code optimized} over {@code baseline}, rounded to two decimals.
     * A zero baseline gives 0% rather than a division by zero.
     */
    static Improvement compare(QueryMeasurement baseline, QueryMeasurement optimized) {
        double saved = baseline.getElapsedMs() - optimized.getElapsedMs();
        double timePercent = baseline.getElapsedMs() > 0 ? saved / baseline.getElapsedMs() * 100.0 : 0.0;

        long baseIo = baseline.getIo().totalBufferAccesses();
        long optIo = optimized.getIo().totalBufferAccesses();
        double ioPercent = baseIo > 0 ? (double) (baseIo - optIo) / baseIo * 100.0 : 0.0;

        return new Improvement(round2(timePercent), round2(saved), round2(ioPercent));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
