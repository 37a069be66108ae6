package com.di.pgproof.job;

import java.util.Arrays;

public enum JobType {
    BENCHMARK("benchmark"),
    APPLY("apply"),
    ROLLBACK("rollback");

    private final String code;

    JobType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static JobType fromCode(String code) {
        return Arrays.stream(values())
                .filter(v -> v.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job type: " + code));
    }
}
