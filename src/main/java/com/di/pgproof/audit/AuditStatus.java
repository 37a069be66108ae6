package com.di.pgproof.audit;

import java.util.Arrays;

public enum AuditStatus {
    COMPLETED("completed"),
    FAILED("failed"),
    PARTIAL("partial");

    private final String code;

    AuditStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AuditStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(v -> v.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown audit status: " + code));
    }
}
