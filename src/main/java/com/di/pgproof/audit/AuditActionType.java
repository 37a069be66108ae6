package com.di.pgproof.audit;

import java.util.Arrays;

public enum AuditActionType {
    RECOMMENDATION_APPLIED("recommendation_applied"),
    RECOMMENDATION_APPLY_FAILED("recommendation_apply_failed"),
    RECOMMENDATION_ROLLED_BACK("recommendation_rolled_back"),
    RECOMMENDATION_ROLLBACK_FAILED("recommendation_rollback_failed"),
    CLEANUP("cleanup");

    private final String code;

    AuditActionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AuditActionType fromCode(String code) {
        return Arrays.stream(values())
                .filter(v -> v.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown audit action type: " + code));
    }
}
