package com.di.pgproof.apply;

import java.util.Arrays;

public enum ChangeStatus {
    APPLIED("applied"),
    ROLLED_BACK("rolled_back");

    private final String code;

    ChangeStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ChangeStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(v -> v.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown change status: " + code));
    }
}
