package com.di.pgproof.job;

import java.util.Arrays;

/**
 * Job lifecycle: {@code PENDING -> RUNNING -> COMPLETED | FAILED | ERROR}, and {@code CANCELLED}
 * from either non-terminal state.
 * <ul>
 *   <li>{@link #FAILED} - the request was refused before any work (unknown recommendation, unsafe SQL, ...)</li>
 *   <li>{@link #ERROR} - the work itself failed</li>
 * </ul>
 */
public enum JobStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    ERROR("error"),
    CANCELLED("cancelled");

    private final String code;

    JobStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public static JobStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(v -> v.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job status: " + code));
    }
}
