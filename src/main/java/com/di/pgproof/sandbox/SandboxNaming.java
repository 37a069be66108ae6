package com.di.pgproof.sandbox;

import com.di.pgproof.util.InputValidator;

/**
 * Sandbox namespaces are named {@code benchmark_job_<job id>} with dashes turned into underscores,
 * so the name is derived 1:1 from the owning job.
 */
public final class SandboxNaming {

    public static final String PREFIX = "benchmark_job_";

    /** LIKE pattern for catalog scans; underscores escaped. */
    public static final String LIKE_PATTERN = "benchmark\\_job\\_%";

    private SandboxNaming() {
    }

    public static String schemaNameFor(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("Job id cannot be null or empty");
        }
        return InputValidator.validateIdentifier(PREFIX + jobId.trim().replace('-', '_'), "sandbox schema name");
    }

    public static boolean isSandboxSchema(String schemaName) {
        return schemaName != null && schemaName.startsWith(PREFIX);
    }
}
