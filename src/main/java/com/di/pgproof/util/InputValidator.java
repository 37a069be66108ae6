package com.di.pgproof.util;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Validation and quoting for identifiers that end up inside dynamically built SQL
 * (sandbox schema names, sampled table names). Everything interpolated into a statement passes
 * through here first.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    /**
     * Unquoted PostgreSQL identifier: letter or underscore first, then letters, digits,
     * underscores or dollar signs, at most 63 characters.
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_$]{0,62}$"
    );

    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final double MIN_SAMPLE_PERCENT = 0.0;
    private static final double MAX_SAMPLE_PERCENT = 100.0;

    /**
     * Validates a PostgreSQL identifier (schema, table or index name).
     *
     * @param identifier     the identifier to validate
     * @param identifierType used in error messages, e.g. "table name"
     * @return the trimmed identifier
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = identifier.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters: %s",
                            identifierType, MAX_IDENTIFIER_LENGTH, trimmed));
        }
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            log.warn("Rejected {}: {}", identifierType, trimmed);
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'. " +
                                    "Must start with a letter or underscore, followed by letters, digits, underscores, or dollar signs.",
                            identifierType, trimmed));
        }
        return trimmed;
    }

    /**
     * Splits {@code schema.table} or {@code table} and validates both parts.
     *
     * @param tableName     table reference as it appears in a recommendation
     * @param defaultSchema schema used when the reference is unqualified
     * @return {@code [schema, table]}
     */
    public static String[] splitTableName(String tableName, String defaultSchema) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        String[] parts = tableName.trim().split("\\.", 2);
        if (parts.length == 2) {
            return new String[] {
                    validateIdentifier(parts[0], "Schema name"),
                    validateIdentifier(parts[1], "Table name")
            };
        }
        return new String[] {
                validateIdentifier(defaultSchema, "Schema name"),
                validateIdentifier(parts[0], "Table name")
        };
    }

    /**
     * Double-quotes a validated identifier.
     */
    public static String quoteIdentifier(String identifier) {
        return "\"" + validateIdentifier(identifier, "Identifier").replace("\"", "\"\"") + "\"";
    }

    public static String qualify(String schema, String table) {
        return quoteIdentifier(schema) + "." + quoteIdentifier(table);
    }

    /**
     * Sample percentage must lie in (0, 100].
     */
    public static double validateSamplePercent(double samplePercent) {
        if (Double.isNaN(samplePercent) || samplePercent <= MIN_SAMPLE_PERCENT || samplePercent > MAX_SAMPLE_PERCENT) {
            throw new IllegalArgumentException(
                    String.format("Sample percent must be in (%.0f, %.0f], got %s", MIN_SAMPLE_PERCENT, MAX_SAMPLE_PERCENT, samplePercent));
        }
        return samplePercent;
    }

    /**
     * Plain decimal form for SQL literals: 10.0 becomes {@code 10}, 2.5 stays {@code 2.5}.
     */
    public static String formatPercent(double samplePercent) {
        return BigDecimal.valueOf(samplePercent).stripTrailingZeros().toPlainString();
    }

    /**
     * Clamps a caller-supplied list limit to {@code [1, max]}.
     */
    public static int clampLimit(int limit, int max) {
        return Math.min(Math.max(1, limit), max);
    }
}
