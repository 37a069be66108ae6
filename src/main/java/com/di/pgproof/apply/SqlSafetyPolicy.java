package com.di.pgproof.apply;

import java.util.List;
import java.util.Locale;

/**
 * Statement-prefix allow-list guarding every statement that reaches a real database.
 * Does not parse SQL: anything not starting with one of the allowed prefixes is refused, and so is
 * any {@code ;} other than a single trailing one, so exactly one statement gets through.
 */
public final class SqlSafetyPolicy {

    static final List<String> ALLOWED_PREFIXES = List.of(
            "CREATE INDEX CONCURRENTLY",
            "DROP INDEX CONCURRENTLY",
            "ALTER SYSTEM",
            "SET "
    );

    private static final List<String> NON_TRANSACTIONAL_PREFIXES = List.of(
            "CREATE INDEX CONCURRENTLY",
            "DROP INDEX CONCURRENTLY",
            "ALTER SYSTEM"
    );

    private SqlSafetyPolicy() {
    }

    public static boolean isAllowed(String sql) {
        String normalized = normalize(sql);
        if (normalized.isEmpty() || !isSingleStatement(normalized)) {
            return false;
        }
        return ALLOWED_PREFIXES.stream().anyMatch(normalized::startsWith);
    }

    /**
     * Statements PostgreSQL refuses to run inside a transaction block.
     */
    public static boolean requiresAutocommit(String sql) {
        String normalized = normalize(sql);
        return NON_TRANSACTIONAL_PREFIXES.stream().anyMatch(normalized::startsWith);
    }

    private static boolean isSingleStatement(String normalized) {
        String body = normalized.endsWith(";")
                ? normalized.substring(0, normalized.length() - 1)
                : normalized;
        return body.indexOf(';') < 0;
    }

    /** Upper-cased with surrounding whitespace removed; inner whitespace is left alone. */
    static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        return sql.strip().toUpperCase(Locale.ROOT);
    }
}
