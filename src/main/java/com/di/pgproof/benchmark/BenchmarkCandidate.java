package com.di.pgproof.benchmark;

import com.di.pgproof.recommendation.Recommendation;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * What gets measured after the baseline. Only two shapes are sandbox-safe: an index built on a
 * sandbox table, and a read-only query run in place of the original. Server settings
 * ({@code SET}, {@code ALTER SYSTEM}) and any other statement are never sent to the sandbox.
 *
 * <p>{@code patchSql} is preferred; {@code sqlFix} contributes only an index definition.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BenchmarkCandidate {

    public enum Kind { INDEX, QUERY, NONE }

    public static final BenchmarkCandidate NONE = new BenchmarkCandidate(Kind.NONE, null);

    private static final Pattern INDEX_DDL = Pattern.compile("^CREATE\\s+(UNIQUE\\s+)?INDEX\\b");
    private static final Pattern READ_QUERY = Pattern.compile("^(SELECT|WITH)\\b");
    /** Schema-qualified targets would resolve outside the sandbox. */
    private static final Pattern QUALIFIED_TARGET =
            Pattern.compile("\\bON\\s+(ONLY\\s+)?(\"[^\"]+\"|[A-Z_][A-Z0-9_$]*)\\s*\\.");

    Kind kind;
    String sql;

    public static BenchmarkCandidate from(Recommendation rec) {
        String patch = trimToNull(rec.getPatchSql());
        if (patch != null) {
            if (isSandboxIndex(patch)) {
                return new BenchmarkCandidate(Kind.INDEX, patch);
            }
            if (isQuery(patch)) {
                return new BenchmarkCandidate(Kind.QUERY, patch);
            }
        }
        String fix = trimToNull(rec.getSqlFix());
        if (fix != null && isSandboxIndex(fix)) {
            return new BenchmarkCandidate(Kind.INDEX, fix);
        }
        return NONE;
    }

    static boolean isSandboxIndex(String sql) {
        String upper = sql.strip().toUpperCase(Locale.ROOT);
        if (!INDEX_DDL.matcher(upper).find()) {
            return false;
        }
        int semicolon = upper.indexOf(';');
        if (semicolon >= 0 && semicolon != upper.length() - 1) {
            return false;
        }
        return !QUALIFIED_TARGET.matcher(upper).find();
    }

    static boolean isQuery(String sql) {
        return READ_QUERY.matcher(sql.strip().toUpperCase(Locale.ROOT)).find();
    }

    private static String trimToNull(String sql) {
        return sql == null || sql.isBlank() ? null : sql.trim();
    }
}
