package com.di.pgproof.apply;

import com.di.pgproof.recommendation.Recommendation;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort undo statements. A supplied rollback wins; otherwise only two shapes are handled:
 * <ul>
 *   <li>{@code CREATE INDEX CONCURRENTLY <name> ...} becomes {@code DROP INDEX CONCURRENTLY <name>;}</li>
 *   <li>{@code SET <param> = ...} becomes {@code SET <param> = '<stock value>';}, or
 *   {@code SET <param> = DEFAULT;} for parameters without a known stock value</li>
 * </ul>
 * Anything else has no rollback, which is an allowed outcome.
 */
public final class RollbackDeriver {

    private static final Pattern CREATE_INDEX = Pattern.compile(
            "^\\s*CREATE\\s+INDEX\\s+CONCURRENTLY\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SET_PARAM = Pattern.compile(
            "^\\s*SET\\s+(\\w+)\\s*(?:=|\\s+TO\\s+)", Pattern.CASE_INSENSITIVE);

    /** Stock PostgreSQL values for the parameters tuning advice usually touches. */
    static final Map<String, String> SAFE_DEFAULTS = Map.of(
            "work_mem", "4MB",
            "shared_buffers", "128MB",
            "effective_cache_size", "4GB",
            "random_page_cost", "4.0",
            "seq_page_cost", "1.0"
    );

    private RollbackDeriver() {
    }

    public static Optional<String> derive(Recommendation recommendation) {
        if (recommendation.getRollbackSql() != null && !recommendation.getRollbackSql().isBlank()) {
            return Optional.of(recommendation.getRollbackSql().trim());
        }
        return deriveFrom(recommendation.getSqlFix());
    }

    static Optional<String> deriveFrom(String sqlFix) {
        if (sqlFix == null || sqlFix.isBlank()) {
            return Optional.empty();
        }
        Matcher index = CREATE_INDEX.matcher(sqlFix);
        if (index.find()) {
            return Optional.of("DROP INDEX CONCURRENTLY " + index.group(1) + ";");
        }
        Matcher set = SET_PARAM.matcher(sqlFix);
        if (set.find()) {
            String param = set.group(1).toLowerCase(Locale.ROOT);
            String stock = SAFE_DEFAULTS.get(param);
            return Optional.of("SET " + param + " = " + (stock != null ? "'" + stock + "'" : "DEFAULT") + ";");
        }
        return Optional.empty();
    }
}
