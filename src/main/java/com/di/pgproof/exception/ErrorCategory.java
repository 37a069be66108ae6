package com.di.pgproof.exception;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;

/**
 * Coarse classification of failures, stored next to job errors and in audit details so that
 * operators can tell a refused connection from a bad statement at a glance.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error"),
    UNDEFINED_OBJECT("Undefined object", "Referenced table, index or schema does not exist"),
    TRANSACTION_STATE_ERROR("Transaction state error", "Statement not allowed in the current transaction state"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    PERMISSION_ERROR("Permission denied", "Insufficient permissions to perform operation"),
    QUERY_CANCELLED("Query cancelled", "Statement was cancelled before it completed"),
    DATABASE_ERROR("Database error", "General database operation error"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    CANCELLED("Cancelled", "Work was cancelled by request or shutdown"),
    VALIDATION_ERROR("Validation error", "Input validation or precondition violation"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** First match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isCancellation, CANCELLED);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    /** Exact SQLSTATE codes checked before the class prefix. */
    private static final Map<String, ErrorCategory> SQL_STATE_EXACT = Map.of(
            "42501", PERMISSION_ERROR,
            "42P01", UNDEFINED_OBJECT,
            "42704", UNDEFINED_OBJECT,
            "3F000", UNDEFINED_OBJECT,
            "25001", TRANSACTION_STATE_ERROR,
            "57014", QUERY_CANCELLED
    );

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "25", TRANSACTION_STATE_ERROR
    );

    /**
     * Classifies the throwable, looking through wrapper exceptions to the first
     * {@link SQLException} in the cause chain.
     */
    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        SQLException sqlEx = findSqlException(exception);
        if (sqlEx != null) {
            return categorizeSqlException(sqlEx);
        }
        for (Throwable t = exception; t != null; t = t.getCause()) {
            for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
                if (e.getKey().test(t)) {
                    return e.getValue();
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return APPLICATION_ERROR;
    }

    /**
     * One-line, log-safe description: {@code CATEGORY: root message}.
     */
    public static String describe(Throwable exception) {
        ErrorCategory category = categorize(exception);
        return category.name() + ": " + rootMessage(exception);
    }

    public static String rootMessage(Throwable exception) {
        if (exception == null) {
            return "unknown error";
        }
        Throwable t = exception;
        SQLException sqlEx = findSqlException(exception);
        if (sqlEx != null) {
            t = sqlEx;
        }
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg.trim();
    }

    private static SQLException findSqlException(Throwable exception) {
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof SQLException) {
                return (SQLException) t;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && !sqlState.isEmpty()) {
            ErrorCategory exact = SQL_STATE_EXACT.get(sqlState);
            if (exact != null) {
                return exact;
            }
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "timeout", "timed out")) return TIMEOUT_ERROR;
            if (containsAny(lower, "permission", "access denied")) return PERMISSION_ERROR;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static boolean isCancellation(Throwable t) {
        return t instanceof CancellationException || t instanceof InterruptedException;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || (t instanceof java.net.SocketException);
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof PreconditionViolationException
                || t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
