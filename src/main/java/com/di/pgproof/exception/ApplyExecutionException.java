package com.di.pgproof.exception;

/**
 * Apply or rollback failed while talking to the database. The message is normalized through
 * {@link ErrorCategory#describe(Throwable)}; the original failure is kept as the cause.
 */
public class ApplyExecutionException extends RuntimeException {

    private final String recommendationId;
    private final ErrorCategory category;

    public ApplyExecutionException(String operation, String recommendationId, Throwable cause) {
        super("Failed to " + operation + " recommendation " + recommendationId + ": " + ErrorCategory.describe(cause), cause);
        this.recommendationId = recommendationId;
        this.category = ErrorCategory.categorize(cause);
    }

    public String getRecommendationId() {
        return recommendationId;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
