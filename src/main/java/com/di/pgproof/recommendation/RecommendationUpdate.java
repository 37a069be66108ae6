package com.di.pgproof.recommendation;

import lombok.Value;

import java.time.Instant;

/**
 * The apply-state fields a recommendation store must be able to update.
 */
@Value
public class RecommendationUpdate {
    boolean applied;
    Instant appliedAt;
    String status;

    public static RecommendationUpdate applied(Instant at) {
        return new RecommendationUpdate(true, at, Recommendation.STATUS_APPLIED);
    }

    public static RecommendationUpdate rolledBack() {
        return new RecommendationUpdate(false, null, Recommendation.STATUS_ROLLED_BACK);
    }
}
