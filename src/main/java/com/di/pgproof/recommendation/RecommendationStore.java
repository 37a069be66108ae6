package com.di.pgproof.recommendation;

import java.util.Optional;

public interface RecommendationStore {

    Optional<Recommendation> get(String id);

    /**
     * @return false if no recommendation has this id
     */
    boolean update(String id, RecommendationUpdate update);
}
