package com.di.pgproof.recommendation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory recommendations. The generator that normally fills this lives outside the service;
 * {@link #save(Recommendation)} is how recommendations arrive in single-node mode and in tests.
 */
@Component
@ConditionalOnProperty(name = "pgproof.store.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryRecommendationStore implements RecommendationStore {

    private final Map<String, Recommendation> byId = new ConcurrentHashMap<>();

    public void save(Recommendation recommendation) {
        if (recommendation == null || recommendation.getId() == null) return;
        byId.put(recommendation.getId(), recommendation);
    }

    @Override
    public Optional<Recommendation> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public boolean update(String id, RecommendationUpdate update) {
        return byId.computeIfPresent(id, (k, existing) -> existing.toBuilder()
                .applied(update.isApplied())
                .appliedAt(update.getAppliedAt())
                .status(update.getStatus() != null ? update.getStatus() : existing.getStatus())
                .build()) != null;
    }
}
