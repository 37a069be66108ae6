package com.di.pgproof.apply;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "pgproof.store.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryAppliedChangeStore implements AppliedChangeStore {

    private final Map<String, AppliedChange> byRecommendation = new ConcurrentHashMap<>();

    @Override
    public void save(AppliedChange change) {
        if (change == null || change.getRecommendationId() == null) return;
        byRecommendation.put(change.getRecommendationId(), change);
    }

    @Override
    public Optional<AppliedChange> find(String recommendationId) {
        return recommendationId == null ? Optional.empty() : Optional.ofNullable(byRecommendation.get(recommendationId));
    }

    @Override
    public List<AppliedChange> findAll() {
        return byRecommendation.values().stream()
                .sorted(Comparator.comparing(AppliedChange::getAppliedAt).reversed())
                .collect(Collectors.toList());
    }
}
