package com.di.pgproof.sandbox;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Live sandboxes keyed by owning job id.
 */
@Component
public class SandboxRegistry {

    private final Map<String, TempSchema> byJobId = new ConcurrentHashMap<>();

    public void register(TempSchema schema) {
        byJobId.put(schema.getJobId(), schema);
    }

    public Optional<TempSchema> remove(String jobId) {
        return Optional.ofNullable(byJobId.remove(jobId));
    }

    public Optional<TempSchema> get(String jobId) {
        return Optional.ofNullable(byJobId.get(jobId));
    }

    public boolean ownsSchema(String schemaName) {
        return byJobId.values().stream().anyMatch(s -> s.getSchemaName().equals(schemaName));
    }

    public List<TempSchema> snapshot() {
        return byJobId.values().stream()
                .sorted(Comparator.comparing(TempSchema::getCreatedAt))
                .collect(Collectors.toList());
    }
}
