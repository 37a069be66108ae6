package com.di.pgproof.sql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON text columns (job results, audit details, table lists) for the JDBC stores.
 */
@Slf4j
@Component
public class JsonColumns {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonColumns(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String write(Object value) {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} to JSON: {}", value.getClass().getSimpleName(), e.getMessage());
            return "{\"serializeError\":\"" + (e.getMessage() != null ? e.getMessage().replace("\"", "'") : "") + "\"}";
        }
    }

    public Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column, keeping raw text: {}", e.getMessage());
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("raw", json);
            return raw;
        }
    }

    public List<String> readStringList(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return mapper.readValue(json, STRING_LIST_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON list column: {}", e.getMessage());
            return List.of();
        }
    }
}
