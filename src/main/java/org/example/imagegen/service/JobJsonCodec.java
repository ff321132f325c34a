package org.example.imagegen.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.imagegen.model.LoraSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON TEXT columns of generation_jobs.
 */
@Component
public class JobJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(JobJsonCodec.class);

    private static final TypeReference<List<LoraSelection>> LORA_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JobJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public List<LoraSelection> readLoras(String json) {
        return read(json, LORA_LIST, List.of());
    }

    public List<String> readStrings(String json) {
        return read(json, STRING_LIST, List.of());
    }

    public Map<String, Object> readObjectMap(String json) {
        return read(json, OBJECT_MAP, Map.of());
    }

    private <T> T read(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            T value = objectMapper.readValue(json, type);
            return value == null ? fallback : value;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stored JSON column: {}", e.getOriginalMessage());
            return fallback;
        }
    }
}
