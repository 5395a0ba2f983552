package dev.maplecms.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque key-value metadata attached to an article.
 * Stored in PostgreSQL as JSONB and in H2 as a JSON string; the content is never interpreted.
 */
@Slf4j
public class Metadata {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>(){};

    private final Map<String, Object> values;

    public Metadata() {
        this.values = new LinkedHashMap<>();
    }

    public Metadata(Map<String, Object> values) {
        this.values = values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>();
    }

    public static Metadata empty() {
        return new Metadata();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Deserialize from a JSON object string. Malformed or non-object input yields empty metadata.
     */
    public static Metadata fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new Metadata();
        }
        try {
            return new Metadata(MAPPER.readValue(json, MAP_TYPE_REF));
        } catch (JsonProcessingException e) {
            log.warn("Stored metadata is not a JSON object, treating as empty: {}", e.getOriginalMessage());
            return new Metadata();
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("error.invalid_metadata", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Metadata)) return false;
        return Objects.equals(values, ((Metadata) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
