package com.arbor.hierarchy.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-defined attributes of a node: a JSON-like map from string keys to scalars (string,
 * number, boolean, null), lists and nested maps of the same. The engine stores and returns it
 * but never reads it.
 */
public record NodeMetadata(Map<String, Object> values) {

    private static final NodeMetadata EMPTY = new NodeMetadata(Map.of());

    public NodeMetadata {
        if (values == null) {
            values = Map.of();
        }
        values.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("metadata keys must not be blank");
            }
            requireJsonLike(key, value);
        });
        // LinkedHashMap keeps insertion order and, unlike Map.copyOf, tolerates null values.
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static NodeMetadata empty() {
        return EMPTY;
    }

    public static NodeMetadata of(Map<String, Object> values) {
        return values == null || values.isEmpty() ? EMPTY : new NodeMetadata(values);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static void requireJsonLike(String key, Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean) {
            return;
        }
        if (value instanceof List<?> list) {
            list.forEach(item -> requireJsonLike(key, item));
            return;
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((nestedKey, nestedValue) -> {
                if (!(nestedKey instanceof String)) {
                    throw new IllegalArgumentException("metadata '%s' has a non-string nested key".formatted(key));
                }
                requireJsonLike(key, nestedValue);
            });
            return;
        }
        throw new IllegalArgumentException(
                "metadata '%s' holds unsupported type %s".formatted(key, value.getClass().getSimpleName()));
    }
}
