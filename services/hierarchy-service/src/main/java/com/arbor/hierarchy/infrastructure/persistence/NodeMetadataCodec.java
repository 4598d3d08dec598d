package com.arbor.hierarchy.infrastructure.persistence;

import com.arbor.hierarchy.domain.model.NodeMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON text form of {@link NodeMetadata} for the {@code metadata} column.
 */
public final class NodeMetadataCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private NodeMetadataCodec() {
        // utility class
    }

    /**
     * @throws MetadataSerializationException if the values cannot be written as JSON
     */
    public static String toJson(NodeMetadata metadata) {
        try {
            return MAPPER.writeValueAsString(metadata.values());
        } catch (JsonProcessingException e) {
            throw new MetadataSerializationException("Failed to serialize node metadata", e);
        }
    }

    /**
     * @throws MetadataSerializationException if the column does not hold a JSON object
     */
    public static NodeMetadata fromJson(String json) {
        if (json == null || json.isBlank()) {
            return NodeMetadata.empty();
        }
        try {
            Map<String, Object> values = MAPPER.readValue(json, MAP_TYPE);
            return NodeMetadata.of(values);
        } catch (JsonProcessingException e) {
            throw new MetadataSerializationException("Failed to deserialize node metadata", e);
        }
    }

    /**
     * Stored metadata could not be converted.
     */
    public static class MetadataSerializationException extends RuntimeException {
        public MetadataSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
