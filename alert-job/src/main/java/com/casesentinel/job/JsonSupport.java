package com.casesentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;

/**
 * Shared Jackson mapper for HTTP responses and JSON columns.
 */
final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private JsonSupport() {
        // utility class — not instantiable
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }

    static String writeStringList(List<String> values) {
        try {
            return MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize list: " + e.getMessage(), e);
        }
    }

    static List<String> readStringList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed JSON list: " + e.getMessage(), e);
        }
    }
}
