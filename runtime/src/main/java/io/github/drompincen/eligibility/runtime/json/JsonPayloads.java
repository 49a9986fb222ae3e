package io.github.drompincen.eligibility.runtime.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class JsonPayloads {

    private JsonPayloads() {}

    /** Serializes a prompt payload; falls back to {@code toString} if Jackson cannot. */
    public static String write(ObjectMapper objectMapper, Object payload) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return String.valueOf(payload);
        }
    }
}
