package com.acme.enginesync.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class Jsons {
    private static final ObjectMapper M =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Jsons() {}

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + o.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parse JSON into the given type.
     *
     * @throws IllegalArgumentException if the text is not valid JSON or does not bind to {@code clazz}
     */
    public static <T> T fromJson(String json, Class<T> clazz) {
        if (json == null) {
            throw new IllegalArgumentException("JSON input is null");
        }
        try {
            return M.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Cannot parse " + clazz.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
