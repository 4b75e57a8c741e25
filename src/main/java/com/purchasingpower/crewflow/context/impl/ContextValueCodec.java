package com.purchasingpower.crewflow.context.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.exception.ContextStoreException;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding shared by the store implementations, so both hand back detached,
 * normalized values (maps as LinkedHashMap, numbers as Integer/Long/Double).
 */
@RequiredArgsConstructor
class ContextValueCodec {

    private final ObjectMapper objectMapper;

    String encode(ContextScope scope, String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ContextStoreException(scope, key, "Context value is not JSON-serializable: " + key, e);
        }
    }

    Object decode(ContextScope scope, String key, String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new ContextStoreException(scope, key, "Stored context value is corrupt: " + key, e);
        }
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> mergeInto(Object existing, Map<String, ?> partial) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (existing instanceof Map<?, ?> existingMap) {
            merged.putAll((Map<String, Object>) existingMap);
        }
        if (partial != null) {
            merged.putAll(partial);
        }
        return merged;
    }
}
