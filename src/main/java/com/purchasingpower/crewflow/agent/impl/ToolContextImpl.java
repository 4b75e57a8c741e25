package com.purchasingpower.crewflow.agent.impl;

import com.purchasingpower.crewflow.agent.ToolContext;
import com.purchasingpower.crewflow.context.ScopedContext;
import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Default implementation of ToolContext.
 */
@Data
@Builder
public class ToolContextImpl implements ToolContext {

    private String agentName;

    private String conversationId;

    private String userId;

    private String crewName;

    private ScopedContext context;

    @Builder.Default
    private Map<String, Object> collectedFields = new HashMap<>();

    /**
     * Persists explicit field updates; supplied by the dispatcher.
     */
    private BiConsumer<String, Object> fieldWriter;

    @Override
    public void updateField(String fieldName, Object value) {
        if (fieldWriter == null) {
            throw new IllegalStateException("Field updates are not available in this context");
        }
        fieldWriter.accept(fieldName, value);
        collectedFields.put(fieldName, value);
    }
}
