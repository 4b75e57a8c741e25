package com.purchasingpower.crewflow.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.model.llm.ToolSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts tools into the schema form published to the model.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolSchemaFactory {

    public static final String TOOL_NAME_PREFIX = "call_";

    private final ObjectMapper objectMapper;

    public ToolSchema schemaOf(Tool tool) {
        return new ToolSchema(TOOL_NAME_PREFIX + tool.getName(), tool.getDescription(), parse(tool));
    }

    /**
     * Tool name as registered, given the name the model used.
     */
    public static String toolNameOf(String requestedName) {
        if (requestedName != null && requestedName.startsWith(TOOL_NAME_PREFIX)) {
            return requestedName.substring(TOOL_NAME_PREFIX.length());
        }
        return requestedName;
    }

    private JsonNode parse(Tool tool) {
        String schema = tool.getParameterSchema();
        if (schema == null || schema.isBlank()) {
            return objectMapper.createObjectNode().put("type", "object");
        }
        try {
            return objectMapper.readTree(schema);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool '" + tool.getName() + "' has an invalid parameter schema", e);
        }
    }
}
