package com.purchasingpower.crewflow.model.llm;

import lombok.Value;

import java.util.Map;

/**
 * A tool call requested by the model during generation.
 */
@Value
public class ToolCallRequest {

    String id;

    /** Name as requested by the model, possibly prefixed. */
    String name;

    Map<String, Object> arguments;
}
