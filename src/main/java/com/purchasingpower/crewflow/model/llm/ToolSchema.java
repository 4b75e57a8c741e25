package com.purchasingpower.crewflow.model.llm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Tool description published to the model.
 */
@Value
public class ToolSchema {

    /** Name as the model sees it (prefixed). */
    String name;

    String description;

    /** JSON schema of the arguments object. */
    JsonNode parameters;
}
