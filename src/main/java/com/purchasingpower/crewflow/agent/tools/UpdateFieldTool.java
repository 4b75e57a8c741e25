package com.purchasingpower.crewflow.agent.tools;

import com.purchasingpower.crewflow.agent.Tool;
import com.purchasingpower.crewflow.agent.ToolContext;
import com.purchasingpower.crewflow.agent.ToolResult;
import com.purchasingpower.crewflow.fields.FieldValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Lets a crew overwrite one collected field explicitly, e.g. after the user confirms a
 * corrected value.
 */
@Slf4j
@Component
public class UpdateFieldTool implements Tool {

    @Override
    public String getName() {
        return "update_field";
    }

    @Override
    public String getDescription() {
        return "Overwrite one collected field with a value the user explicitly confirmed.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "field_name": {"type": "string", "description": "Name of the field to update"},
                    "value": {"description": "New value of the field"}
                  },
                  "required": ["field_name", "value"]
                }
                """;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        Object fieldName = parameters.get("field_name");
        if (!(fieldName instanceof String name) || name.isBlank()) {
            return ToolResult.failure("field_name parameter is required");
        }
        Object value = parameters.get("value");
        if (FieldValues.isEmpty(value)) {
            return ToolResult.failure("value parameter is required; collected fields are never cleared");
        }

        Object previous = context.getCollectedFields().get(name);
        context.updateField(name, value);
        log.info("Field {} updated by crew {} (conversation {})", name, context.getCrewName(),
                context.getConversationId());

        return ToolResult.success(
                Map.of("field", name, "value", value, "replaced", previous != null),
                "Updated " + name);
    }
}
