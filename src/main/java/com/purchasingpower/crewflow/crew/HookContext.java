package com.purchasingpower.crewflow.crew;

import com.purchasingpower.crewflow.context.ScopedContext;
import com.purchasingpower.crewflow.fields.FieldValues;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Everything a capability override may look at when it is evaluated:
 * the crew, the conversation's collected fields, and the scoped context store.
 */
@Value
@Builder
public class HookContext {

    String agentName;

    String conversationId;

    String userId;

    CrewDefinition crew;

    /**
     * Read-only view of the conversation's collected fields.
     */
    Map<String, Object> collectedFields;

    ScopedContext context;

    public Object field(String name) {
        return collectedFields.get(name);
    }

    public String fieldAsString(String name) {
        return FieldValues.asString(collectedFields.get(name));
    }

    public boolean hasField(String name) {
        return FieldValues.isCollected(collectedFields, name);
    }
}
