package com.purchasingpower.crewflow.crew;

import com.purchasingpower.crewflow.fields.FieldValues;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fallback behavior for crews that do not override a capability.
 */
public final class CrewDefaults {

    /** Every field, every turn (already-collected ones are filtered by the field collection service). */
    public static final FieldExposure ALL_FIELDS = (fields, collected) -> fields;

    public static final PreTransferRule NEVER_BEFORE_REPLY = context -> false;

    public static final PostTransferRule NEVER_AFTER_REPLY = (context, reply) -> false;

    public static final PostTransferRule AFTER_FIRST_REPLY = (context, reply) -> true;

    public static final ContextBuilder BASE_CONTEXT = CrewDefaults::baseContext;

    public static final MessageProcessor UNCHANGED_MESSAGES = new MessageProcessor() {
    };

    private CrewDefaults() {
    }

    /**
     * Context every crew receives: collected data, what is still missing, and a timestamp.
     * Crew-specific builders start from this map.
     */
    public static Map<String, Object> baseContext(HookContext context) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("crewName", context.getCrew().getName());
        result.put("displayName", context.getCrew().getDisplayName());
        result.put("collectedData", new LinkedHashMap<>(context.getCollectedFields()));
        result.put("remainingFields", remainingFields(context.getCrew(), context.getCollectedFields()));
        result.put("timestamp", Instant.now().toString());
        return result;
    }

    public static List<String> remainingFields(CrewDefinition crew, Map<String, Object> collectedFields) {
        return crew.getFieldsToCollect().stream()
                .map(FieldDefinition::getName)
                .filter(name -> !FieldValues.isCollected(collectedFields, name))
                .toList();
    }
}
