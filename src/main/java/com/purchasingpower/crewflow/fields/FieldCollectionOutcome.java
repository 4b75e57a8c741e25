package com.purchasingpower.crewflow.fields;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of running the field collection contract for one turn.
 */
@Value
@Builder
public class FieldCollectionOutcome {

    /** Only the fields whose value changed this turn; what must be persisted. */
    Map<String, Object> updates;

    /** Collected fields after the merge. */
    Map<String, Object> collectedFields;

    List<String> exposedFields;

    List<String> remainingFields;

    public static FieldCollectionOutcome unchanged(Map<String, Object> collectedFields, List<String> remainingFields) {
        return FieldCollectionOutcome.builder()
                .updates(Map.of())
                .collectedFields(collectedFields)
                .exposedFields(List.of())
                .remainingFields(remainingFields)
                .build();
    }
}
