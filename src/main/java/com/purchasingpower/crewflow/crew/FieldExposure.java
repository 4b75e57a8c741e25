package com.purchasingpower.crewflow.crew;

import java.util.List;
import java.util.Map;

/**
 * Decides which of a crew's fields the extractor may fill this turn.
 *
 * <p>Must be deterministic in {@code collectedFields}. Returned fields that are already
 * collected are dropped unless they are marked {@link FieldDefinition#isReevaluate()}.
 */
@FunctionalInterface
public interface FieldExposure {

    List<FieldDefinition> exposedFields(List<FieldDefinition> fieldsToCollect, Map<String, Object> collectedFields);
}
