package com.purchasingpower.crewflow.fields;

import java.util.Collection;
import java.util.Map;

/**
 * Emptiness rules for collected field values.
 */
public final class FieldValues {

    private FieldValues() {
    }

    /**
     * Null, blank strings, and empty collections or maps count as "not collected".
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    public static boolean isCollected(Map<String, Object> collectedFields, String fieldName) {
        return collectedFields != null && !isEmpty(collectedFields.get(fieldName));
    }

    public static String asString(Object value) {
        return isEmpty(value) ? null : value.toString().trim();
    }
}
