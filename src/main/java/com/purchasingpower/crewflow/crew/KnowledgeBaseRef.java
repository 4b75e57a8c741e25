package com.purchasingpower.crewflow.crew;

import lombok.Value;

/**
 * Retrieval capability a crew may declare. Consulted by the provider adapter only.
 */
@Value
public class KnowledgeBaseRef {

    boolean enabled;

    String storeId;

    public static KnowledgeBaseRef of(String storeId) {
        return new KnowledgeBaseRef(true, storeId);
    }
}
