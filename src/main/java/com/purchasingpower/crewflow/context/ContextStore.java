package com.purchasingpower.crewflow.context;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Scoped key-value persistence shared across crews and, for user scope, across conversations.
 *
 * Values are JSON-like: maps, lists, strings, numbers and booleans. Every operation works on a
 * single (scope, owner, key) entry; nothing spans multiple keys. Concurrent writers to the same
 * entry are resolved last-writer-wins.
 *
 * Implementations raise {@link com.purchasingpower.crewflow.exception.ContextStoreException}
 * on I/O failure.
 */
public interface ContextStore {

    /**
     * Replace the value stored under the key.
     */
    void write(ContextScope scope, String ownerId, String key, Object value);

    /**
     * Shallow-union the partial object into the stored object. Later keys win on conflict.
     * A missing or non-object stored value is treated as an empty object.
     *
     * @return the merged object as now stored
     */
    Map<String, Object> merge(ContextScope scope, String ownerId, String key, Map<String, ?> partial);

    /**
     * Most recent committed value, or empty if the key was never written (or was deleted).
     */
    Optional<Object> read(ContextScope scope, String ownerId, String key);

    /**
     * Values for every requested key that exists. Missing keys are absent from the result.
     */
    Map<String, Object> readMultiple(ContextScope scope, String ownerId, Collection<String> keys);

    /**
     * @return true if an entry was removed
     */
    boolean delete(ContextScope scope, String ownerId, String key);
}
