package com.purchasingpower.crewflow.context;

import com.google.common.base.Preconditions;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * View of the {@link ContextStore} bound to one conversation and one user.
 *
 * This is what hooks, context builders and tools receive, so crew code addresses
 * entries by scope and key only and never sees owner ids.
 */
@Getter
public class ScopedContext {

    private final ContextStore store;
    private final String conversationId;
    private final String userId;

    public ScopedContext(ContextStore store, String conversationId, String userId) {
        Preconditions.checkNotNull(store, "Context store cannot be null");
        Preconditions.checkNotNull(conversationId, "Conversation id cannot be null");
        Preconditions.checkNotNull(userId, "User id cannot be null");
        this.store = store;
        this.conversationId = conversationId;
        this.userId = userId;
    }

    public void write(ContextScope scope, String key, Object value) {
        store.write(scope, ownerOf(scope), key, value);
    }

    public Map<String, Object> merge(ContextScope scope, String key, Map<String, ?> partial) {
        return store.merge(scope, ownerOf(scope), key, partial);
    }

    public Optional<Object> read(ContextScope scope, String key) {
        return store.read(scope, ownerOf(scope), key);
    }

    /**
     * Read an object entry. Absent or non-object values read as an empty map.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> readMap(ContextScope scope, String key) {
        return read(scope, key)
                .filter(Map.class::isInstance)
                .map(value -> (Map<String, Object>) value)
                .orElse(Collections.emptyMap());
    }

    public Map<String, Object> readMultiple(ContextScope scope, Collection<String> keys) {
        return store.readMultiple(scope, ownerOf(scope), keys);
    }

    public boolean delete(ContextScope scope, String key) {
        return store.delete(scope, ownerOf(scope), key);
    }

    private String ownerOf(ContextScope scope) {
        return scope == ContextScope.USER ? userId : conversationId;
    }
}
