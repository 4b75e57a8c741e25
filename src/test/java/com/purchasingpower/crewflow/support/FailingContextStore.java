package com.purchasingpower.crewflow.support;

import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.context.ContextStore;
import com.purchasingpower.crewflow.exception.ContextStoreException;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Context store whose every operation fails, as an unreachable backend would.
 */
public class FailingContextStore implements ContextStore {

    @Override
    public void write(ContextScope scope, String ownerId, String key, Object value) {
        throw failure(scope, key);
    }

    @Override
    public Map<String, Object> merge(ContextScope scope, String ownerId, String key, Map<String, ?> partial) {
        throw failure(scope, key);
    }

    @Override
    public Optional<Object> read(ContextScope scope, String ownerId, String key) {
        throw failure(scope, key);
    }

    @Override
    public Map<String, Object> readMultiple(ContextScope scope, String ownerId, Collection<String> keys) {
        throw failure(scope, null);
    }

    @Override
    public boolean delete(ContextScope scope, String ownerId, String key) {
        throw failure(scope, key);
    }

    private static ContextStoreException failure(ContextScope scope, String key) {
        return new ContextStoreException(scope, key, "Context store unavailable", null);
    }
}
