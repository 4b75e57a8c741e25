package com.purchasingpower.crewflow.context.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.context.ContextStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local context store. Values are kept as JSON text so callers never share
 * mutable state with the store.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.crew.context-store", havingValue = "memory")
public class InMemoryContextStore implements ContextStore {

    private final ContextValueCodec codec;
    private final Map<EntryKey, String> entries = new ConcurrentHashMap<>();

    public InMemoryContextStore(ObjectMapper objectMapper) {
        this.codec = new ContextValueCodec(objectMapper);
        log.info("Using in-memory context store");
    }

    @Override
    public void write(ContextScope scope, String ownerId, String key, Object value) {
        EntryKey entryKey = EntryKey.of(scope, ownerId, key);
        entries.put(entryKey, codec.encode(scope, key, value));
        log.debug("Context write {}:{}:{}", scope, ownerId, key);
    }

    @Override
    public Map<String, Object> merge(ContextScope scope, String ownerId, String key, Map<String, ?> partial) {
        EntryKey entryKey = EntryKey.of(scope, ownerId, key);
        String stored = entries.compute(entryKey, (k, existing) ->
                codec.encode(scope, key, codec.mergeInto(codec.decode(scope, key, existing), partial)));
        @SuppressWarnings("unchecked")
        Map<String, Object> merged = (Map<String, Object>) codec.decode(scope, key, stored);
        return merged;
    }

    @Override
    public Optional<Object> read(ContextScope scope, String ownerId, String key) {
        return Optional.ofNullable(codec.decode(scope, key, entries.get(EntryKey.of(scope, ownerId, key))));
    }

    @Override
    public Map<String, Object> readMultiple(ContextScope scope, String ownerId, Collection<String> keys) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            read(scope, ownerId, key).ifPresent(value -> result.put(key, value));
        }
        return result;
    }

    @Override
    public boolean delete(ContextScope scope, String ownerId, String key) {
        return entries.remove(EntryKey.of(scope, ownerId, key)) != null;
    }

    private record EntryKey(ContextScope scope, String ownerId, String key) {

        static EntryKey of(ContextScope scope, String ownerId, String key) {
            Preconditions.checkNotNull(scope, "Scope cannot be null");
            Preconditions.checkNotNull(ownerId, "Owner id cannot be null");
            Preconditions.checkArgument(key != null && !key.isBlank(), "Key cannot be empty");
            return new EntryKey(scope, ownerId, key);
        }
    }
}
