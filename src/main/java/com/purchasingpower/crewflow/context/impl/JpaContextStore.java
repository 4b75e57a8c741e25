package com.purchasingpower.crewflow.context.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.context.ContextStore;
import com.purchasingpower.crewflow.exception.ContextStoreException;
import com.purchasingpower.crewflow.model.context.ContextEntry;
import com.purchasingpower.crewflow.repository.ContextEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Context store backed by the CONTEXT_ENTRIES table.
 *
 * Each operation runs in its own transaction and touches one row. There is no version
 * column, so concurrent merges of the same entry are last-writer-wins.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.crew.context-store", havingValue = "jpa", matchIfMissing = true)
public class JpaContextStore implements ContextStore {

    private final ContextEntryRepository repository;
    private final ContextValueCodec codec;

    public JpaContextStore(ContextEntryRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.codec = new ContextValueCodec(objectMapper);
    }

    @Override
    @Transactional
    public void write(ContextScope scope, String ownerId, String key, Object value) {
        validate(scope, ownerId, key);
        String json = codec.encode(scope, key, value);
        try {
            upsert(scope, ownerId, key, json);
            log.debug("Context write {}:{}:{}", scope, ownerId, key);
        } catch (DataAccessException e) {
            throw new ContextStoreException(scope, key, "Failed to write context entry: " + key, e);
        }
    }

    @Override
    @Transactional
    public Map<String, Object> merge(ContextScope scope, String ownerId, String key, Map<String, ?> partial) {
        validate(scope, ownerId, key);
        try {
            Optional<ContextEntry> existing = repository.findByScopeAndOwnerIdAndContextKey(scope, ownerId, key);
            Object current = existing.map(entry -> codec.decode(scope, key, entry.getValueJson())).orElse(null);
            Map<String, Object> merged = codec.mergeInto(current, partial);
            upsert(scope, ownerId, key, codec.encode(scope, key, merged));
            log.debug("Context merge {}:{}:{} keys={}", scope, ownerId, key, partial == null ? 0 : partial.keySet());
            return merged;
        } catch (DataAccessException e) {
            throw new ContextStoreException(scope, key, "Failed to merge context entry: " + key, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Object> read(ContextScope scope, String ownerId, String key) {
        validate(scope, ownerId, key);
        try {
            return repository.findByScopeAndOwnerIdAndContextKey(scope, ownerId, key)
                    .map(entry -> codec.decode(scope, key, entry.getValueJson()));
        } catch (DataAccessException e) {
            throw new ContextStoreException(scope, key, "Failed to read context entry: " + key, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Object> readMultiple(ContextScope scope, String ownerId, Collection<String> keys) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (keys == null || keys.isEmpty()) {
            return result;
        }
        try {
            for (ContextEntry entry : repository.findByScopeAndOwnerIdAndContextKeyIn(scope, ownerId, keys)) {
                result.put(entry.getContextKey(), codec.decode(scope, entry.getContextKey(), entry.getValueJson()));
            }
            return result;
        } catch (DataAccessException e) {
            throw new ContextStoreException(scope, String.join(",", keys), "Failed to read context entries", e);
        }
    }

    @Override
    @Transactional
    public boolean delete(ContextScope scope, String ownerId, String key) {
        validate(scope, ownerId, key);
        try {
            return repository.deleteByScopeAndOwnerIdAndContextKey(scope, ownerId, key) > 0;
        } catch (DataAccessException e) {
            throw new ContextStoreException(scope, key, "Failed to delete context entry: " + key, e);
        }
    }

    private void upsert(ContextScope scope, String ownerId, String key, String json) {
        ContextEntry entry = repository.findByScopeAndOwnerIdAndContextKey(scope, ownerId, key)
                .orElseGet(() -> ContextEntry.builder()
                        .scope(scope)
                        .ownerId(ownerId)
                        .contextKey(key)
                        .build());
        entry.setValueJson(json);
        repository.save(entry);
    }

    private void validate(ContextScope scope, String ownerId, String key) {
        Preconditions.checkNotNull(scope, "Scope cannot be null");
        Preconditions.checkNotNull(ownerId, "Owner id cannot be null");
        Preconditions.checkArgument(key != null && !key.isBlank(), "Key cannot be empty");
    }
}
