package com.purchasingpower.crewflow.context.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.repository.ContextEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class JpaContextStoreTest {

    @Autowired
    private ContextEntryRepository repository;

    private JpaContextStore store;

    @BeforeEach
    void setUp() {
        store = new JpaContextStore(repository, new ObjectMapper());
    }

    @Test
    @DisplayName("Write then read returns the stored value")
    void writeThenRead() {
        store.write(ContextScope.CONVERSATION, "c1", "onboarding_profile", Map.of("age", 21, "eligible", true));

        assertThat(store.read(ContextScope.CONVERSATION, "c1", "onboarding_profile"))
                .contains(Map.of("age", 21, "eligible", true));
        assertThat(store.read(ContextScope.CONVERSATION, "c2", "onboarding_profile")).isEmpty();
    }

    @Test
    @DisplayName("Second write replaces the row instead of adding one")
    void writeReplaces() {
        store.write(ContextScope.USER, "u1", "event_log", List.of("a"));
        store.write(ContextScope.USER, "u1", "event_log", List.of("a", "b"));

        assertThat(store.read(ContextScope.USER, "u1", "event_log")).contains(List.of("a", "b"));
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Merge unions objects across calls")
    void mergeUnions() {
        store.merge(ContextScope.USER, "u1", "assessment_state", Map.of("gaps", Map.of("score", 4)));
        Map<String, Object> merged = store.merge(ContextScope.USER, "u1", "assessment_state",
                Map.of("motivation", Map.of("score", 9)));

        assertThat(merged).containsOnlyKeys("gaps", "motivation");
        assertThat(store.readMultiple(ContextScope.USER, "u1", List.of("assessment_state", "missing")))
                .containsOnlyKeys("assessment_state");
    }

    @Test
    @DisplayName("Same key under different scopes are separate entries")
    void scopesAreSeparate() {
        store.write(ContextScope.USER, "same-id", "key", "user value");
        store.write(ContextScope.CONVERSATION, "same-id", "key", "conversation value");

        assertThat(store.read(ContextScope.USER, "same-id", "key")).contains("user value");
        assertThat(store.delete(ContextScope.CONVERSATION, "same-id", "key")).isTrue();
        assertThat(store.read(ContextScope.USER, "same-id", "key")).contains("user value");
    }
}
