package com.purchasingpower.crewflow.crew;

import com.purchasingpower.crewflow.config.CrewProperties;
import com.purchasingpower.crewflow.crew.impl.CrewRegistryImpl;
import com.purchasingpower.crewflow.exception.CrewConfigurationException;
import com.purchasingpower.crewflow.exception.CrewFlowException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrewEditorServiceTest {

    private final List<String> saved = new ArrayList<>();
    private CrewRegistryImpl registry;
    private CrewEditorService editor;

    @BeforeEach
    void setUp() {
        DynamicCrewService dynamicCrews = new DynamicCrewService(null, null, null) {
            @Override
            public List<CrewDefinition> loadCrews(String agentName) {
                return List.of();
            }

            @Override
            public Set<String> agentNames() {
                return Set.of();
            }

            @Override
            public void save(String agentName, CrewDefinition crew) {
                saved.add(agentName + "/" + crew.getName());
            }
        };
        AgentCrewProvider provider = new AgentCrewProvider() {
            @Override
            public String getAgentName() {
                return "guide";
            }

            @Override
            public List<CrewDefinition> getCrews() {
                return List.of(
                        CrewDefinition.builder().name("welcome").guidance("v1").transitionTo("closing")
                                .isDefault(true).build(),
                        CrewDefinition.builder().name("closing").guidance("Bye").build());
            }
        };
        CrewProperties properties = new CrewProperties();
        properties.setEditorHistorySize(2);
        registry = new CrewRegistryImpl(List.of(provider), dynamicCrews);
        editor = new CrewEditorService(registry, dynamicCrews, properties);
    }

    @Test
    @DisplayName("Edit publishes the new definition and keeps the old one as a backup")
    void editKeepsBackup() {
        // When
        editor.update("guide", "welcome", crew -> crew.toBuilder().guidance("v2").build());

        // Then
        assertThat(registry.resolve("guide", "welcome").getGuidance()).isEqualTo("v2");
        assertThat(editor.backupCount("guide", "welcome")).isEqualTo(1);
        assertThat(saved).isEmpty();
    }

    @Test
    @DisplayName("Restore swaps the previous definition back in")
    void restorePrevious() {
        editor.update("guide", "welcome", crew -> crew.toBuilder().guidance("v2").build());

        editor.restorePrevious("guide", "welcome");

        assertThat(registry.resolve("guide", "welcome").getGuidance()).isEqualTo("v1");
        assertThat(editor.backupCount("guide", "welcome")).isZero();
    }

    @Test
    @DisplayName("Restore without a backup fails")
    void restoreWithoutBackup() {
        assertThatThrownBy(() -> editor.restorePrevious("guide", "welcome"))
                .isInstanceOf(CrewFlowException.class)
                .hasMessageContaining("No previous definition");
    }

    @Test
    @DisplayName("Invalid edit is rejected before any backup is taken")
    void invalidEditRejected() {
        assertThatThrownBy(() -> editor.update("guide", "welcome",
                crew -> crew.toBuilder().transitionTo("nowhere").build()))
                .isInstanceOf(CrewConfigurationException.class);

        assertThat(editor.backupCount("guide", "welcome")).isZero();
        assertThat(registry.resolve("guide", "welcome").getGuidance()).isEqualTo("v1");
    }

    @Test
    @DisplayName("Backups are bounded by the configured history size")
    void backupsAreBounded() {
        for (int version = 2; version <= 5; version++) {
            String guidance = "v" + version;
            editor.update("guide", "welcome", crew -> crew.toBuilder().guidance(guidance).build());
        }

        assertThat(editor.backupCount("guide", "welcome")).isEqualTo(2);
        editor.restorePrevious("guide", "welcome");
        assertThat(registry.resolve("guide", "welcome").getGuidance()).isEqualTo("v4");
    }

    @Test
    @DisplayName("Edited crew keeps its origin")
    void editKeepsOrigin() {
        editor.update("guide", "closing", crew -> crew.toBuilder().origin(CrewOrigin.DATABASE).build());

        assertThat(registry.resolve("guide", "closing").getOrigin()).isEqualTo(CrewOrigin.CODE);
        assertThat(saved).isEmpty();
    }
}
