package com.purchasingpower.crewflow.crew;

import com.purchasingpower.crewflow.exception.CrewConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrewGraphValidatorTest {

    private static CrewDefinition crew(String name, String transitionTo, boolean isDefault) {
        return CrewDefinition.builder().name(name).guidance("Help.").transitionTo(transitionTo)
                .isDefault(isDefault).build();
    }

    @Test
    @DisplayName("Valid graph returns its single default crew")
    void validGraphReturnsDefault() {
        String defaultCrew = CrewGraphValidator.validate("agent", List.of(
                crew("intake", "coach", true),
                crew("coach", null, false)));

        assertThat(defaultCrew).isEqualTo("intake");
    }

    @Test
    @DisplayName("Two default crews are rejected")
    void rejectsTwoDefaults() {
        assertThatThrownBy(() -> CrewGraphValidator.validate("agent", List.of(
                crew("a", null, true),
                crew("b", null, true))))
                .isInstanceOf(CrewConfigurationException.class)
                .hasMessageContaining("exactly one default crew");
    }

    @Test
    @DisplayName("No default crew is rejected")
    void rejectsMissingDefault() {
        assertThatThrownBy(() -> CrewGraphValidator.validate("agent", List.of(crew("a", null, false))))
                .isInstanceOf(CrewConfigurationException.class);
    }

    @Test
    @DisplayName("Transition to an unknown crew is rejected")
    void rejectsDanglingTransition() {
        assertThatThrownBy(() -> CrewGraphValidator.validate("agent", List.of(
                crew("a", "missing", true))))
                .isInstanceOf(CrewConfigurationException.class)
                .hasMessageContaining("unknown crew 'missing'");
    }

    @Test
    @DisplayName("Duplicate crew names are rejected")
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> CrewGraphValidator.validate("agent", List.of(
                crew("a", null, true),
                crew("a", null, false))))
                .isInstanceOf(CrewConfigurationException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("One-shot crew without a target is rejected")
    void rejectsTerminalOneShot() {
        CrewDefinition oneShot = CrewDefinition.builder().name("a").isDefault(true).oneShot(true).build();

        assertThatThrownBy(() -> CrewGraphValidator.validate("agent", List.of(oneShot)))
                .isInstanceOf(CrewConfigurationException.class)
                .hasMessageContaining("must declare transitionTo");
    }

    @Test
    @DisplayName("Field declared twice in a crew is rejected")
    void rejectsDuplicateField() {
        CrewDefinition crew = CrewDefinition.builder().name("a").isDefault(true)
                .field(FieldDefinition.of("age", "Age"))
                .field(FieldDefinition.of("age", "Age again"))
                .build();

        assertThatThrownBy(() -> CrewGraphValidator.validate("agent", List.of(crew)))
                .isInstanceOf(CrewConfigurationException.class)
                .hasMessageContaining("twice");
    }

    @Test
    @DisplayName("Empty agent is rejected")
    void rejectsEmptyAgent() {
        assertThatThrownBy(() -> CrewGraphValidator.validate("agent", List.of()))
                .isInstanceOf(CrewConfigurationException.class)
                .hasMessageContaining("has no crews");
    }
}
