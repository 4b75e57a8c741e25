package com.purchasingpower.crewflow.crew;

import com.purchasingpower.crewflow.exception.CrewConfigurationException;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for an agent's crew graph.
 */
public final class CrewGraphValidator {

    private CrewGraphValidator() {
    }

    /**
     * @return the name of the single default crew
     * @throws CrewConfigurationException if the graph is not loadable
     */
    public static String validate(String agentName, Collection<CrewDefinition> crews) {
        if (crews == null || crews.isEmpty()) {
            throw new CrewConfigurationException(agentName, "Agent '" + agentName + "' has no crews");
        }

        Set<String> names = new HashSet<>();
        for (CrewDefinition crew : crews) {
            if (crew.getName() == null || crew.getName().isBlank()) {
                throw new CrewConfigurationException(agentName, "Crew without a name in agent '" + agentName + "'");
            }
            if (!names.add(crew.getName())) {
                throw new CrewConfigurationException(agentName, crew.getName(),
                        "Duplicate crew name '" + crew.getName() + "'");
            }
            validateFields(agentName, crew);
        }

        List<String> defaults = crews.stream().filter(CrewDefinition::isDefault).map(CrewDefinition::getName).toList();
        if (defaults.size() != 1) {
            throw new CrewConfigurationException(agentName,
                    "Agent '" + agentName + "' must have exactly one default crew, found " + defaults);
        }

        for (CrewDefinition crew : crews) {
            if (crew.getTransitionTo() != null && !names.contains(crew.getTransitionTo())) {
                throw new CrewConfigurationException(agentName, crew.getName(),
                        "Crew '" + crew.getName() + "' transitions to unknown crew '" + crew.getTransitionTo() + "'");
            }
            if (crew.isOneShot() && crew.isTerminal()) {
                throw new CrewConfigurationException(agentName, crew.getName(),
                        "One-shot crew '" + crew.getName() + "' must declare transitionTo");
            }
        }
        return defaults.get(0);
    }

    private static void validateFields(String agentName, CrewDefinition crew) {
        Set<String> fieldNames = new HashSet<>();
        for (FieldDefinition field : crew.getFieldsToCollect()) {
            if (field.getName() == null || field.getName().isBlank()) {
                throw new CrewConfigurationException(agentName, crew.getName(),
                        "Crew '" + crew.getName() + "' declares a field without a name");
            }
            if (!fieldNames.add(field.getName())) {
                throw new CrewConfigurationException(agentName, crew.getName(),
                        "Crew '" + crew.getName() + "' declares field '" + field.getName() + "' twice");
            }
        }
    }
}
