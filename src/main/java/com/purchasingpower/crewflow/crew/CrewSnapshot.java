package com.purchasingpower.crewflow.crew;

import com.purchasingpower.crewflow.exception.CrewConfigurationException;
import com.purchasingpower.crewflow.exception.CrewNotFoundException;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated crew table of one agent at one version.
 *
 * <p>A turn captures the current snapshot once and resolves every crew through it, so a hot
 * swap published mid-turn is only seen by turns that start afterwards. Swapping a crew
 * produces a new snapshot; this one is never modified.
 */
@Getter
public final class CrewSnapshot {

    private final String agentName;
    private final long version;
    private final Map<String, CrewDefinition> crews;
    private final String defaultCrewName;

    private CrewSnapshot(String agentName, long version, Map<String, CrewDefinition> crews, String defaultCrewName) {
        this.agentName = agentName;
        this.version = version;
        this.crews = crews;
        this.defaultCrewName = defaultCrewName;
    }

    /**
     * @throws CrewConfigurationException if the crews do not form a valid graph
     */
    public static CrewSnapshot of(String agentName, long version, Collection<CrewDefinition> crews) {
        String defaultCrew = CrewGraphValidator.validate(agentName, crews);
        Map<String, CrewDefinition> table = new LinkedHashMap<>();
        crews.forEach(crew -> table.put(crew.getName(), crew));
        return new CrewSnapshot(agentName, version, Collections.unmodifiableMap(table), defaultCrew);
    }

    public CrewDefinition resolve(String crewName) {
        CrewDefinition crew = crews.get(crewName);
        if (crew == null) {
            throw new CrewNotFoundException(agentName, crewName);
        }
        return crew;
    }

    public Optional<CrewDefinition> find(String crewName) {
        return Optional.ofNullable(crews.get(crewName));
    }

    public CrewDefinition getDefaultCrew() {
        return crews.get(defaultCrewName);
    }

    /**
     * Copy of this snapshot with one crew replaced.
     *
     * @throws CrewNotFoundException if the crew is not part of this agent
     * @throws CrewConfigurationException if the replacement breaks the graph
     */
    public CrewSnapshot withCrew(CrewDefinition replacement, long newVersion) {
        if (!crews.containsKey(replacement.getName())) {
            throw new CrewNotFoundException(agentName, replacement.getName());
        }
        Map<String, CrewDefinition> copy = new LinkedHashMap<>(crews);
        copy.put(replacement.getName(), replacement);
        return of(agentName, newVersion, copy.values());
    }
}
