package com.purchasingpower.crewflow.crew;

import java.util.List;
import java.util.Set;

/**
 * Maps agent names to their crews and the single default crew.
 *
 * <p>Each agent's table is published as an immutable {@link CrewSnapshot}. Readers take the
 * current snapshot; {@link #hotSwap} and {@link #reload} publish a new one atomically.
 */
public interface CrewRegistry {

    /**
     * Load (or return the already loaded) snapshot for an agent.
     *
     * @throws com.purchasingpower.crewflow.exception.CrewConfigurationException
     *         if there is not exactly one default crew or a transitionTo is dangling
     * @throws com.purchasingpower.crewflow.exception.CrewNotFoundException if the agent has no crews
     */
    CrewSnapshot load(String agentName);

    CrewDefinition resolve(String agentName, String crewName);

    /**
     * Replace exactly one crew's definition. Turns that already captured the previous
     * snapshot keep using it.
     *
     * @return the newly published snapshot
     */
    CrewSnapshot hotSwap(String agentName, String crewName, CrewDefinition newDefinition);

    /**
     * Rebuild an agent's snapshot from its sources. The current snapshot stays published if
     * the rebuilt graph is invalid.
     */
    CrewSnapshot reload(String agentName);

    List<CrewSummary> listCrew(String agentName);

    boolean hasCrew(String agentName, String crewName);

    Set<String> loadedAgents();

    Set<String> availableAgents();
}
