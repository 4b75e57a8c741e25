package com.purchasingpower.crewflow.crew;

import java.util.List;

/**
 * Source of code-defined crews for one agent. Implementations are Spring beans and are
 * picked up by the crew registry.
 */
public interface AgentCrewProvider {

    String getAgentName();

    List<CrewDefinition> getCrews();
}
