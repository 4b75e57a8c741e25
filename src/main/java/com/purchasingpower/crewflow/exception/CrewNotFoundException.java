package com.purchasingpower.crewflow.exception;

import lombok.Getter;

@Getter
public class CrewNotFoundException extends CrewFlowException {

    private final String agentName;
    private final String crewName;

    public CrewNotFoundException(String agentName, String crewName) {
        super(crewName == null
                ? "Unknown agent: " + agentName
                : "Crew '" + crewName + "' not found for agent '" + agentName + "'");
        this.agentName = agentName;
        this.crewName = crewName;
    }
}
