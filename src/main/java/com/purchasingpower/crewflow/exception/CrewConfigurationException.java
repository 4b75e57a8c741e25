package com.purchasingpower.crewflow.exception;

import lombok.Getter;

/**
 * Invalid crew graph: missing or duplicate default crew, dangling transitionTo,
 * or a terminal crew whose transfer hook fired.
 */
@Getter
public class CrewConfigurationException extends CrewFlowException {

    private final String agentName;
    private final String crewName;

    public CrewConfigurationException(String agentName, String crewName, String message) {
        super(message);
        this.agentName = agentName;
        this.crewName = crewName;
    }

    public CrewConfigurationException(String agentName, String message) {
        this(agentName, null, message);
    }
}
