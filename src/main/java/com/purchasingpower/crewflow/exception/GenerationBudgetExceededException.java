package com.purchasingpower.crewflow.exception;

import lombok.Getter;

@Getter
public class GenerationBudgetExceededException extends CrewFlowException {

    private final String crewName;
    private final int maxRoundTrips;

    public GenerationBudgetExceededException(String crewName, int maxRoundTrips) {
        super("Crew '" + crewName + "' exceeded " + maxRoundTrips + " tool-call round trips");
        this.crewName = crewName;
        this.maxRoundTrips = maxRoundTrips;
    }
}
