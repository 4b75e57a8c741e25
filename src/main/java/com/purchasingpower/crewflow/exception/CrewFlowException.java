package com.purchasingpower.crewflow.exception;

/**
 * Base type for every failure raised by the crew orchestration core.
 */
public class CrewFlowException extends RuntimeException {

    public CrewFlowException(String message) {
        super(message);
    }

    public CrewFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
