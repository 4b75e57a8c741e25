package com.purchasingpower.crewflow.exception;

/**
 * The LLM provider could not be reached or answered with something unusable.
 */
public class LLMProviderException extends CrewFlowException {

    public LLMProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
