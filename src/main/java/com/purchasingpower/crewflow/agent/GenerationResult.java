package com.purchasingpower.crewflow.agent;

import lombok.Value;

/**
 * Reply produced by one crew generation.
 */
@Value
public class GenerationResult {

    String crewName;

    String text;

    int toolCalls;

    /** True when generation stopped because the turn was cancelled. */
    boolean cancelled;
}
