package com.purchasingpower.crewflow.transition;

import lombok.Value;

import java.time.Instant;

/**
 * One applied (or pending) move of a conversation from one crew to another.
 */
@Value
public class CrewTransition {

    String fromCrew;

    String toCrew;

    TransferPhase phase;

    Instant timestamp;

    public static CrewTransition of(String fromCrew, String toCrew, TransferPhase phase) {
        return new CrewTransition(fromCrew, toCrew, phase, Instant.now());
    }
}
