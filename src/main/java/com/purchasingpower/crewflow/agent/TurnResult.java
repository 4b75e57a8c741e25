package com.purchasingpower.crewflow.agent;

import com.purchasingpower.crewflow.transition.CrewTransition;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a completed or cancelled turn.
 */
@Value
@Builder
public class TurnResult {

    String conversationId;

    /** Crew that produced the reply. */
    String respondingCrew;

    /** Crew that will handle the next message. */
    String activeCrew;

    String reply;

    @Builder.Default
    List<CrewTransition> transitions = List.of();

    Map<String, Object> collectedFields;

    int toolCalls;

    boolean cancelled;

    long durationMs;
}
