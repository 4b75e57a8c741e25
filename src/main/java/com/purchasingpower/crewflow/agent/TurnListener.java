package com.purchasingpower.crewflow.agent;

import com.purchasingpower.crewflow.transition.CrewTransition;

/**
 * Receives what a turn produces while it runs.
 */
public interface TurnListener {

    TurnListener NO_OP = token -> {
    };

    /**
     * A chunk of reply text, in order.
     */
    void onToken(String token);

    default void onToolCall(String toolName, String status) {
    }

    default void onTransition(CrewTransition transition) {
    }
}
