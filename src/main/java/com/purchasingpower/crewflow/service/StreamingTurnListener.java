package com.purchasingpower.crewflow.service;

import com.purchasingpower.crewflow.agent.TurnListener;
import com.purchasingpower.crewflow.transition.CrewTransition;
import lombok.RequiredArgsConstructor;

/**
 * Forwards turn output to the conversation's SSE stream.
 */
@RequiredArgsConstructor
public class StreamingTurnListener implements TurnListener {

    private final ChatStreamService chatStreamService;
    private final String conversationId;

    @Override
    public void onToken(String token) {
        chatStreamService.sendPartialResponse(conversationId, token);
    }

    @Override
    public void onToolCall(String toolName, String status) {
        chatStreamService.sendToolExecution(conversationId, toolName, status);
    }

    @Override
    public void onTransition(CrewTransition transition) {
        chatStreamService.sendTransition(conversationId, transition);
    }
}
