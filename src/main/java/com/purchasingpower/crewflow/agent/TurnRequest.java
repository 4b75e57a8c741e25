package com.purchasingpower.crewflow.agent;

import lombok.Builder;
import lombok.Value;

/**
 * One inbound user message for an agent conversation.
 */
@Value
@Builder
public class TurnRequest {

    String agentName;

    String conversationId;

    String userId;

    String message;

    /** Crew that answers this turn instead of the active crew, when the agent has it. */
    String overrideCrewMember;

    @Builder.Default
    boolean knowledgeBaseEnabled = true;
}
