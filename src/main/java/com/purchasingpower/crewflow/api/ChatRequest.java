package com.purchasingpower.crewflow.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    /**
     * Agent to talk to. Required for a new conversation; must match for an existing one.
     */
    private String agentName;

    /**
     * The user's message.
     */
    private String message;

    /**
     * Existing conversation ID (null for new conversation).
     */
    private String conversationId;

    /**
     * User ID. Owner of user-scope context entries.
     */
    private String userId;

    /**
     * Allow crews that declare a knowledge base to use it (default true).
     */
    private Boolean knowledgeBaseEnabled;

    /**
     * Crew to answer this message instead of the conversation's active crew (optional).
     * Unknown names fall back to the active crew.
     */
    private String overrideCrewMember;
}
