package com.purchasingpower.crewflow.service;

import com.purchasingpower.crewflow.model.conversation.ChatMessage;
import com.purchasingpower.crewflow.model.conversation.Conversation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of conversation state: active crew pointer, collected fields and history.
 */
public interface ConversationService {

    String ANONYMOUS_PREFIX = "anonymous:";

    /**
     * Owner of a conversation's user-scope context. A conversation without a user id gets an
     * owner of its own, so anonymous users never share user-scope entries.
     */
    static String ownerOf(String conversationId, String userId) {
        return userId != null && !userId.isBlank() ? userId : ANONYMOUS_PREFIX + conversationId;
    }

    /**
     * Create a conversation positioned on the agent's default crew.
     */
    Conversation startConversation(String conversationId, String userId, String agentName, String defaultCrewName);

    Optional<Conversation> getConversation(String conversationId);

    /**
     * Full message history, oldest first.
     */
    List<ChatMessage> getHistory(String conversationId);

    void addMessage(String conversationId, String role, String content, String crewName);

    /**
     * Overwrite the given fields and leave every other field untouched.
     *
     * @return collected fields after the merge
     */
    Map<String, Object> mergeCollectedFields(String conversationId, Map<String, Object> updates);

    /**
     * Move the active crew pointer. Called by the transition controller only.
     */
    void updateActiveCrew(String conversationId, String crewName);

    List<Conversation> getActiveConversations(String userId);

    void closeConversation(String conversationId);
}
