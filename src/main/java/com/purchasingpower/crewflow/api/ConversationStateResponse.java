package com.purchasingpower.crewflow.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation state: where it stands in the crew graph and what has been collected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationStateResponse {

    private String conversationId;
    private String userId;
    private String agentName;
    private String activeCrew;
    private String status;
    private boolean turnInProgress;
    private boolean hasActiveStream;

    @Builder.Default
    private Map<String, Object> collectedFields = new LinkedHashMap<>();

    @Builder.Default
    private List<String> remainingFields = new ArrayList<>();

    private String createdAt;
    private String lastActivity;
}
