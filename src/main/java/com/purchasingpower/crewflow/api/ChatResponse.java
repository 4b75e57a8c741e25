package com.purchasingpower.crewflow.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response from chat and admin endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private boolean success;
    private String conversationId;
    private String activeCrew;
    private String response;
    private String error;

    public static ChatResponse success(String conversationId, String activeCrew, String response) {
        return ChatResponse.builder()
            .success(true)
            .conversationId(conversationId)
            .activeCrew(activeCrew)
            .response(response)
            .build();
    }

    public static ChatResponse error(String error) {
        return ChatResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
