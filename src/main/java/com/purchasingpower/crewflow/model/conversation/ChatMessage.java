package com.purchasingpower.crewflow.model.conversation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Detached view of one conversation message, safe to use outside a transaction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private String role;
    private String content;

    /** Crew that produced an assistant message, or was active for a user message. */
    private String crewName;

    private LocalDateTime timestamp;

    public static ChatMessage user(String content) {
        return ChatMessage.builder().role(USER).content(content).timestamp(LocalDateTime.now()).build();
    }

    public static ChatMessage assistant(String content, String crewName) {
        return ChatMessage.builder().role(ASSISTANT).content(content).crewName(crewName)
                .timestamp(LocalDateTime.now()).build();
    }

    public boolean isUser() {
        return USER.equals(role);
    }

    public boolean isAssistant() {
        return ASSISTANT.equals(role);
    }
}
