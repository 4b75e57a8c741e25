package com.purchasingpower.crewflow.api;

import com.purchasingpower.crewflow.transition.CrewTransition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * SSE event for chat streaming.
 *
 * Event types:
 * - CONNECTED: Initial connection established
 * - THINKING: Turn accepted and running
 * - TOOL: A crew tool is executing
 * - PARTIAL: Reply tokens
 * - TRANSITION: The active crew changed
 * - COMPLETE: Final reply
 * - ERROR: The turn failed; the conversation stays on its previous crew
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatEvent {

    private String conversationId;
    private EventType type;
    private String message;
    private String content;
    private String tool;
    private String crew;
    private String fromCrew;
    private String toCrew;
    private String phase;

    public enum EventType {
        CONNECTED,
        THINKING,
        TOOL,
        PARTIAL,
        TRANSITION,
        COMPLETE,
        ERROR
    }

    public static ChatEvent thinking(String conversationId, String message) {
        return ChatEvent.builder()
            .conversationId(conversationId)
            .type(EventType.THINKING)
            .message(message)
            .build();
    }

    public static ChatEvent tool(String conversationId, String toolName, String status) {
        return ChatEvent.builder()
            .conversationId(conversationId)
            .type(EventType.TOOL)
            .tool(toolName)
            .message(status)
            .build();
    }

    public static ChatEvent transition(String conversationId, CrewTransition transition) {
        return ChatEvent.builder()
            .conversationId(conversationId)
            .type(EventType.TRANSITION)
            .fromCrew(transition.getFromCrew())
            .toCrew(transition.getToCrew())
            .phase(transition.getPhase().name())
            .message(transition.getFromCrew() + " -> " + transition.getToCrew())
            .build();
    }

    public static ChatEvent complete(String conversationId, String crew, String response) {
        return ChatEvent.builder()
            .conversationId(conversationId)
            .type(EventType.COMPLETE)
            .crew(crew)
            .content(response)
            .build();
    }

    public static ChatEvent error(String conversationId, String error) {
        return ChatEvent.builder()
            .conversationId(conversationId)
            .type(EventType.ERROR)
            .message(error)
            .build();
    }
}
