package com.purchasingpower.crewflow.model.llm;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One message of the transcript sent to the provider: conversation history plus the
 * tool exchanges of the current turn.
 */
@Value
@Builder
public class ProviderMessage {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    String role;

    String content;

    @Builder.Default
    List<ToolCallRequest> toolCalls = List.of();

    /** Set on tool result messages. */
    String toolName;

    String toolCallId;

    public static ProviderMessage of(String role, String content) {
        return ProviderMessage.builder().role(role).content(content).build();
    }

    public static ProviderMessage assistantToolCalls(String content, List<ToolCallRequest> toolCalls) {
        return ProviderMessage.builder().role(ASSISTANT).content(content).toolCalls(List.copyOf(toolCalls)).build();
    }

    public static ProviderMessage toolResult(ToolCallRequest call, String payloadJson) {
        return ProviderMessage.builder()
                .role(TOOL)
                .content(payloadJson)
                .toolName(call.getName())
                .toolCallId(call.getId())
                .build();
    }
}
