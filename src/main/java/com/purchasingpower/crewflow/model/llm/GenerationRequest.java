package com.purchasingpower.crewflow.model.llm;

import com.purchasingpower.crewflow.crew.KnowledgeBaseRef;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Input of one provider streaming call.
 */
@Value
@Builder(toBuilder = true)
public class GenerationRequest {

    String agentName;

    String conversationId;

    String crewName;

    /** Model override, or null for the adapter default. */
    String model;

    int maxTokens;

    /** Rendered system prompt: crew guidance plus runtime context. */
    String systemPrompt;

    Map<String, Object> runtimeContext;

    @Builder.Default
    List<ToolSchema> tools = List.of();

    @Builder.Default
    List<ProviderMessage> messages = List.of();

    /** Attached only when both the crew and the client allow it. */
    KnowledgeBaseRef knowledgeBase;
}
