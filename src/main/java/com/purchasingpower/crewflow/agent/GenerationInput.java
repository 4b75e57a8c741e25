package com.purchasingpower.crewflow.agent;

import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.HookContext;
import com.purchasingpower.crewflow.model.conversation.ChatMessage;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;

/**
 * What one crew generation needs: the crew, its hook context and the transcript so far.
 */
@Value
@Builder(toBuilder = true)
public class GenerationInput {

    CrewDefinition crew;

    HookContext hookContext;

    /** Conversation history including the inbound user message. */
    List<ChatMessage> history;

    @Builder.Default
    boolean knowledgeBaseEnabled = true;

    /** Persists explicit field updates made by tools. */
    BiConsumer<String, Object> fieldWriter;

    /**
     * Consulted before tool calls run; may block. False stops the generation as cancelled.
     * Null lets tools run at once.
     */
    BooleanSupplier toolGate;
}
