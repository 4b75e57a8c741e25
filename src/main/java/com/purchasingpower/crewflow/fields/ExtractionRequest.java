package com.purchasingpower.crewflow.fields;

import com.purchasingpower.crewflow.crew.ExtractionMode;
import com.purchasingpower.crewflow.crew.FieldDefinition;
import com.purchasingpower.crewflow.model.conversation.ChatMessage;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Input handed to the field extractor.
 */
@Value
@Builder
public class ExtractionRequest {

    String agentName;

    String conversationId;

    String crewName;

    ExtractionMode mode;

    /** History slice already cut to the crew's extraction mode. */
    List<ChatMessage> messages;

    /** Fields eligible for extraction this turn. */
    List<FieldDefinition> fields;

    /** This crew's already-collected fields; the extractor may report corrections for them. */
    Map<String, Object> collectedFields;
}
