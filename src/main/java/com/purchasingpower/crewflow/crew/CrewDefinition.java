package com.purchasingpower.crewflow.crew;

import com.purchasingpower.crewflow.agent.Tool;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Immutable definition of one crew member: a named conversational state with its own
 * guidance, fields, tools and transition target.
 *
 * <p>Behavior is customized through the optional capability overrides. When an override is
 * absent, the matching {@link CrewDefaults} implementation applies. A new version of a crew
 * is a new instance (see {@code toBuilder()}); instances are never mutated, so a turn holding
 * a reference always sees one consistent definition.
 */
@Value
@Builder(toBuilder = true)
public class CrewDefinition {

    /** Unique within an agent. */
    String name;

    String displayName;

    String description;

    /** Prompt text. Passed to the model as-is. */
    String guidance;

    @Singular("field")
    List<FieldDefinition> fieldsToCollect;

    @Builder.Default
    ExtractionMode extractionMode = ExtractionMode.CONVERSATIONAL;

    @Singular
    List<Tool> tools;

    KnowledgeBaseRef knowledgeBase;

    /** Next crew, or null for a terminal crew. */
    String transitionTo;

    /** Entry crew of the agent; exactly one per agent. */
    boolean isDefault;

    /** Transfer right after the first delivered reply unless a post-transfer rule is supplied. */
    boolean oneShot;

    String model;

    @Builder.Default
    int maxTokens = 2048;

    FieldExposure fieldExposure;

    PreTransferRule preTransferRule;

    PostTransferRule postTransferRule;

    ContextBuilder contextBuilder;

    MessageProcessor messageProcessor;

    @Builder.Default
    CrewOrigin origin = CrewOrigin.CODE;

    public boolean isTerminal() {
        return transitionTo == null;
    }

    public String getDisplayName() {
        return displayName != null ? displayName : name;
    }

    public Optional<Tool> findTool(String toolName) {
        return tools.stream().filter(tool -> tool.getName().equals(toolName)).findFirst();
    }

    public FieldExposure effectiveFieldExposure() {
        return fieldExposure != null ? fieldExposure : CrewDefaults.ALL_FIELDS;
    }

    public PreTransferRule effectivePreTransferRule() {
        return preTransferRule != null ? preTransferRule : CrewDefaults.NEVER_BEFORE_REPLY;
    }

    public PostTransferRule effectivePostTransferRule() {
        if (postTransferRule != null) {
            return postTransferRule;
        }
        return oneShot ? CrewDefaults.AFTER_FIRST_REPLY : CrewDefaults.NEVER_AFTER_REPLY;
    }

    public ContextBuilder effectiveContextBuilder() {
        return contextBuilder != null ? contextBuilder : CrewDefaults.BASE_CONTEXT;
    }

    public MessageProcessor effectiveMessageProcessor() {
        return messageProcessor != null ? messageProcessor : CrewDefaults.UNCHANGED_MESSAGES;
    }
}
