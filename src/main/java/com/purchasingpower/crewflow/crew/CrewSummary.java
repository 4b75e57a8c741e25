package com.purchasingpower.crewflow.crew;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only description of a loaded crew, for listing and editor tooling.
 */
@Value
@Builder
public class CrewSummary {

    String name;
    String displayName;
    String description;
    List<String> fields;
    ExtractionMode extractionMode;
    String transitionTo;
    @JsonProperty("isDefault")
    boolean isDefault;
    boolean oneShot;
    List<String> tools;
    boolean knowledgeBaseEnabled;
    String model;
    CrewOrigin origin;
    long snapshotVersion;

    public static CrewSummary from(CrewDefinition crew, long snapshotVersion) {
        return CrewSummary.builder()
                .name(crew.getName())
                .displayName(crew.getDisplayName())
                .description(crew.getDescription())
                .fields(crew.getFieldsToCollect().stream().map(FieldDefinition::getName).toList())
                .extractionMode(crew.getExtractionMode())
                .transitionTo(crew.getTransitionTo())
                .isDefault(crew.isDefault())
                .oneShot(crew.isOneShot())
                .tools(crew.getTools().stream().map(tool -> tool.getName()).toList())
                .knowledgeBaseEnabled(crew.getKnowledgeBase() != null && crew.getKnowledgeBase().isEnabled())
                .model(crew.getModel())
                .origin(crew.getOrigin())
                .snapshotVersion(snapshotVersion)
                .build();
    }
}
