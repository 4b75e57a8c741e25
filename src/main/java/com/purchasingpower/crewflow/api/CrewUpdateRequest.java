package com.purchasingpower.crewflow.api;

import com.purchasingpower.crewflow.agent.Tool;
import com.purchasingpower.crewflow.agent.ToolRegistry;
import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.ExtractionMode;
import com.purchasingpower.crewflow.crew.FieldDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Edit of one crew. Absent (null) properties keep their current value; capability overrides
 * of code crews are always kept.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrewUpdateRequest {

    private String displayName;
    private String description;
    private String guidance;
    private List<FieldDefinition> fieldsToCollect;
    private ExtractionMode extractionMode;
    private String transitionTo;

    /**
     * Make the crew terminal. Takes precedence over transitionTo.
     */
    private boolean terminal;

    private Boolean oneShot;
    private List<String> tools;
    private String model;
    private Integer maxTokens;

    /**
     * @throws IllegalArgumentException if a tool name is not registered
     */
    public CrewDefinition applyTo(CrewDefinition current, ToolRegistry toolRegistry) {
        CrewDefinition.CrewDefinitionBuilder builder = current.toBuilder();
        if (displayName != null) {
            builder.displayName(displayName);
        }
        if (description != null) {
            builder.description(description);
        }
        if (guidance != null) {
            builder.guidance(guidance);
        }
        if (fieldsToCollect != null) {
            builder.clearFieldsToCollect().fieldsToCollect(fieldsToCollect);
        }
        if (extractionMode != null) {
            builder.extractionMode(extractionMode);
        }
        if (terminal) {
            builder.transitionTo(null);
        } else if (transitionTo != null) {
            builder.transitionTo(transitionTo);
        }
        if (oneShot != null) {
            builder.oneShot(oneShot);
        }
        if (tools != null) {
            List<Tool> resolved = new ArrayList<>();
            for (String name : tools) {
                resolved.add(toolRegistry.get(name)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown tool: " + name)));
            }
            builder.clearTools().tools(resolved);
        }
        if (model != null) {
            builder.model(model);
        }
        if (maxTokens != null) {
            builder.maxTokens(maxTokens);
        }
        return builder.build();
    }
}
