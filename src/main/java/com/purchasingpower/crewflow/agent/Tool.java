package com.purchasingpower.crewflow.agent;

import java.util.Map;

/**
 * A capability a crew exposes to the model.
 *
 * <p>The model sees the name, description and parameter schema; when it requests a call,
 * the generation loop resolves the tool by name and invokes {@link #execute}. A tool may
 * return a failure result or throw. Both outcomes are reported back to the model and never
 * abort the turn.
 *
 * <p>Example implementation:
 * <pre>
 * public class RecordAssessmentTool implements Tool {
 *     public String getName() { return "record_assessment"; }
 *
 *     public ToolResult execute(Map&lt;String, Object&gt; params, ToolContext context) {
 *         context.getContext().merge(ContextScope.USER, "assessment_state", Map.of(...));
 *         return ToolResult.success(Map.of("status", "recorded"), "Recorded");
 *     }
 * }
 * </pre>
 */
public interface Tool {

    /**
     * Unique name for this tool (e.g., "record_assessment", "update_field").
     * Published to the model with the {@code call_} prefix.
     */
    String getName();

    /**
     * Human-readable description for the model.
     * Explains what the tool does and when to use it.
     */
    String getDescription();

    /**
     * JSON schema of the tool's arguments object.
     *
     * @return JSON schema string
     */
    String getParameterSchema();

    /**
     * Execute this tool with the arguments supplied by the model.
     *
     * @param parameters Arguments from the model
     * @param context Execution context (conversation, crew, context store)
     * @return Tool execution result
     */
    ToolResult execute(Map<String, Object> parameters, ToolContext context);
}
