package com.purchasingpower.crewflow.catalog.compass;

import com.purchasingpower.crewflow.agent.Tool;
import com.purchasingpower.crewflow.agent.ToolContext;
import com.purchasingpower.crewflow.agent.ToolResult;
import com.purchasingpower.crewflow.context.ContextScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records one assessment dimension in the user's {@code assessment_state}.
 * Each call merges a single dimension key, so earlier dimensions are kept.
 */
@Slf4j
@Component
public class RecordAssessmentTool implements Tool {

    public static final String ASSESSMENT_STATE = "assessment_state";

    @Override
    public String getName() {
        return "record_assessment";
    }

    @Override
    public String getDescription() {
        return "Record the self-assessment for one dimension. Call after the user has shared their thoughts.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "dimension": {
                      "type": "string",
                      "enum": ["transferable_skills", "gaps", "motivation"],
                      "description": "The dimension being assessed"
                    },
                    "findings": {
                      "type": "string",
                      "description": "A 2-3 sentence summary of what the user shared for this dimension"
                    },
                    "strength_score": {
                      "type": "number",
                      "minimum": 1,
                      "maximum": 10,
                      "description": "Readiness score for this dimension (1-10)"
                    }
                  },
                  "required": ["dimension", "findings", "strength_score"]
                }
                """;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        Object dimensionParam = parameters.get("dimension");
        if (!(dimensionParam instanceof String dimension) || !AssessmentScoring.isDimension(dimension)) {
            return ToolResult.failure("dimension must be one of " + AssessmentScoring.DIMENSIONS);
        }
        Double score = toScore(parameters.get("strength_score"));
        if (score == null || score < 1 || score > 10) {
            return ToolResult.failure("strength_score must be a number between 1 and 10");
        }
        Object findings = parameters.get("findings");

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("score", score);
        entry.put("findings", findings != null ? findings.toString() : "");
        entry.put("recordedAt", Instant.now().toString());

        Map<String, Object> state = context.getContext()
                .merge(ContextScope.USER, ASSESSMENT_STATE, Map.of(dimension, entry));
        log.info("Compass: recorded {} (score {}) for conversation {}", dimension, score,
                context.getConversationId());

        List<String> remaining = AssessmentScoring.remainingDimensions(state);
        if (remaining.isEmpty()) {
            return ToolResult.success(Map.of(
                    "status", "all_complete",
                    "message", "All 3 dimensions recorded. The assessment is complete."), "Assessment complete");
        }
        return ToolResult.success(Map.of(
                "status", "recorded",
                "next_dimension", remaining.get(0),
                "next_question", AssessmentScoring.questionFor(remaining.get(0)),
                "remaining_count", remaining.size()), "Recorded " + dimension);
    }

    private static Double toScore(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
