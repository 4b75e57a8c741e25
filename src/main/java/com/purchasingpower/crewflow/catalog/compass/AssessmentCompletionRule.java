package com.purchasingpower.crewflow.catalog.compass;

import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.crew.HookContext;
import com.purchasingpower.crewflow.crew.PostTransferRule;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands over to the transition plan once every dimension is recorded, after storing the
 * readiness score and level as the user's {@code assessment_results}.
 */
@Slf4j
public class AssessmentCompletionRule implements PostTransferRule {

    public static final String ASSESSMENT_RESULTS = "assessment_results";

    @Override
    public boolean shouldTransfer(HookContext context, String reply) {
        Map<String, Object> state = context.getContext()
                .readMap(ContextScope.USER, RecordAssessmentTool.ASSESSMENT_STATE);
        if (!AssessmentScoring.remainingDimensions(state).isEmpty()) {
            return false;
        }

        Map<String, Object> scores = new LinkedHashMap<>();
        Map<String, Object> findings = new LinkedHashMap<>();
        List<Number> values = new ArrayList<>();
        for (String dimension : AssessmentScoring.DIMENSIONS) {
            Map<?, ?> entry = (Map<?, ?>) state.get(dimension);
            if (entry.get("score") instanceof Number score) {
                values.add(score);
                scores.put(dimension, score);
            }
            findings.put(dimension, entry.get("findings"));
        }

        double readinessScore = AssessmentScoring.readinessScore(values);
        String readinessLevel = AssessmentScoring.classify(readinessScore);

        Map<String, Object> results = new LinkedHashMap<>();
        results.put("completed", true);
        results.put("dimensions", findings);
        results.put("scores", scores);
        results.put("readinessScore", readinessScore);
        results.put("readinessLevel", readinessLevel);
        results.put("completedAt", Instant.now().toString());
        context.getContext().write(ContextScope.USER, ASSESSMENT_RESULTS, results);

        log.info("Compass: assessment complete for conversation {}. Readiness {} ({})",
                context.getConversationId(), readinessScore, readinessLevel);
        return true;
    }
}
