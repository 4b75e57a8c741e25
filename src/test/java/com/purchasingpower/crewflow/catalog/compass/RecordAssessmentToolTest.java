package com.purchasingpower.crewflow.catalog.compass;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.agent.ToolResult;
import com.purchasingpower.crewflow.agent.impl.ToolContextImpl;
import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.context.ScopedContext;
import com.purchasingpower.crewflow.context.impl.InMemoryContextStore;
import com.purchasingpower.crewflow.crew.HookContext;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordAssessmentToolTest {

    private final RecordAssessmentTool tool = new RecordAssessmentTool();
    private ScopedContext context;
    private ToolContextImpl toolContext;

    @BeforeEach
    void setUp() {
        context = new ScopedContext(new InMemoryContextStore(new ObjectMapper()), "c1", "u1");
        toolContext = ToolContextImpl.builder()
                .agentName(CompassCrewProvider.AGENT_NAME)
                .conversationId("c1")
                .userId("u1")
                .crewName("self_assessment")
                .context(context)
                .build();
    }

    private ToolResult record(String dimension, Object score) {
        return tool.execute(Map.of("dimension", dimension, "findings", "Summary of " + dimension,
                "strength_score", score), toolContext);
    }

    @Test
    @DisplayName("Three sequential recordings accumulate in the user's assessment state")
    void recordingsMerge() {
        // When
        ToolResult first = record("transferable_skills", 8);
        ToolResult second = record("gaps", "6");
        ToolResult third = record("motivation", 7.5);

        // Then
        assertThat(first.getData()).isEqualTo(Map.of(
                "status", "recorded",
                "next_dimension", "gaps",
                "next_question", AssessmentScoring.questionFor("gaps"),
                "remaining_count", 2));
        assertThat(second.isSuccess()).isTrue();
        assertThat(third.getData()).asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("status", "all_complete");
        assertThat(context.readMap(ContextScope.USER, RecordAssessmentTool.ASSESSMENT_STATE))
                .containsOnlyKeys("transferable_skills", "gaps", "motivation");
    }

    @Test
    @DisplayName("Completion rule stores the readiness result once every dimension is recorded")
    void completionRuleStoresResults() {
        // Given
        record("transferable_skills", 8);
        record("gaps", 6);
        AssessmentCompletionRule rule = new AssessmentCompletionRule();
        HookContext hook = HookContext.builder()
                .agentName(CompassCrewProvider.AGENT_NAME).conversationId("c1").userId("u1")
                .collectedFields(Map.of()).context(context).build();

        // Then: not yet
        assertThat(rule.shouldTransfer(hook, "reply")).isFalse();
        assertThat(context.read(ContextScope.USER, AssessmentCompletionRule.ASSESSMENT_RESULTS)).isEmpty();

        // When the last dimension arrives
        record("motivation", 7);

        // Then
        assertThat(rule.shouldTransfer(hook, "reply")).isTrue();
        Map<String, Object> results = context.readMap(ContextScope.USER, AssessmentCompletionRule.ASSESSMENT_RESULTS);
        assertThat(results).containsEntry("completed", true)
                .containsEntry("readinessScore", 7.0)
                .containsEntry("readinessLevel", AssessmentScoring.MODERATE);
    }

    @Test
    @DisplayName("Unknown dimension and out-of-range score are rejected without writing")
    void invalidArgumentsRejected() {
        ToolResult unknown = record("luck", 5);
        ToolResult tooHigh = record("gaps", 11);
        ToolResult notANumber = record("gaps", "high");

        assertThat(unknown.isSuccess()).isFalse();
        assertThat(unknown.getMessage()).contains("dimension must be one of");
        assertThat(tooHigh.getMessage()).contains("between 1 and 10");
        assertThat(notANumber.isSuccess()).isFalse();
        assertThat(context.read(ContextScope.USER, RecordAssessmentTool.ASSESSMENT_STATE)).isEmpty();
    }
}
