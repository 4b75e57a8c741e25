package com.purchasingpower.crewflow.catalog.compass;

import com.purchasingpower.crewflow.agent.TurnListener;
import com.purchasingpower.crewflow.agent.TurnRequest;
import com.purchasingpower.crewflow.agent.TurnResult;
import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.context.ScopedContext;
import com.purchasingpower.crewflow.fields.ExtractionResult;
import com.purchasingpower.crewflow.model.llm.GenerationStep;
import com.purchasingpower.crewflow.model.llm.ProviderMessage;
import com.purchasingpower.crewflow.support.CrewFlowHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.purchasingpower.crewflow.support.ScriptedLLMProvider.call;
import static org.assertj.core.api.Assertions.assertThat;

class CompassFlowTest {

    private static final String CONVERSATION = "compass-1";

    private CrewFlowHarness harness;

    @BeforeEach
    void setUp() {
        harness = new CrewFlowHarness(List.of(
                new CompassCrewProvider(CrewFlowHarness.prompts(), new RecordAssessmentTool())));
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    @DisplayName("Intake hands over to the assessment as soon as the profile is complete")
    void intakeHandsOverWhenProfileComplete() {
        // Given the user gives name and role first, target industry later
        harness.getLlm().respondWith(request -> GenerationStep.completed("Reply from " + request.getCrewName()));
        harness.getExtractor().extracting(Map.of("seeker_name", "Maya", "current_role", "teacher"));
        TurnResult first = harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "I'm Maya, a teacher");

        // When
        harness.getExtractor().extracting(Map.of("target_industry", "tech"));
        TurnResult second = harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "I want to move into tech");

        // Then
        assertThat(first.getRespondingCrew()).isEqualTo("intake");
        assertThat(second.getRespondingCrew()).isEqualTo("self_assessment");
        Optional<Object> profile = harness.getContextStore().read(ContextScope.USER, "user-1",
                CompassCrewProvider.SEEKER_PROFILE);
        assertThat(profile).hasValueSatisfying(value -> assertThat(value.toString())
                .contains("Maya").contains("teacher").contains("tech"));
    }

    @Test
    @DisplayName("Full journey: assessment, report delivered once, then coaching")
    void fullJourney() {
        // Given a model that records one dimension per assessment turn
        scriptAssessment(8, 6, 7);

        // When
        TurnResult intake = harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "Maya, teacher, into tech");
        TurnResult gaps = harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "I'd need a bootcamp");
        TurnResult motivation = harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "I want more impact");
        TurnResult report = harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "Show me my plan");
        TurnResult coaching = harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "What should I learn first?");

        // Then
        assertThat(intake.getRespondingCrew()).isEqualTo("self_assessment");
        assertThat(intake.getToolCalls()).isEqualTo(1);
        assertThat(gaps.getActiveCrew()).isEqualTo("self_assessment");
        assertThat(motivation.getActiveCrew()).isEqualTo("transition_plan");
        assertThat(report.getRespondingCrew()).isEqualTo("transition_plan");
        assertThat(report.getActiveCrew()).isEqualTo("coach");
        assertThat(coaching.getRespondingCrew()).isEqualTo("coach");
        assertThat(coaching.getActiveCrew()).isEqualTo("coach");

        Map<String, Object> results = new ScopedContext(
                harness.getContextStore(), CONVERSATION, "user-1")
                .readMap(ContextScope.USER, AssessmentCompletionRule.ASSESSMENT_RESULTS);
        assertThat(results).containsEntry("readinessScore", 7.0)
                .containsEntry("readinessLevel", AssessmentScoring.MODERATE);
        assertThat(harness.getLlm().getRequests().get(harness.getLlm().getRequests().size() - 1)
                .getRuntimeContext()).containsKey("assessment");
    }

    @ParameterizedTest(name = "{0}, {1}, {2} -> {3} {4}")
    @CsvSource({
            "8, 7, 7.5, 7.5, strong",
            "8, 7, 7.4, 7.5, strong",
            "8, 7, 7.3, 7.4, moderate",
            "5, 5, 5, 5.0, moderate",
            "5, 5, 4.9, 5.0, moderate",
            "5, 5, 4.8, 4.9, challenging"
    })
    @DisplayName("Readiness is the rounded average of the three recorded scores, classified after rounding")
    void readinessBoundaries(double first, double second, double third, double expectedScore, String expectedLevel) {
        // Given
        scriptAssessment(first, second, third);

        // When three assessment turns each record one dimension
        harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "Maya, teacher, into tech");
        harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "I'd need a bootcamp");
        TurnResult last = harness.send(CompassCrewProvider.AGENT_NAME, CONVERSATION, "I want more impact");

        // Then the post-transfer read all three and stored the result
        assertThat(last.getActiveCrew()).isEqualTo("transition_plan");
        Map<String, Object> results = new ScopedContext(harness.getContextStore(), CONVERSATION, "user-1")
                .readMap(ContextScope.USER, AssessmentCompletionRule.ASSESSMENT_RESULTS);
        assertThat(results).containsEntry("readinessScore", expectedScore)
                .containsEntry("readinessLevel", expectedLevel);
        assertThat((Map<?, ?>) results.get("scores")).hasSize(3);
    }

    @Test
    @DisplayName("Users without an id never see each other's user-scope entries")
    void anonymousUsersAreIsolated() {
        // Given one anonymous user completes the intake
        harness.getExtractor().respondWith(request -> "alice-conv".equals(request.getConversationId())
                ? ExtractionResult.builder().extractedFields(Map.of(
                        "seeker_name", "Maya", "current_role", "teacher", "target_industry", "tech")).build()
                : ExtractionResult.empty(List.of()));
        TurnResult alice = harness.send(anonymous("alice-conv", "Maya, teacher, into tech"), TurnListener.NO_OP);

        // When another anonymous user starts
        TurnResult bob = harness.send(anonymous("bob-conv", "Hello"), TurnListener.NO_OP);

        // Then
        String aliceOwner = harness.getConversations().getConversation("alice-conv").orElseThrow().getUserId();
        String bobOwner = harness.getConversations().getConversation("bob-conv").orElseThrow().getUserId();
        assertThat(aliceOwner).isEqualTo("anonymous:alice-conv");
        assertThat(bobOwner).isEqualTo("anonymous:bob-conv");
        assertThat(alice.getRespondingCrew()).isEqualTo("self_assessment");
        assertThat(bob.getRespondingCrew()).isEqualTo("intake");
        assertThat(harness.getContextStore().read(ContextScope.USER, aliceOwner, CompassCrewProvider.SEEKER_PROFILE))
                .isPresent();
        assertThat(new ScopedContext(harness.getContextStore(), "bob-conv", bobOwner)
                .read(ContextScope.USER, CompassCrewProvider.SEEKER_PROFILE)).isEmpty();
    }

    private static TurnRequest anonymous(String conversationId, String message) {
        return TurnRequest.builder()
                .agentName(CompassCrewProvider.AGENT_NAME)
                .conversationId(conversationId)
                .message(message)
                .build();
    }

    /**
     * Intake completes on the first message; each self-assessment turn then records the next
     * dimension with the given score.
     */
    private void scriptAssessment(double... scores) {
        AtomicInteger recorded = new AtomicInteger();
        harness.getLlm().respondWith(request -> {
            boolean toolAlreadyRan = request.getMessages().stream()
                    .anyMatch(message -> ProviderMessage.TOOL.equals(message.getRole()));
            if ("self_assessment".equals(request.getCrewName()) && !toolAlreadyRan) {
                int index = recorded.getAndIncrement();
                return GenerationStep.toolCalls("", List.of(call("call_record_assessment", Map.of(
                        "dimension", AssessmentScoring.DIMENSIONS.get(index),
                        "findings", "Finding " + index,
                        "strength_score", scores[index]))));
            }
            return GenerationStep.completed("Reply from " + request.getCrewName());
        });
        harness.getExtractor().respondWith(request -> "intake".equals(request.getCrewName())
                ? ExtractionResult.builder().extractedFields(Map.of(
                        "seeker_name", "Maya", "current_role", "teacher", "target_industry", "tech")).build()
                : ExtractionResult.empty(List.of()));
    }
}
