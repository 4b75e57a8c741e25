package com.purchasingpower.crewflow.catalog.onboarding;

import com.purchasingpower.crewflow.agent.TurnResult;
import com.purchasingpower.crewflow.agent.tools.LogEventTool;
import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.crew.FieldDefinition;
import com.purchasingpower.crewflow.fields.ExtractionResult;
import com.purchasingpower.crewflow.model.llm.GenerationRequest;
import com.purchasingpower.crewflow.model.llm.GenerationStep;
import com.purchasingpower.crewflow.support.CrewFlowHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

class OnboardingFlowTest {

    private static final String CONVERSATION = "onboarding-1";

    private CrewFlowHarness harness;

    @BeforeEach
    void setUp() {
        harness = new CrewFlowHarness(List.of(
                new OnboardingCrewProvider(CrewFlowHarness.prompts(), new LogEventTool())));
        harness.getLlm().respondWith(request -> GenerationStep.completed("Reply from " + request.getCrewName()));
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private TurnResult send(String message, Map<String, Object> extracted) {
        harness.getExtractor().respondWith(request -> ExtractionResult.builder().extractedFields(extracted).build());
        return harness.send(OnboardingCrewProvider.AGENT_NAME, CONVERSATION, message);
    }

    private GenerationRequest lastRequest() {
        List<GenerationRequest> requests = harness.getLlm().getRequests();
        return requests.get(requests.size() - 1);
    }

    @Test
    @DisplayName("Customer under 16 stays on the entry crew and is told about the age requirement")
    void underageCustomerStays() {
        // When
        TurnResult result = send("I'm Sam and I'm 15", Map.of("user_name", "Sam", "age", 15));

        // Then
        assertThat(result.getRespondingCrew()).isEqualTo("entry_introduction");
        assertThat(result.getActiveCrew()).isEqualTo("entry_introduction");
        assertThat(lastRequest().getRuntimeContext())
                .containsEntry("eligibilityStatus", "Not eligible (under 16)");
        assertThat(harness.getContextStore().read(ContextScope.CONVERSATION, CONVERSATION,
                OnboardingCrewProvider.ONBOARDING_PROFILE)).isEmpty();
    }

    @Test
    @DisplayName("Eligible customer moves to the financial profile in the same turn")
    void eligibleCustomerMovesOn() {
        TurnResult result = send("Ada, 25 years old", Map.of("user_name", "Ada", "age", "25 years"));

        assertThat(result.getRespondingCrew()).isEqualTo("profile_enrichment");
        assertThat(harness.getContextStore().read(ContextScope.CONVERSATION, CONVERSATION,
                OnboardingCrewProvider.ONBOARDING_PROFILE))
                .hasValueSatisfying(profile -> assertThat(profile.toString()).contains("eligibleForOnboarding=true"));
        assertThat(lastRequest().getRuntimeContext()).containsEntry("customerName", "Ada");
    }

    @Test
    @DisplayName("Profile questions come one at a time, then identity verification takes over")
    void profileThenVerification() {
        // Given an eligible customer
        send("Ada, 25", Map.of("user_name", "Ada", "age", 25));

        // When the profile is answered field by field
        TurnResult status = send("I'm a student", Map.of("employment_status", "student"));
        List<String> askedForStatus = harness.getExtractor().getRequests()
                .get(harness.getExtractor().getRequests().size() - 1)
                .getFields().stream().map(FieldDefinition::getName).toList();
        send("My parents", Map.of("primary_income_source", "family support"));
        send("About 3000", Map.of("monthly_income_range", "up to 5,000"));
        TurnResult usage = send("Mostly savings", Map.of("expected_account_usage", "savings"));

        // Then
        assertThat(askedForStatus).containsExactly("employment_status");
        assertThat(status.getRespondingCrew()).isEqualTo("profile_enrichment");
        assertThat(usage.getRespondingCrew()).isEqualTo("identity_verification");
    }

    @Test
    @DisplayName("Verification completes only with a six-digit code")
    void verificationNeedsSixDigits() {
        // Given the conversation is on identity verification
        harness.getConversations().startConversation(CONVERSATION, "user-1", OnboardingCrewProvider.AGENT_NAME,
                "identity_verification");

        // When
        TurnResult shortCode = send("+1 555 0100, code 12345",
                Map.of("phone_number", "+15550100", "otp_code", "12345"));
        TurnResult fullCode = send("Sorry, it's 123456", Map.of("otp_code", "123456"));

        // Then
        assertThat(shortCode.getRespondingCrew()).isEqualTo("identity_verification");
        assertThat(fullCode.getRespondingCrew()).isEqualTo("completion");
        assertThat(harness.getConversations().collectedFields(CONVERSATION)).containsEntry("otp_code", "123456");
    }

    @Test
    @DisplayName("Age is read from numbers and from text that starts with a number")
    void parseAge() {
        assertThat(OnboardingCrewProvider.parseAge(34)).isEqualTo(OptionalInt.of(34));
        assertThat(OnboardingCrewProvider.parseAge("25 years")).isEqualTo(OptionalInt.of(25));
        assertThat(OnboardingCrewProvider.parseAge("twenty")).isEmpty();
        assertThat(OnboardingCrewProvider.parseAge(null)).isEmpty();
    }
}
