package com.purchasingpower.crewflow.catalog.onboarding;

import com.purchasingpower.crewflow.agent.tools.LogEventTool;
import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.crew.AgentCrewProvider;
import com.purchasingpower.crewflow.crew.CrewDefaults;
import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.ExtractionMode;
import com.purchasingpower.crewflow.crew.FieldDefinition;
import com.purchasingpower.crewflow.crew.HookContext;
import com.purchasingpower.crewflow.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Digital bank account opening.
 *
 * <pre>
 * entry_introduction -> profile_enrichment -> identity_verification -> completion
 * </pre>
 *
 * Customers under 16 stay on the entry crew, which explains the age requirement.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OnboardingCrewProvider implements AgentCrewProvider {

    public static final String AGENT_NAME = "onboarding";

    public static final int MINIMUM_AGE = 16;

    static final String ONBOARDING_PROFILE = "onboarding_profile";

    private static final Pattern OTP_CODE = Pattern.compile("\\d{6}");
    private static final Pattern LEADING_NUMBER = Pattern.compile("\\d+");

    private final PromptLibraryService promptLibrary;
    private final LogEventTool logEventTool;

    @Override
    public String getAgentName() {
        return AGENT_NAME;
    }

    @Override
    public List<CrewDefinition> getCrews() {
        return List.of(entryIntroduction(), profileEnrichment(), identityVerification(), completion());
    }

    CrewDefinition entryIntroduction() {
        return CrewDefinition.builder()
                .name("entry_introduction")
                .displayName("Welcome")
                .description("Introduction and eligibility check")
                .guidance(guidance("onboarding-entry-introduction"))
                .isDefault(true)
                .field(FieldDefinition.of("user_name", "The user's name or preferred name"))
                .field(FieldDefinition.builder()
                        .name("age")
                        .type("number")
                        .description("The user's age as a number. If they give a date of birth, compute the age.")
                        .build())
                .transitionTo("profile_enrichment")
                .maxTokens(1024)
                .preTransferRule(OnboardingCrewProvider::eligible)
                .contextBuilder(context -> {
                    Map<String, Object> result = CrewDefaults.baseContext(context);
                    OptionalInt age = parseAge(context.field("age"));
                    result.put("role", "Welcome and eligibility check");
                    result.put("eligibilityStatus", age.isEmpty() ? "Pending verification"
                            : age.getAsInt() >= MINIMUM_AGE ? "Eligible" : "Not eligible (under " + MINIMUM_AGE + ")");
                    result.put("instruction", !context.hasField("user_name")
                            ? "Greet warmly, explain the journey and ask for their name."
                            : age.isEmpty()
                            ? "Ask for their age to confirm eligibility."
                            : age.getAsInt() < MINIMUM_AGE
                            ? "Explain the age requirement respectfully. Do not continue the onboarding."
                            : "Confirm eligibility and prepare for the next step.");
                    return result;
                })
                .build();
    }

    CrewDefinition profileEnrichment() {
        return CrewDefinition.builder()
                .name("profile_enrichment")
                .displayName("Financial Profile")
                .description("Financial profile collection, one question at a time")
                .guidance(guidance("onboarding-profile-enrichment"))
                .extractionMode(ExtractionMode.FORM)
                .field(FieldDefinition.builder()
                        .name(ProfileFieldSequence.EMPLOYMENT_STATUS)
                        .description("Employment status")
                        .allowedValues(List.of("employed", "self-employed", "student", "retired", "unemployed"))
                        .build())
                .field(FieldDefinition.builder()
                        .name(ProfileFieldSequence.OCCUPATION)
                        .description("Job title or general field of work")
                        .required(false)
                        .build())
                .field(FieldDefinition.of("primary_income_source", "Main source of income"))
                .field(FieldDefinition.builder()
                        .name("monthly_income_range")
                        .description("Monthly income, mapped to the closest bracket")
                        .allowedValues(List.of("up to 5,000", "5,000-10,000", "10,000-20,000", "20,000+"))
                        .build())
                .field(FieldDefinition.builder()
                        .name("expected_account_usage")
                        .description("Planned use of the account")
                        .allowedValues(List.of("daily expenses", "salary deposit", "savings", "bill payments", "mixed"))
                        .build())
                .field(FieldDefinition.builder()
                        .name("existing_financial_commitments")
                        .description("Loans, mortgage or other commitments; 'none' if there are none")
                        .required(false)
                        .build())
                .transitionTo("identity_verification")
                .maxTokens(2000)
                .fieldExposure(new ProfileFieldSequence())
                .preTransferRule(context -> ProfileFieldSequence.REQUIRED.stream().allMatch(context::hasField))
                .contextBuilder(context -> {
                    Map<String, Object> result = CrewDefaults.baseContext(context);
                    List<String> missing = ProfileFieldSequence.REQUIRED.stream()
                            .filter(name -> !context.hasField(name))
                            .toList();
                    result.put("role", "Financial profile collection");
                    result.put("customerName", context.field("user_name"));
                    result.put("missingRequired", missing);
                    result.put("isComplete", missing.isEmpty());
                    return result;
                })
                .build();
    }

    CrewDefinition identityVerification() {
        return CrewDefinition.builder()
                .name("identity_verification")
                .displayName("Identity Verification")
                .description("Identity verification by one-time code")
                .guidance(guidance("onboarding-identity-verification"))
                .extractionMode(ExtractionMode.FORM)
                .field(FieldDefinition.of("phone_number", "Mobile phone number for the one-time code"))
                .field(FieldDefinition.builder()
                        .name("otp_code")
                        .description("The latest one-time code the user entered, digits only")
                        .reevaluate(true)
                        .build())
                .tool(logEventTool)
                .transitionTo("completion")
                .maxTokens(1500)
                .preTransferRule(OnboardingCrewProvider::codeEntered)
                .contextBuilder(context -> {
                    Map<String, Object> result = CrewDefaults.baseContext(context);
                    result.put("role", "Identity verification");
                    result.put("customerName", context.field("user_name"));
                    result.put("phoneNumber", context.hasField("phone_number") ? "Collected" : "Pending");
                    result.put("otpCode", context.hasField("otp_code") ? "Entered but not valid" : "Not entered");
                    result.put("instruction", !context.hasField("phone_number")
                            ? "Ask for the mobile number the code should go to."
                            : "Tell the user a 6-digit code was sent and ask them to type it.");
                    return result;
                })
                .build();
    }

    CrewDefinition completion() {
        return CrewDefinition.builder()
                .name("completion")
                .displayName("All Set")
                .description("Summary and closing of the onboarding journey")
                .guidance(guidance("onboarding-completion"))
                .tool(logEventTool)
                .contextBuilder(context -> {
                    Map<String, Object> result = CrewDefaults.baseContext(context);
                    result.put("role", "Onboarding completion");
                    result.put("profile", context.getContext().readMap(ContextScope.CONVERSATION, ONBOARDING_PROFILE));
                    return result;
                })
                .build();
    }

    /**
     * Fires for a named customer aged 16 or over, after saving the onboarding profile.
     */
    static boolean eligible(HookContext context) {
        if (!context.hasField("user_name")) {
            return false;
        }
        OptionalInt age = parseAge(context.field("age"));
        if (age.isEmpty() || age.getAsInt() < MINIMUM_AGE) {
            return false;
        }

        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("name", context.fieldAsString("user_name"));
        profile.put("age", age.getAsInt());
        profile.put("eligibleForOnboarding", true);
        profile.put("startedAt", Instant.now().toString());
        context.getContext().write(ContextScope.CONVERSATION, ONBOARDING_PROFILE, profile);
        return true;
    }

    static boolean codeEntered(HookContext context) {
        return context.hasField("phone_number") && context.hasField("otp_code")
                && OTP_CODE.matcher(context.fieldAsString("otp_code")).matches();
    }

    /**
     * Leading integer of the value, so "25", 25 and "25 years" all read as 25.
     */
    static OptionalInt parseAge(Object value) {
        if (value instanceof Number number) {
            return OptionalInt.of(number.intValue());
        }
        if (value == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = LEADING_NUMBER.matcher(value.toString().trim());
        if (matcher.lookingAt()) {
            try {
                return OptionalInt.of(Integer.parseInt(matcher.group()));
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }

    private String guidance(String templateName) {
        return promptLibrary.render(templateName, Map.of());
    }
}
