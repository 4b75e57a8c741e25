package com.purchasingpower.crewflow.catalog.compass;

import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.crew.AgentCrewProvider;
import com.purchasingpower.crewflow.crew.CrewDefaults;
import com.purchasingpower.crewflow.crew.CrewDefinition;
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

/**
 * Compass, a career change navigator.
 *
 * <pre>
 * intake -> self_assessment -> transition_plan (one shot) -> coach
 * </pre>
 *
 * Intake hands over before replying once the profile is complete; the assessment hands over
 * after replying once all dimensions are recorded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompassCrewProvider implements AgentCrewProvider {

    public static final String AGENT_NAME = "compass";

    static final String SEEKER_PROFILE = "seeker_profile";

    private final PromptLibraryService promptLibrary;
    private final RecordAssessmentTool recordAssessmentTool;

    @Override
    public String getAgentName() {
        return AGENT_NAME;
    }

    @Override
    public List<CrewDefinition> getCrews() {
        return List.of(intake(), selfAssessment(), transitionPlan(), coach());
    }

    CrewDefinition intake() {
        return CrewDefinition.builder()
                .name("intake")
                .displayName("Compass - Navigator")
                .description("Welcome and initial profile collection")
                .guidance(guidance("compass-intake"))
                .isDefault(true)
                .field(FieldDefinition.of("seeker_name", "The user's first name or preferred name"))
                .field(FieldDefinition.of("current_role",
                        "What they do now: job title, profession, or general situation"))
                .field(FieldDefinition.of("target_industry",
                        "The industry or field they want to move into, e.g. tech, finance, healthcare"))
                .transitionTo("self_assessment")
                .maxTokens(512)
                .preTransferRule(CompassCrewProvider::profileComplete)
                .contextBuilder(context -> {
                    Map<String, Object> result = CrewDefaults.baseContext(context);
                    List<String> missing = CrewDefaults.remainingFields(context.getCrew(), context.getCollectedFields());
                    result.put("role", "Welcome and profile collection");
                    result.put("instruction", missing.isEmpty()
                            ? "All fields collected. The system will move on automatically."
                            : "Still need: " + String.join(", ", missing) + ". Ask naturally, one at a time.");
                    return result;
                })
                .build();
    }

    CrewDefinition selfAssessment() {
        return CrewDefinition.builder()
                .name("self_assessment")
                .displayName("Self Assessment")
                .description("Structured three-dimension career change self-assessment")
                .guidance(guidance("compass-self-assessment"))
                .tool(recordAssessmentTool)
                .transitionTo("transition_plan")
                .maxTokens(1024)
                .postTransferRule(new AssessmentCompletionRule())
                .contextBuilder(context -> {
                    Map<String, Object> result = CrewDefaults.baseContext(context);
                    Map<String, Object> state = context.getContext()
                            .readMap(ContextScope.USER, RecordAssessmentTool.ASSESSMENT_STATE);
                    List<String> remaining = AssessmentScoring.remainingDimensions(state);
                    String current = remaining.isEmpty() ? null : remaining.get(0);

                    result.put("role", "Career self-assessment guide");
                    result.put("seekerName", context.field("seeker_name"));
                    result.put("currentRole", context.field("current_role"));
                    result.put("targetIndustry", context.field("target_industry"));
                    result.put("currentDimension", current);
                    result.put("currentDimensionQuestion", current != null ? AssessmentScoring.questionFor(current) : null);
                    result.put("completedDimensions", state.keySet());
                    result.put("remainingCount", remaining.size());
                    result.put("instruction", current != null
                            ? "Explore \"" + current + "\". After the user responds, call record_assessment."
                            : "All dimensions recorded. Wrap up warmly, the Compass Report is on its way.");
                    return result;
                })
                .build();
    }

    CrewDefinition transitionPlan() {
        return CrewDefinition.builder()
                .name("transition_plan")
                .displayName("Compass Report")
                .description("Delivers the personalized career transition plan")
                .guidance(guidance("compass-transition-plan"))
                .oneShot(true)
                .transitionTo("coach")
                .contextBuilder(context -> withProfileAndResults(context,
                        "Compass Report delivery: personalized career transition plan"))
                .build();
    }

    CrewDefinition coach() {
        return CrewDefinition.builder()
                .name("coach")
                .displayName("Compass Coach")
                .description("Ongoing questions about the career transition")
                .guidance(guidance("compass-coach"))
                .contextBuilder(context -> withProfileAndResults(context, "Ongoing career transition coach"))
                .build();
    }

    /**
     * Fires once name, role and target are known, after saving them as the user's seeker profile.
     */
    static boolean profileComplete(HookContext context) {
        if (!context.hasField("seeker_name") || !context.hasField("current_role")
                || !context.hasField("target_industry")) {
            return false;
        }

        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("seekerName", context.fieldAsString("seeker_name"));
        profile.put("currentRole", context.fieldAsString("current_role"));
        profile.put("targetIndustry", context.fieldAsString("target_industry"));
        profile.put("profiledAt", Instant.now().toString());
        context.getContext().write(ContextScope.USER, SEEKER_PROFILE, profile);

        log.info("Compass seeker profile saved for conversation {}", context.getConversationId());
        return true;
    }

    private static Map<String, Object> withProfileAndResults(HookContext context, String role) {
        Map<String, Object> result = CrewDefaults.baseContext(context);
        Map<String, Object> profile = context.getContext().readMap(ContextScope.USER, SEEKER_PROFILE);
        result.put("role", role);
        result.put("seekerName", profile.getOrDefault("seekerName", context.field("seeker_name")));
        result.put("currentRole", profile.getOrDefault("currentRole", context.field("current_role")));
        result.put("targetIndustry", profile.getOrDefault("targetIndustry", context.field("target_industry")));

        Map<String, Object> assessment = context.getContext()
                .readMap(ContextScope.USER, AssessmentCompletionRule.ASSESSMENT_RESULTS);
        result.put("assessment", assessment.isEmpty() ? null : assessment);
        return result;
    }

    private String guidance(String templateName) {
        return promptLibrary.render(templateName, Map.of());
    }
}
