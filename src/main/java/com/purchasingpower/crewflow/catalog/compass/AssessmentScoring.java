package com.purchasingpower.crewflow.catalog.compass;

import java.util.List;
import java.util.Map;

/**
 * Dimensions of the Compass self-assessment and the readiness classification.
 */
public final class AssessmentScoring {

    public static final List<String> DIMENSIONS = List.of("transferable_skills", "gaps", "motivation");

    public static final String STRONG = "strong";
    public static final String MODERATE = "moderate";
    public static final String CHALLENGING = "challenging";

    private static final Map<String, String> QUESTIONS = Map.of(
            "transferable_skills",
            "What skills, experiences, or strengths from your current role could carry over to your new direction?",
            "gaps",
            "What skills, credentials, or experience would you need to acquire for this transition?",
            "motivation",
            "Why do you want to make this change, and what would success look like to you?");

    private AssessmentScoring() {
    }

    /**
     * Average rounded to one decimal, half up.
     */
    public static double readinessScore(List<? extends Number> scores) {
        if (scores.isEmpty()) {
            return 5.0;
        }
        double average = scores.stream().mapToDouble(Number::doubleValue).average().orElse(5.0);
        return Math.round(average * 10) / 10.0;
    }

    /**
     * 7.5 and above is strong, 5 and above moderate, anything lower challenging.
     */
    public static String classify(double readinessScore) {
        if (readinessScore >= 7.5) {
            return STRONG;
        }
        if (readinessScore >= 5) {
            return MODERATE;
        }
        return CHALLENGING;
    }

    public static List<String> remainingDimensions(Map<String, Object> state) {
        return DIMENSIONS.stream().filter(dimension -> !(state.get(dimension) instanceof Map)).toList();
    }

    public static boolean isDimension(String name) {
        return DIMENSIONS.contains(name);
    }

    public static String questionFor(String dimension) {
        return QUESTIONS.get(dimension);
    }
}
