package com.purchasingpower.crewflow.catalog.compass;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AssessmentScoringTest {

    @Test
    @DisplayName("Readiness is the average score rounded to one decimal")
    void readinessScore() {
        assertThat(AssessmentScoring.readinessScore(List.of(7, 8, 8))).isEqualTo(7.7);
        assertThat(AssessmentScoring.readinessScore(List.of(5.0, 6.0))).isEqualTo(5.5);
        assertThat(AssessmentScoring.readinessScore(List.of())).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Readiness level boundaries sit at 7.5 and 5")
    void classifyBoundaries() {
        assertThat(AssessmentScoring.classify(7.5)).isEqualTo(AssessmentScoring.STRONG);
        assertThat(AssessmentScoring.classify(7.4)).isEqualTo(AssessmentScoring.MODERATE);
        assertThat(AssessmentScoring.classify(5.0)).isEqualTo(AssessmentScoring.MODERATE);
        assertThat(AssessmentScoring.classify(4.9)).isEqualTo(AssessmentScoring.CHALLENGING);
    }

    @Test
    @DisplayName("Dimensions without a recorded entry are still remaining")
    void remainingDimensions() {
        Map<String, Object> state = Map.of(
                "gaps", Map.of("score", 4.0),
                "motivation", "not an entry");

        assertThat(AssessmentScoring.remainingDimensions(state)).containsExactly("transferable_skills", "motivation");
        assertThat(AssessmentScoring.questionFor("gaps")).contains("skills, credentials");
    }
}
