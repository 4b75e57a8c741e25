package com.purchasingpower.crewflow.catalog.onboarding;

import com.purchasingpower.crewflow.crew.FieldDefinition;
import com.purchasingpower.crewflow.crew.FieldExposure;
import com.purchasingpower.crewflow.fields.FieldValues;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Exposes the financial profile one field at a time, in declaration order.
 * The occupation question is skipped for statuses that have no occupation. Once everything
 * is collected the closing commitments question stays exposed, so the rule never comes back empty.
 */
public class ProfileFieldSequence implements FieldExposure {

    static final String EMPLOYMENT_STATUS = "employment_status";
    static final String OCCUPATION = "occupation";
    static final String COMMITMENTS = "existing_financial_commitments";

    static final List<String> REQUIRED = List.of(
            EMPLOYMENT_STATUS, "primary_income_source", "monthly_income_range", "expected_account_usage");

    static final Set<String> SKIP_OCCUPATION_STATUSES = Set.of("student", "retired", "unemployed");

    @Override
    public List<FieldDefinition> exposedFields(List<FieldDefinition> fields, Map<String, Object> collectedFields) {
        boolean skipOccupation = FieldValues.isCollected(collectedFields, EMPLOYMENT_STATUS)
                && SKIP_OCCUPATION_STATUSES.contains(
                        FieldValues.asString(collectedFields.get(EMPLOYMENT_STATUS)).trim().toLowerCase(Locale.ROOT));

        for (FieldDefinition field : fields) {
            if (skipOccupation && OCCUPATION.equals(field.getName())) {
                continue;
            }
            if (!FieldValues.isCollected(collectedFields, field.getName())) {
                return List.of(field);
            }
        }
        return fields.stream()
                .filter(field -> COMMITMENTS.equals(field.getName()))
                .findFirst()
                .or(() -> fields.stream().reduce((first, second) -> second))
                .map(List::of)
                .orElse(List.of());
    }
}
