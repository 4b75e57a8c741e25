package com.purchasingpower.crewflow.fields;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Extractor output. No completeness guarantee: any field may be missing.
 */
@Value
@Builder
public class ExtractionResult {

    @Builder.Default
    Map<String, Object> extractedFields = Map.of();

    /** New values for fields the user explicitly changed after they were collected. */
    @Builder.Default
    Map<String, Object> corrections = Map.of();

    @Builder.Default
    List<String> remainingFields = List.of();

    public static ExtractionResult empty(List<String> remainingFields) {
        return ExtractionResult.builder().remainingFields(List.copyOf(remainingFields)).build();
    }

    public boolean isEmpty() {
        return extractedFields.isEmpty() && corrections.isEmpty();
    }
}
