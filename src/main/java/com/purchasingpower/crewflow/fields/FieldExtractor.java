package com.purchasingpower.crewflow.fields;

/**
 * The field extraction micro-agent: reads a history slice and proposes field values.
 *
 * Implementations should return an empty result rather than throw when they cannot
 * produce usable output.
 */
public interface FieldExtractor {

    ExtractionResult extract(ExtractionRequest request);
}
