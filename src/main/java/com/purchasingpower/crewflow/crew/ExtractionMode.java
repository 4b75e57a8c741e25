package com.purchasingpower.crewflow.crew;

/**
 * How much conversation history the field extractor may consider.
 */
public enum ExtractionMode {
    /** Recent message history. */
    CONVERSATIONAL,
    /** Only the latest user message. */
    FORM
}
