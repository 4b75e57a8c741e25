package com.purchasingpower.crewflow.crew;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A piece of information a crew elicits from the user.
 */
@Value
@Builder
@Jacksonized
public class FieldDefinition {

    String name;

    String description;

    @Builder.Default
    String type = "string";

    @Builder.Default
    List<String> allowedValues = List.of();

    /**
     * Re-exposed to the extractor every turn even when already collected
     * (a value the user may legitimately change, such as the latest OTP code entered).
     */
    boolean reevaluate;

    @Builder.Default
    boolean required = true;

    public static FieldDefinition of(String name, String description) {
        return FieldDefinition.builder().name(name).description(description).build();
    }
}
