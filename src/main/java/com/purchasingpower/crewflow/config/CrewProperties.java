package com.purchasingpower.crewflow.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Orchestration settings.
 *
 * <p>Configuration in application.yml:
 * <pre>
 * app:
 *   crew:
 *     max-transfer-hops: 5
 *     max-tool-round-trips: 10
 *     history-window: 20
 *     speculative-draft: false
 *     context-store: jpa
 *     editor-history-size: 10
 * </pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.crew")
public class CrewProperties {

    /**
     * Longest chain of pre-transfers allowed within one turn.
     */
    @Min(1)
    @Max(50)
    private int maxTransferHops = 5;

    /**
     * Tool-call round trips allowed per generation before the turn fails.
     */
    @Min(1)
    @Max(100)
    private int maxToolRoundTrips = 10;

    /**
     * Messages of history given to the extractor (conversational mode) and to the model.
     */
    @Min(1)
    private int historyWindow = 20;

    /**
     * Draft the current crew's reply while fields are extracted. The draft is buffered and
     * dropped if a pre-transfer fires.
     */
    private boolean speculativeDraft = false;

    /**
     * Context store backend: "jpa" or "memory".
     */
    @NotBlank
    @Pattern(regexp = "jpa|memory")
    private String contextStore = "jpa";

    /**
     * Previous definitions kept per crew by the crew editor.
     */
    @Min(1)
    private int editorHistorySize = 10;
}
