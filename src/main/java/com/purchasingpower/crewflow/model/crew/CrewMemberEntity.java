package com.purchasingpower.crewflow.model.crew;

import com.purchasingpower.crewflow.crew.ExtractionMode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A crew member defined in the database rather than in code.
 *
 * Database crews use the default capability behavior; their tools are referenced by
 * name and resolved through the tool registry when the agent is loaded.
 */
@Data
@Entity
@Table(name = "CREW_MEMBERS",
        uniqueConstraints = @UniqueConstraint(
                name = "UK_CREW_MEMBERS_AGENT_CREW",
                columnNames = {"agent_name", "crew_name"}))
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrewMemberEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_name", nullable = false, length = 100)
    private String agentName;

    @Column(name = "crew_name", nullable = false, length = 100)
    private String crewName;

    @Column(name = "display_name", length = 200)
    private String displayName;

    @Column(name = "description", length = 1000)
    private String description;

    @Lob
    @Column(name = "guidance", columnDefinition = "CLOB")
    private String guidance;

    /**
     * JSON array of field definitions.
     */
    @Lob
    @Column(name = "fields_json", columnDefinition = "CLOB")
    private String fieldsJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "extraction_mode", length = 20)
    private ExtractionMode extractionMode;

    @Column(name = "transition_to", length = 100)
    private String transitionTo;

    @Column(name = "is_default")
    private boolean isDefault;

    @Column(name = "one_shot")
    private boolean oneShot;

    /**
     * Comma-separated tool names.
     */
    @Column(name = "tool_names", length = 1000)
    private String toolNames;

    @Column(name = "model", length = 100)
    private String model;

    @Column(name = "max_tokens")
    private Integer maxTokens;

    @Column(name = "kb_store_id", length = 200)
    private String knowledgeBaseStoreId;

    @Column(name = "is_active")
    @Builder.Default
    private boolean isActive = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    public void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
