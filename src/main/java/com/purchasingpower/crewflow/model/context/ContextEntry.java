package com.purchasingpower.crewflow.model.context;

import com.purchasingpower.crewflow.context.ContextScope;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One (scope, owner, key) entry of the context store.
 *
 * The owner is a conversation id for CONVERSATION scope and a user id for USER scope.
 */
@Data
@Entity
@Table(name = "CONTEXT_ENTRIES",
        uniqueConstraints = @UniqueConstraint(
                name = "UK_CONTEXT_SCOPE_OWNER_KEY",
                columnNames = {"scope", "owner_id", "context_key"}))
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", nullable = false, length = 20)
    private ContextScope scope;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Column(name = "context_key", nullable = false, length = 200)
    private String contextKey;

    @Lob
    @Column(name = "value_json", columnDefinition = "CLOB")
    private String valueJson;

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
