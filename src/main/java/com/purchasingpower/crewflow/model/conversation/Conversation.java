package com.purchasingpower.crewflow.model.conversation;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation - one user's run through an agent's crews.
 *
 * Holds the active crew pointer and the fields collected so far. The active crew is only
 * changed by the transition controller; collected fields only accumulate.
 */
@Data
@Entity
@Table(name = "CONVERSATIONS")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    @Id
    @Column(name = "conversation_id", nullable = false, length = 100)
    private String conversationId;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "agent_name", nullable = false, length = 100)
    private String agentName;

    @Column(name = "active_crew_name", nullable = false, length = 100)
    private String activeCrewName;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "collected_fields", length = 8000)
    @Builder.Default
    private Map<String, Object> collectedFields = new LinkedHashMap<>();

    /**
     * Is this conversation still active?
     */
    @Column(name = "is_active")
    @Builder.Default
    private boolean isActive = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_activity", nullable = false)
    private LocalDateTime lastActivity;

    @OneToMany(mappedBy = "conversation", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<ConversationMessage> messages = new ArrayList<>();

    // ================================================================
    // Lifecycle Hooks
    // ================================================================

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (lastActivity == null) {
            lastActivity = LocalDateTime.now();
        }
    }

    @PreUpdate
    public void preUpdate() {
        lastActivity = LocalDateTime.now();
    }

    // ================================================================
    // Helper Methods
    // ================================================================

    /**
     * Add a message to this conversation.
     */
    public void addMessage(ConversationMessage message) {
        if (this.messages == null) {
            this.messages = new ArrayList<>();
        }
        message.setConversation(this);
        if (message.getTimestamp() == null) {
            message.setTimestamp(LocalDateTime.now());
        }
        this.messages.add(message);
        this.lastActivity = LocalDateTime.now();
    }

    /**
     * Close this conversation.
     */
    public void close() {
        this.isActive = false;
        this.lastActivity = LocalDateTime.now();
    }

    /**
     * Reopen this conversation.
     */
    public void reopen() {
        this.isActive = true;
        this.lastActivity = LocalDateTime.now();
    }
}
