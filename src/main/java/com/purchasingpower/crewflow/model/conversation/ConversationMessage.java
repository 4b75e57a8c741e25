package com.purchasingpower.crewflow.model.conversation;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * ConversationMessage - Individual message in a conversation.
 */
@Data
@Entity
@Table(name = "CONVERSATION_MESSAGES")
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "conversation_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Conversation conversation;

    @Column(nullable = false, length = 20)
    private String role; // "user" or "assistant"

    @Lob
    @Column(columnDefinition = "CLOB", nullable = false)
    private String content;

    /**
     * Crew that produced an assistant message, or was active when a user message arrived.
     */
    @Column(name = "crew_name", length = 100)
    private String crewName;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    public ConversationMessage(String role, String content, String crewName) {
        this.role = role;
        this.content = content;
        this.crewName = crewName;
        this.timestamp = LocalDateTime.now();
    }

    public ChatMessage toChatMessage() {
        return ChatMessage.builder()
                .role(role)
                .content(content)
                .crewName(crewName)
                .timestamp(timestamp)
                .build();
    }
}
