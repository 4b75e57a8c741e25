package com.purchasingpower.crewflow.repository;

import com.purchasingpower.crewflow.model.conversation.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Conversation entities.
 */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, String> {

    /**
     * Find all active conversations for a specific user.
     */
    List<Conversation> findByUserIdAndIsActiveTrue(String userId);

    /**
     * Find conversation by ID with messages eagerly loaded.
     */
    @Query("SELECT c FROM Conversation c LEFT JOIN FETCH c.messages WHERE c.conversationId = :conversationId")
    Optional<Conversation> findByIdWithMessages(@Param("conversationId") String conversationId);
}
