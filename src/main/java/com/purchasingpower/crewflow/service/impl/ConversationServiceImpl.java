package com.purchasingpower.crewflow.service.impl;

import com.purchasingpower.crewflow.exception.CrewFlowException;
import com.purchasingpower.crewflow.model.conversation.ChatMessage;
import com.purchasingpower.crewflow.model.conversation.Conversation;
import com.purchasingpower.crewflow.model.conversation.ConversationMessage;
import com.purchasingpower.crewflow.repository.ConversationRepository;
import com.purchasingpower.crewflow.service.ConversationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Implementation of ConversationService.
 *
 * Each method is its own transaction; the dispatcher serializes turns per conversation, so
 * read-modify-write of collected fields does not race within a conversation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationServiceImpl implements ConversationService {

    private final ConversationRepository conversationRepo;

    @Override
    @Transactional
    public Conversation startConversation(String conversationId, String userId, String agentName,
                                          String defaultCrewName) {
        String effectiveUserId = ConversationService.ownerOf(conversationId, userId);
        log.info("Creating conversation: {} for user: {} on agent: {} (crew: {})",
                conversationId, effectiveUserId, agentName, defaultCrewName);

        Conversation conversation = Conversation.builder()
                .conversationId(conversationId)
                .userId(effectiveUserId)
                .agentName(agentName)
                .activeCrewName(defaultCrewName)
                .collectedFields(new LinkedHashMap<>())
                .isActive(true)
                .createdAt(LocalDateTime.now())
                .lastActivity(LocalDateTime.now())
                .build();

        return conversationRepo.save(conversation);
    }

    @Override
    public Optional<Conversation> getConversation(String conversationId) {
        return conversationRepo.findById(conversationId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> getHistory(String conversationId) {
        return conversationRepo.findByIdWithMessages(conversationId)
                .map(conversation -> conversation.getMessages().stream()
                        .map(ConversationMessage::toChatMessage)
                        .toList())
                .orElse(List.of());
    }

    @Override
    @Transactional
    public void addMessage(String conversationId, String role, String content, String crewName) {
        Conversation conversation = require(conversationId);
        conversation.addMessage(new ConversationMessage(role, content, crewName));
        conversationRepo.save(conversation);
        log.debug("Message added to conversation {}: {} - {}",
                conversationId, role, content.substring(0, Math.min(50, content.length())));
    }

    @Override
    @Transactional
    public Map<String, Object> mergeCollectedFields(String conversationId, Map<String, Object> updates) {
        Conversation conversation = require(conversationId);
        Map<String, Object> merged = new LinkedHashMap<>(conversation.getCollectedFields());
        if (updates != null && !updates.isEmpty()) {
            merged.putAll(updates);
            conversation.setCollectedFields(merged);
            conversationRepo.save(conversation);
            log.debug("Collected fields updated for conversation {}: {}", conversationId, updates.keySet());
        }
        return merged;
    }

    @Override
    @Transactional
    public void updateActiveCrew(String conversationId, String crewName) {
        Conversation conversation = require(conversationId);
        conversation.setActiveCrewName(crewName);
        conversationRepo.save(conversation);
    }

    @Override
    public List<Conversation> getActiveConversations(String userId) {
        return conversationRepo.findByUserIdAndIsActiveTrue(userId);
    }

    @Override
    @Transactional
    public void closeConversation(String conversationId) {
        conversationRepo.findById(conversationId).ifPresent(conversation -> {
            conversation.close();
            conversationRepo.save(conversation);
            log.info("Conversation closed: {}", conversationId);
        });
    }

    private Conversation require(String conversationId) {
        return conversationRepo.findById(conversationId)
                .orElseThrow(() -> new CrewFlowException("Conversation not found: " + conversationId));
    }
}
