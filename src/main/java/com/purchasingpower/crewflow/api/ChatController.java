package com.purchasingpower.crewflow.api;

import com.purchasingpower.crewflow.agent.CrewDispatcher;
import com.purchasingpower.crewflow.agent.TurnRequest;
import com.purchasingpower.crewflow.agent.TurnResult;
import com.purchasingpower.crewflow.crew.CrewDefaults;
import com.purchasingpower.crewflow.crew.CrewRegistry;
import com.purchasingpower.crewflow.crew.CrewSnapshot;
import com.purchasingpower.crewflow.exception.CrewConfigurationException;
import com.purchasingpower.crewflow.exception.CrewFlowException;
import com.purchasingpower.crewflow.exception.CrewNotFoundException;
import com.purchasingpower.crewflow.model.conversation.Conversation;
import com.purchasingpower.crewflow.service.ChatStreamService;
import com.purchasingpower.crewflow.service.ConversationService;
import com.purchasingpower.crewflow.service.StreamingTurnListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * REST controller for chat API.
 *
 * Flow:
 * 1. Client posts a message for an agent
 * 2. Conversation is created on the agent's default crew if needed
 * 3. The turn runs on the turn executor
 * 4. Tokens, tool activity and crew transitions arrive on the SSE stream
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    private final CrewDispatcher dispatcher;
    private final CrewRegistry crewRegistry;
    private final ConversationService conversationService;
    private final ChatStreamService chatStreamService;
    private final Executor turnExecutor;

    public ChatController(CrewDispatcher dispatcher,
                          CrewRegistry crewRegistry,
                          ConversationService conversationService,
                          ChatStreamService chatStreamService,
                          @Qualifier("turnExecutor") Executor turnExecutor) {
        this.dispatcher = dispatcher;
        this.crewRegistry = crewRegistry;
        this.conversationService = conversationService;
        this.chatStreamService = chatStreamService;
        this.turnExecutor = turnExecutor;
    }

    /**
     * Send a chat message.
     *
     * POST /api/v1/chat
     *
     * Returns conversationId immediately. Connect to SSE stream for updates.
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return ResponseEntity.badRequest().body(ChatResponse.error("Message is required"));
        }

        try {
            String conversationId = request.getConversationId();
            String agentName = request.getAgentName();
            Conversation conversation;

            if (conversationId == null || conversationId.isBlank()) {
                if (agentName == null || agentName.isBlank()) {
                    return ResponseEntity.badRequest().body(ChatResponse.error(
                            "agentName is required for new conversations. Available agents: "
                                    + crewRegistry.availableAgents()));
                }
                CrewSnapshot snapshot = crewRegistry.load(agentName);
                conversationId = UUID.randomUUID().toString();
                conversation = conversationService.startConversation(conversationId, request.getUserId(), agentName,
                        snapshot.getDefaultCrewName());
                log.info("New conversation: {} on agent: {}", conversationId, agentName);
            } else {
                Optional<Conversation> existing = conversationService.getConversation(conversationId);
                if (existing.isEmpty()) {
                    return ResponseEntity.badRequest()
                            .body(ChatResponse.error("Conversation not found: " + conversationId));
                }
                conversation = existing.get();
                if (agentName != null && !agentName.isBlank() && !agentName.equals(conversation.getAgentName())) {
                    return ResponseEntity.badRequest().body(ChatResponse.error(
                            "Conversation " + conversationId + " belongs to agent " + conversation.getAgentName()));
                }
                if (!conversation.isActive()) {
                    return ResponseEntity.badRequest()
                            .body(ChatResponse.error("Conversation " + conversationId + " is closed"));
                }
                log.info("Continue conversation: {}", conversationId);
            }

            TurnRequest turn = TurnRequest.builder()
                    .agentName(conversation.getAgentName())
                    .conversationId(conversationId)
                    .userId(conversation.getUserId())
                    .message(request.getMessage())
                    .overrideCrewMember(request.getOverrideCrewMember())
                    .knowledgeBaseEnabled(!Boolean.FALSE.equals(request.getKnowledgeBaseEnabled()))
                    .build();
            chatStreamService.sendThinking(conversationId, "Processing your message...");
            CompletableFuture.runAsync(() -> processTurnAsync(turn), turnExecutor);

            return ResponseEntity.ok(ChatResponse.success(conversationId, conversation.getActiveCrewName(),
                    "Processing... Connect to SSE stream for updates."));

        } catch (CrewNotFoundException e) {
            return ResponseEntity.badRequest().body(ChatResponse.error(e.getMessage()));
        } catch (CrewConfigurationException e) {
            log.error("Agent {} has an invalid crew graph", request.getAgentName(), e);
            return ResponseEntity.internalServerError().body(ChatResponse.error(e.getMessage()));
        } catch (RejectedExecutionException e) {
            log.error("Turn executor saturated", e);
            return ResponseEntity.status(503).body(ChatResponse.error("Server busy, retry shortly"));
        }
    }

    private void processTurnAsync(TurnRequest turn) {
        String conversationId = turn.getConversationId();
        try {
            TurnResult result = dispatcher.handleTurn(turn,
                    new StreamingTurnListener(chatStreamService, conversationId));

            chatStreamService.sendComplete(conversationId, result.getRespondingCrew(), result.getReply(),
                    result.isCancelled() ? "Turn cancelled" : "Response complete");

        } catch (CrewFlowException e) {
            chatStreamService.sendError(conversationId, e.getMessage());
        } catch (Exception e) {
            log.error("Async turn processing failed", e);
            chatStreamService.sendError(conversationId, "Processing failed: " + e.getMessage());
        }
    }

    /**
     * Conversation state.
     *
     * GET /api/v1/chat/{id}
     */
    @GetMapping("/{conversationId}")
    public ResponseEntity<ConversationStateResponse> getState(@PathVariable String conversationId) {
        Optional<Conversation> conversation = conversationService.getConversation(conversationId);
        if (conversation.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        Conversation conv = conversation.get();
        List<String> remaining = List.of();
        try {
            remaining = CrewDefaults.remainingFields(
                    crewRegistry.resolve(conv.getAgentName(), conv.getActiveCrewName()), conv.getCollectedFields());
        } catch (CrewFlowException e) {
            log.warn("Active crew of conversation {} cannot be resolved: {}", conversationId, e.getMessage());
        }

        return ResponseEntity.ok(ConversationStateResponse.builder()
                .conversationId(conversationId)
                .userId(conv.getUserId())
                .agentName(conv.getAgentName())
                .activeCrew(conv.getActiveCrewName())
                .status(conv.isActive() ? "ACTIVE" : "CLOSED")
                .turnInProgress(dispatcher.isRunning(conversationId))
                .hasActiveStream(chatStreamService.hasActiveStream(conversationId))
                .collectedFields(conv.getCollectedFields())
                .remainingFields(remaining)
                .createdAt(conv.getCreatedAt() != null ? conv.getCreatedAt().toString() : null)
                .lastActivity(conv.getLastActivity() != null ? conv.getLastActivity().toString() : null)
                .build());
    }

    /**
     * Get conversation history.
     *
     * GET /api/v1/chat/{id}/history
     */
    @GetMapping("/{conversationId}/history")
    public ResponseEntity<ConversationHistory> getHistory(@PathVariable String conversationId) {
        if (conversationService.getConversation(conversationId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        List<ConversationHistory.Message> messages = conversationService.getHistory(conversationId).stream()
                .map(m -> ConversationHistory.Message.builder()
                        .role(m.getRole())
                        .content(m.getContent())
                        .crew(m.getCrewName())
                        .timestamp(m.getTimestamp() != null ? m.getTimestamp().toString() : null)
                        .build())
                .toList();

        return ResponseEntity.ok(ConversationHistory.builder()
                .conversationId(conversationId)
                .messages(messages)
                .build());
    }

    /**
     * Cancel the in-flight turn.
     *
     * DELETE /api/v1/chat/{id}/turn
     */
    @DeleteMapping("/{conversationId}/turn")
    public ResponseEntity<Map<String, Object>> cancelTurn(@PathVariable String conversationId) {
        boolean cancelled = dispatcher.cancel(conversationId);
        return ResponseEntity.ok(Map.of("conversationId", conversationId, "cancelled", cancelled));
    }

    /**
     * End a conversation.
     *
     * DELETE /api/v1/chat/{id}
     */
    @DeleteMapping("/{conversationId}")
    public ResponseEntity<Void> closeConversation(@PathVariable String conversationId) {
        dispatcher.cancel(conversationId);
        conversationService.closeConversation(conversationId);
        return ResponseEntity.noContent().build();
    }

    /**
     * SSE stream for real-time updates.
     *
     * GET /api/v1/chat/{id}/stream
     *
     * Disconnecting cancels the in-flight turn.
     */
    @GetMapping(value = "/{conversationId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String conversationId) {
        log.info("Client connected to chat stream: {}", conversationId);
        return chatStreamService.createStream(conversationId, () -> dispatcher.cancel(conversationId));
    }
}
