package com.purchasingpower.crewflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.api.ChatEvent;
import com.purchasingpower.crewflow.transition.CrewTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SSE streams for chat conversations.
 *
 * Events sent before a client connects are buffered and replayed on connect. A client that
 * goes away (abort, timeout, transport error) triggers the disconnect callback registered
 * with the stream, which the chat controller uses to cancel the in-flight turn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatStreamService {

    private static final long SSE_TIMEOUT_MS = 15 * 60 * 1000; // 15 minutes
    private static final int MAX_BUFFERED_EVENTS = 500;

    private final ObjectMapper objectMapper;

    private final Map<String, SseEmitter> emitters = new ConcurrentHashMap<>();
    private final Map<String, Runnable> disconnectHandlers = new ConcurrentHashMap<>();
    private final Map<String, List<ChatEvent>> eventBuffer = new ConcurrentHashMap<>();

    public SseEmitter createStream(String conversationId, Runnable onDisconnect) {
        log.info("Creating SSE stream for chat: {}", conversationId);

        if (conversationId == null || conversationId.isBlank() || "null".equals(conversationId)) {
            log.warn("Rejected SSE connection with invalid conversationId");
            return createErrorEmitter("Invalid conversationId.");
        }

        // Replace any stale emitter for this conversation
        closeEmitter(emitters.remove(conversationId), conversationId);

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        emitter.onCompletion(() -> cleanup(conversationId, emitter, "completed"));
        emitter.onTimeout(() -> disconnect(conversationId, emitter, "timed out"));
        emitter.onError(ex -> disconnect(conversationId, emitter, "error: " + ex.getMessage()));

        emitters.put(conversationId, emitter);
        if (onDisconnect != null) {
            disconnectHandlers.put(conversationId, onDisconnect);
        }

        sendEventInternal(conversationId, emitter, ChatEvent.builder()
                .conversationId(conversationId)
                .type(ChatEvent.EventType.CONNECTED)
                .message("Connected to chat stream")
                .build());

        List<ChatEvent> buffered = eventBuffer.remove(conversationId);
        if (buffered != null && !buffered.isEmpty()) {
            log.debug("Replaying {} buffered events for: {}", buffered.size(), conversationId);
            for (ChatEvent event : buffered) {
                sendEventInternal(conversationId, emitter, event);
            }
            if (isFinal(buffered.get(buffered.size() - 1))) {
                finish(conversationId, "turn ended before connect");
            }
        }
        return emitter;
    }

    /**
     * Send "thinking" event - a turn is running.
     */
    public void sendThinking(String conversationId, String message) {
        sendUpdate(conversationId, ChatEvent.thinking(conversationId, message));
    }

    /**
     * Send "tool" event - a crew tool is executing.
     */
    public void sendToolExecution(String conversationId, String toolName, String status) {
        sendUpdate(conversationId, ChatEvent.tool(conversationId, toolName, status));
    }

    /**
     * Send partial response (streaming tokens).
     */
    public void sendPartialResponse(String conversationId, String content) {
        sendUpdate(conversationId, ChatEvent.builder()
                .conversationId(conversationId)
                .type(ChatEvent.EventType.PARTIAL)
                .content(content)
                .build());
    }

    public void sendTransition(String conversationId, CrewTransition transition) {
        sendUpdate(conversationId, ChatEvent.transition(conversationId, transition));
    }

    /**
     * Send complete response and close stream.
     */
    public void sendComplete(String conversationId, String crewName, String response, String message) {
        ChatEvent event = ChatEvent.complete(conversationId, crewName, response);
        event.setMessage(message);
        sendUpdate(conversationId, event);
        finish(conversationId, "explicit completion");
    }

    /**
     * Send error and close stream. Uses a regular event plus complete() rather than
     * completeWithError, which the SSE converter cannot render.
     */
    public void sendError(String conversationId, String error) {
        log.error("Sending error event for conversation {}: {}", conversationId, error);
        sendUpdate(conversationId, ChatEvent.error(conversationId, error));
        finish(conversationId, "explicit error sent");
    }

    public void sendUpdate(String conversationId, ChatEvent event) {
        SseEmitter emitter = emitters.get(conversationId);

        if (emitter == null) {
            List<ChatEvent> buffer = eventBuffer.computeIfAbsent(conversationId,
                    k -> Collections.synchronizedList(new ArrayList<>()));
            if (buffer.size() < MAX_BUFFERED_EVENTS) {
                buffer.add(event);
                log.debug("Buffered chat event: {} type={}", conversationId, event.getType());
            }
            return;
        }

        sendEventInternal(conversationId, emitter, event);
    }

    public boolean hasActiveStream(String conversationId) {
        return emitters.containsKey(conversationId);
    }

    private void sendEventInternal(String conversationId, SseEmitter emitter, ChatEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            emitter.send(SseEmitter.event()
                    .id(UUID.randomUUID().toString())
                    .name("chat-update")
                    .data(json));
        } catch (IOException | IllegalStateException e) {
            log.warn("SSE stream for {} aborted by client ({}). Cleaning up.", conversationId, e.getMessage());
            disconnect(conversationId, emitter, "abort");
        }
    }

    /**
     * Turn ended: close the emitter without firing the disconnect callback.
     */
    private void finish(String conversationId, String reason) {
        disconnectHandlers.remove(conversationId);
        SseEmitter emitter = emitters.remove(conversationId);
        if (emitter == null) {
            // Nobody connected yet; the buffer is replayed on connect
            return;
        }
        closeEmitter(emitter, conversationId);
        eventBuffer.remove(conversationId);
        log.debug("SSE stream finished for {}: {}", conversationId, reason);
    }

    private static boolean isFinal(ChatEvent event) {
        return event.getType() == ChatEvent.EventType.COMPLETE || event.getType() == ChatEvent.EventType.ERROR;
    }

    private void disconnect(String conversationId, SseEmitter emitter, String reason) {
        if (!emitters.remove(conversationId, emitter)) {
            return;
        }
        Runnable handler = disconnectHandlers.remove(conversationId);
        if (handler != null) {
            log.info("Client left chat stream {} ({}), notifying turn", conversationId, reason);
            handler.run();
        }
        closeEmitter(emitter, conversationId);
    }

    private void cleanup(String conversationId, SseEmitter emitter, String reason) {
        if (emitters.remove(conversationId, emitter)) {
            disconnectHandlers.remove(conversationId);
        }
        log.debug("SSE resource cleanup for {}: {}", conversationId, reason);
    }

    private void closeEmitter(SseEmitter emitter, String conversationId) {
        if (emitter == null) {
            return;
        }
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("SSE emitter for {} already closed: {}", conversationId, e.getMessage());
        }
    }

    private SseEmitter createErrorEmitter(String message) {
        SseEmitter errorEmitter = new SseEmitter(5000L);
        try {
            errorEmitter.send(SseEmitter.event()
                    .name("chat-update")
                    .data(objectMapper.writeValueAsString(ChatEvent.error(null, message))));
            errorEmitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.warn("Could not deliver SSE error event: {}", e.getMessage());
            errorEmitter.completeWithError(e);
        }
        return errorEmitter;
    }
}
