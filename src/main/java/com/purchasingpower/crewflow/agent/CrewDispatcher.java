package com.purchasingpower.crewflow.agent;

import com.google.common.base.Preconditions;
import com.purchasingpower.crewflow.config.CrewProperties;
import com.purchasingpower.crewflow.context.ContextStore;
import com.purchasingpower.crewflow.context.ScopedContext;
import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.CrewRegistry;
import com.purchasingpower.crewflow.crew.CrewSnapshot;
import com.purchasingpower.crewflow.crew.HookContext;
import com.purchasingpower.crewflow.exception.CrewFlowException;
import com.purchasingpower.crewflow.fields.FieldCollectionOutcome;
import com.purchasingpower.crewflow.fields.FieldCollectionService;
import com.purchasingpower.crewflow.model.conversation.ChatMessage;
import com.purchasingpower.crewflow.model.conversation.Conversation;
import com.purchasingpower.crewflow.service.ConversationService;
import com.purchasingpower.crewflow.transition.CrewTransition;
import com.purchasingpower.crewflow.transition.PreTransferOutcome;
import com.purchasingpower.crewflow.transition.TransitionController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Runs one turn of an agent conversation.
 *
 * <p>Order within a turn: capture the agent's crew snapshot, record the user message, collect
 * fields for the active crew, follow pre-transfers, generate the reply, then evaluate the
 * post-transfer of the crew that replied. Turns of one conversation are serialized through
 * {@link ConversationTurnGate}.
 *
 * <p>Pre-transfer moves are committed only once the reply is generated and the post-transfer
 * hook has been evaluated, so a turn that fails at any step leaves the conversation on the crew
 * it started with.
 *
 * <p>A request may name an override crew. It answers this turn in place of the active crew
 * when the agent has it; otherwise the active crew is used and a warning is logged.
 */
@Slf4j
@Service
public class CrewDispatcher {

    private final CrewRegistry crewRegistry;
    private final ConversationService conversationService;
    private final FieldCollectionService fieldCollectionService;
    private final TransitionController transitionController;
    private final GenerationLoop generationLoop;
    private final ContextStore contextStore;
    private final ConversationTurnGate turnGate;
    private final CrewProperties crewProperties;
    private final Executor turnExecutor;

    private final Map<String, CancellationSignal> inFlight = new ConcurrentHashMap<>();

    public CrewDispatcher(CrewRegistry crewRegistry,
                          ConversationService conversationService,
                          FieldCollectionService fieldCollectionService,
                          TransitionController transitionController,
                          GenerationLoop generationLoop,
                          ContextStore contextStore,
                          ConversationTurnGate turnGate,
                          CrewProperties crewProperties,
                          @Qualifier("turnExecutor") Executor turnExecutor) {
        this.crewRegistry = crewRegistry;
        this.conversationService = conversationService;
        this.fieldCollectionService = fieldCollectionService;
        this.transitionController = transitionController;
        this.generationLoop = generationLoop;
        this.contextStore = contextStore;
        this.turnGate = turnGate;
        this.crewProperties = crewProperties;
        this.turnExecutor = turnExecutor;
    }

    /**
     * Process one user message. Blocks until the turn completes, fails or is cancelled.
     */
    public TurnResult handleTurn(TurnRequest request, TurnListener listener) {
        Preconditions.checkArgument(request.getAgentName() != null && !request.getAgentName().isBlank(),
                "Agent name cannot be empty");
        Preconditions.checkArgument(request.getConversationId() != null, "Conversation id cannot be null");
        Preconditions.checkArgument(request.getMessage() != null && !request.getMessage().isBlank(),
                "Message cannot be empty");

        return turnGate.runExclusive(request.getConversationId(), () -> {
            CancellationSignal cancellation = new CancellationSignal();
            inFlight.put(request.getConversationId(), cancellation);
            try {
                return runTurn(request, listener, cancellation);
            } catch (RuntimeException e) {
                log.error("Turn failed for conversation {} (agent {}): {}",
                        request.getConversationId(), request.getAgentName(), e.getMessage());
                throw e;
            } finally {
                inFlight.remove(request.getConversationId(), cancellation);
            }
        });
    }

    /**
     * Cancel the turn currently running for a conversation.
     *
     * @return true if a running turn was signalled
     */
    public boolean cancel(String conversationId) {
        CancellationSignal signal = inFlight.get(conversationId);
        if (signal == null) {
            return false;
        }
        boolean cancelled = signal.cancel();
        if (cancelled) {
            log.info("Cancellation requested for conversation {}", conversationId);
        }
        return cancelled;
    }

    public boolean isRunning(String conversationId) {
        return inFlight.containsKey(conversationId);
    }

    private TurnResult runTurn(TurnRequest request, TurnListener listener, CancellationSignal cancellation) {
        long startTime = System.currentTimeMillis();
        String conversationId = request.getConversationId();

        CrewSnapshot snapshot = crewRegistry.load(request.getAgentName());
        Conversation conversation = conversationService.getConversation(conversationId)
                .orElseGet(() -> conversationService.startConversation(conversationId, request.getUserId(),
                        request.getAgentName(), snapshot.getDefaultCrewName()));
        if (!snapshot.getAgentName().equals(conversation.getAgentName())) {
            throw new CrewFlowException("Conversation " + conversationId + " belongs to agent "
                    + conversation.getAgentName() + ", not " + request.getAgentName());
        }

        CrewDefinition startCrew = startCrew(snapshot, conversation, request.getOverrideCrewMember());
        log.info("Turn started: conversation={}, agent={}, crew={}, snapshot={}",
                conversationId, snapshot.getAgentName(), startCrew.getName(), snapshot.getVersion());

        conversationService.addMessage(conversationId, ChatMessage.USER, request.getMessage(), startCrew.getName());
        List<ChatMessage> history = conversationService.getHistory(conversationId);
        ScopedContext scopedContext = new ScopedContext(contextStore, conversationId, conversation.getUserId());

        Map<String, Object> collected = Collections.synchronizedMap(
                new LinkedHashMap<>(conversation.getCollectedFields()));
        BiConsumer<String, Object> fieldWriter = (name, value) -> {
            conversationService.mergeCollectedFields(conversationId, Collections.singletonMap(name, value));
            collected.put(name, value);
        };
        Function<CrewDefinition, HookContext> contextFor = crew -> HookContext.builder()
                .agentName(snapshot.getAgentName())
                .conversationId(conversationId)
                .userId(conversation.getUserId())
                .crew(crew)
                .collectedFields(readOnlyCopy(collected))
                .context(scopedContext)
                .build();
        Function<CrewDefinition, GenerationInput> inputFor = crew -> GenerationInput.builder()
                .crew(crew)
                .hookContext(contextFor.apply(crew))
                .history(history)
                .knowledgeBaseEnabled(request.isKnowledgeBaseEnabled())
                .fieldWriter(fieldWriter)
                .build();

        Draft draft = crewProperties.isSpeculativeDraft()
                ? startDraft(inputFor.apply(startCrew), cancellation)
                : null;
        try {
            FieldCollectionOutcome fields = fieldCollectionService.collect(snapshot.getAgentName(), conversationId,
                    startCrew, history, readOnlyCopy(collected));
            if (!fields.getUpdates().isEmpty()) {
                conversationService.mergeCollectedFields(conversationId, fields.getUpdates());
                collected.putAll(fields.getUpdates());
            }

            PreTransferOutcome preTransfer = transitionController.resolvePreTransfers(
                    snapshot, startCrew, contextFor, conversationId);
            CrewDefinition responding = preTransfer.getRespondingCrew();
            // An override answers this turn only; the stored crew stays active unless a transfer fires
            CrewDefinition stored = preTransfer.transferred() ? responding
                    : snapshot.find(conversation.getActiveCrewName()).orElse(responding);

            GenerationResult generation;
            if (draft != null && !preTransfer.transferred()) {
                draft.buffer.keep();
                generation = draft.await();
                draft.buffer.release(listener);
            } else {
                if (draft != null) {
                    log.debug("Discarding draft of crew {} after pre-transfer", startCrew.getName());
                    draft.abandon();
                }
                generation = generationLoop.generate(inputFor.apply(responding), listener, cancellation);
            }
            draft = null;

            List<CrewTransition> transitions = new ArrayList<>();
            if (generation.isCancelled()) {
                transitionController.commitChain(conversationId, preTransfer);
                notifyPreTransfers(preTransfer, transitions, listener);
                log.info("Turn cancelled: conversation={}, crew={}", conversationId, responding.getName());
                return result(conversationId, responding, stored, generation, transitions, collected, startTime);
            }

            // Decided before anything is written: a misconfigured hook fails the turn cleanly
            Optional<CrewTransition> postTransfer = transitionController.evaluatePostTransfer(
                    snapshot, responding, contextFor.apply(responding), generation.getText());

            conversationService.addMessage(conversationId, ChatMessage.ASSISTANT, generation.getText(),
                    responding.getName());
            transitionController.commitChain(conversationId, preTransfer);
            notifyPreTransfers(preTransfer, transitions, listener);

            CrewDefinition active = stored;
            if (postTransfer.isPresent()) {
                transitionController.commit(conversationId, postTransfer.get());
                transitions.add(postTransfer.get());
                listener.onTransition(postTransfer.get());
                active = snapshot.resolve(postTransfer.get().getToCrew());
            }

            TurnResult result = result(conversationId, responding, active, generation, transitions, collected,
                    startTime);
            log.info("Turn completed: conversation={}, crew={}, next={}, tools={}, {}ms", conversationId,
                    responding.getName(), active.getName(), generation.getToolCalls(), result.getDurationMs());
            return result;
        } finally {
            if (draft != null) {
                draft.abandon();
            }
        }
    }

    private CrewDefinition startCrew(CrewSnapshot snapshot, Conversation conversation, String overrideCrewName) {
        if (overrideCrewName != null && !overrideCrewName.isBlank()) {
            Optional<CrewDefinition> override = snapshot.find(overrideCrewName);
            if (override.isPresent()) {
                log.info("Using override crew {} for conversation {} (active crew {})", overrideCrewName,
                        conversation.getConversationId(), conversation.getActiveCrewName());
                return override.get();
            }
            log.warn("Override crew {} not found in agent {}, falling back to active crew {}",
                    overrideCrewName, snapshot.getAgentName(), conversation.getActiveCrewName());
        }
        return snapshot.resolve(conversation.getActiveCrewName());
    }

    /**
     * Draft on the turn executor. Its tool calls wait for the turn's keep or discard decision.
     */
    private Draft startDraft(GenerationInput input, CancellationSignal cancellation) {
        DraftBuffer buffer = new DraftBuffer();
        CancellationSignal signal = cancellation.child();
        GenerationInput gated = input.toBuilder().toolGate(buffer::awaitDecision).build();
        CompletableFuture<GenerationResult> future = CompletableFuture.supplyAsync(
                () -> generationLoop.generate(gated, buffer, signal), turnExecutor);
        log.debug("Speculative draft started for crew {}", input.getCrew().getName());
        return new Draft(buffer, signal, future);
    }

    private void notifyPreTransfers(PreTransferOutcome preTransfer, List<CrewTransition> transitions,
                                    TurnListener listener) {
        for (CrewTransition hop : preTransfer.getHops()) {
            transitions.add(hop);
            listener.onTransition(hop);
        }
    }

    private TurnResult result(String conversationId, CrewDefinition responding, CrewDefinition active,
                              GenerationResult generation, List<CrewTransition> transitions,
                              Map<String, Object> collected, long startTime) {
        return TurnResult.builder()
                .conversationId(conversationId)
                .respondingCrew(responding.getName())
                .activeCrew(active.getName())
                .reply(generation.getText())
                .transitions(List.copyOf(transitions))
                .collectedFields(readOnlyCopy(collected))
                .toolCalls(generation.getToolCalls())
                .cancelled(generation.isCancelled())
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private static Map<String, Object> readOnlyCopy(Map<String, Object> collected) {
        synchronized (collected) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(collected));
        }
    }

    private static final class Draft {
        private final DraftBuffer buffer;
        private final CancellationSignal signal;
        private final CompletableFuture<GenerationResult> future;

        private Draft(DraftBuffer buffer, CancellationSignal signal, CompletableFuture<GenerationResult> future) {
            this.buffer = buffer;
            this.signal = signal;
            this.future = future;
        }

        GenerationResult await() {
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                signal.cancel();
                throw new CrewFlowException("Interrupted while waiting for draft", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new CrewFlowException("Draft generation failed", e.getCause());
            }
        }

        void abandon() {
            signal.cancel();
            buffer.discard();
        }
    }
}
