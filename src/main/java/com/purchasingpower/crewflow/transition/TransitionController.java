package com.purchasingpower.crewflow.transition;

import com.purchasingpower.crewflow.config.CrewProperties;
import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.CrewSnapshot;
import com.purchasingpower.crewflow.crew.HookContext;
import com.purchasingpower.crewflow.exception.ContextStoreException;
import com.purchasingpower.crewflow.exception.CrewConfigurationException;
import com.purchasingpower.crewflow.exception.TransitionLoopException;
import com.purchasingpower.crewflow.service.ConversationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Evaluates transfer hooks and is the only writer of a conversation's active crew.
 *
 * <p>The pre-transfer chain is an explicit loop with a hop counter bounded by
 * {@code app.crew.max-transfer-hops}. A hook that fails on the context store counts as
 * "not yet safe to transfer". A terminal crew whose hook fires is a configuration error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransitionController {

    private final ConversationService conversationService;
    private final CrewProperties crewProperties;

    /**
     * Follow pre-transfers starting at {@code startCrew} until a crew declines to transfer.
     * Nothing is committed; the caller commits once the turn succeeds.
     *
     * @param contextFor builds the hook context for a crew of the chain
     * @throws TransitionLoopException if the chain is longer than the configured bound
     * @throws CrewConfigurationException if a terminal crew's hook fires
     */
    public PreTransferOutcome resolvePreTransfers(CrewSnapshot snapshot, CrewDefinition startCrew,
                                                  Function<CrewDefinition, HookContext> contextFor,
                                                  String conversationId) {
        int maxHops = crewProperties.getMaxTransferHops();
        List<String> path = new ArrayList<>(List.of(startCrew.getName()));
        List<CrewTransition> hops = new ArrayList<>();
        CrewDefinition current = startCrew;

        while (firesBeforeReply(current, contextFor.apply(current))) {
            CrewDefinition next = nextCrew(snapshot, current, TransferPhase.PRE);
            path.add(next.getName());
            if (hops.size() >= maxHops) {
                log.error("Pre-transfer loop in conversation {}: {}", conversationId, path);
                throw new TransitionLoopException(conversationId, path, maxHops);
            }
            hops.add(CrewTransition.of(current.getName(), next.getName(), TransferPhase.PRE));
            log.info("Pre-transfer {} -> {} (conversation {}, hop {})",
                    current.getName(), next.getName(), conversationId, hops.size());
            current = next;
        }
        return new PreTransferOutcome(current, List.copyOf(hops));
    }

    /**
     * Evaluate the post-transfer hook of the crew that just replied.
     *
     * @return the transition to apply before the next message, if the hook fired
     */
    public Optional<CrewTransition> evaluatePostTransfer(CrewSnapshot snapshot, CrewDefinition crew,
                                                         HookContext context, String reply) {
        boolean fire;
        try {
            fire = crew.effectivePostTransferRule().shouldTransfer(context, reply);
        } catch (ContextStoreException e) {
            log.warn("Post-transfer hook of crew {} hit a context store failure on {}, staying: {}",
                    crew.getName(), e.getKey(), e.getMessage());
            fire = false;
        }
        if (!fire) {
            return Optional.empty();
        }
        CrewDefinition next = nextCrew(snapshot, crew, TransferPhase.POST);
        return Optional.of(CrewTransition.of(crew.getName(), next.getName(), TransferPhase.POST));
    }

    /**
     * Point the conversation at the transition's target crew.
     */
    public void commit(String conversationId, CrewTransition transition) {
        conversationService.updateActiveCrew(conversationId, transition.getToCrew());
        log.info("Conversation {} active crew {} -> {} ({})", conversationId,
                transition.getFromCrew(), transition.getToCrew(), transition.getPhase());
    }

    /**
     * Commit the net effect of a pre-transfer chain.
     */
    public void commitChain(String conversationId, PreTransferOutcome outcome) {
        if (!outcome.transferred()) {
            return;
        }
        List<CrewTransition> hops = outcome.getHops();
        CrewTransition net = CrewTransition.of(hops.get(0).getFromCrew(),
                hops.get(hops.size() - 1).getToCrew(), TransferPhase.PRE);
        commit(conversationId, net);
    }

    private boolean firesBeforeReply(CrewDefinition crew, HookContext context) {
        try {
            return crew.effectivePreTransferRule().shouldTransfer(context);
        } catch (ContextStoreException e) {
            log.warn("Pre-transfer hook of crew {} hit a context store failure on {}, staying: {}",
                    crew.getName(), e.getKey(), e.getMessage());
            return false;
        }
    }

    private CrewDefinition nextCrew(CrewSnapshot snapshot, CrewDefinition crew, TransferPhase phase) {
        if (crew.isTerminal()) {
            throw new CrewConfigurationException(snapshot.getAgentName(), crew.getName(),
                    "Terminal crew '" + crew.getName() + "' fired its " + phase + " transfer hook");
        }
        return snapshot.resolve(crew.getTransitionTo());
    }
}
