package com.purchasingpower.crewflow.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Holds what a speculative draft produces until the turn knows whether the drafting crew
 * keeps the floor. Nothing reaches the caller unless {@link #release} is called.
 *
 * <p>The draft may stream text freely, but its tool calls wait in {@link #awaitDecision}
 * until the turn calls {@link #keep} or {@link #discard}, so a discarded draft never writes
 * fields or context entries.
 */
public class DraftBuffer implements TurnListener {

    private enum Decision { PENDING, KEEP, DROP }

    private final List<Consumer<TurnListener>> events = new ArrayList<>();
    private boolean closed;
    private Decision decision = Decision.PENDING;

    @Override
    public synchronized void onToken(String token) {
        if (!closed) {
            events.add(listener -> listener.onToken(token));
        }
    }

    @Override
    public synchronized void onToolCall(String toolName, String status) {
        if (!closed) {
            events.add(listener -> listener.onToolCall(toolName, status));
        }
    }

    /**
     * The drafting crew keeps the floor: held tool calls may run. Events stay buffered.
     */
    public synchronized void keep() {
        if (decision == Decision.PENDING) {
            decision = Decision.KEEP;
            notifyAll();
        }
    }

    /**
     * Block until the turn decides on this draft.
     *
     * @return true if the draft was kept, false if it was discarded or the wait was interrupted
     */
    public synchronized boolean awaitDecision() {
        while (decision == Decision.PENDING) {
            try {
                wait();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return decision == Decision.KEEP;
    }

    /**
     * Replay everything buffered, in order, to the real listener.
     */
    public synchronized void release(TurnListener downstream) {
        keep();
        closed = true;
        events.forEach(event -> event.accept(downstream));
        events.clear();
    }

    /**
     * Drop the draft. Later events are ignored and held tool calls never run.
     */
    public synchronized void discard() {
        closed = true;
        events.clear();
        if (decision == Decision.PENDING) {
            decision = Decision.DROP;
            notifyAll();
        }
    }

    public synchronized int size() {
        return events.size();
    }
}
