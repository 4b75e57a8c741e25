package com.purchasingpower.crewflow.agent;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes turns per conversation. Turns of different conversations never wait on each other.
 *
 * <p>Locks are reference counted and removed once no turn holds or waits for them.
 */
@Component
public class ConversationTurnGate {

    private final Map<String, LockHolder> locks = new ConcurrentHashMap<>();

    public <T> T runExclusive(String conversationId, Supplier<T> action) {
        LockHolder holder = locks.compute(conversationId, (id, current) -> {
            LockHolder h = current != null ? current : new LockHolder();
            h.users++;
            return h;
        });

        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(conversationId, (id, h) -> --h.users == 0 ? null : h);
        }
    }

    /**
     * Conversations with a turn running or queued.
     */
    public int busyConversations() {
        return locks.size();
    }

    private static final class LockHolder {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
