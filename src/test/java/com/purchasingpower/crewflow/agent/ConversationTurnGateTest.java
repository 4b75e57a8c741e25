package com.purchasingpower.crewflow.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationTurnGateTest {

    private final ConversationTurnGate gate = new ConversationTurnGate();

    @Test
    @DisplayName("Turns of one conversation never overlap")
    void sameConversationIsSerialized() throws Exception {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        List<Future<Integer>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < 8; i++) {
            futures.add(executor.submit(() -> gate.runExclusive("c1", () -> {
                int now = running.incrementAndGet();
                maxConcurrent.accumulateAndGet(now, Math::max);
                sleep(10);
                running.decrementAndGet();
                return now;
            })));
        }
        for (Future<Integer> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(maxConcurrent.get()).isEqualTo(1);
        assertThat(gate.busyConversations()).isZero();
    }

    @Test
    @DisplayName("Different conversations run in parallel")
    void differentConversationsRunInParallel() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch bothInside = new CountDownLatch(2);
        List<String> finished = Collections.synchronizedList(new ArrayList<>());

        Future<Boolean> first = executor.submit(
                () -> gate.runExclusive("c1", () -> awaitAndRecord(bothInside, finished, "c1")));
        Future<Boolean> second = executor.submit(
                () -> gate.runExclusive("c2", () -> awaitAndRecord(bothInside, finished, "c2")));

        assertThat(first.get(10, TimeUnit.SECONDS)).isTrue();
        assertThat(second.get(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(finished).containsExactlyInAnyOrder("c1", "c2");
    }

    @Test
    @DisplayName("Lock is released when the turn throws")
    void releasedOnFailure() {
        try {
            gate.runExclusive("c1", () -> {
                throw new IllegalStateException("boom");
            });
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("boom");
        }

        assertThat(gate.runExclusive("c1", () -> "next turn")).isEqualTo("next turn");
        assertThat(gate.busyConversations()).isZero();
    }

    private static boolean awaitAndRecord(CountDownLatch latch, List<String> finished, String id) {
        latch.countDown();
        try {
            boolean both = latch.await(5, TimeUnit.SECONDS);
            finished.add(id);
            return both;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
