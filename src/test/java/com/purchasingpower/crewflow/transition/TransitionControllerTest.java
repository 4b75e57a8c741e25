package com.purchasingpower.crewflow.transition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.config.CrewProperties;
import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.context.ContextStore;
import com.purchasingpower.crewflow.context.ScopedContext;
import com.purchasingpower.crewflow.context.impl.InMemoryContextStore;
import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.CrewSnapshot;
import com.purchasingpower.crewflow.crew.HookContext;
import com.purchasingpower.crewflow.exception.CrewConfigurationException;
import com.purchasingpower.crewflow.exception.TransitionLoopException;
import com.purchasingpower.crewflow.support.FailingContextStore;
import com.purchasingpower.crewflow.support.InMemoryConversationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransitionControllerTest {

    private InMemoryConversationService conversations;
    private CrewProperties properties;
    private TransitionController controller;

    @BeforeEach
    void setUp() {
        conversations = new InMemoryConversationService();
        conversations.startConversation("c1", "u1", "agent", "a");
        properties = new CrewProperties();
        controller = new TransitionController(conversations, properties);
    }

    private static Function<CrewDefinition, HookContext> contextFor(ContextStore store) {
        ScopedContext context = new ScopedContext(store, "c1", "u1");
        return crew -> HookContext.builder().agentName("agent").conversationId("c1").userId("u1")
                .crew(crew).collectedFields(Map.of()).context(context).build();
    }

    private static CrewDefinition alwaysTransfers(String name, String to, boolean isDefault) {
        return CrewDefinition.builder().name(name).transitionTo(to).isDefault(isDefault)
                .preTransferRule(context -> true).build();
    }

    @Test
    @DisplayName("Pre-transfers chain until a crew declines, nothing is committed yet")
    void chainStopsAtDecliningCrew() {
        // Given a -> b -> c where c declines
        CrewSnapshot snapshot = CrewSnapshot.of("agent", 1, List.of(
                alwaysTransfers("a", "b", true),
                alwaysTransfers("b", "c", false),
                CrewDefinition.builder().name("c").build()));

        // When
        PreTransferOutcome outcome = controller.resolvePreTransfers(snapshot, snapshot.resolve("a"),
                contextFor(new InMemoryContextStore(new ObjectMapper())), "c1");

        // Then
        assertThat(outcome.getRespondingCrew().getName()).isEqualTo("c");
        assertThat(outcome.getHops()).extracting(CrewTransition::getToCrew).containsExactly("b", "c");
        assertThat(conversations.activeCrew("c1")).isEqualTo("a");
    }

    @Test
    @DisplayName("Committing a chain writes its final crew once")
    void commitChainWritesNetEffect() {
        CrewSnapshot snapshot = CrewSnapshot.of("agent", 1, List.of(
                alwaysTransfers("a", "b", true),
                alwaysTransfers("b", "c", false),
                CrewDefinition.builder().name("c").build()));
        PreTransferOutcome outcome = controller.resolvePreTransfers(snapshot, snapshot.resolve("a"),
                contextFor(new InMemoryContextStore(new ObjectMapper())), "c1");

        controller.commitChain("c1", outcome);

        assertThat(conversations.activeCrew("c1")).isEqualTo("c");
        assertThat(conversations.getCrewChanges()).containsExactly("c");
    }

    @Test
    @DisplayName("Cycle of pre-transfers fails once the hop bound is passed")
    void cycleIsBounded() {
        // Given a <-> b, both always transferring
        properties.setMaxTransferHops(3);
        CrewSnapshot snapshot = CrewSnapshot.of("agent", 1, List.of(
                alwaysTransfers("a", "b", true),
                alwaysTransfers("b", "a", false)));

        // Then
        assertThatThrownBy(() -> controller.resolvePreTransfers(snapshot, snapshot.resolve("a"),
                contextFor(new InMemoryContextStore(new ObjectMapper())), "c1"))
                .isInstanceOf(TransitionLoopException.class)
                .hasMessageContaining("3 hops");
        assertThat(conversations.activeCrew("c1")).isEqualTo("a");
    }

    @Test
    @DisplayName("Terminal crew whose hook fires is a configuration error")
    void terminalCrewFiring() {
        CrewSnapshot snapshot = CrewSnapshot.of("agent", 1, List.of(
                CrewDefinition.builder().name("a").isDefault(true).preTransferRule(context -> true).build()));

        assertThatThrownBy(() -> controller.resolvePreTransfers(snapshot, snapshot.resolve("a"),
                contextFor(new InMemoryContextStore(new ObjectMapper())), "c1"))
                .isInstanceOf(CrewConfigurationException.class)
                .hasMessageContaining("Terminal crew 'a'");
    }

    @Test
    @DisplayName("Hook that fails on the context store counts as not transferring")
    void contextStoreFailureMeansStay() {
        // Given a hook that reads the context store
        CrewSnapshot snapshot = CrewSnapshot.of("agent", 1, List.of(
                CrewDefinition.builder().name("a").transitionTo("b").isDefault(true)
                        .preTransferRule(context -> context.getContext()
                                .read(ContextScope.USER, "profile").isPresent())
                        .postTransferRule((context, reply) -> context.getContext()
                                .read(ContextScope.USER, "profile").isPresent())
                        .build(),
                CrewDefinition.builder().name("b").build()));
        Function<CrewDefinition, HookContext> failing = contextFor(new FailingContextStore());

        // When
        PreTransferOutcome outcome = controller.resolvePreTransfers(snapshot, snapshot.resolve("a"), failing, "c1");
        Optional<CrewTransition> post = controller.evaluatePostTransfer(snapshot, snapshot.resolve("a"),
                failing.apply(snapshot.resolve("a")), "reply");

        // Then
        assertThat(outcome.transferred()).isFalse();
        assertThat(post).isEmpty();
    }

    @Test
    @DisplayName("Post-transfer returns the transition without committing it")
    void postTransferEvaluation() {
        CrewSnapshot snapshot = CrewSnapshot.of("agent", 1, List.of(
                CrewDefinition.builder().name("a").transitionTo("b").isDefault(true).oneShot(true).build(),
                CrewDefinition.builder().name("b").build()));

        Optional<CrewTransition> post = controller.evaluatePostTransfer(snapshot, snapshot.resolve("a"),
                contextFor(new InMemoryContextStore(new ObjectMapper())).apply(snapshot.resolve("a")), "Hi");

        assertThat(post).hasValueSatisfying(transition -> {
            assertThat(transition.getToCrew()).isEqualTo("b");
            assertThat(transition.getPhase()).isEqualTo(TransferPhase.POST);
        });
        assertThat(conversations.activeCrew("c1")).isEqualTo("a");
    }
}
