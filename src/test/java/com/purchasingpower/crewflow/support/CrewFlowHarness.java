package com.purchasingpower.crewflow.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.agent.ConversationTurnGate;
import com.purchasingpower.crewflow.agent.CrewDispatcher;
import com.purchasingpower.crewflow.agent.GenerationLoop;
import com.purchasingpower.crewflow.agent.ToolSchemaFactory;
import com.purchasingpower.crewflow.agent.TurnListener;
import com.purchasingpower.crewflow.agent.TurnRequest;
import com.purchasingpower.crewflow.agent.TurnResult;
import com.purchasingpower.crewflow.config.CrewProperties;
import com.purchasingpower.crewflow.context.ContextStore;
import com.purchasingpower.crewflow.context.impl.InMemoryContextStore;
import com.purchasingpower.crewflow.crew.AgentCrewProvider;
import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.DynamicCrewService;
import com.purchasingpower.crewflow.crew.impl.CrewRegistryImpl;
import com.purchasingpower.crewflow.fields.FieldCollectionService;
import com.purchasingpower.crewflow.service.PromptLibraryService;
import com.purchasingpower.crewflow.transition.TransitionController;
import lombok.Getter;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The turn pipeline wired by hand around scripted model and extractor fakes.
 */
@Getter
public class CrewFlowHarness implements AutoCloseable {

    private static final PromptLibraryService PROMPTS = loadPrompts();

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CrewProperties properties = new CrewProperties();
    private final ScriptedLLMProvider llm = new ScriptedLLMProvider();
    private final ScriptedFieldExtractor extractor = new ScriptedFieldExtractor();
    private final InMemoryConversationService conversations = new InMemoryConversationService();
    private final ContextStore contextStore = new InMemoryContextStore(objectMapper);
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final CrewRegistryImpl registry;
    private final CrewDispatcher dispatcher;

    public CrewFlowHarness(List<AgentCrewProvider> providers) {
        DynamicCrewService noDatabaseCrews = new DynamicCrewService(null, null, null) {
            @Override
            public List<CrewDefinition> loadCrews(String agentName) {
                return List.of();
            }

            @Override
            public Set<String> agentNames() {
                return Set.of();
            }
        };
        registry = new CrewRegistryImpl(providers, noDatabaseCrews);
        GenerationLoop generationLoop = new GenerationLoop(llm, PROMPTS, new ToolSchemaFactory(objectMapper),
                properties, objectMapper);
        dispatcher = new CrewDispatcher(registry, conversations,
                new FieldCollectionService(extractor, properties),
                new TransitionController(conversations, properties),
                generationLoop, contextStore, new ConversationTurnGate(), properties, executor);
    }

    public static PromptLibraryService prompts() {
        return PROMPTS;
    }

    public TurnResult send(String agentName, String conversationId, String message) {
        return send(agentName, conversationId, message, TurnListener.NO_OP);
    }

    public TurnResult send(String agentName, String conversationId, String message, TurnListener listener) {
        return send(TurnRequest.builder()
                .agentName(agentName)
                .conversationId(conversationId)
                .userId("user-1")
                .message(message)
                .build(), listener);
    }

    public TurnResult send(TurnRequest request, TurnListener listener) {
        return dispatcher.handleTurn(request, listener);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static PromptLibraryService loadPrompts() {
        PromptLibraryService prompts = new PromptLibraryService();
        prompts.loadPrompts();
        return prompts;
    }
}
