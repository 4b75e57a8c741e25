package com.purchasingpower.crewflow.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.agent.impl.ToolContextImpl;
import com.purchasingpower.crewflow.client.LLMProvider;
import com.purchasingpower.crewflow.config.CrewProperties;
import com.purchasingpower.crewflow.crew.CrewDefaults;
import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.HookContext;
import com.purchasingpower.crewflow.exception.ContextStoreException;
import com.purchasingpower.crewflow.exception.GenerationBudgetExceededException;
import com.purchasingpower.crewflow.model.conversation.ChatMessage;
import com.purchasingpower.crewflow.model.llm.GenerationRequest;
import com.purchasingpower.crewflow.model.llm.GenerationStep;
import com.purchasingpower.crewflow.model.llm.ProviderMessage;
import com.purchasingpower.crewflow.model.llm.ToolCallRequest;
import com.purchasingpower.crewflow.model.llm.ToolSchema;
import com.purchasingpower.crewflow.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs one crew's reply: streams from the provider, dispatches requested tools, feeds their
 * results back and repeats until the model completes.
 *
 * <p>The number of tool round trips is bounded by {@code app.crew.max-tool-round-trips};
 * going past it fails the turn. A tool that fails or throws is reported to the model as
 * {@code {"error": ..., "tool": ...}} and never aborts the loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationLoop {

    static final String SYSTEM_PROMPT_TEMPLATE = "crew-generation";

    private final LLMProvider llmProvider;
    private final PromptLibraryService promptLibrary;
    private final ToolSchemaFactory toolSchemaFactory;
    private final CrewProperties crewProperties;
    private final ObjectMapper objectMapper;

    public GenerationResult generate(GenerationInput input, TurnListener listener, CancellationSignal cancellation) {
        CrewDefinition crew = input.getCrew();
        HookContext hookContext = input.getHookContext();
        int maxRoundTrips = crewProperties.getMaxToolRoundTrips();

        Map<String, Object> runtimeContext = buildRuntimeContext(crew, hookContext);
        List<ToolSchema> toolSchemas = crew.getTools().stream().map(toolSchemaFactory::schemaOf).toList();

        GenerationRequest request = GenerationRequest.builder()
                .agentName(hookContext.getAgentName())
                .conversationId(hookContext.getConversationId())
                .crewName(crew.getName())
                .model(crew.getModel())
                .maxTokens(crew.getMaxTokens())
                .systemPrompt(renderSystemPrompt(crew, runtimeContext, !toolSchemas.isEmpty()))
                .runtimeContext(runtimeContext)
                .tools(toolSchemas)
                .knowledgeBase(input.isKnowledgeBaseEnabled() ? crew.getKnowledgeBase() : null)
                .build();

        ToolContextImpl toolContext = ToolContextImpl.builder()
                .agentName(hookContext.getAgentName())
                .conversationId(hookContext.getConversationId())
                .userId(hookContext.getUserId())
                .crewName(crew.getName())
                .context(hookContext.getContext())
                .collectedFields(new HashMap<>(hookContext.getCollectedFields()))
                .fieldWriter(input.getFieldWriter())
                .build();

        List<ProviderMessage> transcript = toProviderMessages(input.getHistory(), crew, hookContext);
        StringBuilder reply = new StringBuilder();
        int roundTrips = 0;
        int toolCalls = 0;

        while (true) {
            if (cancellation.isCancelled()) {
                return new GenerationResult(crew.getName(), reply.toString(), toolCalls, true);
            }

            GenerationStep step = llmProvider.stream(
                    request.toBuilder().messages(List.copyOf(transcript)).build(), listener, cancellation);
            if (step.getText() != null) {
                reply.append(step.getText());
            }

            if (step.getStopReason() == GenerationStep.StopReason.STOPPED || cancellation.isCancelled()) {
                log.info("Generation for crew {} stopped (conversation {})",
                        crew.getName(), hookContext.getConversationId());
                return new GenerationResult(crew.getName(), reply.toString(), toolCalls, true);
            }
            if (!step.hasToolCalls()) {
                String finalReply = crew.effectiveMessageProcessor().postProcess(reply.toString(), hookContext);
                return new GenerationResult(crew.getName(), finalReply, toolCalls, false);
            }

            if (roundTrips >= maxRoundTrips) {
                log.error("Crew {} exceeded {} tool round trips (conversation {})",
                        crew.getName(), maxRoundTrips, hookContext.getConversationId());
                throw new GenerationBudgetExceededException(crew.getName(), maxRoundTrips);
            }
            roundTrips++;

            if (input.getToolGate() != null && !input.getToolGate().getAsBoolean()) {
                log.debug("Generation of crew {} dropped before running tools (conversation {})",
                        crew.getName(), hookContext.getConversationId());
                return new GenerationResult(crew.getName(), reply.toString(), toolCalls, true);
            }

            transcript.add(ProviderMessage.assistantToolCalls(step.getText(), step.getToolCalls()));
            for (ToolCallRequest call : step.getToolCalls()) {
                String toolName = ToolSchemaFactory.toolNameOf(call.getName());
                listener.onToolCall(toolName, "Executing...");

                ToolResult result = executeTool(crew, toolName, call.getArguments(), toolContext);
                toolCalls++;

                listener.onToolCall(toolName, result.isSuccess() ? "Completed" : "Failed");
                transcript.add(ProviderMessage.toolResult(call, toJson(result.toPayload(toolName))));
            }
        }
    }

    private ToolResult executeTool(CrewDefinition crew, String toolName, Map<String, Object> parameters,
                                   ToolContext context) {
        Tool tool = crew.findTool(toolName).orElse(null);
        if (tool == null) {
            String validTools = crew.getTools().stream().map(Tool::getName).collect(Collectors.joining(", "));
            log.warn("Unknown tool '{}' requested by crew {}. Valid tools: {}", toolName, crew.getName(), validTools);
            return ToolResult.failure("Tool '" + toolName + "' does not exist. Valid tools: " + validTools);
        }

        log.info("Executing tool: {} (crew {})", toolName, crew.getName());
        try {
            ToolResult result = tool.execute(parameters != null ? parameters : Map.of(), context);
            if (result == null) {
                return ToolResult.failure("Tool returned no result");
            }
            if (!result.isSuccess()) {
                log.warn("Tool {} reported failure: {}", toolName, result.getMessage());
            }
            return result;
        } catch (Exception e) {
            log.error("Tool {} failed", toolName, e);
            return ToolResult.failure("Tool execution failed: " + e.getMessage());
        }
    }

    private Map<String, Object> buildRuntimeContext(CrewDefinition crew, HookContext hookContext) {
        try {
            Map<String, Object> context = crew.effectiveContextBuilder().buildContext(hookContext);
            return context != null ? context : CrewDefaults.baseContext(hookContext);
        } catch (ContextStoreException e) {
            log.warn("Context builder of crew {} hit a context store failure on {}, using base context: {}",
                    crew.getName(), e.getKey(), e.getMessage());
            return CrewDefaults.baseContext(hookContext);
        }
    }

    private String renderSystemPrompt(CrewDefinition crew, Map<String, Object> runtimeContext, boolean hasTools) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("guidance", crew.getGuidance() != null ? crew.getGuidance() : "");
        variables.put("contextJson", toPrettyJson(runtimeContext));
        variables.put("hasTools", hasTools);
        return promptLibrary.render(SYSTEM_PROMPT_TEMPLATE, variables);
    }

    /**
     * Recent history as provider messages. The inbound user message goes through the crew's
     * pre-processor.
     */
    private List<ProviderMessage> toProviderMessages(List<ChatMessage> history, CrewDefinition crew,
                                                     HookContext hookContext) {
        List<ProviderMessage> messages = new ArrayList<>();
        if (history == null || history.isEmpty()) {
            return messages;
        }
        int from = Math.max(0, history.size() - crewProperties.getHistoryWindow());
        for (int i = from; i < history.size(); i++) {
            ChatMessage message = history.get(i);
            String content = message.getContent();
            if (i == history.size() - 1 && message.isUser()) {
                content = crew.effectiveMessageProcessor().preProcess(content, hookContext);
            }
            messages.add(ProviderMessage.of(message.getRole(), content));
        }
        return messages;
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Tool result is not serializable: {}", e.getMessage());
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("result", String.valueOf(payload));
            return objectMapper.valueToTree(fallback).toString();
        }
    }

    private String toPrettyJson(Map<String, Object> value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Runtime context is not serializable", e);
        }
    }
}
