package com.purchasingpower.crewflow.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.agent.CancellationSignal;
import com.purchasingpower.crewflow.agent.TurnListener;
import com.purchasingpower.crewflow.agent.ToolSchemaFactory;
import com.purchasingpower.crewflow.exception.LLMProviderException;
import com.purchasingpower.crewflow.model.llm.GenerationRequest;
import com.purchasingpower.crewflow.model.llm.GenerationStep;
import com.purchasingpower.crewflow.model.llm.ProviderMessage;
import com.purchasingpower.crewflow.model.llm.ToolCallRequest;
import com.purchasingpower.crewflow.model.llm.ToolSchema;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Ollama LLM provider implementation over the /api/chat endpoint.
 *
 * Crew replies stream as NDJSON chunks with native tool calling; field extraction uses a
 * separate, smaller model in JSON mode.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OllamaClient implements LLMProvider {

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private WebClient ollamaWebClient;

    @Value("${app.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${app.ollama.chat-model:qwen2.5:14b}")
    private String chatModel;

    @Value("${app.ollama.extraction-model:qwen2.5:7b}")
    private String extractionModel;

    @Value("${app.ollama.num-ctx:16384}")
    private int numCtx;

    @PostConstruct
    public void init() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(Duration.ofMinutes(5))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(5, TimeUnit.MINUTES))
                        .addHandlerLast(new WriteTimeoutHandler(1, TimeUnit.MINUTES)));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + chatModel + ")";
    }

    @Override
    public String chat(String prompt, String agentName, String conversationId) {
        log.info("[LLM REQUEST] Provider=Ollama, Agent={}, Model={}", agentName, extractionModel);
        long startTime = System.currentTimeMillis();

        Map<String, Object> body = Map.of(
                "model", extractionModel,
                "messages", List.of(
                        Map.of("role", "system", "content", "You are a precise data extraction engine. Output only valid JSON."),
                        Map.of("role", "user", "content", prompt)
                ),
                "stream", false,
                "format", "json",
                "options", Map.of(
                        "num_ctx", numCtx,
                        "temperature", 0.0
                )
        );

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String content = response == null ? "" : response.path("message").path("content").asText();
            log.info("[LLM RESPONSE] Provider=Ollama, Conversation={}, Latency={}ms, ResponseLength={}",
                    conversationId, System.currentTimeMillis() - startTime, content.length());
            return content;

        } catch (WebClientException e) {
            log.error("Ollama call failed for model {}: {}", extractionModel, e.getMessage());
            throw new LLMProviderException("Ollama extraction call failed. Ensure " + extractionModel
                    + " is downloaded and Ollama is running.", e);
        }
    }

    @Override
    public GenerationStep stream(GenerationRequest request, TurnListener listener, CancellationSignal cancellation) {
        String model = request.getModel() != null ? request.getModel() : chatModel;
        log.info("[LLM STREAM] Provider=Ollama, Agent={}, Crew={}, Model={}, Messages={}, Tools={}",
                request.getAgentName(), request.getCrewName(), model,
                request.getMessages().size(), request.getTools().size());
        if (request.getKnowledgeBase() != null) {
            log.debug("Knowledge base {} requested by crew {}; Ollama has no retrieval backend configured",
                    request.getKnowledgeBase().getStoreId(), request.getCrewName());
        }

        StringBuilder text = new StringBuilder();
        List<ToolCallRequest> toolCalls = new ArrayList<>();

        try (Stream<JsonNode> chunks = ollamaWebClient.post()
                .uri("/api/chat")
                .bodyValue(buildStreamBody(request, model))
                .retrieve()
                .bodyToFlux(JsonNode.class)
                .toStream()) {

            Iterator<JsonNode> iterator = chunks.iterator();
            while (iterator.hasNext()) {
                if (cancellation.isCancelled()) {
                    log.info("Generation cancelled for crew {} after {} chars", request.getCrewName(), text.length());
                    return GenerationStep.stopped(text.toString());
                }
                JsonNode chunk = iterator.next();
                JsonNode message = chunk.path("message");

                String content = message.path("content").asText("");
                if (!content.isEmpty()) {
                    text.append(content);
                    listener.onToken(content);
                }
                for (JsonNode call : message.path("tool_calls")) {
                    toolCalls.add(toToolCall(call));
                }
                if (chunk.path("done").asBoolean(false)) {
                    break;
                }
            }
        } catch (WebClientException e) {
            log.error("Ollama stream failed for crew {}: {}", request.getCrewName(), e.getMessage());
            throw new LLMProviderException("Ollama generation failed for crew " + request.getCrewName(), e);
        }

        return toolCalls.isEmpty()
                ? GenerationStep.completed(text.toString())
                : GenerationStep.toolCalls(text.toString(), toolCalls);
    }

    private Map<String, Object> buildStreamBody(GenerationRequest request, String model) {
        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        for (ProviderMessage message : request.getMessages()) {
            messages.add(toOllamaMessage(message));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("stream", true);
        if (!request.getTools().isEmpty()) {
            body.put("tools", request.getTools().stream().map(this::toOllamaTool).toList());
        }
        body.put("options", Map.of(
                "num_ctx", numCtx,
                "num_predict", request.getMaxTokens(),
                "temperature", 0.7
        ));
        return body;
    }

    private Map<String, Object> toOllamaMessage(ProviderMessage message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("role", message.getRole());
        result.put("content", message.getContent() == null ? "" : message.getContent());
        if (!message.getToolCalls().isEmpty()) {
            result.put("tool_calls", message.getToolCalls().stream()
                    .map(call -> Map.of("function", Map.of("name", call.getName(), "arguments", call.getArguments())))
                    .toList());
        }
        if (message.getToolName() != null) {
            result.put("tool_name", message.getToolName());
        }
        return result;
    }

    private Map<String, Object> toOllamaTool(ToolSchema schema) {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", schema.getName(),
                        "description", schema.getDescription() == null ? "" : schema.getDescription(),
                        "parameters", schema.getParameters()
                )
        );
    }

    private ToolCallRequest toToolCall(JsonNode call) {
        JsonNode function = call.path("function");
        JsonNode arguments = function.path("arguments");
        Map<String, Object> args;
        if (arguments.isTextual()) {
            args = parseArguments(arguments.asText());
        } else if (arguments.isObject()) {
            args = objectMapper.convertValue(arguments, ARGUMENTS);
        } else {
            args = Map.of();
        }
        String id = call.hasNonNull("id") ? call.get("id").asText() : UUID.randomUUID().toString();
        String name = function.path("name").asText();
        log.debug("Model requested tool {} ({})", name, ToolSchemaFactory.toolNameOf(name));
        return new ToolCallRequest(id, name, args);
    }

    private Map<String, Object> parseArguments(String json) {
        try {
            return objectMapper.readValue(json, ARGUMENTS);
        } catch (Exception e) {
            log.warn("Tool call arguments are not valid JSON, passing none: {}", e.getMessage());
            return Map.of();
        }
    }
}
