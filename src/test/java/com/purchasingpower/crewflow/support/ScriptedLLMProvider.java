package com.purchasingpower.crewflow.support;

import com.purchasingpower.crewflow.agent.CancellationSignal;
import com.purchasingpower.crewflow.agent.TurnListener;
import com.purchasingpower.crewflow.client.LLMProvider;
import com.purchasingpower.crewflow.model.llm.GenerationRequest;
import com.purchasingpower.crewflow.model.llm.GenerationStep;
import com.purchasingpower.crewflow.model.llm.ToolCallRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * LLM provider that answers from a script instead of a model. Text is streamed word by word.
 */
public class ScriptedLLMProvider implements LLMProvider {

    private final List<GenerationRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private volatile Function<GenerationRequest, GenerationStep> script = request -> GenerationStep.completed("ok");
    private volatile String chatAnswer = "{}";

    /**
     * Reply "Reply from {crew}" for every request.
     */
    public static ScriptedLLMProvider echoingCrewName() {
        ScriptedLLMProvider provider = new ScriptedLLMProvider();
        provider.respondWith(request -> GenerationStep.completed("Reply from " + request.getCrewName()));
        return provider;
    }

    public ScriptedLLMProvider respondWith(Function<GenerationRequest, GenerationStep> script) {
        this.script = script;
        return this;
    }

    public ScriptedLLMProvider answerChatWith(String json) {
        this.chatAnswer = json;
        return this;
    }

    public static ToolCallRequest call(String name, Map<String, Object> arguments) {
        return new ToolCallRequest(UUID.randomUUID().toString(), name, arguments);
    }

    public List<GenerationRequest> getRequests() {
        return List.copyOf(requests);
    }

    /**
     * Block until at least {@code count} streaming requests were made.
     */
    public void awaitRequests(int count, long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (requests.size() < count) {
            if (System.currentTimeMillis() > deadline) {
                throw new IllegalStateException("Expected " + count + " requests, got " + requests.size());
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for requests", e);
            }
        }
    }

    public List<String> crewsAsked() {
        return getRequests().stream().map(GenerationRequest::getCrewName).toList();
    }

    @Override
    public String chat(String prompt, String agentName, String conversationId) {
        return chatAnswer;
    }

    @Override
    public GenerationStep stream(GenerationRequest request, TurnListener listener, CancellationSignal cancellation) {
        requests.add(request);
        GenerationStep step = script.apply(request);
        if (cancellation.isCancelled()) {
            return GenerationStep.stopped("");
        }
        if (step.getText() != null && !step.getText().isEmpty()) {
            String[] words = step.getText().split("(?<= )");
            for (String word : words) {
                if (cancellation.isCancelled()) {
                    return GenerationStep.stopped("");
                }
                listener.onToken(word);
            }
        }
        return step;
    }

    @Override
    public String getProviderName() {
        return "Scripted";
    }
}
