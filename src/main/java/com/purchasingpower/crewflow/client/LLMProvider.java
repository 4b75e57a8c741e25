package com.purchasingpower.crewflow.client;

import com.purchasingpower.crewflow.agent.CancellationSignal;
import com.purchasingpower.crewflow.agent.TurnListener;
import com.purchasingpower.crewflow.model.llm.GenerationRequest;
import com.purchasingpower.crewflow.model.llm.GenerationStep;

/**
 * Interface to the LLM provider.
 *
 * Implementations handle provider-specific API and streaming details.
 */
public interface LLMProvider {

    /**
     * One-shot completion in JSON mode. Used by the field extraction micro-agent.
     *
     * @param prompt The prompt to send
     * @param agentName Name of the calling agent (for logging)
     * @param conversationId ID of the conversation (for logging)
     * @return The raw response text
     */
    String chat(String prompt, String agentName, String conversationId);

    /**
     * Stream one generation step. Text is pushed to the listener as it arrives; the step ends
     * with plain completion, a set of tool-call requests, or a stop caused by cancellation.
     *
     * @param request Guidance, context, tool schemas and transcript
     * @param listener Receives text tokens in order
     * @param cancellation Checked between chunks; when cancelled the step stops early
     */
    GenerationStep stream(GenerationRequest request, TurnListener listener, CancellationSignal cancellation);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
