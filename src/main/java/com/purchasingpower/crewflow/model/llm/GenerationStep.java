package com.purchasingpower.crewflow.model.llm;

import lombok.Value;

import java.util.List;

/**
 * Outcome of one provider streaming call: the text produced and, if the model asked
 * for them, the tool calls to run before continuing.
 */
@Value
public class GenerationStep {

    public enum StopReason {
        COMPLETED,
        TOOL_CALLS,
        STOPPED
    }

    String text;

    List<ToolCallRequest> toolCalls;

    StopReason stopReason;

    public static GenerationStep completed(String text) {
        return new GenerationStep(text, List.of(), StopReason.COMPLETED);
    }

    public static GenerationStep toolCalls(String text, List<ToolCallRequest> calls) {
        return new GenerationStep(text, List.copyOf(calls), StopReason.TOOL_CALLS);
    }

    public static GenerationStep stopped(String text) {
        return new GenerationStep(text, List.of(), StopReason.STOPPED);
    }

    public boolean hasToolCalls() {
        return stopReason == StopReason.TOOL_CALLS && !toolCalls.isEmpty();
    }
}
