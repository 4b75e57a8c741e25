package com.purchasingpower.crewflow.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class TransitionLoopException extends CrewFlowException {

    private final String conversationId;
    private final List<String> path;
    private final int maxHops;

    public TransitionLoopException(String conversationId, List<String> path, int maxHops) {
        super("Pre-transfer chain exceeded " + maxHops + " hops: " + String.join(" -> ", path));
        this.conversationId = conversationId;
        this.path = List.copyOf(path);
        this.maxHops = maxHops;
    }
}
