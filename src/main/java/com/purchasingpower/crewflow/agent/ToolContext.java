package com.purchasingpower.crewflow.agent;

import com.purchasingpower.crewflow.context.ScopedContext;

import java.util.Map;

/**
 * Context provided to tools during execution.
 */
public interface ToolContext {

    String getAgentName();

    String getConversationId();

    String getUserId();

    /**
     * Crew whose generation requested the call.
     */
    String getCrewName();

    /**
     * Context store bound to this conversation and user.
     */
    ScopedContext getContext();

    /**
     * Collected fields as of the start of generation.
     */
    Map<String, Object> getCollectedFields();

    /**
     * Explicitly overwrite one collected field on behalf of the crew.
     */
    void updateField(String fieldName, Object value);
}
