package com.purchasingpower.crewflow.context;

/**
 * Visibility of a context entry.
 *
 * CONVERSATION entries are owned by a conversation id and are visible only inside it.
 * USER entries are owned by a user id and are shared by all of that user's
 * conversations and crews.
 */
public enum ContextScope {
    CONVERSATION,
    USER
}
