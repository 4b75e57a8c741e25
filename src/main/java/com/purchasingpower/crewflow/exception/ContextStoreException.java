package com.purchasingpower.crewflow.exception;

import com.purchasingpower.crewflow.context.ContextScope;
import lombok.Getter;

/**
 * Raised when the context store cannot complete a read or write.
 * Hooks must treat it as "transfer not yet safe".
 */
@Getter
public class ContextStoreException extends CrewFlowException {

    private final ContextScope scope;
    private final String key;

    public ContextStoreException(ContextScope scope, String key, String message, Throwable cause) {
        super(message, cause);
        this.scope = scope;
        this.key = key;
    }
}
