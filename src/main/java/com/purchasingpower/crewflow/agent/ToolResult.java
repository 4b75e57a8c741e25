package com.purchasingpower.crewflow.agent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result from a tool execution.
 *
 * <p>Successful results carry JSON-serializable data. Failed results carry a message that
 * is returned to the model as a structured error payload.
 */
public interface ToolResult {

    /**
     * Whether the tool executed successfully.
     */
    boolean isSuccess();

    /**
     * The primary result data, fed back to the model.
     */
    Object getData();

    /**
     * Human-readable message about the result.
     */
    String getMessage();

    /**
     * Payload handed back to the model: the data on success, {@code {error, tool}} on failure.
     */
    default Object toPayload(String toolName) {
        if (isSuccess()) {
            return getData() != null ? getData() : Map.of("status", "ok", "message", String.valueOf(getMessage()));
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", getMessage());
        error.put("tool", toolName);
        return error;
    }

    /**
     * Create a successful result.
     */
    static ToolResult success(Object data, String message) {
        return new ToolResultImpl(true, data, message);
    }

    /**
     * Create a failed result.
     */
    static ToolResult failure(String message) {
        return new ToolResultImpl(false, null, message);
    }
}

/**
 * Default implementation of ToolResult.
 */
record ToolResultImpl(boolean isSuccess, Object data, String message) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public Object getData() {
        return data;
    }

    @Override
    public String getMessage() {
        return message;
    }
}
