package com.purchasingpower.crewflow.agent.tools;

import com.purchasingpower.crewflow.agent.Tool;
import com.purchasingpower.crewflow.agent.ToolContext;
import com.purchasingpower.crewflow.agent.ToolResult;
import com.purchasingpower.crewflow.context.ContextScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends an audit entry to the conversation's {@code event_log} context entry.
 */
@Slf4j
@Component
public class LogEventTool implements Tool {

    public static final String EVENT_LOG_KEY = "event_log";

    @Override
    public String getName() {
        return "log_event";
    }

    @Override
    public String getDescription() {
        return "Record a notable conversation event (consent given, document requested, escalation) in the audit log.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "event_type": {"type": "string", "description": "Short event identifier"},
                    "details": {"type": "object", "description": "Free-form event details"}
                  },
                  "required": ["event_type"]
                }
                """;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        Object eventType = parameters.get("event_type");
        if (!(eventType instanceof String type) || type.isBlank()) {
            return ToolResult.failure("event_type parameter is required");
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("event_type", type);
        entry.put("details", parameters.getOrDefault("details", Map.of()));
        entry.put("crew", context.getCrewName());
        entry.put("timestamp", Instant.now().toString());

        List<Object> events = new ArrayList<>();
        context.getContext().read(ContextScope.CONVERSATION, EVENT_LOG_KEY)
                .filter(List.class::isInstance)
                .ifPresent(existing -> events.addAll((List<?>) existing));
        events.add(entry);
        context.getContext().write(ContextScope.CONVERSATION, EVENT_LOG_KEY, events);

        log.info("Event {} logged by crew {} (conversation {})", type, context.getCrewName(),
                context.getConversationId());
        return ToolResult.success(Map.of("logged", type, "count", events.size()), "Event logged");
    }
}
