package com.purchasingpower.crewflow.agent;

import com.purchasingpower.crewflow.model.llm.ToolSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named tools available to database-defined crews and to editor tooling.
 * Seeded with every {@link Tool} bean; more can be registered at runtime.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ToolSchemaFactory schemaFactory;

    public ToolRegistry(List<Tool> toolBeans, ToolSchemaFactory schemaFactory) {
        this.schemaFactory = schemaFactory;
        toolBeans.forEach(this::register);
        log.info("Tool registry initialized with {} tools: {}", tools.size(), list());
    }

    public void register(Tool tool) {
        Tool previous = tools.put(tool.getName(), tool);
        if (previous != null && previous != tool) {
            log.warn("Tool '{}' re-registered, previous handler replaced", tool.getName());
        }
    }

    public boolean unregister(String name) {
        return tools.remove(name) != null;
    }

    public boolean has(String name) {
        return tools.containsKey(name);
    }

    public Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<String> list() {
        return List.copyOf(new TreeSet<>(tools.keySet()));
    }

    public List<ToolSchema> schemas() {
        return list().stream().map(name -> schemaFactory.schemaOf(tools.get(name))).toList();
    }
}
