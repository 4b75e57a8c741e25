package com.purchasingpower.crewflow.crew;

import com.purchasingpower.crewflow.config.CrewProperties;
import com.purchasingpower.crewflow.exception.CrewFlowException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * In-process hot-reload caller: validates an edited crew, keeps the previous definition as a
 * backup, persists database crews and publishes through {@link CrewRegistry#hotSwap}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrewEditorService {

    private final CrewRegistry crewRegistry;
    private final DynamicCrewService dynamicCrewService;
    private final CrewProperties crewProperties;

    private final Map<String, Deque<CrewDefinition>> backups = new HashMap<>();

    /**
     * Apply an edit to the currently published definition of a crew.
     */
    public CrewSnapshot update(String agentName, String crewName, UnaryOperator<CrewDefinition> edit) {
        CrewDefinition current = crewRegistry.resolve(agentName, crewName);
        return replace(agentName, crewName, edit.apply(current));
    }

    public synchronized CrewSnapshot replace(String agentName, String crewName, CrewDefinition replacement) {
        CrewDefinition current = crewRegistry.resolve(agentName, crewName);
        CrewDefinition candidate = replacement.toBuilder().origin(current.getOrigin()).build();

        // Throws before anything is backed up or persisted
        crewRegistry.load(agentName).withCrew(candidate, -1);

        Deque<CrewDefinition> history = backups.computeIfAbsent(key(agentName, crewName), k -> new ArrayDeque<>());
        history.push(current);
        while (history.size() > crewProperties.getEditorHistorySize()) {
            history.removeLast();
        }

        return publish(agentName, crewName, candidate);
    }

    /**
     * Swap the most recent backup of a crew back in.
     */
    public synchronized CrewSnapshot restorePrevious(String agentName, String crewName) {
        Deque<CrewDefinition> history = backups.get(key(agentName, crewName));
        if (history == null || history.isEmpty()) {
            throw new CrewFlowException("No previous definition of crew " + agentName + "/" + crewName);
        }
        CrewDefinition previous = history.peek();
        crewRegistry.load(agentName).withCrew(previous, -1);
        history.pop();

        log.info("Restoring previous definition of crew {}/{}", agentName, crewName);
        return publish(agentName, crewName, previous);
    }

    public synchronized int backupCount(String agentName, String crewName) {
        Deque<CrewDefinition> history = backups.get(key(agentName, crewName));
        return history == null ? 0 : history.size();
    }

    private CrewSnapshot publish(String agentName, String crewName, CrewDefinition definition) {
        if (definition.getOrigin() == CrewOrigin.DATABASE) {
            dynamicCrewService.save(agentName, definition);
        }
        return crewRegistry.hotSwap(agentName, crewName, definition);
    }

    private static String key(String agentName, String crewName) {
        return agentName + "/" + crewName;
    }
}
