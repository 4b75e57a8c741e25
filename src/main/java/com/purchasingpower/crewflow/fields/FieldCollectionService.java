package com.purchasingpower.crewflow.fields;

import com.purchasingpower.crewflow.config.CrewProperties;
import com.purchasingpower.crewflow.crew.CrewDefaults;
import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.ExtractionMode;
import com.purchasingpower.crewflow.crew.FieldDefinition;
import com.purchasingpower.crewflow.model.conversation.ChatMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Field collection contract: which fields the extractor may fill this turn, what history it
 * may read, and how its output is merged into the conversation's collected fields.
 *
 * <p>Merging never clears a collected value. Empty extractor values are ignored, and a field
 * not returned by the extractor is left untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldCollectionService {

    private final FieldExtractor fieldExtractor;
    private final CrewProperties crewProperties;

    /**
     * Fields eligible for extraction. The crew's exposure rule proposes, then fields that are
     * undeclared or already collected (and not re-evaluated) are dropped.
     */
    public List<FieldDefinition> exposedFields(CrewDefinition crew, Map<String, Object> collectedFields) {
        List<FieldDefinition> declared = crew.getFieldsToCollect();
        if (declared.isEmpty()) {
            return List.of();
        }

        Map<String, FieldDefinition> byName = declared.stream()
                .collect(Collectors.toMap(FieldDefinition::getName, field -> field, (a, b) -> a, LinkedHashMap::new));
        List<FieldDefinition> proposed = crew.effectiveFieldExposure()
                .exposedFields(declared, Collections.unmodifiableMap(collectedFields));

        Set<String> seen = new LinkedHashSet<>();
        List<FieldDefinition> exposed = new ArrayList<>();
        for (FieldDefinition candidate : proposed == null ? List.<FieldDefinition>of() : proposed) {
            FieldDefinition field = byName.get(candidate.getName());
            if (field == null || !seen.add(field.getName())) {
                continue;
            }
            if (field.isReevaluate() || !FieldValues.isCollected(collectedFields, field.getName())) {
                exposed.add(field);
            }
        }
        return exposed;
    }

    /**
     * History slice the extractor may read.
     *
     * <p>FORM: the latest user message, preceded by the assistant message it answers when there
     * is one. CONVERSATIONAL: the last {@code historyWindow} messages.
     */
    public List<ChatMessage> extractionWindow(ExtractionMode mode, List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        if (mode == ExtractionMode.FORM) {
            int lastUser = lastUserIndex(history);
            if (lastUser < 0) {
                return List.of();
            }
            List<ChatMessage> window = new ArrayList<>(2);
            if (lastUser > 0 && history.get(lastUser - 1).isAssistant()) {
                window.add(history.get(lastUser - 1));
            }
            window.add(history.get(lastUser));
            return window;
        }
        int from = Math.max(0, history.size() - crewProperties.getHistoryWindow());
        return List.copyOf(history.subList(from, history.size()));
    }

    /**
     * Run extraction for the crew and merge the result. Nothing is persisted here; callers
     * store {@link FieldCollectionOutcome#getUpdates()}.
     */
    public FieldCollectionOutcome collect(String agentName, String conversationId, CrewDefinition crew,
                                          List<ChatMessage> history, Map<String, Object> collectedFields) {
        List<FieldDefinition> exposed = exposedFields(crew, collectedFields);
        Map<String, Object> crewCollected = collectedFor(crew, collectedFields);
        List<String> remaining = CrewDefaults.remainingFields(crew, collectedFields);

        if (exposed.isEmpty() && crewCollected.isEmpty()) {
            log.debug("No fields to extract for crew {}", crew.getName());
            return FieldCollectionOutcome.unchanged(collectedFields, remaining);
        }

        List<ChatMessage> window = extractionWindow(crew.getExtractionMode(), history);
        if (window.stream().noneMatch(ChatMessage::isUser)) {
            return FieldCollectionOutcome.unchanged(collectedFields, remaining);
        }

        ExtractionRequest request = ExtractionRequest.builder()
                .agentName(agentName)
                .conversationId(conversationId)
                .crewName(crew.getName())
                .mode(crew.getExtractionMode())
                .messages(window)
                .fields(exposed)
                .collectedFields(crewCollected)
                .build();

        ExtractionResult result;
        try {
            result = fieldExtractor.extract(request);
        } catch (RuntimeException e) {
            log.warn("Field extraction failed for crew {} in conversation {}, continuing without new fields: {}",
                    crew.getName(), conversationId, e.getMessage());
            result = null;
        }
        if (result == null) {
            result = ExtractionResult.empty(remaining);
        }

        Map<String, Object> updates = merge(crew, exposed, collectedFields, result);
        Map<String, Object> merged = new LinkedHashMap<>(collectedFields);
        merged.putAll(updates);

        if (!updates.isEmpty()) {
            log.info("Collected fields for crew {}: {}", crew.getName(), updates.keySet());
        }

        return FieldCollectionOutcome.builder()
                .updates(updates)
                .collectedFields(merged)
                .exposedFields(exposed.stream().map(FieldDefinition::getName).toList())
                .remainingFields(CrewDefaults.remainingFields(crew, merged))
                .build();
    }

    /**
     * Values to write: extracted values for exposed fields, and corrections for fields of
     * this crew that are already collected. Empty values are never written.
     */
    public Map<String, Object> merge(CrewDefinition crew, List<FieldDefinition> exposed,
                                     Map<String, Object> collectedFields, ExtractionResult result) {
        Set<String> exposedNames = exposed.stream().map(FieldDefinition::getName).collect(Collectors.toSet());
        Set<String> declaredNames = crew.getFieldsToCollect().stream()
                .map(FieldDefinition::getName).collect(Collectors.toSet());

        Map<String, Object> updates = new LinkedHashMap<>();
        result.getExtractedFields().forEach((name, value) -> {
            if (!exposedNames.contains(name)) {
                log.debug("Ignoring extracted value for unexposed field {}", name);
            } else if (!FieldValues.isEmpty(value)) {
                updates.put(name, value);
            }
        });
        result.getCorrections().forEach((name, value) -> {
            if (declaredNames.contains(name) && FieldValues.isCollected(collectedFields, name)
                    && !FieldValues.isEmpty(value)) {
                updates.put(name, value);
            }
        });
        return updates;
    }

    private Map<String, Object> collectedFor(CrewDefinition crew, Map<String, Object> collectedFields) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (FieldDefinition field : crew.getFieldsToCollect()) {
            if (FieldValues.isCollected(collectedFields, field.getName())) {
                result.put(field.getName(), collectedFields.get(field.getName()));
            }
        }
        return result;
    }

    private static int lastUserIndex(List<ChatMessage> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).isUser()) {
                return i;
            }
        }
        return -1;
    }
}
