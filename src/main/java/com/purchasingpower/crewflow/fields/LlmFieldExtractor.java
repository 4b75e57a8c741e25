package com.purchasingpower.crewflow.fields;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.client.LLMProvider;
import com.purchasingpower.crewflow.crew.ExtractionMode;
import com.purchasingpower.crewflow.crew.FieldDefinition;
import com.purchasingpower.crewflow.model.conversation.ChatMessage;
import com.purchasingpower.crewflow.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Field extractor backed by a JSON-mode LLM call.
 *
 * Transport failures and malformed answers produce an empty result; the turn continues
 * with the fields it already had.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmFieldExtractor implements FieldExtractor {

    static final String EXTRACTOR_NAME = "fields-extractor";

    private static final TypeReference<Map<String, Object>> VALUES = new TypeReference<>() {
    };

    private final LLMProvider llmProvider;
    private final PromptLibraryService promptLibrary;
    private final ObjectMapper objectMapper;

    @Override
    public ExtractionResult extract(ExtractionRequest request) {
        List<String> requested = request.getFields().stream().map(FieldDefinition::getName).toList();
        String template = request.getMode() == ExtractionMode.FORM
                ? "field-extraction-form" : "field-extraction-conversational";

        try {
            String prompt = promptLibrary.render(template, variables(request));
            String raw = llmProvider.chat(prompt, EXTRACTOR_NAME, request.getConversationId());
            ExtractionResult result = parse(raw, requested);
            log.debug("Extractor for crew {} returned fields={} corrections={}",
                    request.getCrewName(), result.getExtractedFields().keySet(), result.getCorrections().keySet());
            return result;
        } catch (Exception e) {
            log.warn("Field extraction failed for crew {} (conversation {}): {}",
                    request.getCrewName(), request.getConversationId(), e.getMessage());
            return ExtractionResult.empty(requested);
        }
    }

    ExtractionResult parse(String raw, List<String> requested) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(stripCodeFence(raw));
        Map<String, Object> extracted = toMap(root.path("extractedFields"));
        Map<String, Object> corrections = toMap(root.path("corrections"));

        List<String> remaining = requested.stream()
                .filter(name -> FieldValues.isEmpty(extracted.get(name)))
                .toList();

        return ExtractionResult.builder()
                .extractedFields(extracted)
                .corrections(corrections)
                .remainingFields(remaining)
                .build();
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, Object> values = objectMapper.convertValue(node, VALUES);
        values.values().removeIf(FieldValues::isEmpty);
        return values;
    }

    private Map<String, Object> variables(ExtractionRequest request) throws JsonProcessingException {
        Map<String, Object> variables = new HashMap<>();
        variables.put("crewName", request.getCrewName());
        variables.put("fields", request.getFields().stream().map(this::describe).toList());
        variables.put("collectedJson", objectMapper.writeValueAsString(request.getCollectedFields()));
        variables.put("transcript", request.getMessages().stream()
                .map(message -> message.getRole() + ": " + message.getContent())
                .collect(Collectors.joining("\n")));

        List<ChatMessage> messages = request.getMessages();
        ChatMessage latest = messages.isEmpty() ? null : messages.get(messages.size() - 1);
        variables.put("latestUserMessage", latest != null && latest.isUser() ? latest.getContent() : "");
        if (messages.size() > 1 && messages.get(messages.size() - 2).isAssistant()) {
            variables.put("previousAssistantMessage", messages.get(messages.size() - 2).getContent());
        }
        return variables;
    }

    private Map<String, Object> describe(FieldDefinition field) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", field.getName());
        description.put("type", field.getType());
        description.put("description", field.getDescription());
        if (!field.getAllowedValues().isEmpty()) {
            description.put("allowedValues", String.join(", ", field.getAllowedValues()));
        }
        return description;
    }

    private static String stripCodeFence(String raw) {
        if (raw == null) {
            return "{}";
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}
