package com.purchasingpower.crewflow.crew;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.crewflow.agent.Tool;
import com.purchasingpower.crewflow.agent.ToolRegistry;
import com.purchasingpower.crewflow.exception.CrewConfigurationException;
import com.purchasingpower.crewflow.model.crew.CrewMemberEntity;
import com.purchasingpower.crewflow.repository.CrewMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds crew definitions from the CREW_MEMBERS table and writes edited definitions back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DynamicCrewService {

    private static final TypeReference<List<FieldDefinition>> FIELD_LIST = new TypeReference<>() {
    };

    private final CrewMemberRepository crewMemberRepository;
    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public List<CrewDefinition> loadCrews(String agentName) {
        List<CrewDefinition> crews = new ArrayList<>();
        for (CrewMemberEntity entity : crewMemberRepository.findByAgentNameAndIsActiveTrueOrderByIdAsc(agentName)) {
            crews.add(toDefinition(entity));
        }
        if (!crews.isEmpty()) {
            log.info("Loaded {} database crews for agent {}", crews.size(), agentName);
        }
        return crews;
    }

    @Transactional(readOnly = true)
    public Set<String> agentNames() {
        return new LinkedHashSet<>(crewMemberRepository.findActiveAgentNames());
    }

    /**
     * Insert or update the database row for a crew definition.
     */
    @Transactional
    public void save(String agentName, CrewDefinition crew) {
        CrewMemberEntity entity = crewMemberRepository.findByAgentNameAndCrewName(agentName, crew.getName())
                .orElseGet(() -> CrewMemberEntity.builder()
                        .agentName(agentName)
                        .crewName(crew.getName())
                        .build());

        entity.setDisplayName(crew.getDisplayName());
        entity.setDescription(crew.getDescription());
        entity.setGuidance(crew.getGuidance());
        entity.setFieldsJson(writeFields(agentName, crew));
        entity.setExtractionMode(crew.getExtractionMode());
        entity.setTransitionTo(crew.getTransitionTo());
        entity.setDefault(crew.isDefault());
        entity.setOneShot(crew.isOneShot());
        entity.setToolNames(String.join(",", crew.getTools().stream().map(Tool::getName).toList()));
        entity.setModel(crew.getModel());
        entity.setMaxTokens(crew.getMaxTokens());
        entity.setKnowledgeBaseStoreId(crew.getKnowledgeBase() != null ? crew.getKnowledgeBase().getStoreId() : null);
        entity.setActive(true);

        crewMemberRepository.save(entity);
        log.info("Saved database crew {}/{}", agentName, crew.getName());
    }

    CrewDefinition toDefinition(CrewMemberEntity entity) {
        CrewDefinition.CrewDefinitionBuilder builder = CrewDefinition.builder()
                .name(entity.getCrewName())
                .displayName(entity.getDisplayName())
                .description(entity.getDescription())
                .guidance(entity.getGuidance())
                .fieldsToCollect(readFields(entity))
                .extractionMode(entity.getExtractionMode() != null
                        ? entity.getExtractionMode() : ExtractionMode.CONVERSATIONAL)
                .transitionTo(blankToNull(entity.getTransitionTo()))
                .isDefault(entity.isDefault())
                .oneShot(entity.isOneShot())
                .model(entity.getModel())
                .origin(CrewOrigin.DATABASE);

        if (entity.getMaxTokens() != null) {
            builder.maxTokens(entity.getMaxTokens());
        }
        if (entity.getKnowledgeBaseStoreId() != null && !entity.getKnowledgeBaseStoreId().isBlank()) {
            builder.knowledgeBase(KnowledgeBaseRef.of(entity.getKnowledgeBaseStoreId()));
        }
        for (String toolName : toolNames(entity)) {
            Tool tool = toolRegistry.get(toolName).orElseThrow(() -> new CrewConfigurationException(
                    entity.getAgentName(), entity.getCrewName(),
                    "Crew '" + entity.getCrewName() + "' references unknown tool '" + toolName + "'"));
            builder.tool(tool);
        }
        return builder.build();
    }

    private List<FieldDefinition> readFields(CrewMemberEntity entity) {
        if (entity.getFieldsJson() == null || entity.getFieldsJson().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(entity.getFieldsJson(), FIELD_LIST);
        } catch (JsonProcessingException e) {
            throw new CrewConfigurationException(entity.getAgentName(), entity.getCrewName(),
                    "Crew '" + entity.getCrewName() + "' has malformed fields JSON: " + e.getOriginalMessage());
        }
    }

    private String writeFields(String agentName, CrewDefinition crew) {
        try {
            return objectMapper.writeValueAsString(crew.getFieldsToCollect());
        } catch (JsonProcessingException e) {
            throw new CrewConfigurationException(agentName, crew.getName(),
                    "Fields of crew '" + crew.getName() + "' cannot be serialized");
        }
    }

    private List<String> toolNames(CrewMemberEntity entity) {
        if (entity.getToolNames() == null || entity.getToolNames().isBlank()) {
            return List.of();
        }
        return Arrays.stream(entity.getToolNames().split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
