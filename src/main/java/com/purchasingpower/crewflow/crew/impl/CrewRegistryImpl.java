package com.purchasingpower.crewflow.crew.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.crewflow.crew.AgentCrewProvider;
import com.purchasingpower.crewflow.crew.CrewDefinition;
import com.purchasingpower.crewflow.crew.CrewOrigin;
import com.purchasingpower.crewflow.crew.CrewRegistry;
import com.purchasingpower.crewflow.crew.CrewSnapshot;
import com.purchasingpower.crewflow.crew.CrewSummary;
import com.purchasingpower.crewflow.crew.DynamicCrewService;
import com.purchasingpower.crewflow.exception.CrewConfigurationException;
import com.purchasingpower.crewflow.exception.CrewNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Crew registry holding one immutable {@link CrewSnapshot} per agent.
 *
 * <p>Crews come from two sources: database rows (via {@link DynamicCrewService}) and
 * {@link AgentCrewProvider} beans. Code crews override database crews with the same name.
 *
 * <p>Publication goes through {@link ConcurrentHashMap#compute}, which replaces the snapshot
 * reference for one agent atomically. Readers never block and never see a partially built table.
 */
@Slf4j
@Service
public class CrewRegistryImpl implements CrewRegistry {

    private final List<AgentCrewProvider> providers;
    private final DynamicCrewService dynamicCrewService;
    private final Map<String, CrewSnapshot> snapshots = new ConcurrentHashMap<>();
    private final AtomicLong versions = new AtomicLong();

    public CrewRegistryImpl(List<AgentCrewProvider> providers, DynamicCrewService dynamicCrewService) {
        this.providers = providers;
        this.dynamicCrewService = dynamicCrewService;
    }

    @Override
    public CrewSnapshot load(String agentName) {
        Preconditions.checkArgument(agentName != null && !agentName.isBlank(), "Agent name cannot be empty");
        return snapshots.computeIfAbsent(agentName, this::buildSnapshot);
    }

    @Override
    public CrewDefinition resolve(String agentName, String crewName) {
        return load(agentName).resolve(crewName);
    }

    @Override
    public CrewSnapshot hotSwap(String agentName, String crewName, CrewDefinition newDefinition) {
        Preconditions.checkNotNull(newDefinition, "New definition cannot be null");
        if (!crewName.equals(newDefinition.getName())) {
            throw new CrewConfigurationException(agentName, crewName,
                    "Hot swap of '" + crewName + "' received a definition named '" + newDefinition.getName() + "'");
        }

        load(agentName);
        CrewSnapshot published = snapshots.compute(agentName,
                (name, current) -> current.withCrew(newDefinition, versions.incrementAndGet()));

        log.info("Hot-swapped crew {}/{} (snapshot version {})", agentName, crewName, published.getVersion());
        return published;
    }

    @Override
    public CrewSnapshot reload(String agentName) {
        CrewSnapshot rebuilt = buildSnapshot(agentName);
        snapshots.put(agentName, rebuilt);
        log.info("Reloaded agent {}: {} crews (snapshot version {})",
                agentName, rebuilt.getCrews().size(), rebuilt.getVersion());
        return rebuilt;
    }

    @Override
    public List<CrewSummary> listCrew(String agentName) {
        CrewSnapshot snapshot = load(agentName);
        return snapshot.getCrews().values().stream()
                .map(crew -> CrewSummary.from(crew, snapshot.getVersion()))
                .toList();
    }

    @Override
    public boolean hasCrew(String agentName, String crewName) {
        try {
            return load(agentName).find(crewName).isPresent();
        } catch (CrewNotFoundException e) {
            return false;
        }
    }

    @Override
    public Set<String> loadedAgents() {
        return new TreeSet<>(snapshots.keySet());
    }

    @Override
    public Set<String> availableAgents() {
        Set<String> agents = new TreeSet<>(dynamicCrewService.agentNames());
        providers.forEach(provider -> agents.add(provider.getAgentName()));
        return agents;
    }

    private CrewSnapshot buildSnapshot(String agentName) {
        Map<String, CrewDefinition> crews = new LinkedHashMap<>();
        dynamicCrewService.loadCrews(agentName).forEach(crew -> crews.put(crew.getName(), crew));

        Set<String> codeCrews = new HashSet<>();
        for (AgentCrewProvider provider : providers) {
            if (!agentName.equals(provider.getAgentName())) {
                continue;
            }
            for (CrewDefinition crew : provider.getCrews()) {
                if (!codeCrews.add(crew.getName())) {
                    throw new CrewConfigurationException(agentName, crew.getName(),
                            "Crew '" + crew.getName() + "' is defined twice in code");
                }
                CrewDefinition replaced = crews.put(crew.getName(), crew);
                if (replaced != null && replaced.getOrigin() == CrewOrigin.DATABASE) {
                    log.info("Code crew {}/{} overrides database definition", agentName, crew.getName());
                }
            }
        }

        if (crews.isEmpty()) {
            throw new CrewNotFoundException(agentName, null);
        }

        CrewSnapshot snapshot = CrewSnapshot.of(agentName, versions.incrementAndGet(), crews.values());
        log.info("Loaded agent {}: crews={}, default={}", agentName, snapshot.getCrews().keySet(),
                snapshot.getDefaultCrewName());
        return snapshot;
    }
}
