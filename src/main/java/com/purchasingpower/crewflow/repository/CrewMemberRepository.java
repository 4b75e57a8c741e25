package com.purchasingpower.crewflow.repository;

import com.purchasingpower.crewflow.model.crew.CrewMemberEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for database-defined crews.
 */
@Repository
public interface CrewMemberRepository extends JpaRepository<CrewMemberEntity, Long> {

    List<CrewMemberEntity> findByAgentNameAndIsActiveTrueOrderByIdAsc(String agentName);

    Optional<CrewMemberEntity> findByAgentNameAndCrewName(String agentName, String crewName);

    @Query("SELECT DISTINCT c.agentName FROM CrewMemberEntity c WHERE c.isActive = true")
    List<String> findActiveAgentNames();
}
