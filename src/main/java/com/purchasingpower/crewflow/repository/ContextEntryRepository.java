package com.purchasingpower.crewflow.repository;

import com.purchasingpower.crewflow.context.ContextScope;
import com.purchasingpower.crewflow.model.context.ContextEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ContextEntryRepository extends JpaRepository<ContextEntry, Long> {

    Optional<ContextEntry> findByScopeAndOwnerIdAndContextKey(ContextScope scope, String ownerId, String contextKey);

    List<ContextEntry> findByScopeAndOwnerIdAndContextKeyIn(ContextScope scope, String ownerId, Collection<String> keys);

    long deleteByScopeAndOwnerIdAndContextKey(ContextScope scope, String ownerId, String contextKey);
}
