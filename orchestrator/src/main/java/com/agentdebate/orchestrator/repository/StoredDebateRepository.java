package com.agentdebate.orchestrator.repository;

import com.agentdebate.orchestrator.model.StoredDebate;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD operations for the debates table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface StoredDebateRepository extends JpaRepository<StoredDebate, String> {
}
