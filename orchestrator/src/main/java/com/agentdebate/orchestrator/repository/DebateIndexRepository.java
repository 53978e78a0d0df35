package com.agentdebate.orchestrator.repository;

import com.agentdebate.orchestrator.model.DebateIndexRow;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Listing queries for the debate_index table.
 */
public interface DebateIndexRepository extends JpaRepository<DebateIndexRow, Long> {

    /** Newest index rows first; the page size is the listing limit. */
    List<DebateIndexRow> findAllByOrderBySeqDesc(Pageable page);

    /** Must run inside a transaction (derived delete queries load then remove). */
    long deleteByDebateId(String debateId);
}
