package com.agentdebate.orchestrator.store;

import com.agentdebate.orchestrator.model.DebateRecord;

import java.util.List;

/**
 * Durable storage for debate records.
 *
 * Every record is keyed by its debate id, and every save also appends a
 * lightweight index entry {id, created_at, topic_title} that drives
 * {@link #list}. Ids are unique per debate, so concurrent saves never write
 * the same key.
 */
public interface DebateStore {

    /**
     * Persist a record and append it to the index.
     *
     * @return the record's debate id
     * @throws com.agentdebate.orchestrator.error.StorageException if it cannot be written
     */
    String save(DebateRecord debate);

    /**
     * @throws com.agentdebate.orchestrator.error.DebateNotFoundException if no record exists for the id
     */
    DebateRecord get(String debateId);

    /**
     * Most recently saved first, at most {@code limit}. Index entries whose
     * record has gone missing are skipped rather than failing the call, so
     * fewer than {@code limit} records may come back.
     */
    List<DebateRecord> list(int limit);

    /**
     * Remove a record and its index entry.
     *
     * @return false if there was no record to remove
     */
    boolean delete(String debateId);
}
