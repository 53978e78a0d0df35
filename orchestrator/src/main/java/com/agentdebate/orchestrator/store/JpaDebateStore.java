package com.agentdebate.orchestrator.store;

import com.agentdebate.orchestrator.error.DebateNotFoundException;
import com.agentdebate.orchestrator.error.StorageException;
import com.agentdebate.orchestrator.model.DebateIndexRow;
import com.agentdebate.orchestrator.model.DebateRecord;
import com.agentdebate.orchestrator.model.StoredDebate;
import com.agentdebate.orchestrator.repository.DebateIndexRepository;
import com.agentdebate.orchestrator.repository.StoredDebateRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database-backed debate store (enabled with {@code debate.store.type=database}).
 *
 * The record document and its index row are written in one transaction,
 * so a listing never sees an index row for a debate that failed to save.
 */
public class JpaDebateStore implements DebateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaDebateStore.class);

    private final StoredDebateRepository debateRepo;
    private final DebateIndexRepository  indexRepo;
    private final ObjectMapper           json;

    public JpaDebateStore(StoredDebateRepository debateRepo,
                          DebateIndexRepository indexRepo,
                          ObjectMapper objectMapper) {
        this.debateRepo = debateRepo;
        this.indexRepo  = indexRepo;
        this.json       = objectMapper;
    }

    @Override
    @Transactional
    public String save(DebateRecord debate) {
        String id = debate.debateId();
        try {
            String document = json.writeValueAsString(debate);
            debateRepo.save(new StoredDebate(id, debate.topic().title(), debate.createdAt(), document));
            indexRepo.save(new DebateIndexRow(id, debate.createdAt(), debate.topic().title()));
        } catch (JsonProcessingException e) {
            throw new StorageException("Could not serialise debate " + id, e);
        } catch (DataAccessException e) {
            throw new StorageException("Could not save debate " + id + ": " + e.getMessage(), e);
        }
        log.info("Saved debate {} to the database", id);
        return id;
    }

    @Override
    @Transactional(readOnly = true)
    public DebateRecord get(String debateId) {
        return find(debateId).orElseThrow(() -> new DebateNotFoundException(debateId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DebateRecord> list(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        if (limit == 0) {
            return List.of();
        }
        List<DebateRecord> debates = new ArrayList<>();
        for (DebateIndexRow row : indexRepo.findAllByOrderBySeqDesc(PageRequest.of(0, limit))) {
            Optional<DebateRecord> debate = find(row.getDebateId());
            if (debate.isPresent()) {
                debates.add(debate.get());
            } else {
                log.debug("Index row {} points at missing debate {}, skipping", row.getSeq(), row.getDebateId());
            }
        }
        return debates;
    }

    @Override
    @Transactional
    public boolean delete(String debateId) {
        if (debateId == null || !debateRepo.existsById(debateId)) {
            return false;
        }
        debateRepo.deleteById(debateId);
        indexRepo.deleteByDebateId(debateId);
        log.info("Deleted debate {} from the database", debateId);
        return true;
    }

    private Optional<DebateRecord> find(String debateId) {
        if (debateId == null) {
            return Optional.empty();
        }
        return debateRepo.findById(debateId).map(this::parse);
    }

    private DebateRecord parse(StoredDebate stored) {
        try {
            return json.readValue(stored.getRecordJson(), DebateRecord.class);
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored debate " + stored.getId() + " is not a valid record", e);
        }
    }
}
