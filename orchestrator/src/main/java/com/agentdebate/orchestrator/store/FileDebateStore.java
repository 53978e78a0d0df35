package com.agentdebate.orchestrator.store;

import com.agentdebate.orchestrator.error.DebateNotFoundException;
import com.agentdebate.orchestrator.error.StorageException;
import com.agentdebate.orchestrator.model.DebateRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * JSON-file debate store.
 *
 * Layout under the configured directory:
 * <pre>
 *   &lt;debate_id&gt;.json   one pretty-printed DebateRecord per debate
 *   _index.json          ordered list of {id, created_at, topic_title}
 * </pre>
 *
 * The directory is created on the first save, never at construction.
 * Files are written to a temp file and moved into place, so a crash never
 * leaves a half-written record behind. Index read-modify-write cycles are
 * serialised on a lock; record files need none because ids are unique.
 */
public class FileDebateStore implements DebateStore {

    private static final Logger log = LoggerFactory.getLogger(FileDebateStore.class);

    private static final String  INDEX_FILE = "_index.json";
    private static final Pattern SAFE_ID    = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    private static final TypeReference<List<DebateIndexEntry>> INDEX_TYPE = new TypeReference<>() {};

    private final Path         directory;
    private final Path         indexFile;
    private final ObjectMapper json;
    private final Object       indexLock = new Object();

    public FileDebateStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.indexFile = directory.resolve(INDEX_FILE);
        this.json      = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    // ------------------------------------------------------------------
    // DebateStore
    // ------------------------------------------------------------------

    @Override
    public String save(DebateRecord debate) {
        String id = debate.debateId();
        if (!SAFE_ID.matcher(id).matches()) {
            throw new StorageException("Refusing to store debate with unsafe id '" + id + "'");
        }
        try {
            Files.createDirectories(directory);
            writeAtomically(recordFile(id), json.writeValueAsBytes(debate));

            synchronized (indexLock) {
                List<DebateIndexEntry> index = new ArrayList<>(loadIndex());
                index.add(new DebateIndexEntry(id, debate.createdAt(), debate.topic().title()));
                writeAtomically(indexFile, json.writeValueAsBytes(index));
            }
        } catch (IOException e) {
            throw new StorageException("Could not save debate " + id + " under " + directory, e);
        }
        log.info("Saved debate {} to {}", id, directory);
        return id;
    }

    @Override
    public DebateRecord get(String debateId) {
        if (debateId == null || !SAFE_ID.matcher(debateId).matches()) {
            throw new DebateNotFoundException(debateId);
        }
        Path file = recordFile(debateId);
        if (!Files.exists(file)) {
            throw new DebateNotFoundException(debateId);
        }
        try {
            return json.readValue(file.toFile(), DebateRecord.class);
        } catch (IOException e) {
            throw new StorageException("Could not read debate " + debateId + " from " + file, e);
        }
    }

    @Override
    public List<DebateRecord> list(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        List<DebateIndexEntry> recent = new ArrayList<>(loadIndex());
        Collections.reverse(recent);

        List<DebateRecord> debates = new ArrayList<>();
        for (DebateIndexEntry entry : recent.subList(0, Math.min(limit, recent.size()))) {
            try {
                debates.add(get(entry.id()));
            } catch (DebateNotFoundException e) {
                log.debug("Index entry {} has no record file, skipping", entry.id());
            }
        }
        return debates;
    }

    @Override
    public boolean delete(String debateId) {
        if (debateId == null || !SAFE_ID.matcher(debateId).matches()) {
            return false;
        }
        boolean removedFile;
        boolean prunedIndex;
        try {
            synchronized (indexLock) {
                removedFile = Files.deleteIfExists(recordFile(debateId));

                // The index entry goes even when the record file was already gone.
                List<DebateIndexEntry> index = loadIndex();
                List<DebateIndexEntry> kept = index.stream()
                        .filter(e -> !e.id().equals(debateId))
                        .toList();
                prunedIndex = kept.size() != index.size();
                if (prunedIndex) {
                    writeAtomically(indexFile, json.writeValueAsBytes(kept));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Could not delete debate " + debateId, e);
        }
        if (!removedFile && !prunedIndex) {
            return false;
        }
        log.info("Deleted debate {} (record file removed: {}, index entry removed: {})",
                debateId, removedFile, prunedIndex);
        return true;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path recordFile(String debateId) {
        return directory.resolve(debateId + ".json");
    }

    private List<DebateIndexEntry> loadIndex() {
        if (!Files.exists(indexFile)) {
            return List.of();
        }
        try {
            return json.readValue(indexFile.toFile(), INDEX_TYPE);
        } catch (IOException e) {
            throw new StorageException("Debate index " + indexFile + " is unreadable", e);
        }
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
