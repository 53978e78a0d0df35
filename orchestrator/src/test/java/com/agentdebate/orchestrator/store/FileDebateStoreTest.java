package com.agentdebate.orchestrator.store;

import com.agentdebate.orchestrator.DebateFixtures;
import com.agentdebate.orchestrator.error.DebateNotFoundException;
import com.agentdebate.orchestrator.error.StorageException;
import com.agentdebate.orchestrator.model.DebateRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileDebateStoreTest {

    @TempDir Path tmp;

    ObjectMapper    mapper;
    Path            dir;
    FileDebateStore store;

    @BeforeEach
    void setUp() {
        mapper = Jackson2ObjectMapperBuilder.json().build();
        dir    = tmp.resolve("debates");
        store  = new FileDebateStore(dir, mapper);
    }

    @Test
    void directoryIsCreatedOnFirstSaveOnly() {
        assertThat(dir).doesNotExist();

        store.save(DebateFixtures.debate("d1", "First", Instant.parse("2026-01-01T00:00:00Z")));

        assertThat(dir.resolve("d1.json")).exists();
        assertThat(dir.resolve("_index.json")).exists();
    }

    @Test
    void saveThenGet_returnsEqualRecord() {
        DebateRecord debate = DebateFixtures.debateWithFailedStage("with-failure");

        String id = store.save(debate);

        assertThat(id).isEqualTo("with-failure");
        assertThat(store.get(id)).isEqualTo(debate);
    }

    @Test
    void recordFile_usesSnakeCaseFieldNames() throws IOException {
        store.save(DebateFixtures.debate("d1", "First", Instant.parse("2026-01-01T00:00:00Z")));

        JsonNode json = mapper.readTree(dir.resolve("d1.json").toFile());

        assertThat(json.has("debate_id")).isTrue();
        assertThat(json.has("total_execution_time_ms")).isTrue();
        assertThat(json.get("agent_responses").get(0).get("model_provider").asText()).isEqualTo("claude");
        assertThat(json.get("agents_config").get(0).has("timeout_seconds")).isTrue();
    }

    @Test
    void list_isMostRecentFirst_andHonoursLimit() {
        store.save(DebateFixtures.debate("a", "A", Instant.parse("2026-01-01T00:00:00Z")));
        store.save(DebateFixtures.debate("b", "B", Instant.parse("2026-01-02T00:00:00Z")));
        store.save(DebateFixtures.debate("c", "C", Instant.parse("2026-01-03T00:00:00Z")));

        assertThat(store.list(10)).extracting(DebateRecord::debateId).containsExactly("c", "b", "a");
        assertThat(store.list(2)).extracting(DebateRecord::debateId).containsExactly("c", "b");
        assertThat(store.list(0)).isEmpty();
    }

    @Test
    void list_onEmptyStore_isEmpty() {
        assertThat(store.list(10)).isEmpty();
    }

    @Test
    void list_skipsIndexEntriesWhoseFileWasRemoved() throws IOException {
        store.save(DebateFixtures.debate("a", "A", Instant.parse("2026-01-01T00:00:00Z")));
        store.save(DebateFixtures.debate("b", "B", Instant.parse("2026-01-02T00:00:00Z")));
        Files.delete(dir.resolve("b.json"));

        assertThat(store.list(10)).extracting(DebateRecord::debateId).containsExactly("a");
    }

    @Test
    void get_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> store.get("missing"))
                .isInstanceOf(DebateNotFoundException.class)
                .hasMessage("Debate missing not found");
    }

    @Test
    void get_pathTraversalId_isTreatedAsUnknown() {
        assertThatThrownBy(() -> store.get("../etc/passwd"))
                .isInstanceOf(DebateNotFoundException.class);
    }

    @Test
    void delete_removesRecordAndIndexEntry() {
        store.save(DebateFixtures.debate("a", "A", Instant.parse("2026-01-01T00:00:00Z")));
        store.save(DebateFixtures.debate("b", "B", Instant.parse("2026-01-02T00:00:00Z")));

        assertThat(store.delete("a")).isTrue();
        assertThat(store.delete("a")).isFalse();

        assertThat(dir.resolve("a.json")).doesNotExist();
        assertThat(store.list(10)).extracting(DebateRecord::debateId).containsExactly("b");
    }

    @Test
    void delete_prunesIndexEntryWhenRecordFileIsAlreadyGone() throws IOException {
        store.save(DebateFixtures.debate("a", "A", Instant.parse("2026-01-01T00:00:00Z")));
        store.save(DebateFixtures.debate("b", "B", Instant.parse("2026-01-02T00:00:00Z")));
        Files.delete(dir.resolve("b.json"));

        assertThat(store.delete("b")).isTrue();
        assertThat(store.delete("b")).isFalse();

        JsonNode index = mapper.readTree(dir.resolve("_index.json").toFile());
        assertThat(index.size()).isEqualTo(1);
        assertThat(index.get(0).get("id").asText()).isEqualTo("a");
    }

    @Test
    void corruptIndex_isAStorageError() throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("_index.json"), "{not json");

        assertThatThrownBy(() -> store.list(5)).isInstanceOf(StorageException.class);
    }
}
