package com.agentdebate.orchestrator.store;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/** One row of the file store's _index.json. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DebateIndexEntry(String id, Instant createdAt, String topicTitle) {}
