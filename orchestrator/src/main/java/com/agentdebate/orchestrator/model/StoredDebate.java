package com.agentdebate.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * A debate record as stored by the database-backed store.
 *
 * The whole DebateRecord is kept as one JSON document so the stored shape is
 * identical to the file store's; title and timestamp are copied out only for
 * operators browsing the table.
 *
 * DB table: debates  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "debates")
public class StoredDebate {

    // The debate's UUID, assigned by the orchestrator, never generated here.
    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "topic_title", nullable = false, columnDefinition = "TEXT")
    private String topicTitle;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "record_json", nullable = false, columnDefinition = "TEXT")
    private String recordJson;

    protected StoredDebate() {}   // required by JPA

    public StoredDebate(String id, String topicTitle, Instant createdAt, String recordJson) {
        this.id         = id;
        this.topicTitle = topicTitle;
        this.createdAt  = createdAt;
        this.recordJson = recordJson;
    }

    public String  getId()         { return id; }
    public String  getTopicTitle() { return topicTitle; }
    public Instant getCreatedAt()  { return createdAt; }
    public String  getRecordJson() { return recordJson; }
}
