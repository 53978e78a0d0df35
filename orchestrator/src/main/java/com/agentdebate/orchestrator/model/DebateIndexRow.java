package com.agentdebate.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Listing index row for the database-backed store.
 *
 * seq grows with every insert and is the listing order (newest = highest).
 * A row may outlive its debates row if the record is removed out-of-band;
 * listing skips such rows.
 *
 * DB table: debate_index  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "debate_index")
public class DebateIndexRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long seq;

    @Column(name = "debate_id", nullable = false, length = 36)
    private String debateId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "topic_title", nullable = false, columnDefinition = "TEXT")
    private String topicTitle;

    protected DebateIndexRow() {}   // required by JPA

    public DebateIndexRow(String debateId, Instant createdAt, String topicTitle) {
        this.debateId   = debateId;
        this.createdAt  = createdAt;
        this.topicTitle = topicTitle;
    }

    public Long    getSeq()        { return seq; }
    public String  getDebateId()   { return debateId; }
    public Instant getCreatedAt()  { return createdAt; }
    public String  getTopicTitle() { return topicTitle; }
}
