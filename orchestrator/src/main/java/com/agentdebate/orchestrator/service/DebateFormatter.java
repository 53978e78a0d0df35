package com.agentdebate.orchestrator.service;

import com.agentdebate.orchestrator.error.StorageException;
import com.agentdebate.orchestrator.model.AgentResponse;
import com.agentdebate.orchestrator.model.DebateRecord;
import com.agentdebate.orchestrator.model.DebateRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders debate records for people: terminal text, Markdown, JSON, and a
 * short listing.
 */
@Component
public class DebateFormatter {

    public enum Format { TEXT, MARKDOWN, JSON }

    private static final String HEAVY_RULE = "=".repeat(70);
    private static final String LIGHT_RULE = "-".repeat(70);

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final ObjectMapper json;

    public DebateFormatter(ObjectMapper objectMapper) {
        this.json = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String render(DebateRecord debate, Format format) {
        return switch (format) {
            case TEXT     -> toText(debate);
            case MARKDOWN -> toMarkdown(debate);
            case JSON     -> toJson(debate);
        };
    }

    public String toText(DebateRecord debate) {
        StringBuilder sb = new StringBuilder();
        sb.append(HEAVY_RULE).append('\n');
        sb.append("  DEBATE: ").append(debate.topic().title()).append('\n');
        sb.append(HEAVY_RULE).append("\n\n");

        sb.append("TOPIC DESCRIPTION:\n");
        sb.append(debate.topic().description()).append("\n\n");

        int i = 1;
        for (AgentResponse r : debate.agentResponses()) {
            sb.append(LIGHT_RULE).append('\n');
            sb.append(i++).append(". ").append(r.role()).append(" ARGUMENT\n");
            sb.append("Agent: ").append(r.agentName()).append('\n');
            sb.append("Model: ").append(r.modelName()).append('\n');
            sb.append("Execution Time: ").append(millis(r.executionTimeMs())).append('\n');
            if (!r.success()) {
                sb.append("FAILED: ").append(r.errorMessage()).append('\n');
            }
            sb.append('\n').append(r.responseText()).append("\n\n");
        }

        sb.append(LIGHT_RULE).append('\n');
        sb.append("SUMMARY\n");
        sb.append("Total Execution Time: ").append(millis(debate.totalExecutionTimeMs())).append('\n');
        sb.append("Created: ").append(TIMESTAMP.format(debate.createdAt())).append('\n');
        sb.append("Debate ID: ").append(debate.debateId()).append('\n');
        sb.append(HEAVY_RULE);
        return sb.toString();
    }

    public String toMarkdown(DebateRecord debate) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(debate.topic().title()).append("\n\n");
        sb.append("## Topic Description\n\n");
        sb.append(debate.topic().description()).append("\n\n");

        int i = 1;
        for (AgentResponse r : debate.agentResponses()) {
            sb.append("## ").append(i++).append(". ").append(heading(r.role())).append("\n\n");
            sb.append("**Agent:** ").append(r.agentName()).append("\n\n");
            sb.append("**Model:** ").append(r.modelName()).append("\n\n");
            sb.append("**Execution Time:** ").append(millis(r.executionTimeMs())).append("\n\n");
            if (!r.success()) {
                sb.append("> **Failed:** ").append(r.errorMessage()).append("\n\n");
            }
            sb.append(r.responseText()).append("\n\n");
        }

        sb.append("---\n");
        sb.append("## Metadata\n\n");
        sb.append("- **Total Execution Time:** ").append(millis(debate.totalExecutionTimeMs())).append('\n');
        sb.append("- **Debate ID:** `").append(debate.debateId()).append("`\n");
        sb.append("- **Created:** ").append(TIMESTAMP.format(debate.createdAt())).append('\n');
        return sb.toString();
    }

    public String toJson(DebateRecord debate) {
        try {
            return json.writeValueAsString(debate);
        } catch (JsonProcessingException e) {
            throw new StorageException("Could not serialise debate " + debate.debateId(), e);
        }
    }

    /** Numbered listing: title, id, creation time, response count. */
    public String summarize(List<DebateRecord> debates) {
        if (debates.isEmpty()) {
            return "No debates found.";
        }
        StringBuilder sb = new StringBuilder("Stored Debates:\n\n");
        int i = 1;
        for (DebateRecord d : debates) {
            sb.append(i++).append(". ").append(d.topic().title()).append('\n');
            sb.append("   ID: ").append(d.debateId()).append('\n');
            sb.append("   Created: ").append(TIMESTAMP.format(d.createdAt())).append('\n');
            sb.append("   Agents: ").append(d.agentResponses().size()).append("\n\n");
        }
        return sb.toString().stripTrailing();
    }

    public static Format parseFormat(String value) {
        if (value == null || value.isBlank()) return Format.MARKDOWN;
        try {
            return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown export format '" + value + "' (expected markdown, text or json)", e);
        }
    }

    private static String heading(DebateRole role) {
        return switch (role) {
            case FOR       -> "Affirmative Argument";
            case AGAINST   -> "Negative Argument";
            case SYNTHESIS -> "Synthesis";
        };
    }

    private static String millis(long ms) {
        return String.format(Locale.ROOT, "%.1fms", (double) ms);
    }
}
