package com.agentdebate.orchestrator.api;

import com.agentdebate.orchestrator.api.dto.DebateSummaryResponse;
import com.agentdebate.orchestrator.api.dto.RunDebateRequest;
import com.agentdebate.orchestrator.model.DebateRecord;
import com.agentdebate.orchestrator.service.DebateFormatter;
import com.agentdebate.orchestrator.service.DebateOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for debates.
 *
 * POST   /debates                 : run a debate synchronously and store it
 * GET    /debates?limit=N         : most recent debates first
 * GET    /debates/{id}            : full stored record
 * GET    /debates/{id}/export     : record rendered as markdown, text or json
 * DELETE /debates/{id}            : remove a stored debate
 */
@RestController
@RequestMapping("/debates")
public class DebateController {

    private final DebateOrchestrator orchestrator;
    private final DebateFormatter    formatter;

    public DebateController(DebateOrchestrator orchestrator, DebateFormatter formatter) {
        this.orchestrator = orchestrator;
        this.formatter    = formatter;
    }

    /**
     * Run a debate. Blocks until all three agents have answered.
     *
     * Example:
     *   curl -X POST http://localhost:8080/debates \
     *     -H "Content-Type: application/json" \
     *     -d '{"title":"Remote work","description":"Is remote work better?","provider":"mixed"}'
     */
    @PostMapping
    public ResponseEntity<DebateRecord> run(@RequestBody RunDebateRequest req) {
        DebateRecord debate = orchestrator.runDebate(req.topic(), req.agentConfigs());
        return ResponseEntity.status(HttpStatus.CREATED).body(debate);
    }

    @GetMapping
    public List<DebateSummaryResponse> list(@RequestParam(defaultValue = "10") int limit) {
        return orchestrator.listDebates(limit).stream()
                .map(DebateSummaryResponse::from)
                .toList();
    }

    /** Returns 404 if the debate ID is not found. */
    @GetMapping("/{id}")
    public DebateRecord get(@PathVariable String id) {
        return orchestrator.getDebate(id);
    }

    @GetMapping("/{id}/export")
    public ResponseEntity<String> export(@PathVariable String id,
                                         @RequestParam(defaultValue = "markdown") String format) {
        DebateFormatter.Format fmt = DebateFormatter.parseFormat(format);
        DebateRecord debate = orchestrator.getDebate(id);
        MediaType type = switch (fmt) {
            case JSON     -> MediaType.APPLICATION_JSON;
            case MARKDOWN -> MediaType.TEXT_MARKDOWN;
            case TEXT     -> MediaType.TEXT_PLAIN;
        };
        return ResponseEntity.ok().contentType(type).body(formatter.render(debate, fmt));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return orchestrator.deleteDebate(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
