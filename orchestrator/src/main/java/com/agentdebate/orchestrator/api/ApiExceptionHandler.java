package com.agentdebate.orchestrator.api;

import com.agentdebate.orchestrator.error.DebateConfigurationException;
import com.agentdebate.orchestrator.error.DebateNotFoundException;
import com.agentdebate.orchestrator.error.DebatePersistenceException;
import com.agentdebate.orchestrator.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Maps debate errors onto HTTP statuses with one error body shape:
 * {@code {code, message, timestamp, details}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ErrorResponse(String code,
                                String message,
                                OffsetDateTime timestamp,
                                Map<String, Object> details) {

        static ErrorResponse of(String code, String message) {
            return new ErrorResponse(code, message, OffsetDateTime.now(), null);
        }
    }

    @ExceptionHandler(DebateConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(DebateConfigurationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("INVALID_DEBATE_CONFIG", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("MALFORMED_REQUEST", "Request body could not be read"));
    }

    @ExceptionHandler(DebateNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(DebateNotFoundException e) {
        ErrorResponse error = new ErrorResponse("DEBATE_NOT_FOUND", e.getMessage(), OffsetDateTime.now(),
                Map.of("debateId", String.valueOf(e.debateId())));
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /** The debate ran; its id is returned so the caller can report it. */
    @ExceptionHandler(DebatePersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(DebatePersistenceException e) {
        ErrorResponse error = new ErrorResponse("DEBATE_NOT_SAVED", e.getMessage(), OffsetDateTime.now(),
                Map.of("debateId", e.debate().debateId()));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException e) {
        log.error("Debate storage failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("STORAGE_ERROR", e.getMessage()));
    }
}
