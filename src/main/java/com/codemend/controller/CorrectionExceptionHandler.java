package com.codemend.controller;

import com.codemend.core.cancel.OperationCancelledException;
import com.codemend.core.filesystem.WorkspaceUnavailableException;
import com.codemend.llm.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class CorrectionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CorrectionExceptionHandler.class);

    @ExceptionHandler(OperationCancelledException.class)
    public ResponseEntity<Map<String, String>> cancelled(OperationCancelledException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(WorkspaceUnavailableException.class)
    public ResponseEntity<Map<String, String>> workspaceUnavailable(WorkspaceUnavailableException e) {
        log.error("[Controller] Workspace unavailable: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<Map<String, String>> generationFailed(GenerationException e) {
        log.error("[Controller] Generation failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
