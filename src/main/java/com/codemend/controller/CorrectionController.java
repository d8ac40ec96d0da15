package com.codemend.controller;

import com.codemend.core.cancel.CancellationToken;
import com.codemend.core.diagnostics.PublishedDiagnosticProvider;
import com.codemend.core.issue.RawDiagnostic;
import com.codemend.orchestrator.CorrectionOrchestrator;
import com.codemend.orchestrator.CorrectionRequest;
import com.codemend.orchestrator.CorrectionResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

@RestController
@RequestMapping("/codemend")
public class CorrectionController {

    private final CorrectionOrchestrator                orchestrator;
    private final Optional<PublishedDiagnosticProvider> publishedDiagnostics;

    private final Map<String, CancellationToken> running = new ConcurrentHashMap<>();

    public CorrectionController(
            CorrectionOrchestrator orchestrator,
            Optional<PublishedDiagnosticProvider> publishedDiagnostics
    ) {
        this.orchestrator         = orchestrator;
        this.publishedDiagnostics = publishedDiagnostics;
    }

    @PostMapping("/generate")
    public ResponseEntity<CorrectionResult> generate(@RequestBody Map<String, String> request) {
        return run(request, orchestrator::generateFile);
    }

    @PostMapping("/modify")
    public ResponseEntity<CorrectionResult> modify(@RequestBody Map<String, String> request) {
        return run(request, orchestrator::modifyFile);
    }

    @PostMapping("/cancel/{requestId}")
    public ResponseEntity<Void> cancel(@PathVariable String requestId) {
        CancellationToken token = running.get(requestId);
        if (token == null) {
            return ResponseEntity.notFound().build();
        }
        token.cancel();
        return ResponseEntity.accepted().build();
    }

    /**
     * Body: {@code {"target": "src/App.java", "diagnostics": [{"severity": "error",
     * "line": 3, "column": 5, "message": "...", "lineBase": "one"}]}}.
     */
    @PostMapping("/diagnostics")
    public ResponseEntity<Void> publishDiagnostics(@RequestBody JsonNode body) {
        if (publishedDiagnostics.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        String target = body.path("target").asText("");
        if (target.isBlank()) {
            return ResponseEntity.badRequest().build();
        }

        List<RawDiagnostic> diagnostics = new ArrayList<>();
        for (JsonNode d : body.path("diagnostics")) {
            diagnostics.add(new RawDiagnostic(
                    RawDiagnostic.Severity.valueOf(d.path("severity").asText("information").toUpperCase(Locale.ROOT)),
                    d.path("line").asInt(1),
                    d.path("column").asInt(1),
                    d.path("message").asText(""),
                    d.hasNonNull("code") ? d.get("code").asText() : null,
                    d.hasNonNull("source") ? d.get("source").asText() : null,
                    RawDiagnostic.LineBase.valueOf(d.path("lineBase").asText("one").toUpperCase(Locale.ROOT))));
        }
        publishedDiagnostics.get().publish(target, diagnostics);
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<CorrectionResult> run(
            Map<String, String> request,
            BiFunction<CorrectionRequest, CancellationToken, CorrectionResult> operation
    ) {
        String targetPath  = request.get("targetPath");
        String instruction = request.get("instruction");

        if (targetPath == null || targetPath.trim().isEmpty()
                || instruction == null || instruction.trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        CorrectionRequest correctionRequest = new CorrectionRequest(
                request.get("requestId"), targetPath, instruction,
                request.get("projectContext"), request.get("relevantSnippets"));

        CancellationToken token = new CancellationToken();
        running.put(correctionRequest.getRequestId(), token);
        try {
            return ResponseEntity.ok(operation.apply(correctionRequest, token));
        } finally {
            running.remove(correctionRequest.getRequestId());
        }
    }
}
