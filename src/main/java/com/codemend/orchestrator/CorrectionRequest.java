package com.codemend.orchestrator;

import java.util.UUID;

/**
 * One generate or modify request for a single workspace file.
 */
public final class CorrectionRequest {

    private final String requestId;
    private final String targetPath;
    private final String instruction;
    private final String projectContext;
    private final String relevantSnippets;

    public CorrectionRequest(String requestId, String targetPath, String instruction,
                             String projectContext, String relevantSnippets) {
        if (targetPath == null || targetPath.isBlank()) {
            throw new IllegalArgumentException("targetPath is required");
        }
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException("instruction is required");
        }
        this.requestId        = requestId != null && !requestId.isBlank() ? requestId : UUID.randomUUID().toString();
        this.targetPath       = targetPath.trim();
        this.instruction      = instruction;
        this.projectContext   = projectContext != null ? projectContext : "";
        this.relevantSnippets = relevantSnippets != null ? relevantSnippets : "";
    }

    public static CorrectionRequest of(String targetPath, String instruction) {
        return new CorrectionRequest(null, targetPath, instruction, null, null);
    }

    public String getRequestId()        { return requestId; }
    public String getTargetPath()       { return targetPath; }
    public String getInstruction()      { return instruction; }
    public String getProjectContext()   { return projectContext; }
    public String getRelevantSnippets() { return relevantSnippets; }

    @Override
    public String toString() {
        return "CorrectionRequest{" + requestId + ", " + targetPath + "}";
    }
}
