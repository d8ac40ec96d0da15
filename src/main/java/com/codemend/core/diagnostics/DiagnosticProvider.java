package com.codemend.core.diagnostics;

import com.codemend.core.issue.RawDiagnostic;

import java.util.List;

/**
 * Source of diagnostics for a workspace file. Called repeatedly while
 * waiting for stabilization, so implementations must be cheap and must not
 * block on a fresh analysis.
 */
public interface DiagnosticProvider {

    /**
     * @param target workspace-relative path of the file
     * @return the diagnostics currently reported for the file, never null
     */
    List<RawDiagnostic> getDiagnostics(String target);
}
