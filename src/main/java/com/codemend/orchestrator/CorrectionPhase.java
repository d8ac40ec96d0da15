package com.codemend.orchestrator;

/**
 * Phases of one correction request.
 *
 * INIT → GENERATE_INITIAL → VALIDATE_INITIAL → DONE
 *                                            ↘ PLAN_GENERATE → PLAN_EXECUTE → REVALIDATE → CLASSIFY
 *                                                    ↑_______________________________________|  → DONE
 *
 * GENERATE_INITIAL: produce the file (create) or the edited file (modify) and write it.
 * VALIDATE_INITIAL: wait for diagnostics to settle, classify issues. Zero issues ends here.
 * PLAN_GENERATE   : ask for a correction plan; an unparseable plan ends the iteration.
 * PLAN_EXECUTE    : apply the plan; a failed or empty plan ends the iteration.
 * REVALIDATE      : re-read the target, wait for diagnostics, classify issues.
 * CLASSIFY        : compare with the issues before and record the outcome.
 */
public enum CorrectionPhase {
    INIT,
    GENERATE_INITIAL,
    VALIDATE_INITIAL,
    PLAN_GENERATE,
    PLAN_EXECUTE,
    REVALIDATE,
    CLASSIFY,
    DONE
}
