package com.codemend.core.executor;

import com.codemend.core.cancel.CancellationToken;

/**
 * Asks whether a plan command that passed the security policy may run.
 * Declining skips the step without failing the plan.
 */
public interface CommandConfirmation {

    boolean confirm(String displayCommand, ExecutableRule rule, CancellationToken token);
}
