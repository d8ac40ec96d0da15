package com.codemend.core.executor;

import com.codemend.config.ConfirmationModeResolver;
import com.codemend.core.cancel.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Non-interactive confirmation decided by {@code codemend.commands.confirmation-mode}.
 */
@Component
public class PolicyCommandConfirmation implements CommandConfirmation {

    private static final Logger log = LoggerFactory.getLogger(PolicyCommandConfirmation.class);

    private final ConfirmationModeResolver modeResolver;

    public PolicyCommandConfirmation(ConfirmationModeResolver modeResolver) {
        this.modeResolver = modeResolver;
    }

    @Override
    public boolean confirm(String displayCommand, ExecutableRule rule, CancellationToken token) {
        token.throwIfCancelled();

        boolean allowed;
        switch (modeResolver.getMode()) {
            case ALLOW -> allowed = true;
            case DENY -> allowed = false;
            default -> allowed = !rule.needsCarefulConfirmation();
        }

        log.info("[Confirmation] {} '{}' (mode={}, highRisk={})",
                allowed ? "Allowed" : "Declined", displayCommand, modeResolver.getMode(), rule.isHighRisk());
        return allowed;
    }
}
