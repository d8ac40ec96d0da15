package com.codemend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfirmationModeResolver {

    private final ConfirmationMode mode;

    public ConfirmationModeResolver(
        @Value("${codemend.commands.confirmation-mode:ALLOW_SAFE}") String mode
    ) {
        this.mode = ConfirmationMode.valueOf(mode.trim().toUpperCase().replace('-', '_'));
    }

    public boolean isDeny() {
        return mode == ConfirmationMode.DENY;
    }

    public boolean isAllow() {
        return mode == ConfirmationMode.ALLOW;
    }

    public ConfirmationMode getMode() {
        return mode;
    }
}
