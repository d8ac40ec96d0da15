package com.codemend.config;

/**
 * How plan commands are confirmed when no interactive user is attached.
 */
public enum ConfirmationMode {
    /** Decline every command; the step is skipped. */
    DENY,
    /** Allow every command that passed the security policy. */
    ALLOW,
    /** Allow ordinary commands, decline high-risk ones. */
    ALLOW_SAFE
}
