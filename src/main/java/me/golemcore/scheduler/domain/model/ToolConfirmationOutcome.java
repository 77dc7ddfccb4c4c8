package me.golemcore.scheduler.domain.model;

/**
 * Answer given on the interactive confirmation channel.
 */
public enum ToolConfirmationOutcome {

    /**
     * Run this call only.
     */
    PROCEED_ONCE,

    /**
     * Run this call and stop asking for the same tool for the rest of the
     * session.
     */
    PROCEED_ALWAYS,

    /**
     * Do not run the call.
     */
    CANCEL
}
