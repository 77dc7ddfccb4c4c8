package me.golemcore.scheduler.domain.model;

/**
 * Verdict of the policy engine for a single tool call.
 */
public enum PolicyDecision {
    ALLOW, DENY, ASK_USER
}
