package me.golemcore.scheduler.domain.model;

/**
 * Result of asking the approval authority about a call. {@code reason} is set
 * for denials and surfaced verbatim to the caller. {@code sessionWide} marks an
 * allow that now also covers other calls of the same tool in the session.
 */
public record ApprovalDecision(PolicyDecision decision, String reason, boolean sessionWide) {

    public static ApprovalDecision allow() {
        return new ApprovalDecision(PolicyDecision.ALLOW, null, false);
    }

    public static ApprovalDecision allowForSession() {
        return new ApprovalDecision(PolicyDecision.ALLOW, null, true);
    }

    public static ApprovalDecision deny(String reason) {
        return new ApprovalDecision(PolicyDecision.DENY, reason, false);
    }

    public static ApprovalDecision askUser() {
        return new ApprovalDecision(PolicyDecision.ASK_USER, null, false);
    }

    public boolean isAllowed() {
        return decision == PolicyDecision.ALLOW;
    }
}
