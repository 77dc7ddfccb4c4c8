package me.golemcore.scheduler.domain.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of a call handed to the approval authority. Never the live
 * tracked call.
 *
 * @param hookRequestedApproval
 *            a before-tool hook deferred the call to approval
 * @param hookReason
 *            reason given by that hook, if any
 */
@Builder
public record ApprovalRequest(String sessionId, String agentId, String callId, String toolName,
        Map<String, Object> args, boolean hookRequestedApproval, String hookReason) {

    public ApprovalRequest {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }
}
