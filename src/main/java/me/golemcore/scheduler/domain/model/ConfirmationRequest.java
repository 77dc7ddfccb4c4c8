package me.golemcore.scheduler.domain.model;

import lombok.Builder;

import java.util.Map;

/**
 * Prompt sent over the interactive confirmation channel.
 */
@Builder
public record ConfirmationRequest(String sessionId, String agentId, String callId, String toolName,
        Map<String, Object> args, String description) {
}
