package me.golemcore.scheduler.domain.model;

import lombok.Builder;

/**
 * Render-ready projection of a tracked call.
 */
@Builder
public record ToolCallDisplay(String callId, String name, String description, ToolCallDisplayStatus status,
        String resultDisplay, boolean suppressOutput, String agentId) {
}
