package me.golemcore.scheduler.domain.model;

import java.util.List;

/**
 * Published when a batch of tool results is ready for its consumer.
 *
 * @param sessionId
 *            session the batch belongs to
 * @param agentId
 *            actor that issued the calls
 * @param primary
 *            true when the results go back to the main conversation model,
 *            false when they go to a sub-agent launcher
 * @param responses
 *            responses in submission order
 */
public record ToolResultsEvent(String sessionId, String agentId, boolean primary, List<ToolCallResponse> responses)
        implements SchedulerEvent {

    public ToolResultsEvent {
        responses = List.copyOf(responses);
    }
}
