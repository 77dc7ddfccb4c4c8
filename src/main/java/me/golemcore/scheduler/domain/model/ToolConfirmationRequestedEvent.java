package me.golemcore.scheduler.domain.model;

/**
 * Published when a tool call waits for the user. UI layers answer with a
 * {@link ToolConfirmationResponseEvent} carrying the same correlation id.
 */
public record ToolConfirmationRequestedEvent(String correlationId, ConfirmationRequest request)
        implements SchedulerEvent {

    @Override
    public String sessionId() {
        return request.sessionId();
    }
}
