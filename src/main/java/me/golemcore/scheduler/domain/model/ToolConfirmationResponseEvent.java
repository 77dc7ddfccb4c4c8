package me.golemcore.scheduler.domain.model;

/**
 * Answer to a {@link ToolConfirmationRequestedEvent}, published by whichever
 * layer owns the user interaction.
 *
 * @since 1.0
 */
public record ToolConfirmationResponseEvent(String correlationId, ToolConfirmationOutcome outcome) {
}
