package me.golemcore.scheduler.domain.model;

/**
 * Thrown (or used to complete a tool future exceptionally) when a tool stops
 * because its cancellation token fired.
 */
public class ToolCancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ToolCancelledException(String message) {
        super(message);
    }
}
