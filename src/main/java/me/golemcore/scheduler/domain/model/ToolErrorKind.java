package me.golemcore.scheduler.domain.model;

/**
 * Machine-readable classification of why a tool call did not succeed.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolErrorKind {

    /**
     * The requested tool name is not registered.
     */
    UNKNOWN_TOOL,

    /**
     * The tool is registered but disabled by configuration.
     */
    TOOL_DISABLED,

    /**
     * The request itself was malformed (no tool name, unusable arguments).
     */
    INVALID_PARAMS,

    /**
     * A before-tool hook refused the call.
     */
    HOOK_BLOCKED,

    /**
     * The approval authority (policy engine or user) refused the call.
     */
    POLICY_DENIED,

    /**
     * The tool ran and failed (exception, failed result, non-zero exit, etc.).
     */
    EXECUTION_ERROR,

    /**
     * The batch cancellation token fired before or during execution.
     */
    CANCELLED,

    /**
     * A defect in the scheduler itself.
     */
    INTERNAL_SCHEDULER_FAULT
}
