package me.golemcore.scheduler.domain.model;

import lombok.Builder;

/**
 * Terminal outcome of a tool call.
 *
 * @param callId
 *            id of the call this response belongs to
 * @param agentId
 *            actor that issued the call
 * @param result
 *            tool payload (present on success, and on execution errors that
 *            produced a result)
 * @param errorKind
 *            classification when the call did not succeed, null on success
 * @param errorMessage
 *            human-readable reason, surfaced verbatim to the caller
 * @param systemMessage
 *            annotation appended by an after-tool hook
 * @param suppressOutput
 *            display hint set by an after-tool hook
 * @param durationMs
 *            time from validation start to terminal status
 */
@Builder(toBuilder = true)
public record ToolCallResponse(String callId, String agentId, ToolResult result, ToolErrorKind errorKind,
        String errorMessage, String systemMessage, boolean suppressOutput, long durationMs) {

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * Text handed back to the model: the tool output (with the hook system
     * message appended) on success, otherwise the error message.
     */
    public String toModelContent() {
        String base;
        if (isSuccess()) {
            base = result != null ? result.getOutput() : null;
        } else if (result != null && result.getOutput() != null && !result.getOutput().isBlank()) {
            base = result.getOutput();
        } else {
            base = "Error: " + errorMessage;
        }
        if (systemMessage == null || systemMessage.isBlank()) {
            return base;
        }
        if (base == null || base.isEmpty()) {
            return systemMessage;
        }
        return base + "\n\n" + systemMessage;
    }
}
