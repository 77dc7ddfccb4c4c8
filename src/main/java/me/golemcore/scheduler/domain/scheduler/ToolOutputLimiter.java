package me.golemcore.scheduler.domain.scheduler;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.ToolResult;

/**
 * Caps successful tool output so a single result cannot flood the model
 * context.
 */
@Slf4j
public final class ToolOutputLimiter {

    private final int maxChars;

    public ToolOutputLimiter(int maxChars) {
        this.maxChars = maxChars;
    }

    public ToolResult limit(ToolResult result, String toolName) {
        if (result == null || result.getOutput() == null) {
            return result;
        }
        String truncated = truncate(result.getOutput(), toolName);
        if (truncated.equals(result.getOutput())) {
            return result;
        }
        return result.withTruncatedOutput(truncated);
    }

    public String truncate(String content, String toolName) {
        if (content == null) {
            return null;
        }
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. The full result is too large for the context window."
                + " Try a more specific query, use filtering/pagination, or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Scheduler] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }
}
