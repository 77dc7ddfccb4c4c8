package me.golemcore.scheduler.adapter.outbound.hooks;

import me.golemcore.scheduler.infrastructure.config.SchedulerProperties.HookEvent;

import java.util.regex.Pattern;

/**
 * A shell command run around tool calls. A null matcher matches every tool.
 */
record HookDefinition(HookEvent event, Pattern matcher, String command, int timeoutSeconds) {

    boolean matches(HookEvent candidateEvent, String toolName) {
        if (event != candidateEvent) {
            return false;
        }
        return matcher == null || (toolName != null && matcher.matcher(toolName).matches());
    }
}
