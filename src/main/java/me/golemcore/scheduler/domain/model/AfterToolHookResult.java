package me.golemcore.scheduler.domain.model;

/**
 * Annotation produced by the after-tool hooks. Never changes success or
 * failure of the call.
 */
public record AfterToolHookResult(String systemMessage, boolean suppressOutput) {

    public static AfterToolHookResult none() {
        return new AfterToolHookResult(null, false);
    }
}
