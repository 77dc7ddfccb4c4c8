package me.golemcore.scheduler.port.outbound;

import me.golemcore.scheduler.domain.model.AfterToolHookResult;
import me.golemcore.scheduler.domain.model.BeforeToolHookResult;
import me.golemcore.scheduler.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for user-configured hooks that run around every tool call.
 */
public interface HookMediatorPort {

    /**
     * Runs the before-tool hooks. The verdict may allow (optionally with
     * rewritten arguments), block, or defer the call to approval.
     */
    CompletableFuture<BeforeToolHookResult> beforeTool(String sessionId, String toolName, Map<String, Object> args);

    /**
     * Runs the after-tool hooks on a finished call.
     */
    CompletableFuture<AfterToolHookResult> afterTool(String sessionId, String toolName, Map<String, Object> args,
            ToolResult result);

    /**
     * Mediator that allows everything and annotates nothing.
     */
    static HookMediatorPort noop() {
        return new HookMediatorPort() {
            @Override
            public CompletableFuture<BeforeToolHookResult> beforeTool(String sessionId, String toolName,
                    Map<String, Object> args) {
                return CompletableFuture.completedFuture(BeforeToolHookResult.allow());
            }

            @Override
            public CompletableFuture<AfterToolHookResult> afterTool(String sessionId, String toolName,
                    Map<String, Object> args, ToolResult result) {
                return CompletableFuture.completedFuture(AfterToolHookResult.none());
            }
        };
    }
}
