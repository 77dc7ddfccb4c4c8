package me.golemcore.scheduler.domain.scheduler;

import lombok.Builder;
import me.golemcore.scheduler.port.outbound.ApprovalAuthorityPort;
import me.golemcore.scheduler.port.outbound.HookMediatorPort;
import me.golemcore.scheduler.port.outbound.ToolRegistryPort;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators a scheduler instance is built from. Resolved once per
 * instance; the first acquirer's dependencies win.
 *
 * @param toolRegistry
 *            resolves tool names
 * @param hookMediator
 *            before/after hooks; defaults to a no-op mediator
 * @param approvalAuthority
 *            gates execution
 * @param executor
 *            runs state-machine steps
 * @param clock
 *            timestamps for durations and live output
 * @param maxToolResultChars
 *            output cap for successful results, 0 disables
 * @param defaultAgentId
 *            actor id stamped on requests lacking one
 */
@Builder
public record SchedulerDependencies(ToolRegistryPort toolRegistry, HookMediatorPort hookMediator,
        ApprovalAuthorityPort approvalAuthority, Executor executor, Clock clock, int maxToolResultChars,
        String defaultAgentId) {

    public static final String DEFAULT_AGENT_ID = "primary";

    public SchedulerDependencies {
        Objects.requireNonNull(toolRegistry, "toolRegistry must not be null");
        Objects.requireNonNull(approvalAuthority, "approvalAuthority must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        if (hookMediator == null) {
            hookMediator = HookMediatorPort.noop();
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }
        if (defaultAgentId == null || defaultAgentId.isBlank()) {
            defaultAgentId = DEFAULT_AGENT_ID;
        }
    }
}
