package me.golemcore.scheduler.port.outbound;

import me.golemcore.scheduler.domain.model.PolicyDecision;

import java.util.Map;

/**
 * Port for the static allow/deny/ask rules evaluated before a call runs.
 */
public interface PolicyEnginePort {

    /**
     * Evaluates the rules for a tool call.
     *
     * @return the verdict, never null
     */
    PolicyDecision evaluate(String toolName, Map<String, Object> args);
}
