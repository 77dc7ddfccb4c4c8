package me.golemcore.scheduler.port.outbound;

import me.golemcore.scheduler.domain.model.ToolCallResponse;

import java.util.List;

/**
 * Port receiving results of batches issued by sub-agents. These never reach the
 * primary conversation.
 */
public interface SubagentResultPort {

    void deliver(String sessionId, String agentId, List<ToolCallResponse> responses);
}
