package me.golemcore.scheduler.adapter.outbound.results;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.ToolCallResponse;
import me.golemcore.scheduler.domain.model.ToolResultsEvent;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.infrastructure.event.SpringEventBus;
import me.golemcore.scheduler.port.outbound.ConversationResultPort;
import me.golemcore.scheduler.port.outbound.SubagentResultPort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Publishes routed tool results as {@link ToolResultsEvent}s for the
 * conversation loop and sub-agent launchers to pick up.
 */
@Component
@Slf4j
public class EventBusResultAdapter implements ConversationResultPort, SubagentResultPort {

    private final SpringEventBus eventBus;
    private final String primaryAgentId;

    public EventBusResultAdapter(SpringEventBus eventBus, SchedulerProperties properties) {
        this.eventBus = eventBus;
        this.primaryAgentId = properties.getDefaultAgentId();
    }

    @Override
    public void submitToolResponses(String sessionId, List<ToolCallResponse> responses) {
        log.debug("[Scheduler] Submitting {} tool response(s) to model, session {}", responses.size(), sessionId);
        eventBus.publish(new ToolResultsEvent(sessionId, primaryAgentId, true, responses));
    }

    @Override
    public void deliver(String sessionId, String agentId, List<ToolCallResponse> responses) {
        log.debug("[Scheduler] Delivering {} tool response(s) to sub-agent {}, session {}", responses.size(),
                agentId, sessionId);
        eventBus.publish(new ToolResultsEvent(sessionId, agentId, false, responses));
    }
}
