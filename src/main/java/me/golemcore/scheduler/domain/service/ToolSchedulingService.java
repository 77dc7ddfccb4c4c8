package me.golemcore.scheduler.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.LiveOutputChunk;
import me.golemcore.scheduler.domain.model.SchedulerKey;
import me.golemcore.scheduler.domain.scheduler.SchedulerRegistry;
import me.golemcore.scheduler.domain.scheduler.ToolSchedulerBinding;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.springframework.stereotype.Service;

import java.util.function.Consumer;

/**
 * Entry point for the conversation loop and sub-agent launchers. Hands out
 * bindings on shared scheduler instances whose completions are routed through
 * {@link ToolResultRouter}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolSchedulingService {

    private final SchedulerRegistry registry;
    private final SchedulerDependenciesFactory dependenciesFactory;
    private final ToolResultRouter resultRouter;
    private final SchedulerProperties properties;

    /**
     * Binds the main conversation of a session.
     */
    public ToolSchedulerBinding bindPrimary(String sessionId, Consumer<LiveOutputChunk> liveOutputHandler) {
        return bind(sessionId, properties.getDefaultAgentId(), liveOutputHandler);
    }

    /**
     * Binds an actor of a session. Bindings for the same pair share one
     * scheduler instance; close each binding when done. A null or blank agent
     * id binds the main conversation.
     */
    public ToolSchedulerBinding bind(String sessionId, String agentId, Consumer<LiveOutputChunk> liveOutputHandler) {
        String resolvedAgentId = agentId == null || agentId.isBlank() ? properties.getDefaultAgentId() : agentId;
        SchedulerKey key = new SchedulerKey(sessionId, resolvedAgentId);
        log.debug("[Scheduler] Binding {}", key);
        return new ToolSchedulerBinding(registry, sessionId, resolvedAgentId, () -> dependenciesFactory.create(key),
                resultRouter::route, liveOutputHandler);
    }
}
