package me.golemcore.scheduler.domain.model;

import java.util.Objects;

/**
 * Identity of a scheduler instance: one per (session, actor) pair. Plain value
 * semantics, safe to use as a map key.
 */
public record SchedulerKey(String sessionId, String agentId) {

    public SchedulerKey {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(agentId, "agentId must not be null");
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
    }

    @Override
    public String toString() {
        return sessionId + "/" + agentId;
    }
}
