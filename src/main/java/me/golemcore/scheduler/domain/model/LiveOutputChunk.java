package me.golemcore.scheduler.domain.model;

import java.time.Instant;

/**
 * Incremental output emitted by a streaming tool while it executes.
 */
public record LiveOutputChunk(String callId, String chunk, Instant timestamp) {
}
