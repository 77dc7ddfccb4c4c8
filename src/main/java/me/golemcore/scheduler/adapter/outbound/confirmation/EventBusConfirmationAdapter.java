package me.golemcore.scheduler.adapter.outbound.confirmation;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.ConfirmationRequest;
import me.golemcore.scheduler.domain.model.ToolConfirmationOutcome;
import me.golemcore.scheduler.domain.model.ToolConfirmationRequestedEvent;
import me.golemcore.scheduler.domain.model.ToolConfirmationResponseEvent;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.infrastructure.event.SpringEventBus;
import me.golemcore.scheduler.port.outbound.ConfirmationPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Event-bus implementation of {@link ConfirmationPort}.
 *
 * <p>
 * Each prompt is published as a {@link ToolConfirmationRequestedEvent} with a
 * fresh correlation id and kept pending until a
 * {@link ToolConfirmationResponseEvent} with the same id arrives, the timeout
 * elapses (resolved as {@link ToolConfirmationOutcome#CANCEL}), or the caller
 * cancels the returned future.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code scheduler.confirmation.enabled} - Enable/disable
 * <li>{@code scheduler.confirmation.timeout-seconds} - Timeout
 * </ul>
 *
 * @see me.golemcore.scheduler.domain.service.ToolApprovalService
 */
@Component
@Slf4j
public class EventBusConfirmationAdapter implements ConfirmationPort {

    private final Map<String, CompletableFuture<ToolConfirmationOutcome>> pending = new ConcurrentHashMap<>();
    private final SpringEventBus eventBus;
    private final boolean enabled;
    private final int timeoutSeconds;

    public EventBusConfirmationAdapter(SpringEventBus eventBus, SchedulerProperties properties) {
        this.eventBus = eventBus;
        SchedulerProperties.ConfirmationProperties config = properties.getConfirmation();
        this.enabled = config.isEnabled();
        this.timeoutSeconds = config.getTimeoutSeconds();
        log.info("[Confirmation] EventBusConfirmationAdapter enabled: {}, timeout: {}s", enabled, timeoutSeconds);
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolConfirmationOutcome> requestConfirmation(ConfirmationRequest request) {
        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<ToolConfirmationOutcome> future = new CompletableFuture<>();
        pending.put(correlationId, future);
        future.whenComplete((outcome, error) -> pending.remove(correlationId, future));
        if (timeoutSeconds > 0) {
            future.completeOnTimeout(ToolConfirmationOutcome.CANCEL, timeoutSeconds, TimeUnit.SECONDS);
        }

        try {
            eventBus.publish(new ToolConfirmationRequestedEvent(correlationId, request));
        } catch (RuntimeException e) {
            log.error("[Confirmation] Failed to publish confirmation request, cancelling", e);
            future.complete(ToolConfirmationOutcome.CANCEL);
        }
        log.debug("[Confirmation] Pending confirmation {} for '{}'", correlationId, request.toolName());
        return future;
    }

    @EventListener
    public void onConfirmationResponse(ToolConfirmationResponseEvent event) {
        CompletableFuture<ToolConfirmationOutcome> future = pending.get(event.correlationId());
        if (future == null) {
            log.debug("[Confirmation] No pending confirmation found for id: {}", event.correlationId());
            return;
        }
        ToolConfirmationOutcome outcome = event.outcome() != null ? event.outcome() : ToolConfirmationOutcome.CANCEL;
        future.complete(outcome);
        log.info("[Confirmation] Confirmation {} resolved: {}", event.correlationId(), outcome);
    }

    public int getPendingCount() {
        return pending.size();
    }
}
