package me.golemcore.scheduler.domain.scheduler;

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
import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.LiveOutputChunk;
import me.golemcore.scheduler.domain.model.SchedulerKey;
import me.golemcore.scheduler.domain.model.ToolCallRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Scheduler instance for one (session, actor) pair.
 *
 * <p>
 * Owns the tracked calls of all in-flight batches, deduplicates submissions by
 * call id, publishes one {@link BatchCompletion} per non-empty batch and relays
 * live output. Instances are normally obtained from {@link SchedulerRegistry}
 * rather than constructed directly.
 */
@Slf4j
public class ToolCallScheduler {

    private static final long LIVE_OUTPUT_EMIT_TIMEOUT_NANOS = Duration.ofMillis(500).toNanos();

    private final SchedulerKey key;
    private final String defaultAgentId;
    private final boolean primary;
    private final Clock clock;
    private final ToolCallStateMachine stateMachine;

    private final Object lock = new Object();
    private final Map<String, ToolCall> trackedCalls = new LinkedHashMap<>();
    private final Set<ToolCallBatch> activeBatches = new LinkedHashSet<>();
    private final AtomicLong batchSequence = new AtomicLong();
    private final AtomicLong lastOutputAt = new AtomicLong();
    private boolean disposed;

    private final Object completionLock = new Object();
    private final Sinks.Many<BatchCompletion> completions = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<LiveOutputChunk> liveOutput = Sinks.many().multicast().directBestEffort();

    public ToolCallScheduler(SchedulerKey key, SchedulerDependencies dependencies) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.defaultAgentId = dependencies.defaultAgentId();
        this.primary = defaultAgentId.equals(key.agentId());
        this.clock = dependencies.clock();
        this.stateMachine = new ToolCallStateMachine(key, dependencies, this::onLiveOutput);
    }

    public SchedulerKey getKey() {
        return key;
    }

    public boolean isPrimary() {
        return primary;
    }

    /**
     * Submits a batch. Requests whose call id is already tracked by this
     * instance, or repeated within the batch, are dropped. Requests without an
     * agent id get the default one.
     *
     * @param requests
     *            calls to run together
     * @param cancellationToken
     *            caller token; cancelling it cancels this batch only
     * @return future completing after the batch completion was published (at
     *         once for an empty batch)
     */
    public CompletableFuture<Void> schedule(List<ToolCallRequest> requests, CancellationToken cancellationToken) {
        Objects.requireNonNull(requests, "requests must not be null");
        ToolCallBatch batch;
        synchronized (lock) {
            if (disposed) {
                throw new IllegalStateException("Scheduler " + key + " is disposed");
            }
            List<ToolCall> accepted = new ArrayList<>();
            for (ToolCallRequest request : requests) {
                Objects.requireNonNull(request, "request must not be null");
                Objects.requireNonNull(request.callId(), "callId must not be null");
                if (trackedCalls.containsKey(request.callId())) {
                    log.debug("[Scheduler] {} dropped duplicate call {} ({})", key, request.callId(),
                            request.name());
                    continue;
                }
                ToolCall call = new ToolCall(request.withAgentIdIfMissing(defaultAgentId), clock.millis());
                trackedCalls.put(call.getCallId(), call);
                accepted.add(call);
            }
            if (accepted.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            batch = new ToolCallBatch(batchSequence.incrementAndGet(), accepted, cancellationToken);
            activeBatches.add(batch);
        }

        log.debug("[Scheduler] {} scheduling batch #{} with {} call(s)", key, batch.getId(), batch.getCalls().size());
        return batch.start(stateMachine).thenAccept(calls -> completeBatch(batch, calls));
    }

    /**
     * Cancels every in-flight batch on this instance. Calls inside tool
     * execution are cancelled once the tool unwinds.
     */
    public void cancelAll(String reason) {
        List<ToolCallBatch> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(activeBatches);
        }
        if (!snapshot.isEmpty()) {
            log.info("[Scheduler] {} cancelling {} batch(es)", key, snapshot.size());
        }
        for (ToolCallBatch batch : snapshot) {
            batch.cancel(reason);
        }
    }

    public void cancelAll() {
        cancelAll(ToolCallStateMachine.DEFAULT_CANCEL_REASON);
    }

    /**
     * Batch completions, one event per non-empty batch.
     */
    public Flux<BatchCompletion> completions() {
        return completions.asFlux();
    }

    /**
     * Incremental output of streaming tools.
     */
    public Flux<LiveOutputChunk> liveOutput() {
        return liveOutput.asFlux();
    }

    /**
     * Epoch millis of the most recent live output, 0 if none yet. Never moves
     * backwards.
     */
    public long getLastOutputAt() {
        return lastOutputAt.get();
    }

    public List<ToolCall> getTrackedCalls() {
        synchronized (lock) {
            return List.copyOf(trackedCalls.values());
        }
    }

    /**
     * Marks tracked calls as delivered to their consumer.
     *
     * @return number of calls newly marked
     */
    public int markResponsesDelivered(Collection<String> callIds) {
        List<ToolCall> matches = new ArrayList<>();
        synchronized (lock) {
            for (String callId : callIds) {
                ToolCall call = trackedCalls.get(callId);
                if (call != null) {
                    matches.add(call);
                }
            }
        }
        int marked = 0;
        for (ToolCall call : matches) {
            if (call.markResponseDelivered()) {
                marked++;
            }
        }
        return marked;
    }

    public boolean isDisposed() {
        synchronized (lock) {
            return disposed;
        }
    }

    /**
     * Cancels outstanding work and completes both streams. Called by the
     * registry when the last reference is released.
     */
    public void dispose() {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            disposed = true;
        }
        cancelAll("Scheduler disposed.");
        synchronized (completionLock) {
            completions.tryEmitComplete();
        }
        emitLiveOutput(liveOutput::tryEmitComplete, "completion");
        log.debug("[Scheduler] {} disposed", key);
    }

    private void completeBatch(ToolCallBatch batch, List<ToolCall> calls) {
        if (!batch.markCompleted()) {
            return;
        }
        BatchCompletion completion = new BatchCompletion(key, calls, primary);
        log.debug("[Scheduler] {} batch #{} complete", key, batch.getId());
        // completions of concurrent batches are serialized among themselves only
        synchronized (completionLock) {
            Sinks.EmitResult result = completions.tryEmitNext(completion);
            if (result == Sinks.EmitResult.FAIL_OVERFLOW || result == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
                log.warn("[Scheduler] {} could not publish completion of batch #{}: {}", key, batch.getId(), result);
            }
        }
        synchronized (lock) {
            for (ToolCall call : calls) {
                trackedCalls.remove(call.getCallId(), call);
            }
            activeBatches.remove(batch);
        }
        batch.close();
    }

    private void onLiveOutput(ToolCall call, String chunk) {
        Instant now = clock.instant();
        lastOutputAt.accumulateAndGet(now.toEpochMilli(), Math::max);
        LiveOutputChunk event = new LiveOutputChunk(call.getCallId(), chunk, now);
        emitLiveOutput(() -> liveOutput.tryEmitNext(event), call.getCallId());
    }

    /**
     * Emits without holding a lock across subscriber code; concurrent emitters
     * spin until the sink is free or the timeout passes.
     */
    private void emitLiveOutput(Supplier<Sinks.EmitResult> emission, String what) {
        long deadline = System.nanoTime() + LIVE_OUTPUT_EMIT_TIMEOUT_NANOS;
        Sinks.EmitResult result = emission.get();
        while (result == Sinks.EmitResult.FAIL_NON_SERIALIZED && System.nanoTime() < deadline) {
            Thread.onSpinWait();
            result = emission.get();
        }
        if (result == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
            log.warn("[Scheduler] {} dropped live output of {}: sink busy", key, what);
        }
    }
}
