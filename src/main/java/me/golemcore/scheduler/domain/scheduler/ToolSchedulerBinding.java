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
import reactor.core.Disposable;
import reactor.core.Disposables;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Caller-side handle on a shared scheduler instance.
 *
 * <p>
 * Acquires the instance from the {@link SchedulerRegistry} on creation and
 * releases it on {@link #close()}. Batches scheduled before the instance is
 * ready are queued and replayed in submission order; a queued batch whose token
 * was cancelled in the meantime is skipped.
 */
@Slf4j
public class ToolSchedulerBinding implements AutoCloseable {

    private final SchedulerRegistry registry;
    private final SchedulerKey key;
    private final Consumer<BatchCompletion> completionHandler;
    private final Consumer<LiveOutputChunk> liveOutputHandler;

    private final Object lock = new Object();
    private final List<PendingSchedule> pending = new ArrayList<>();
    private final AtomicLong lastOutputTime = new AtomicLong();
    private ToolCallScheduler scheduler;
    private Disposable subscriptions;
    private boolean closed;

    public ToolSchedulerBinding(SchedulerRegistry registry, String sessionId, String agentId,
            Supplier<CompletableFuture<SchedulerDependencies>> dependencies,
            Consumer<BatchCompletion> completionHandler, Consumer<LiveOutputChunk> liveOutputHandler) {
        this.registry = registry;
        this.key = new SchedulerKey(sessionId, agentId);
        this.completionHandler = completionHandler;
        this.liveOutputHandler = liveOutputHandler;
        registry.acquire(sessionId, agentId, dependencies).whenComplete(this::onReady);
    }

    public SchedulerKey getKey() {
        return key;
    }

    public boolean isReady() {
        synchronized (lock) {
            return scheduler != null;
        }
    }

    /**
     * Schedules a batch, queueing it if the instance is still being built.
     *
     * @return future completing once the batch completion was published
     */
    public CompletableFuture<Void> schedule(List<ToolCallRequest> requests, CancellationToken token) {
        ToolCallScheduler target;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Scheduler binding " + key + " is closed");
            }
            if (scheduler == null) {
                PendingSchedule queued = new PendingSchedule(List.copyOf(requests), token, new CompletableFuture<>());
                pending.add(queued);
                log.debug("[Scheduler] {} not ready, queued {} request(s)", key, requests.size());
                return queued.result();
            }
            target = scheduler;
        }
        return target.schedule(requests, token);
    }

    public void cancelAll() {
        ToolCallScheduler target;
        synchronized (lock) {
            dropPending();
            target = scheduler;
        }
        if (target != null) {
            target.cancelAll();
        }
    }

    public int markResponsesDelivered(Collection<String> callIds) {
        ToolCallScheduler target;
        synchronized (lock) {
            target = scheduler;
        }
        return target != null ? target.markResponsesDelivered(callIds) : 0;
    }

    public List<ToolCall> getTrackedCalls() {
        ToolCallScheduler target;
        synchronized (lock) {
            target = scheduler;
        }
        return target != null ? target.getTrackedCalls() : List.of();
    }

    /**
     * Epoch millis of the last live output seen through this binding, 0 if
     * none.
     */
    public long getLastOutputTime() {
        return lastOutputTime.get();
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            dropPending();
            if (subscriptions != null) {
                subscriptions.dispose();
            }
            scheduler = null;
        }
        registry.release(key.sessionId(), key.agentId());
    }

    private void onReady(ToolCallScheduler ready, Throwable error) {
        synchronized (lock) {
            if (closed) {
                return;
            }
            if (error != null) {
                log.warn("[Scheduler] {} could not be acquired: {}", key,
                        ToolCallStateMachine.safeCauseMessage(error));
                for (PendingSchedule queued : pending) {
                    queued.result().completeExceptionally(ToolCallStateMachine.unwrap(error));
                }
                pending.clear();
                return;
            }
            scheduler = ready;
            subscriptions = Disposables.composite(
                    ready.completions().subscribe(this::onCompletion),
                    ready.liveOutput().subscribe(this::onLiveOutput));
            for (PendingSchedule queued : pending) {
                replay(ready, queued);
            }
            pending.clear();
        }
    }

    private void replay(ToolCallScheduler target, PendingSchedule queued) {
        if (queued.token() != null && queued.token().isCancelled()) {
            log.debug("[Scheduler] {} skipped queued batch, token already cancelled", key);
            queued.result().complete(null);
            return;
        }
        try {
            target.schedule(queued.requests(), queued.token()).whenComplete((ignored, error) -> {
                if (error != null) {
                    queued.result().completeExceptionally(error);
                } else {
                    queued.result().complete(null);
                }
            });
        } catch (RuntimeException e) {
            queued.result().completeExceptionally(e);
        }
    }

    private void dropPending() {
        for (PendingSchedule queued : pending) {
            queued.result().complete(null);
        }
        pending.clear();
    }

    private void onCompletion(BatchCompletion completion) {
        try {
            completionHandler.accept(completion);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] {} completion handler failed: {}", key, e.getMessage(), e);
        }
    }

    private void onLiveOutput(LiveOutputChunk chunk) {
        lastOutputTime.accumulateAndGet(chunk.timestamp().toEpochMilli(), Math::max);
        if (liveOutputHandler == null) {
            return;
        }
        try {
            liveOutputHandler.accept(chunk);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] {} live output handler failed: {}", key, e.getMessage());
        }
    }

    private record PendingSchedule(List<ToolCallRequest> requests, CancellationToken token,
            CompletableFuture<Void> result) {
    }
}
