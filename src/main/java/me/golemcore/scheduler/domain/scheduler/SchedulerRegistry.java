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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.SchedulerKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Reference-counted cache of scheduler instances keyed by
 * {@code (sessionId, agentId)}.
 *
 * <p>
 * The first acquirer's dependencies build the instance; later acquirers share
 * it, including while construction is still in progress. Releasing the last
 * reference disposes and evicts the instance, after which a new acquire builds
 * a fresh one.
 */
@Component
@Slf4j
public class SchedulerRegistry {

    private final Object lock = new Object();
    private final Map<SchedulerKey, Entry> entries = new HashMap<>();

    /**
     * Returns the instance for the key, constructing it if needed.
     *
     * @param dependencies
     *            invoked only when a new instance must be built; may complete
     *            asynchronously
     * @return future completing with the shared instance
     */
    public CompletableFuture<ToolCallScheduler> acquire(String sessionId, String agentId,
            Supplier<CompletableFuture<SchedulerDependencies>> dependencies) {
        SchedulerKey key = new SchedulerKey(sessionId, agentId);
        Entry entry;
        boolean construct = false;
        synchronized (lock) {
            entry = entries.get(key);
            if (entry == null) {
                entry = new Entry(key);
                entries.put(key, entry);
                construct = true;
            }
            entry.refCount++;
            log.debug("[Registry] acquire {} (refs={})", key, entry.refCount);
        }
        if (construct) {
            construct(entry, dependencies);
        }
        return entry.ready.thenApply(scheduler -> scheduler);
    }

    /**
     * Drops one reference. At zero the instance is disposed and evicted; an
     * instance still under construction is disposed as soon as it is ready.
     *
     * @return true if a reference was released
     */
    public boolean release(String sessionId, String agentId) {
        SchedulerKey key = new SchedulerKey(sessionId, agentId);
        ToolCallScheduler toDispose;
        synchronized (lock) {
            Entry entry = entries.get(key);
            if (entry == null) {
                log.debug("[Registry] release of unknown scheduler {}", key);
                return false;
            }
            entry.refCount--;
            log.debug("[Registry] release {} (refs={})", key, entry.refCount);
            if (entry.refCount > 0) {
                return true;
            }
            entries.remove(key);
            toDispose = entry.scheduler;
        }
        if (toDispose != null) {
            toDispose.dispose();
            log.info("[Registry] Disposed scheduler {}", key);
        }
        return true;
    }

    public int getReferenceCount(String sessionId, String agentId) {
        synchronized (lock) {
            Entry entry = entries.get(new SchedulerKey(sessionId, agentId));
            return entry != null ? entry.refCount : 0;
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    @PreDestroy
    public void disposeAll() {
        List<ToolCallScheduler> schedulers = new ArrayList<>();
        synchronized (lock) {
            for (Entry entry : entries.values()) {
                entry.refCount = 0;
                if (entry.scheduler != null) {
                    schedulers.add(entry.scheduler);
                }
            }
            entries.clear();
        }
        schedulers.forEach(ToolCallScheduler::dispose);
    }

    private void construct(Entry entry, Supplier<CompletableFuture<SchedulerDependencies>> dependencies) {
        CompletableFuture<SchedulerDependencies> resolved;
        try {
            resolved = dependencies.get();
        } catch (RuntimeException e) {
            resolved = CompletableFuture.failedFuture(e);
        }
        if (resolved == null) {
            resolved = CompletableFuture.failedFuture(
                    new IllegalStateException("No dependencies supplied for " + entry.key));
        }
        resolved.thenApply(deps -> new ToolCallScheduler(entry.key, deps))
                .whenComplete((scheduler, error) -> onConstructed(entry, scheduler, error));
    }

    private void onConstructed(Entry entry, ToolCallScheduler scheduler, Throwable error) {
        if (error != null) {
            synchronized (lock) {
                entries.remove(entry.key, entry);
            }
            log.warn("[Registry] Failed to construct scheduler {}: {}", entry.key,
                    ToolCallStateMachine.safeCauseMessage(error));
            entry.ready.completeExceptionally(ToolCallStateMachine.unwrap(error));
            return;
        }
        boolean orphaned;
        synchronized (lock) {
            orphaned = entry.refCount <= 0;
            if (!orphaned) {
                entry.scheduler = scheduler;
            }
        }
        if (orphaned) {
            scheduler.dispose();
            log.debug("[Registry] Scheduler {} released before construction finished", entry.key);
            entry.ready.completeExceptionally(new CancellationException("Scheduler " + entry.key + " was released"));
            return;
        }
        log.info("[Registry] Constructed scheduler {}", entry.key);
        entry.ready.complete(scheduler);
    }

    private static final class Entry {

        private final SchedulerKey key;
        private final CompletableFuture<ToolCallScheduler> ready = new CompletableFuture<>();
        private int refCount;
        private ToolCallScheduler scheduler;

        private Entry(SchedulerKey key) {
            this.key = key;
        }
    }
}
