package me.golemcore.scheduler.adapter.outbound.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.component.LiveOutputSink;
import me.golemcore.scheduler.domain.component.ToolCapability;
import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.ToolCancelledException;
import me.golemcore.scheduler.domain.model.ToolResult;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Serializes executions of a tool that must not run concurrently with itself.
 * Waiting executions queue in arrival order; a waiter whose token fires leaves
 * the queue and completes with {@link ToolCancelledException}.
 */
@Slf4j
final class ExclusiveToolCapability implements ToolCapability {

    private final ToolCapability delegate;
    private final Object lock = new Object();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private boolean running;

    ExclusiveToolCapability(ToolCapability delegate) {
        this.delegate = delegate;
    }

    @Override
    public String getToolName() {
        return delegate.getToolName();
    }

    @Override
    public boolean canUpdateOutput() {
        return delegate.canUpdateOutput();
    }

    @Override
    public boolean isExclusive() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return delegate.isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, CancellationToken token,
            LiveOutputSink liveOutput) {
        Waiter waiter = new Waiter(new CompletableFuture<>());
        boolean acquired;
        synchronized (lock) {
            acquired = !running;
            if (acquired) {
                running = true;
            } else {
                waiters.addLast(waiter);
            }
        }
        if (acquired) {
            waiter.slot().complete(null);
        } else {
            log.debug("[Registry] '{}' is busy, waiting for exclusive slot", getToolName());
            CancellationToken.Registration registration = token.onCancel(reason -> {
                boolean removed;
                synchronized (lock) {
                    removed = waiters.remove(waiter);
                }
                if (removed) {
                    waiter.slot().completeExceptionally(new ToolCancelledException(reason));
                }
            });
            waiter.slot().whenComplete((ignored, error) -> registration.close());
        }

        return waiter.slot().thenCompose(ignored -> runAndRelease(parameters, token, liveOutput));
    }

    private CompletableFuture<ToolResult> runAndRelease(Map<String, Object> parameters, CancellationToken token,
            LiveOutputSink liveOutput) {
        CompletableFuture<ToolResult> execution;
        try {
            execution = delegate.execute(parameters, token, liveOutput);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        if (execution == null) {
            execution = CompletableFuture.completedFuture(null);
        }
        return execution.whenComplete((result, error) -> releaseSlot());
    }

    private void releaseSlot() {
        Waiter next;
        synchronized (lock) {
            next = waiters.pollFirst();
            if (next == null) {
                running = false;
            }
        }
        if (next != null) {
            next.slot().complete(null);
        }
    }

    private record Waiter(CompletableFuture<Void> slot) {
    }
}
