package me.golemcore.scheduler.domain.scheduler;

import me.golemcore.scheduler.domain.model.CancellationToken;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Calls submitted together under one cancellation token. Completes once, when
 * every member call is terminal.
 */
final class ToolCallBatch {

    private final long id;
    private final List<ToolCall> calls;
    private final CancellationToken token;
    private final AtomicBoolean completed = new AtomicBoolean();
    private volatile CancellationToken.Registration cancelRegistration;

    ToolCallBatch(long id, List<ToolCall> calls, CancellationToken callerToken) {
        this.id = id;
        this.calls = List.copyOf(calls);
        this.token = CancellationToken.linkedTo(callerToken);
    }

    long getId() {
        return id;
    }

    List<ToolCall> getCalls() {
        return calls;
    }

    CancellationToken getToken() {
        return token;
    }

    /**
     * Starts every call and wires cancellation of pending calls to the token.
     *
     * @return future completing with the calls, in submission order, once all
     *         are terminal
     */
    CompletableFuture<List<ToolCall>> start(ToolCallStateMachine stateMachine) {
        CompletableFuture<?>[] terminals = new CompletableFuture<?>[calls.size()];
        for (int i = 0; i < calls.size(); i++) {
            terminals[i] = stateMachine.start(calls.get(i), token);
        }
        cancelRegistration = token.onCancel(reason -> calls.forEach(call -> stateMachine.cancelPending(call, reason)));
        return CompletableFuture.allOf(terminals).thenApply(ignored -> calls);
    }

    void cancel(String reason) {
        token.cancel(reason);
    }

    /**
     * Claims the right to publish this batch's completion.
     *
     * @return true exactly once
     */
    boolean markCompleted() {
        return completed.compareAndSet(false, true);
    }

    void close() {
        if (cancelRegistration != null) {
            cancelRegistration.close();
        }
        token.detach();
    }
}
