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
import me.golemcore.scheduler.domain.component.LiveOutputSink;
import me.golemcore.scheduler.domain.component.ToolCapability;
import me.golemcore.scheduler.domain.model.AfterToolHookResult;
import me.golemcore.scheduler.domain.model.ApprovalDecision;
import me.golemcore.scheduler.domain.model.ApprovalRequest;
import me.golemcore.scheduler.domain.model.BeforeToolHookResult;
import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.SchedulerKey;
import me.golemcore.scheduler.domain.model.ToolCallResponse;
import me.golemcore.scheduler.domain.model.ToolCallStatus;
import me.golemcore.scheduler.domain.model.ToolCancelledException;
import me.golemcore.scheduler.domain.model.ToolErrorKind;
import me.golemcore.scheduler.domain.model.ToolResult;
import me.golemcore.scheduler.port.outbound.ApprovalAuthorityPort;
import me.golemcore.scheduler.port.outbound.HookMediatorPort;
import me.golemcore.scheduler.port.outbound.ToolRegistryPort;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Drives a single {@link ToolCall} from {@code SCHEDULED} to a terminal status.
 *
 * <p>
 * Steps: resolve the tool, run the before-tool hooks, ask the approval
 * authority (and, if needed, the user), execute, run the after-tool hooks.
 * Every step that waits on an external party is asynchronous, so a call
 * awaiting a human never holds a worker thread. The cancellation token is
 * checked before each step and once more right before execution.
 *
 * <p>
 * Failures of hooks degrade to allow/no-op. Failures of the approval authority
 * become {@link ToolErrorKind#POLICY_DENIED}; a call the user rejects at the
 * prompt ends {@code CANCELLED}. Anything unexpected inside this
 * class becomes {@link ToolErrorKind#INTERNAL_SCHEDULER_FAULT} and is logged at
 * error level.
 */
@Slf4j
public class ToolCallStateMachine {

    static final String DEFAULT_CANCEL_REASON = "Tool call cancelled by user.";

    private final SchedulerKey key;
    private final ToolRegistryPort toolRegistry;
    private final HookMediatorPort hookMediator;
    private final ApprovalAuthorityPort approvalAuthority;
    private final Executor executor;
    private final Clock clock;
    private final ToolOutputLimiter outputLimiter;
    private final BiConsumer<ToolCall, String> liveOutputListener;
    private final Map<String, PendingApproval> pendingApprovals = new ConcurrentHashMap<>();

    public ToolCallStateMachine(SchedulerKey key, SchedulerDependencies dependencies,
            BiConsumer<ToolCall, String> liveOutputListener) {
        this.key = key;
        this.toolRegistry = dependencies.toolRegistry();
        this.hookMediator = dependencies.hookMediator();
        this.approvalAuthority = dependencies.approvalAuthority();
        this.executor = dependencies.executor();
        this.clock = dependencies.clock();
        this.outputLimiter = new ToolOutputLimiter(dependencies.maxToolResultChars());
        this.liveOutputListener = liveOutputListener;
    }

    /**
     * Starts the lifecycle of {@code call} on the scheduler executor.
     *
     * @return future completing with the call once it is terminal
     */
    public CompletableFuture<ToolCall> start(ToolCall call, CancellationToken token) {
        CompletableFuture<Void> pipeline;
        try {
            pipeline = CompletableFuture.runAsync(() -> {
            }, executor).thenCompose(ignored -> validate(call, token));
        } catch (RuntimeException e) {
            pipeline = CompletableFuture.failedFuture(e);
        }
        pipeline.whenComplete((ignored, error) -> {
            if (error != null) {
                fault(call, unwrap(error));
            }
        });
        return call.terminalFuture();
    }

    /**
     * Cancels a call that has not started executing. No-op for executing or
     * terminal calls.
     */
    public boolean cancelPending(ToolCall call, String reason) {
        boolean cancelled = call.cancelIfNotExecuting(cancelledResponse(call, reason));
        if (cancelled) {
            log.debug("[Scheduler] {} cancelled call {} ({})", key, call.getCallId(), call.getRequest().name());
        }
        return cancelled;
    }

    private CompletableFuture<Void> validate(ToolCall call, CancellationToken token) {
        if (cancelIfRequested(call, token) || !call.transitionTo(ToolCallStatus.VALIDATING)) {
            return done();
        }

        String toolName = call.getRequest().name();
        if (toolName == null || toolName.isBlank()) {
            fail(call, ToolErrorKind.INVALID_PARAMS, "Tool call " + call.getCallId() + " has no tool name.", null);
            return done();
        }
        if (toolRegistry.isDisabled(toolName)) {
            fail(call, ToolErrorKind.TOOL_DISABLED,
                    "Tool \"" + toolName + "\" is disabled in the current profile.", null);
            return done();
        }
        Optional<ToolCapability> capability = toolRegistry.resolve(toolName);
        if (capability.isEmpty()) {
            fail(call, ToolErrorKind.UNKNOWN_TOOL,
                    ToolNameSuggester.unknownToolMessage(toolName, toolRegistry.getToolNames()), null);
            return done();
        }
        call.bindTool(capability.get());

        return runBeforeHooks(call).thenCompose(hookResult -> applyBeforeHooks(call, token, hookResult));
    }

    private CompletableFuture<BeforeToolHookResult> runBeforeHooks(ToolCall call) {
        String toolName = call.getRequest().name();
        return invoke(() -> hookMediator.beforeTool(key.sessionId(), toolName, copyArgs(call)))
                .handle((result, error) -> {
                    if (error != null) {
                        log.warn("[Hooks] Before-tool hook failed for '{}', allowing call: {}",
                                toolName, safeCauseMessage(error));
                        return BeforeToolHookResult.allow();
                    }
                    return result != null ? result : BeforeToolHookResult.allow();
                });
    }

    private CompletableFuture<Void> applyBeforeHooks(ToolCall call, CancellationToken token,
            BeforeToolHookResult hookResult) {
        if (hookResult.decision() == BeforeToolHookResult.Decision.BLOCK) {
            String reason = hookResult.reason() != null && !hookResult.reason().isBlank()
                    ? hookResult.reason()
                    : "Tool call blocked by hook.";
            log.info("[Hooks] Blocked '{}' ({}): {}", call.getRequest().name(), call.getCallId(), reason);
            fail(call, ToolErrorKind.HOOK_BLOCKED, reason, null);
            return done();
        }
        if (hookResult.modifiedArgs() != null) {
            log.debug("[Hooks] Arguments of '{}' rewritten by hook", call.getRequest().name());
            call.replaceArgs(hookResult.modifiedArgs());
        }
        boolean hookRequestedApproval = hookResult.decision() == BeforeToolHookResult.Decision.ASK;
        if (hookRequestedApproval) {
            log.debug("[Hooks] Hook deferred '{}' to approval", call.getRequest().name());
        }
        return decide(call, token, approvalRequest(call, hookRequestedApproval, hookResult.reason()));
    }

    private CompletableFuture<Void> decide(ToolCall call, CancellationToken token, ApprovalRequest request) {
        if (cancelIfRequested(call, token)) {
            return done();
        }
        return invoke(() -> approvalAuthority.decide(request))
                .handle((decision, error) -> {
                    if (error != null) {
                        log.warn("[Approval] Approval authority failed for '{}': {}", request.toolName(),
                                safeCauseMessage(error));
                        fail(call, ToolErrorKind.POLICY_DENIED, safeCauseMessage(error), null);
                        return null;
                    }
                    return decision;
                })
                .thenCompose(decision -> {
                    if (decision == null) {
                        fail(call, ToolErrorKind.POLICY_DENIED, "Tool call was not approved.", null);
                        return done();
                    }
                    return switch (decision.decision()) {
                    case ALLOW -> execute(call, token);
                    case DENY -> {
                        fail(call, ToolErrorKind.POLICY_DENIED, denialReason(decision), null);
                        yield done();
                    }
                    case ASK_USER -> awaitConfirmation(call, token, request);
                    };
                });
    }

    private CompletableFuture<Void> awaitConfirmation(ToolCall call, CancellationToken token,
            ApprovalRequest request) {
        PendingApproval pending = new PendingApproval(call, request);
        pendingApprovals.put(call.getCallId(), pending);
        if (!call.transitionTo(ToolCallStatus.AWAITING_APPROVAL) || cancelIfRequested(call, token)) {
            pendingApprovals.remove(call.getCallId(), pending);
            return done();
        }
        log.info("[Approval] Awaiting confirmation for '{}' ({})", request.toolName(), request.callId());
        CompletableFuture<ApprovalDecision> prompt = invoke(() -> approvalAuthority.requestConfirmation(request));
        pending.attachPrompt(prompt);
        prompt.whenComplete((decision, error) -> {
            if (error != null) {
                pending.answer().completeExceptionally(error);
            } else {
                pending.answer().complete(decision);
            }
        });
        CancellationToken.Registration registration = token.onCancel(reason -> prompt.cancel(false));

        return pending.answer().handleAsync((decision, error) -> {
            registration.close();
            pendingApprovals.remove(call.getCallId(), pending);
            if (token.isCancelled()) {
                cancel(call, token.getReason());
                return false;
            }
            if (error != null) {
                fail(call, ToolErrorKind.POLICY_DENIED, safeCauseMessage(error), null);
                return false;
            }
            if (decision == null || !decision.isAllowed()) {
                String reason = decision != null ? denialReason(decision) : "Tool call was not approved.";
                log.info("[Approval] '{}' ({}) rejected by user: {}", request.toolName(), request.callId(), reason);
                cancel(call, reason);
                return false;
            }
            if (decision.sessionWide()) {
                releaseCompatiblePending(call);
            }
            return true;
        }, executor).thenCompose(approved -> approved ? execute(call, token) : done());
    }

    /**
     * Re-asks the approval authority about every other call still waiting for
     * the user. Calls it now allows proceed at once and their prompts are
     * withdrawn.
     */
    private void releaseCompatiblePending(ToolCall approved) {
        for (PendingApproval pending : List.copyOf(pendingApprovals.values())) {
            if (pending.call() == approved || pending.answer().isDone()) {
                continue;
            }
            invoke(() -> approvalAuthority.decide(pending.request())).whenComplete((decision, error) -> {
                if (error != null || decision == null || !decision.isAllowed()) {
                    return;
                }
                if (pending.answer().complete(decision)) {
                    log.info("[Approval] Auto-approved pending '{}' ({})", pending.request().toolName(),
                            pending.request().callId());
                    pending.withdrawPrompt();
                }
            });
        }
    }

    private CompletableFuture<Void> execute(ToolCall call, CancellationToken token) {
        if (!call.transitionTo(ToolCallStatus.EXECUTING)) {
            return done();
        }
        if (token.isCancelled()) {
            cancel(call, token.getReason());
            return done();
        }

        ToolCapability tool = call.getTool();
        LiveOutputSink sink = tool.canUpdateOutput() ? chunk -> relayLiveOutput(call, chunk) : LiveOutputSink.NOOP;
        log.debug("[Scheduler] {} executing '{}' ({})", key, call.getRequest().name(), call.getCallId());

        return invoke(() -> tool.execute(copyArgs(call), token, sink))
                .handle(ExecutionOutcome::new)
                .thenCompose(outcome -> finishExecution(call, token, outcome));
    }

    private CompletableFuture<Void> finishExecution(ToolCall call, CancellationToken token,
            ExecutionOutcome outcome) {
        Throwable error = outcome.error() != null ? unwrap(outcome.error()) : null;
        if (token.isCancelled() || isCancellation(error)) {
            String reason = token.isCancelled() ? token.getReason() : safeCauseMessage(error);
            cancel(call, reason);
            return done();
        }

        String toolName = call.getRequest().name();
        ToolResult result;
        ToolErrorKind errorKind = null;
        String errorMessage = null;
        if (error != null) {
            log.warn("[Scheduler] Tool '{}' failed: {}", toolName, safeCauseMessage(error));
            errorKind = ToolErrorKind.EXECUTION_ERROR;
            errorMessage = "Tool execution failed: " + safeCauseMessage(error);
            result = ToolResult.failure(errorMessage);
        } else if (outcome.result() == null) {
            errorKind = ToolErrorKind.EXECUTION_ERROR;
            errorMessage = "Tool \"" + toolName + "\" returned no result.";
            result = ToolResult.failure(errorMessage);
        } else if (!outcome.result().isSuccess()) {
            errorKind = ToolErrorKind.EXECUTION_ERROR;
            errorMessage = outcome.result().getError() != null ? outcome.result().getError()
                    : "Tool \"" + toolName + "\" failed.";
            result = outcome.result();
        } else {
            result = outputLimiter.limit(outcome.result(), toolName);
        }

        ToolErrorKind finalKind = errorKind;
        String finalMessage = errorMessage;
        return runAfterHooks(call, result).thenAccept(annotation -> {
            ToolCallResponse response = baseResponse(call)
                    .result(result)
                    .errorKind(finalKind)
                    .errorMessage(finalMessage)
                    .systemMessage(annotation.systemMessage())
                    .suppressOutput(annotation.suppressOutput())
                    .build();
            call.complete(finalKind == null ? ToolCallStatus.SUCCESS : ToolCallStatus.ERROR, response);
        });
    }

    private CompletableFuture<AfterToolHookResult> runAfterHooks(ToolCall call, ToolResult result) {
        String toolName = call.getRequest().name();
        return invoke(() -> hookMediator.afterTool(key.sessionId(), toolName, copyArgs(call), result))
                .handle((annotation, error) -> {
                    if (error != null) {
                        log.warn("[Hooks] After-tool hook failed for '{}', ignoring: {}",
                                toolName, safeCauseMessage(error));
                        return AfterToolHookResult.none();
                    }
                    return annotation != null ? annotation : AfterToolHookResult.none();
                });
    }

    private void relayLiveOutput(ToolCall call, String chunk) {
        if (chunk == null || chunk.isEmpty() || call.isTerminal()) {
            return;
        }
        call.appendLiveOutput(chunk);
        try {
            liveOutputListener.accept(call, chunk);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] Live output listener failed for {}: {}", call.getCallId(), e.getMessage());
        }
    }

    private boolean cancelIfRequested(ToolCall call, CancellationToken token) {
        if (!token.isCancelled()) {
            return false;
        }
        cancel(call, token.getReason());
        return true;
    }

    private void cancel(ToolCall call, String reason) {
        call.complete(ToolCallStatus.CANCELLED, cancelledResponse(call, reason));
    }

    private void fail(ToolCall call, ToolErrorKind kind, String message, ToolResult result) {
        ToolCallResponse response = baseResponse(call)
                .result(result)
                .errorKind(kind)
                .errorMessage(message)
                .build();
        call.complete(ToolCallStatus.ERROR, response);
    }

    private void fault(ToolCall call, Throwable error) {
        log.error("[Scheduler] {} internal fault while processing call {}", key, call.getCallId(), error);
        call.complete(ToolCallStatus.ERROR, baseResponse(call)
                .errorKind(ToolErrorKind.INTERNAL_SCHEDULER_FAULT)
                .errorMessage("Internal scheduler error: " + safeCauseMessage(error))
                .build());
    }

    private ToolCallResponse cancelledResponse(ToolCall call, String reason) {
        return baseResponse(call)
                .errorKind(ToolErrorKind.CANCELLED)
                .errorMessage(reason != null && !reason.isBlank() ? reason : DEFAULT_CANCEL_REASON)
                .build();
    }

    private ToolCallResponse.ToolCallResponseBuilder baseResponse(ToolCall call) {
        return ToolCallResponse.builder()
                .callId(call.getCallId())
                .agentId(call.getRequest().agentId())
                .durationMs(Math.max(0, clock.millis() - call.getCreatedAtMillis()));
    }

    private ApprovalRequest approvalRequest(ToolCall call, boolean hookRequestedApproval, String hookReason) {
        return ApprovalRequest.builder()
                .sessionId(key.sessionId())
                .agentId(call.getRequest().agentId())
                .callId(call.getCallId())
                .toolName(call.getRequest().name())
                .args(call.getRequest().args())
                .hookRequestedApproval(hookRequestedApproval)
                .hookReason(hookReason)
                .build();
    }

    private static String denialReason(ApprovalDecision decision) {
        return decision.reason() != null && !decision.reason().isBlank()
                ? decision.reason()
                : "Tool call denied by policy.";
    }

    private static Map<String, Object> copyArgs(ToolCall call) {
        return new LinkedHashMap<>(call.getRequest().args());
    }

    private static boolean isCancellation(Throwable error) {
        return error instanceof ToolCancelledException || error instanceof CancellationException;
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> step) {
        try {
            CompletableFuture<T> future = step.get();
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }

    static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private record ExecutionOutcome(ToolResult result, Throwable error) {
    }

    /**
     * A call waiting for the user. {@code answer} completes with the user's
     * decision or with an allow granted on behalf of another call.
     */
    private static final class PendingApproval {

        private final ToolCall call;
        private final ApprovalRequest request;
        private final CompletableFuture<ApprovalDecision> answer = new CompletableFuture<>();
        private volatile CompletableFuture<ApprovalDecision> prompt;

        private PendingApproval(ToolCall call, ApprovalRequest request) {
            this.call = call;
            this.request = request;
        }

        ToolCall call() {
            return call;
        }

        ApprovalRequest request() {
            return request;
        }

        CompletableFuture<ApprovalDecision> answer() {
            return answer;
        }

        void attachPrompt(CompletableFuture<ApprovalDecision> prompt) {
            this.prompt = prompt;
            if (answer.isDone()) {
                prompt.cancel(false);
            }
        }

        void withdrawPrompt() {
            CompletableFuture<ApprovalDecision> current = prompt;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
