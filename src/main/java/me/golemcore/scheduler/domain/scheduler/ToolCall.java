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

import me.golemcore.scheduler.domain.component.ToolCapability;
import me.golemcore.scheduler.domain.model.ToolCallRequest;
import me.golemcore.scheduler.domain.model.ToolCallResponse;
import me.golemcore.scheduler.domain.model.ToolCallStatus;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable record tracking one request through its lifecycle.
 *
 * <p>
 * Only the owning scheduler mutates a call; the mutators are package-private.
 * Every status change is checked against
 * {@link ToolCallStatus#canTransitionTo(ToolCallStatus)}. Once terminal, the
 * call never changes again and further triggers are ignored.
 */
public final class ToolCall {

    private final Object lock = new Object();
    private final long createdAtMillis;
    private final CompletableFuture<ToolCall> terminal = new CompletableFuture<>();
    private final AtomicBoolean responseDelivered = new AtomicBoolean();
    private final StringBuilder liveOutput = new StringBuilder();

    private volatile ToolCallRequest request;
    private volatile ToolCallStatus status = ToolCallStatus.SCHEDULED;
    private volatile ToolCapability tool;
    private volatile ToolCallResponse response;

    ToolCall(ToolCallRequest request, long createdAtMillis) {
        this.request = request;
        this.createdAtMillis = createdAtMillis;
    }

    public String getCallId() {
        return request.callId();
    }

    public ToolCallRequest getRequest() {
        return request;
    }

    public ToolCallStatus getStatus() {
        return status;
    }

    public ToolCapability getTool() {
        return tool;
    }

    public ToolCallResponse getResponse() {
        return response;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public String getLiveOutput() {
        synchronized (liveOutput) {
            return liveOutput.toString();
        }
    }

    public boolean isResponseDelivered() {
        return responseDelivered.get();
    }

    /**
     * Marks the response as handed to its consumer.
     *
     * @return true for the first caller only
     */
    public boolean markResponseDelivered() {
        return responseDelivered.compareAndSet(false, true);
    }

    long getCreatedAtMillis() {
        return createdAtMillis;
    }

    CompletableFuture<ToolCall> terminalFuture() {
        return terminal;
    }

    /**
     * Moves the call to a non-terminal status.
     *
     * @return false when the call is already terminal
     * @throws IllegalStateException
     *             when the transition is not allowed from the current status
     */
    boolean transitionTo(ToolCallStatus next) {
        if (next.isTerminal()) {
            throw new IllegalArgumentException("Use complete() for terminal status " + next);
        }
        synchronized (lock) {
            if (status.isTerminal()) {
                return false;
            }
            if (!status.canTransitionTo(next)) {
                throw new IllegalStateException(
                        "Illegal transition " + status + " -> " + next + " for call " + getCallId());
            }
            status = next;
            return true;
        }
    }

    /**
     * Moves the call to a terminal status with its response.
     *
     * @return false when the call was already terminal
     */
    boolean complete(ToolCallStatus terminalStatus, ToolCallResponse terminalResponse) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        synchronized (lock) {
            if (status.isTerminal()) {
                return false;
            }
            if (!status.canTransitionTo(terminalStatus)) {
                throw new IllegalStateException(
                        "Illegal transition " + status + " -> " + terminalStatus + " for call " + getCallId());
            }
            response = terminalResponse;
            status = terminalStatus;
        }
        terminal.complete(this);
        return true;
    }

    /**
     * Cancels the call unless it is already terminal or inside tool execution.
     * Executing calls are cancelled cooperatively once the tool unwinds.
     */
    boolean cancelIfNotExecuting(ToolCallResponse cancelledResponse) {
        synchronized (lock) {
            if (status.isTerminal() || status == ToolCallStatus.EXECUTING) {
                return false;
            }
            response = cancelledResponse;
            status = ToolCallStatus.CANCELLED;
        }
        terminal.complete(this);
        return true;
    }

    void bindTool(ToolCapability capability) {
        this.tool = capability;
    }

    void replaceArgs(Map<String, Object> args) {
        this.request = request.withArgs(args);
    }

    void appendLiveOutput(String chunk) {
        synchronized (liveOutput) {
            liveOutput.append(chunk);
        }
    }

    @Override
    public String toString() {
        return "ToolCall{" + getCallId() + ", " + request.name() + ", " + status + "}";
    }
}
