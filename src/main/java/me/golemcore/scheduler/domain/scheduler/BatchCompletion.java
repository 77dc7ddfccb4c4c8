package me.golemcore.scheduler.domain.scheduler;

import me.golemcore.scheduler.domain.model.SchedulerKey;
import me.golemcore.scheduler.domain.model.ToolCallResponse;

import java.util.List;

/**
 * Fired exactly once per non-empty batch, after every call reached a terminal
 * status.
 *
 * @param key
 *            instance that ran the batch
 * @param calls
 *            terminal calls in submission order
 * @param primary
 *            whether the instance belongs to the main conversation rather than
 *            a sub-agent
 */
public record BatchCompletion(SchedulerKey key, List<ToolCall> calls, boolean primary) {

    public BatchCompletion {
        calls = List.copyOf(calls);
    }

    public List<ToolCallResponse> responses() {
        return calls.stream().map(ToolCall::getResponse).toList();
    }
}
