package me.golemcore.scheduler.domain.component;

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

import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An executable tool as seen by the scheduler. Implementations are resolved by
 * name through the tool registry and invoked once per approved call.
 */
public interface ToolCapability {

    /**
     * Returns the unique name the model uses to invoke this tool.
     *
     * @return the tool name
     */
    String getToolName();

    /**
     * Whether the tool streams incremental output through the
     * {@link LiveOutputSink} while it runs.
     */
    default boolean canUpdateOutput() {
        return false;
    }

    /**
     * Whether the tool must not run concurrently with another call of the same
     * tool.
     */
    default boolean isExclusive() {
        return false;
    }

    default boolean isEnabled() {
        return true;
    }

    /**
     * Executes the tool. Implementations should observe {@code token} during
     * long operations and either return promptly or complete with a
     * {@link me.golemcore.scheduler.domain.model.ToolCancelledException} once it
     * fires.
     *
     * @param parameters
     *            the call arguments (a private copy, safe to read)
     * @param token
     *            cancellation signal of the owning batch
     * @param liveOutput
     *            sink for incremental output, ignored unless
     *            {@link #canUpdateOutput()}
     * @return a future containing the tool result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, CancellationToken token,
            LiveOutputSink liveOutput);
}
