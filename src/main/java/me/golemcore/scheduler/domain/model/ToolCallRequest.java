package me.golemcore.scheduler.domain.model;

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

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation requested by the model (or by the client directly).
 *
 * @param callId
 *            caller-assigned id, unique within a session; the deduplication key
 * @param name
 *            tool name as emitted by the model
 * @param args
 *            structured parameters (copied, never null)
 * @param clientInitiated
 *            whether the user, not the model, issued the call
 * @param promptId
 *            id of the prompt/turn that produced the request
 * @param agentId
 *            actor that issued the call (primary conversation or a sub-agent)
 */
@Builder(toBuilder = true)
public record ToolCallRequest(String callId, String name, Map<String, Object> args, boolean clientInitiated,
        String promptId, String agentId) {

    public ToolCallRequest {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public ToolCallRequest withArgs(Map<String, Object> newArgs) {
        return toBuilder().args(newArgs).build();
    }

    public ToolCallRequest withAgentIdIfMissing(String defaultAgentId) {
        if (agentId != null && !agentId.isBlank()) {
            return this;
        }
        return toBuilder().agentId(defaultAgentId).build();
    }
}
