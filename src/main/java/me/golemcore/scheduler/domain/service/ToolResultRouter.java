package me.golemcore.scheduler.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.ToolCallResponse;
import me.golemcore.scheduler.domain.scheduler.BatchCompletion;
import me.golemcore.scheduler.domain.scheduler.ToolCall;
import me.golemcore.scheduler.port.outbound.ConversationResultPort;
import me.golemcore.scheduler.port.outbound.SubagentResultPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes batch completions to their consumer.
 *
 * <p>
 * Primary-conversation batches go back to the model; sub-agent batches go only
 * to the sub-agent launcher. Each call is delivered at most once. Results of
 * client-initiated calls are marked delivered but not sent to the model, since
 * the model never asked for them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolResultRouter {

    private final ConversationResultPort conversationResultPort;
    private final SubagentResultPort subagentResultPort;

    public void route(BatchCompletion completion) {
        List<ToolCall> undelivered = new ArrayList<>();
        for (ToolCall call : completion.calls()) {
            if (call.markResponseDelivered()) {
                undelivered.add(call);
            }
        }
        if (undelivered.isEmpty()) {
            log.debug("[Scheduler] {} completion already delivered", completion.key());
            return;
        }

        String sessionId = completion.key().sessionId();
        if (!completion.primary()) {
            subagentResultPort.deliver(sessionId, completion.key().agentId(), responses(undelivered));
            return;
        }

        List<ToolCall> modelCalls = undelivered.stream()
                .filter(call -> !call.getRequest().clientInitiated())
                .toList();
        if (modelCalls.isEmpty()) {
            log.debug("[Scheduler] {} batch contained only client-initiated calls", completion.key());
            return;
        }
        conversationResultPort.submitToolResponses(sessionId, responses(modelCalls));
    }

    private static List<ToolCallResponse> responses(List<ToolCall> calls) {
        return calls.stream().map(ToolCall::getResponse).toList();
    }
}
