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
import me.golemcore.scheduler.domain.model.ApprovalDecision;
import me.golemcore.scheduler.domain.model.ApprovalRequest;
import me.golemcore.scheduler.domain.model.ConfirmationRequest;
import me.golemcore.scheduler.domain.model.PolicyDecision;
import me.golemcore.scheduler.domain.model.ToolConfirmationOutcome;
import me.golemcore.scheduler.port.outbound.ApprovalAuthorityPort;
import me.golemcore.scheduler.port.outbound.ConfirmationPort;
import me.golemcore.scheduler.port.outbound.PolicyEnginePort;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Approval authority combining the policy engine with the interactive
 * confirmation channel.
 *
 * <p>
 * Remembers "always allow" answers per session and tool, so the user is asked
 * once per tool for the rest of the session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolApprovalService implements ApprovalAuthorityPort {

    static final String USER_DENIED_REASON = "User did not allow tool call";

    private final PolicyEnginePort policyEngine;
    private final ConfirmationPort confirmationPort;
    private final ToolConfirmationPolicy confirmationPolicy;

    private final Set<SessionTool> alwaysAllowed = ConcurrentHashMap.newKeySet();

    @Override
    public CompletableFuture<ApprovalDecision> decide(ApprovalRequest request) {
        if (alwaysAllowed.contains(new SessionTool(request.sessionId(), request.toolName()))) {
            log.debug("[Approval] '{}' always allowed in session {}", request.toolName(), request.sessionId());
            return CompletableFuture.completedFuture(ApprovalDecision.allow());
        }

        PolicyDecision decision = policyEngine.evaluate(request.toolName(), request.args());
        if (decision == PolicyDecision.ALLOW && request.hookRequestedApproval()) {
            decision = PolicyDecision.ASK_USER;
        }

        return CompletableFuture.completedFuture(switch (decision) {
        case ALLOW -> ApprovalDecision.allow();
        case DENY -> ApprovalDecision.deny("Tool \"" + request.toolName() + "\" is denied by policy.");
        case ASK_USER -> askOrDeny(request);
        });
    }

    @Override
    public CompletableFuture<ApprovalDecision> requestConfirmation(ApprovalRequest request) {
        ConfirmationRequest confirmation = ConfirmationRequest.builder()
                .sessionId(request.sessionId())
                .agentId(request.agentId())
                .callId(request.callId())
                .toolName(request.toolName())
                .args(request.args())
                .description(describe(request))
                .build();

        log.info("[Approval] Requesting confirmation for '{}': {}", request.toolName(), confirmation.description());
        CompletableFuture<ToolConfirmationOutcome> outcome = confirmationPort.requestConfirmation(confirmation);
        CompletableFuture<ApprovalDecision> decision = outcome.thenApply(answer -> toDecision(request, answer));
        // cancelling the decision withdraws the prompt
        decision.whenComplete((ignored, error) -> {
            if (decision.isCancelled()) {
                outcome.cancel(false);
            }
        });
        return decision;
    }

    public void forgetSession(String sessionId) {
        alwaysAllowed.removeIf(entry -> entry.sessionId().equals(sessionId));
    }

    private ApprovalDecision askOrDeny(ApprovalRequest request) {
        if (!confirmationPort.isAvailable()) {
            log.info("[Approval] No confirmation channel for '{}', denying", request.toolName());
            return ApprovalDecision.deny("Tool \"" + request.toolName()
                    + "\" requires confirmation but no confirmation channel is available.");
        }
        return ApprovalDecision.askUser();
    }

    private ApprovalDecision toDecision(ApprovalRequest request, ToolConfirmationOutcome answer) {
        if (answer == null) {
            return ApprovalDecision.deny(USER_DENIED_REASON);
        }
        return switch (answer) {
        case PROCEED_ONCE -> ApprovalDecision.allow();
        case PROCEED_ALWAYS -> {
            alwaysAllowed.add(new SessionTool(request.sessionId(), request.toolName()));
            log.info("[Approval] '{}' now always allowed in session {}", request.toolName(), request.sessionId());
            yield ApprovalDecision.allowForSession();
        }
        case CANCEL -> ApprovalDecision.deny(USER_DENIED_REASON);
        };
    }

    private String describe(ApprovalRequest request) {
        String description = confirmationPolicy.describeAction(request.toolName(), request.args());
        if (request.hookReason() != null && !request.hookReason().isBlank()) {
            return description + " (" + request.hookReason() + ")";
        }
        return description;
    }

    private record SessionTool(String sessionId, String toolName) {
    }
}
