package me.golemcore.scheduler.adapter.outbound.policy;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.PolicyDecision;
import me.golemcore.scheduler.domain.service.ToolConfirmationPolicy;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.PolicyEnginePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Policy engine evaluating ordered allow/deny/ask rules from configuration.
 *
 * <p>
 * Rules are checked by descending priority, first match wins. A rule without a
 * tool name matches every tool; a rule with an args pattern also requires the
 * pattern to be found in the canonical JSON of the arguments (keys sorted).
 * When nothing matches, notable actions are asked about and everything else
 * gets the default decision. The approval mode and the non-interactive flag
 * then resolve ASK_USER.
 */
@Component
@Slf4j
public class RuleBasedPolicyEngine implements PolicyEnginePort {

    private final List<PolicyRule> rules;
    private final PolicyDecision defaultDecision;
    private final SchedulerProperties.ApprovalMode approvalMode;
    private final boolean nonInteractive;
    private final Set<String> allowedTools;
    private final ToolConfirmationPolicy confirmationPolicy;
    private final ObjectMapper canonicalMapper;

    public RuleBasedPolicyEngine(SchedulerProperties properties, ToolConfirmationPolicy confirmationPolicy,
            ObjectMapper objectMapper) {
        SchedulerProperties.PolicyProperties policy = properties.getPolicy();
        this.rules = compileRules(policy.getRules());
        this.defaultDecision = policy.getDefaultDecision() != null ? policy.getDefaultDecision()
                : PolicyDecision.ALLOW;
        this.approvalMode = policy.getApprovalMode() != null ? policy.getApprovalMode()
                : SchedulerProperties.ApprovalMode.DEFAULT;
        this.nonInteractive = policy.isNonInteractive();
        this.allowedTools = Set.copyOf(policy.getAllowedTools());
        this.confirmationPolicy = confirmationPolicy;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        log.info("[Policy] {} rule(s), default={}, mode={}, nonInteractive={}", rules.size(), defaultDecision,
                approvalMode, nonInteractive);
    }

    @Override
    public PolicyDecision evaluate(String toolName, Map<String, Object> args) {
        PolicyDecision decision = matchRule(toolName, args);
        if (decision == null) {
            decision = confirmationPolicy.isNotableAction(toolName, args) ? PolicyDecision.ASK_USER : defaultDecision;
        }
        if (decision != PolicyDecision.ASK_USER) {
            return decision;
        }
        if (approvalMode == SchedulerProperties.ApprovalMode.YOLO || allowedTools.contains(toolName)) {
            return PolicyDecision.ALLOW;
        }
        if (nonInteractive) {
            log.debug("[Policy] '{}' needs confirmation in non-interactive mode, denying", toolName);
            return PolicyDecision.DENY;
        }
        return PolicyDecision.ASK_USER;
    }

    private PolicyDecision matchRule(String toolName, Map<String, Object> args) {
        String canonicalArgs = null;
        for (PolicyRule rule : rules) {
            if (rule.toolName() != null && !rule.toolName().equals(toolName)) {
                continue;
            }
            if (rule.argsPattern() != null) {
                if (canonicalArgs == null) {
                    canonicalArgs = canonicalJson(args);
                }
                if (!rule.argsPattern().matcher(canonicalArgs).find()) {
                    continue;
                }
            }
            log.debug("[Policy] '{}' matched rule {} -> {}", toolName, rule, rule.decision());
            return rule.decision();
        }
        return null;
    }

    private String canonicalJson(Map<String, Object> args) {
        try {
            return canonicalMapper.writeValueAsString(args != null ? args : Map.of());
        } catch (JsonProcessingException e) {
            log.warn("[Policy] Could not serialize arguments, matching against empty object: {}", e.getMessage());
            return "{}";
        }
    }

    private static List<PolicyRule> compileRules(List<SchedulerProperties.PolicyRuleProperties> configured) {
        List<PolicyRule> compiled = new ArrayList<>();
        for (SchedulerProperties.PolicyRuleProperties rule : configured) {
            String toolName = rule.getToolName() != null && !rule.getToolName().isBlank() ? rule.getToolName()
                    : null;
            Pattern pattern = rule.getArgsPattern() != null && !rule.getArgsPattern().isBlank()
                    ? Pattern.compile(rule.getArgsPattern())
                    : null;
            int priority = rule.getPriority() != null ? rule.getPriority() : 0;
            PolicyDecision decision = rule.getDecision() != null ? rule.getDecision() : PolicyDecision.ASK_USER;
            compiled.add(new PolicyRule(toolName, pattern, decision, priority));
        }
        // List.sort is stable: equal priorities keep configuration order
        compiled.sort(Comparator.comparingInt(PolicyRule::priority).reversed());
        return List.copyOf(compiled);
    }

    record PolicyRule(String toolName, Pattern argsPattern, PolicyDecision decision, int priority) {
    }
}
