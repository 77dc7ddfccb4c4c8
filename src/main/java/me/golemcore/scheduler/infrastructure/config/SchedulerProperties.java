package me.golemcore.scheduler.infrastructure.config;

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

import lombok.Data;
import me.golemcore.scheduler.domain.model.PolicyDecision;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the tool scheduler, bound from application.properties.
 *
 * <p>
 * All settings live under the {@code scheduler.*} prefix:
 * <ul>
 * <li>{@link ExecutorProperties} - worker pool running state-machine steps</li>
 * <li>{@link OutputProperties} - result size limits</li>
 * <li>{@link PolicyProperties} - approval mode and allow/deny/ask rules</li>
 * <li>{@link ConfirmationProperties} - interactive confirmation channel</li>
 * <li>{@link HooksProperties} - command hooks around tool calls</li>
 * <li>{@link ToolsProperties} - built-in tools</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "scheduler")
@Data
public class SchedulerProperties {

    private String defaultAgentId = "primary";
    private ExecutorProperties executor = new ExecutorProperties();
    private OutputProperties output = new OutputProperties();
    private PolicyProperties policy = new PolicyProperties();
    private ConfirmationProperties confirmation = new ConfirmationProperties();
    private HooksProperties hooks = new HooksProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class ExecutorProperties {
        private int threads = 8;
    }

    @Data
    public static class OutputProperties {
        private int maxToolResultChars = 100000;
    }

    @Data
    public static class PolicyProperties {
        private ApprovalMode approvalMode = ApprovalMode.DEFAULT;
        private PolicyDecision defaultDecision = PolicyDecision.ALLOW;
        private boolean nonInteractive = false;
        private List<String> allowedTools = new ArrayList<>();
        private List<String> disabledTools = new ArrayList<>();
        private List<PolicyRuleProperties> rules = new ArrayList<>();
    }

    public enum ApprovalMode {
        DEFAULT, YOLO
    }

    @Data
    public static class PolicyRuleProperties {
        private String toolName;
        private String argsPattern;
        private PolicyDecision decision = PolicyDecision.ASK_USER;
        private Integer priority;
    }

    @Data
    public static class ConfirmationProperties {
        private boolean enabled = true;
        private int timeoutSeconds = 300;
    }

    @Data
    public static class HooksProperties {
        private boolean enabled = true;
        private String configFile;
        private List<HookDefinitionProperties> definitions = new ArrayList<>();
    }

    @Data
    public static class HookDefinitionProperties {
        private HookEvent event = HookEvent.BEFORE_TOOL;
        private String matcher;
        private String command;
        private int timeoutSeconds = 60;
    }

    public enum HookEvent {
        BEFORE_TOOL, AFTER_TOOL
    }

    @Data
    public static class ToolsProperties {
        private ShellToolProperties shell = new ShellToolProperties();
    }

    @Data
    public static class ShellToolProperties {
        private boolean enabled = true;
        private String workspace = ".";
        private int defaultTimeout = 30;
        private int maxTimeout = 300;
    }
}
