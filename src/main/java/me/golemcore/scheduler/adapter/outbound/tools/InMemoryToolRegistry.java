package me.golemcore.scheduler.adapter.outbound.tools;

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
import me.golemcore.scheduler.domain.component.ToolCapability;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ToolRegistryPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tool registry backed by the {@link ToolCapability} beans of the application
 * context plus tools registered at runtime.
 *
 * <p>
 * Tools listed in {@code scheduler.policy.disabled-tools}, or reporting
 * {@link ToolCapability#isEnabled()} false, are known but not resolvable.
 * Exclusive tools are wrapped so only one execution runs at a time.
 */
@Component
@Slf4j
public class InMemoryToolRegistry implements ToolRegistryPort {

    private final Map<String, ToolCapability> tools = new ConcurrentHashMap<>();
    private final Set<String> disabledTools;

    @Autowired
    public InMemoryToolRegistry(ObjectProvider<ToolCapability> capabilities, SchedulerProperties properties) {
        this(capabilities.orderedStream().toList(), properties);
    }

    public InMemoryToolRegistry(List<ToolCapability> capabilities, SchedulerProperties properties) {
        this.disabledTools = Set.copyOf(properties.getPolicy().getDisabledTools());
        capabilities.forEach(this::registerTool);
        log.info("[Registry] {} tool(s) registered, disabled: {}", tools.size(), disabledTools);
    }

    public void registerTool(ToolCapability tool) {
        ToolCapability registered = tool.isExclusive() ? new ExclusiveToolCapability(tool) : tool;
        ToolCapability previous = tools.put(tool.getToolName(), registered);
        if (previous != null) {
            log.warn("[Registry] Tool '{}' registered twice, keeping the latest", tool.getToolName());
        }
    }

    public void unregisterTools(Collection<String> toolNames) {
        if (toolNames == null) {
            return;
        }
        for (String name : toolNames) {
            tools.remove(name);
        }
        log.debug("[Registry] Unregistered tools: {}", toolNames);
    }

    @Override
    public Optional<ToolCapability> resolve(String toolName) {
        if (toolName == null || isDisabled(toolName)) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(toolName));
    }

    @Override
    public boolean isDisabled(String toolName) {
        if (toolName == null) {
            return false;
        }
        if (disabledTools.contains(toolName)) {
            return true;
        }
        ToolCapability tool = tools.get(toolName);
        return tool != null && !tool.isEnabled();
    }

    @Override
    public Set<String> getToolNames() {
        Set<String> names = new TreeSet<>();
        tools.forEach((name, tool) -> {
            if (!isDisabled(name)) {
                names.add(name);
            }
        });
        return names;
    }
}
