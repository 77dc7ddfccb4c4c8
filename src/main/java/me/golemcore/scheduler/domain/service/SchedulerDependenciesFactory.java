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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.SchedulerKey;
import me.golemcore.scheduler.domain.scheduler.SchedulerDependencies;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ApprovalAuthorityPort;
import me.golemcore.scheduler.port.outbound.HookConfigurationPort;
import me.golemcore.scheduler.port.outbound.ToolRegistryPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Builds the dependencies of a new scheduler instance. Tool registry, approval
 * authority and executor are shared application-wide; the hook mediator is
 * loaded per instance.
 */
@Component
@Slf4j
public class SchedulerDependenciesFactory {

    private final ToolRegistryPort toolRegistry;
    private final ApprovalAuthorityPort approvalAuthority;
    private final HookConfigurationPort hookConfiguration;
    private final ExecutorService executor;
    private final Clock clock;
    private final SchedulerProperties properties;

    public SchedulerDependenciesFactory(ToolRegistryPort toolRegistry, ApprovalAuthorityPort approvalAuthority,
            HookConfigurationPort hookConfiguration, @Qualifier("toolSchedulerExecutor") ExecutorService executor,
            Clock clock, SchedulerProperties properties) {
        this.toolRegistry = toolRegistry;
        this.approvalAuthority = approvalAuthority;
        this.hookConfiguration = hookConfiguration;
        this.executor = executor;
        this.clock = clock;
        this.properties = properties;
    }

    public CompletableFuture<SchedulerDependencies> create(SchedulerKey key) {
        log.debug("[Registry] Resolving dependencies for {}", key);
        return hookConfiguration.loadHooks(key)
                .thenApply(hooks -> SchedulerDependencies.builder()
                        .toolRegistry(toolRegistry)
                        .hookMediator(hooks)
                        .approvalAuthority(approvalAuthority)
                        .executor(executor)
                        .clock(clock)
                        .maxToolResultChars(properties.getOutput().getMaxToolResultChars())
                        .defaultAgentId(properties.getDefaultAgentId())
                        .build());
    }
}
