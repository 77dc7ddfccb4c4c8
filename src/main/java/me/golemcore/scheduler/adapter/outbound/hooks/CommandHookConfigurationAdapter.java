package me.golemcore.scheduler.adapter.outbound.hooks;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.SchedulerKey;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties.HookDefinitionProperties;
import me.golemcore.scheduler.port.outbound.HookConfigurationPort;
import me.golemcore.scheduler.port.outbound.HookMediatorPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads command hook definitions from {@code scheduler.hooks.definitions} and
 * the optional JSON file named by {@code scheduler.hooks.config-file}, then
 * builds a {@link CommandHookMediator} for the scheduler instance.
 *
 * <p>
 * The file is read on every load so edits apply to newly built instances. A
 * missing or unreadable file is logged and skipped.
 *
 * <pre>{@code
 * {"hooks": [{"event": "BEFORE_TOOL", "matcher": "run_shell_command",
 *             "command": "./check.sh", "timeoutSeconds": 30}]}
 * }</pre>
 */
@Component
@Slf4j
public class CommandHookConfigurationAdapter implements HookConfigurationPort {

    private final SchedulerProperties.HooksProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService hookExecutor;

    public CommandHookConfigurationAdapter(SchedulerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties.getHooks();
        this.objectMapper = objectMapper;
        this.hookExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "tool-hooks");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public CompletableFuture<HookMediatorPort> loadHooks(SchedulerKey key) {
        if (!properties.isEnabled()) {
            return CompletableFuture.completedFuture(HookMediatorPort.noop());
        }
        return CompletableFuture.supplyAsync(this::loadDefinitions, hookExecutor)
                .thenApply(definitions -> {
                    log.debug("[Hooks] {} hook(s) loaded for {}", definitions.size(), key);
                    if (definitions.isEmpty()) {
                        return HookMediatorPort.noop();
                    }
                    return new CommandHookMediator(definitions, objectMapper, hookExecutor);
                });
    }

    @PreDestroy
    public void destroy() {
        hookExecutor.shutdownNow();
        try {
            hookExecutor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    List<HookDefinition> loadDefinitions() {
        List<HookDefinitionProperties> configured = new ArrayList<>(properties.getDefinitions());
        configured.addAll(readConfigFile());

        List<HookDefinition> definitions = new ArrayList<>();
        for (HookDefinitionProperties hook : configured) {
            toDefinition(hook).ifPresent(definitions::add);
        }
        return definitions;
    }

    private List<HookDefinitionProperties> readConfigFile() {
        String configFile = properties.getConfigFile();
        if (configFile == null || configFile.isBlank()) {
            return List.of();
        }
        Path path = Path.of(configFile);
        if (!Files.isRegularFile(path)) {
            log.debug("[Hooks] Hook file {} not found, skipping", path);
            return List.of();
        }
        try {
            HookFile file = objectMapper.readValue(path.toFile(), HookFile.class);
            return file.hooks() != null ? file.hooks() : List.of();
        } catch (IOException e) {
            log.warn("[Hooks] Failed to read hook file {}: {}", path, e.getMessage());
            return List.of();
        }
    }

    private Optional<HookDefinition> toDefinition(HookDefinitionProperties hook) {
        if (hook.getCommand() == null || hook.getCommand().isBlank()) {
            log.warn("[Hooks] Skipping hook without command (event={})", hook.getEvent());
            return Optional.empty();
        }
        Pattern matcher = null;
        if (hook.getMatcher() != null && !hook.getMatcher().isBlank() && !"*".equals(hook.getMatcher())) {
            try {
                matcher = Pattern.compile(hook.getMatcher());
            } catch (PatternSyntaxException e) {
                log.warn("[Hooks] Skipping hook '{}', invalid matcher: {}", hook.getCommand(), e.getMessage());
                return Optional.empty();
            }
        }
        SchedulerProperties.HookEvent event = hook.getEvent() != null ? hook.getEvent()
                : SchedulerProperties.HookEvent.BEFORE_TOOL;
        int timeout = hook.getTimeoutSeconds() > 0 ? hook.getTimeoutSeconds() : 60;
        return Optional.of(new HookDefinition(event, matcher, hook.getCommand(), timeout));
    }

    public record HookFile(List<HookDefinitionProperties> hooks) {
    }
}
