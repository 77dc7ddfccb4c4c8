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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.AfterToolHookResult;
import me.golemcore.scheduler.domain.model.BeforeToolHookResult;
import me.golemcore.scheduler.domain.model.ToolResult;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties.HookEvent;
import me.golemcore.scheduler.port.outbound.HookMediatorPort;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hook mediator running user-configured shell commands.
 *
 * <p>
 * Each matching hook receives a JSON document on stdin:
 *
 * <pre>{@code
 * {"hook_event_name": "BeforeTool", "session_id": "...", "tool_name": "...",
 *  "tool_input": {...}, "tool_response": {...}}
 * }</pre>
 *
 * and may print a JSON document on stdout with {@code decision} (allow, block,
 * deny, ask), {@code reason}, {@code hookSpecificOutput.tool_input},
 * {@code systemMessage} and {@code suppressOutput}. Exit code 2 blocks the call
 * with stderr as the reason. Other failures are logged and ignored.
 */
@Slf4j
public class CommandHookMediator implements HookMediatorPort {

    static final int BLOCKING_EXIT_CODE = 2;
    private static final int STREAM_READ_TIMEOUT_SECONDS = 1;
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final List<HookDefinition> hooks;
    private final ObjectMapper objectMapper;
    private final ExecutorService hookExecutor;

    CommandHookMediator(List<HookDefinition> hooks, ObjectMapper objectMapper, ExecutorService hookExecutor) {
        this.hooks = List.copyOf(hooks);
        this.objectMapper = objectMapper;
        this.hookExecutor = hookExecutor;
    }

    @Override
    public CompletableFuture<BeforeToolHookResult> beforeTool(String sessionId, String toolName,
            Map<String, Object> args) {
        List<HookDefinition> matching = matching(HookEvent.BEFORE_TOOL, toolName);
        if (matching.isEmpty()) {
            return CompletableFuture.completedFuture(BeforeToolHookResult.allow());
        }
        return CompletableFuture.supplyAsync(() -> runBeforeHooks(matching, sessionId, toolName, args), hookExecutor);
    }

    @Override
    public CompletableFuture<AfterToolHookResult> afterTool(String sessionId, String toolName,
            Map<String, Object> args, ToolResult result) {
        List<HookDefinition> matching = matching(HookEvent.AFTER_TOOL, toolName);
        if (matching.isEmpty()) {
            return CompletableFuture.completedFuture(AfterToolHookResult.none());
        }
        return CompletableFuture.supplyAsync(() -> runAfterHooks(matching, sessionId, toolName, args, result),
                hookExecutor);
    }

    private BeforeToolHookResult runBeforeHooks(List<HookDefinition> matching, String sessionId, String toolName,
            Map<String, Object> args) {
        Map<String, Object> currentArgs = args;
        boolean rewritten = false;
        String askReason = null;
        boolean ask = false;

        for (HookDefinition hook : matching) {
            HookOutcome outcome = run(hook, input("BeforeTool", sessionId, toolName, currentArgs, null));
            if (outcome.blocked()) {
                return BeforeToolHookResult.block(outcome.blockReason());
            }
            JsonNode output = outcome.output();
            if (output == null) {
                continue;
            }
            String decision = output.path("decision").asText("allow").toLowerCase(Locale.ROOT);
            String reason = output.hasNonNull("reason") ? output.get("reason").asText() : null;
            if ("block".equals(decision) || "deny".equals(decision)) {
                return BeforeToolHookResult.block(reason != null ? reason : "Blocked by hook: " + hook.command());
            }
            if ("ask".equals(decision)) {
                ask = true;
                askReason = askReason != null ? askReason : reason;
            }
            JsonNode toolInput = output.path("hookSpecificOutput").path("tool_input");
            if (toolInput.isObject()) {
                currentArgs = objectMapper.convertValue(toolInput, ARGS_TYPE);
                rewritten = true;
            }
        }

        Map<String, Object> modifiedArgs = rewritten ? currentArgs : null;
        if (ask) {
            return new BeforeToolHookResult(BeforeToolHookResult.Decision.ASK, modifiedArgs, askReason);
        }
        return new BeforeToolHookResult(BeforeToolHookResult.Decision.ALLOW, modifiedArgs, null);
    }

    private AfterToolHookResult runAfterHooks(List<HookDefinition> matching, String sessionId, String toolName,
            Map<String, Object> args, ToolResult result) {
        String systemMessage = null;
        boolean suppressOutput = false;
        Map<String, Object> response = new LinkedHashMap<>();
        if (result != null) {
            response.put("success", result.isSuccess());
            response.put("output", result.getOutput());
            response.put("error", result.getError());
        }

        for (HookDefinition hook : matching) {
            HookOutcome outcome = run(hook, input("AfterTool", sessionId, toolName, args, response));
            if (outcome.blocked()) {
                systemMessage = firstNonBlank(systemMessage, outcome.blockReason());
                continue;
            }
            JsonNode output = outcome.output();
            if (output == null) {
                continue;
            }
            if (output.hasNonNull("systemMessage")) {
                systemMessage = firstNonBlank(systemMessage, output.get("systemMessage").asText());
            }
            suppressOutput = suppressOutput || output.path("suppressOutput").asBoolean(false);
        }
        return new AfterToolHookResult(systemMessage, suppressOutput);
    }

    private List<HookDefinition> matching(HookEvent event, String toolName) {
        return hooks.stream().filter(hook -> hook.matches(event, toolName)).toList();
    }

    private String input(String eventName, String sessionId, String toolName, Map<String, Object> args,
            Map<String, Object> response) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("hook_event_name", eventName);
        input.put("session_id", sessionId);
        input.put("tool_name", toolName);
        input.put("tool_input", args != null ? args : Map.of());
        if (response != null) {
            input.put("tool_response", response);
        }
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize hook input for " + toolName, e);
        }
    }

    private HookOutcome run(HookDefinition hook, String input) {
        HookProcessResult result;
        try {
            result = execute(hook, input);
        } catch (IOException e) {
            log.warn("[Hooks] Hook '{}' could not be started: {}", hook.command(), e.getMessage());
            return HookOutcome.ignored();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Hooks] Interrupted while running hook '{}'", hook.command());
            return HookOutcome.ignored();
        }

        if (result.timedOut()) {
            log.warn("[Hooks] Hook '{}' timed out after {}s, ignoring", hook.command(), hook.timeoutSeconds());
            return HookOutcome.ignored();
        }
        if (result.exitCode() == BLOCKING_EXIT_CODE) {
            String reason = result.stderr().isBlank() ? "Blocked by hook: " + hook.command() : result.stderr().strip();
            return new HookOutcome(true, reason, null);
        }
        if (result.exitCode() != 0) {
            log.warn("[Hooks] Hook '{}' exited with {}, ignoring: {}", hook.command(), result.exitCode(),
                    result.stderr().strip());
            return HookOutcome.ignored();
        }
        String stdout = result.stdout().strip();
        if (stdout.isEmpty()) {
            return HookOutcome.ignored();
        }
        try {
            JsonNode output = objectMapper.readTree(stdout);
            return new HookOutcome(false, null, output.isObject() ? output : null);
        } catch (JsonProcessingException e) {
            log.warn("[Hooks] Hook '{}' printed invalid JSON, ignoring: {}", hook.command(), e.getOriginalMessage());
            return HookOutcome.ignored();
        }
    }

    private HookProcessResult execute(HookDefinition hook, String input) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder();
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            pb.command("cmd.exe", "/c", hook.command());
        } else {
            pb.command("/bin/sh", "-c", hook.command());
        }

        Process process = pb.start();
        Future<String> stdout = hookExecutor.submit(() -> read(process.getInputStream()));
        Future<String> stderr = hookExecutor.submit(() -> read(process.getErrorStream()));

        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("[Hooks] Hook '{}' closed stdin early: {}", hook.command(), e.getMessage());
        }

        boolean completed = process.waitFor(hook.timeoutSeconds(), TimeUnit.SECONDS);
        if (!completed) {
            process.destroyForcibly();
            stdout.cancel(true);
            stderr.cancel(true);
            return new HookProcessResult(-1, "", "", true);
        }
        return new HookProcessResult(process.exitValue(), await(stdout), await(stderr), false);
    }

    private static String await(Future<String> stream) throws InterruptedException {
        try {
            return stream.get(STREAM_READ_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            stream.cancel(true);
            return "";
        }
    }

    private static String read(InputStream stream) throws IOException {
        try (InputStream in = stream; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            in.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        }
    }

    private static String firstNonBlank(String current, String candidate) {
        if (current != null && !current.isBlank()) {
            return current;
        }
        return candidate != null && !candidate.isBlank() ? candidate : current;
    }

    private record HookProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {
    }

    private record HookOutcome(boolean blocked, String blockReason, JsonNode output) {

        static HookOutcome ignored() {
            return new HookOutcome(false, null, null);
        }
    }
}
