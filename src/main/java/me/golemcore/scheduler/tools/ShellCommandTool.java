package me.golemcore.scheduler.tools;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.component.LiveOutputSink;
import me.golemcore.scheduler.domain.component.ToolCapability;
import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.ToolCancelledException;
import me.golemcore.scheduler.domain.model.ToolResult;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tool for executing shell commands, streaming their output line by line.
 *
 * <p>
 * Commands execute via /bin/sh -c in the configured workspace directory with
 * stderr merged into stdout. Cancelling the batch kills the process; the call
 * then completes with {@link ToolCancelledException}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code scheduler.tools.shell.enabled} - Enable/disable
 * <li>{@code scheduler.tools.shell.workspace} - Working directory
 * <li>{@code scheduler.tools.shell.default-timeout} - Default timeout (seconds)
 * <li>{@code scheduler.tools.shell.max-timeout} - Max timeout (seconds)
 * </ul>
 */
@Component
@Slf4j
public class ShellCommandTool implements ToolCapability {

    static final String TOOL_NAME = "run_shell_command";
    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_TIMEOUT = "timeout";
    private static final int MAX_OUTPUT_LENGTH = 100_000;

    private final boolean enabled;
    private final Path workspace;
    private final int defaultTimeout;
    private final int maxTimeout;
    private final ExecutorService executor;

    public ShellCommandTool(SchedulerProperties properties) {
        SchedulerProperties.ShellToolProperties config = properties.getTools().getShell();
        this.enabled = config.isEnabled();
        this.workspace = Paths.get(config.getWorkspace()).toAbsolutePath().normalize();
        this.defaultTimeout = config.getDefaultTimeout();
        this.maxTimeout = config.getMaxTimeout();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "shell-tool");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Shell] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String getToolName() {
        return TOOL_NAME;
    }

    @Override
    public boolean canUpdateOutput() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, CancellationToken token,
            LiveOutputSink liveOutput) {
        Object command = parameters.get(PARAM_COMMAND);
        if (!(command instanceof String commandText) || commandText.isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure("Missing required parameter: command"));
        }
        int timeout = resolveTimeout(parameters.get(PARAM_TIMEOUT));
        return CompletableFuture.supplyAsync(() -> executeCommand(commandText, timeout, token, liveOutput),
                executor);
    }

    private int resolveTimeout(Object requested) {
        if (requested instanceof Number number && number.intValue() > 0) {
            return Math.min(number.intValue(), maxTimeout);
        }
        return defaultTimeout;
    }

    private ToolResult executeCommand(String command, int timeoutSeconds, CancellationToken token,
            LiveOutputSink liveOutput) {
        token.throwIfCancelled();

        ProcessBuilder pb = new ProcessBuilder();
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            pb.command("cmd.exe", "/c", command);
        } else {
            pb.command("/bin/sh", "-c", command);
        }
        pb.directory(workspace.toFile());
        pb.redirectErrorStream(true);

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("[Shell] Failed to start '{}': {}", command, e.getMessage());
            return ToolResult.failure("Failed to start command: " + e.getMessage());
        }

        try (CancellationToken.Registration ignored = token.onCancel(reason -> destroyTree(process))) {
            Future<String> outputFuture = executor.submit(() -> readOutput(process, liveOutput));

            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            long duration = System.currentTimeMillis() - startTime;
            if (token.isCancelled()) {
                terminate(process, outputFuture);
                token.throwIfCancelled();
            }
            if (!completed) {
                terminate(process, outputFuture);
                return ToolResult.failure("Command timed out after " + timeoutSeconds + " seconds");
            }

            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException | ExecutionException e) {
                // a background child still holds the pipe
                terminate(process, outputFuture);
                output = "[Output read timeout]";
            }

            int exitCode = process.exitValue();
            Map<String, Object> data = Map.of(
                    "exitCode", exitCode,
                    "duration", duration,
                    PARAM_COMMAND, command);

            if (exitCode == 0) {
                return ToolResult.success(output.isEmpty() ? "(no output)" : output, data);
            }
            return ToolResult.failure("Command exited with code " + exitCode, output, data);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            throw new ToolCancelledException("Command interrupted");
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void terminate(Process process, Future<String> outputFuture) {
        destroyTree(process);
        outputFuture.cancel(true);
        try {
            process.getInputStream().close();
        } catch (IOException e) {
            log.debug("[Shell] Failed to close process output: {}", e.getMessage());
        }
    }

    private String readOutput(Process process, LiveOutputSink liveOutput) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append("\n");
                }
                liveOutput.accept(line + "\n");
                line = reader.readLine();
            }
        }
        return output.toString();
    }
}
