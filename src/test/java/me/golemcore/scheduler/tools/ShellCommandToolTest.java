package me.golemcore.scheduler.tools;

import me.golemcore.scheduler.domain.component.LiveOutputSink;
import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.ToolCancelledException;
import me.golemcore.scheduler.domain.model.ToolResult;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ShellCommandToolTest {

    private static final String COMMAND = "command";
    private static final String TIMEOUT = "timeout";

    @TempDir
    Path tempDir;

    private ShellCommandTool tool;

    @BeforeEach
    void setUp() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getTools().getShell().setWorkspace(tempDir.toString());
        properties.getTools().getShell().setDefaultTimeout(30);
        properties.getTools().getShell().setMaxTimeout(300);
        tool = new ShellCommandTool(properties);
    }

    @AfterEach
    void tearDown() {
        tool.shutdown();
    }

    @Test
    void executeSimpleCommand() throws Exception {
        ToolResult result = run(Map.of(COMMAND, "echo 'Hello, World!'"), LiveOutputSink.NOOP);

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("Hello, World!"));
    }

    @Test
    void executeInWorkspace() throws Exception {
        ToolResult result = run(Map.of(COMMAND, "echo 'test content' > output.txt"), LiveOutputSink.NOOP);

        assertTrue(result.isSuccess());
        assertTrue(Files.exists(tempDir.resolve("output.txt")));
    }

    @Test
    void shouldStreamOutputLines() throws Exception {
        List<String> chunks = new CopyOnWriteArrayList<>();

        ToolResult result = run(Map.of(COMMAND, "echo one; echo two"), chunks::add);

        assertTrue(result.isSuccess());
        assertEquals(List.of("one\n", "two\n"), chunks);
        assertTrue(tool.canUpdateOutput());
    }

    @Test
    void shouldReportNonZeroExitAsFailureWithOutput() throws Exception {
        ToolResult result = run(Map.of(COMMAND, "echo 'missing file' >&2; exit 3"), LiveOutputSink.NOOP);

        assertFalse(result.isSuccess());
        assertEquals("Command exited with code 3", result.getError());
        assertTrue(result.getOutput().contains("missing file"));
    }

    @Test
    void shouldTimeOut() throws Exception {
        ToolResult result = run(Map.of(COMMAND, "sleep 10", TIMEOUT, 1), LiveOutputSink.NOOP);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("timed out"));
    }

    @Test
    void shouldKillBackgroundChildrenOnTimeout() throws Exception {
        ToolResult result = run(Map.of(COMMAND, "sleep 30 & echo $! > child.pid; wait", TIMEOUT, 1),
                LiveOutputSink.NOOP);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("timed out"));
        long childPid = Long.parseLong(Files.readString(tempDir.resolve("child.pid")).trim());
        long deadline = System.currentTimeMillis() + 5_000;
        while (isAlive(childPid) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(isAlive(childPid));
    }

    @Test
    void shouldRejectMissingCommand() throws Exception {
        ToolResult result = run(Map.of(), LiveOutputSink.NOOP);

        assertFalse(result.isSuccess());
        assertEquals("Missing required parameter: command", result.getError());
    }

    @Test
    void shouldKillProcessWhenCancelled() throws Exception {
        CancellationToken token = CancellationToken.create();
        List<String> chunks = new CopyOnWriteArrayList<>();
        CompletableFuture<ToolResult> future = tool.execute(Map.of(COMMAND, "echo started; sleep 30"), token,
                chunks::add);

        long deadline = System.currentTimeMillis() + 5_000;
        while (chunks.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        token.cancel("user cancelled");

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ToolCancelledException.class, error.getCause());
    }

    @Test
    void shouldReportDisabledFromConfiguration() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getTools().getShell().setEnabled(false);
        ShellCommandTool disabled = new ShellCommandTool(properties);

        assertFalse(disabled.isEnabled());
        assertEquals("run_shell_command", disabled.getToolName());
        disabled.shutdown();
    }

    private ToolResult run(Map<String, Object> params, LiveOutputSink sink) throws Exception {
        return tool.execute(params, CancellationToken.create(), sink).get(15, TimeUnit.SECONDS);
    }

    // zombies left for init to reap count as dead
    private static boolean isAlive(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return false;
        }
        try {
            String stat = Files.readString(Path.of("/proc", Long.toString(pid), "stat"));
            char state = stat.charAt(stat.lastIndexOf(')') + 2);
            return state != 'Z' && state != 'X';
        } catch (IOException e) {
            return handle.get().isAlive();
        }
    }
}
