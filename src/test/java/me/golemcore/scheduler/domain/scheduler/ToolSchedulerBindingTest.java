package me.golemcore.scheduler.domain.scheduler;

import me.golemcore.scheduler.domain.model.ApprovalDecision;
import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.LiveOutputChunk;
import me.golemcore.scheduler.domain.model.ToolCallRequest;
import me.golemcore.scheduler.port.outbound.ApprovalAuthorityPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolSchedulerBindingTest {

    private static final String SESSION_ID = "session-1";
    private static final String AGENT_ID = "primary";
    private static final String TOOL_NAME = "read_file";

    private ExecutorService schedulerExecutor;
    private ExecutorService toolExecutor;
    private SchedulerRegistry registry;
    private RecordingTool tool;
    private CompletableFuture<SchedulerDependencies> dependencies;
    private List<BatchCompletion> completions;
    private List<LiveOutputChunk> chunks;

    @BeforeEach
    void setUp() {
        schedulerExecutor = Executors.newSingleThreadExecutor();
        toolExecutor = Executors.newCachedThreadPool();
        registry = new SchedulerRegistry();
        tool = new RecordingTool(TOOL_NAME, toolExecutor);
        dependencies = new CompletableFuture<>();
        completions = new CopyOnWriteArrayList<>();
        chunks = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        registry.disposeAll();
        schedulerExecutor.shutdownNow();
        toolExecutor.shutdownNow();
    }

    @Test
    void shouldQueueBatchesUntilSchedulerIsReady() throws Exception {
        ToolSchedulerBinding binding = newBinding();

        CompletableFuture<Void> first = binding.schedule(List.of(request("c1", 1)), CancellationToken.create());
        CompletableFuture<Void> second = binding.schedule(List.of(request("c2", 2)), CancellationToken.create());

        assertFalse(binding.isReady());
        assertFalse(first.isDone());
        assertEquals(0, tool.invocations());

        dependencies.complete(newDependencies());
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        assertTrue(binding.isReady());
        assertEquals(List.of(Map.of("n", 1), Map.of("n", 2)), tool.receivedArgs());
        assertEquals(Set.of("c1", "c2"), completedCallIds());
        binding.close();
    }

    @Test
    void shouldSkipQueuedBatchWhoseTokenWasCancelled() throws Exception {
        ToolSchedulerBinding binding = newBinding();
        CancellationToken token = CancellationToken.create();

        CompletableFuture<Void> skipped = binding.schedule(List.of(request("c1", 1)), token);
        CompletableFuture<Void> kept = binding.schedule(List.of(request("c2", 2)), CancellationToken.create());
        token.cancel("changed my mind");

        dependencies.complete(newDependencies());
        skipped.get(5, TimeUnit.SECONDS);
        kept.get(5, TimeUnit.SECONDS);

        assertEquals(1, tool.invocations());
        assertEquals(Set.of("c2"), completedCallIds());
        binding.close();
    }

    @Test
    void shouldDropQueuedBatchesOnCancelAll() throws Exception {
        ToolSchedulerBinding binding = newBinding();
        CompletableFuture<Void> queued = binding.schedule(List.of(request("c1", 1)), CancellationToken.create());

        binding.cancelAll();
        assertTrue(queued.isDone());

        dependencies.complete(newDependencies());
        assertTrue(waitUntilReady(binding));
        assertEquals(0, tool.invocations());
        assertTrue(completions.isEmpty());
        binding.close();
    }

    @Test
    void shouldScheduleDirectlyOnceReady() throws Exception {
        dependencies.complete(newDependencies());
        ToolSchedulerBinding binding = newBinding();
        assertTrue(binding.isReady());

        binding.schedule(List.of(request("c1", 1)), CancellationToken.create()).get(5, TimeUnit.SECONDS);

        assertEquals(Set.of("c1"), completedCallIds());
        binding.close();
    }

    @Test
    void shouldFailQueuedBatchesWhenAcquireFails() {
        ToolSchedulerBinding binding = newBinding();
        CompletableFuture<Void> queued = binding.schedule(List.of(request("c1", 1)), CancellationToken.create());

        dependencies.completeExceptionally(new IllegalStateException("no hooks"));

        ExecutionException error = assertThrows(ExecutionException.class, () -> queued.get(5, TimeUnit.SECONDS));
        assertEquals("no hooks", error.getCause().getMessage());
        binding.close();
    }

    @Test
    void shouldReleaseSchedulerOnClose() throws Exception {
        dependencies.complete(newDependencies());
        ToolSchedulerBinding binding = newBinding();
        assertEquals(1, registry.getReferenceCount(SESSION_ID, AGENT_ID));

        binding.close();
        binding.close();

        assertEquals(0, registry.size());
        assertThrows(IllegalStateException.class,
                () -> binding.schedule(List.of(request("c1", 1)), CancellationToken.create()));
    }

    @Test
    void shouldRelayLiveOutputAndTrackLastOutputTime() throws Exception {
        RecordingTool streaming = new RecordingTool("run_shell_command", toolExecutor)
                .streaming(List.of("building...\n"));
        dependencies.complete(newDependencies(streaming));
        ToolSchedulerBinding binding = newBinding();
        assertEquals(0, binding.getLastOutputTime());

        binding.schedule(List.of(ToolCallRequest.builder().callId("c1").name("run_shell_command").build()),
                CancellationToken.create()).get(5, TimeUnit.SECONDS);

        assertEquals(1, chunks.size());
        assertEquals("building...\n", chunks.get(0).chunk());
        assertTrue(binding.getLastOutputTime() > 0);
        binding.close();
    }

    private ToolSchedulerBinding newBinding() {
        return new ToolSchedulerBinding(registry, SESSION_ID, AGENT_ID, () -> dependencies,
                completions::add, chunks::add);
    }

    private SchedulerDependencies newDependencies() {
        return newDependencies(tool);
    }

    private SchedulerDependencies newDependencies(RecordingTool registered) {
        ApprovalAuthorityPort approvalAuthority = mock(ApprovalAuthorityPort.class);
        when(approvalAuthority.decide(any()))
                .thenReturn(CompletableFuture.completedFuture(ApprovalDecision.allow()));
        return SchedulerDependencies.builder()
                .toolRegistry(new MapToolRegistry().register(registered))
                .approvalAuthority(approvalAuthority)
                .executor(schedulerExecutor)
                .maxToolResultChars(10_000)
                .build();
    }

    private Set<String> completedCallIds() {
        return completions.stream()
                .flatMap(completion -> completion.calls().stream())
                .map(ToolCall::getCallId)
                .collect(Collectors.toSet());
    }

    private static boolean waitUntilReady(ToolSchedulerBinding binding) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!binding.isReady() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        return binding.isReady();
    }

    private static ToolCallRequest request(String callId, int marker) {
        return ToolCallRequest.builder().callId(callId).name(TOOL_NAME).args(Map.of("n", marker)).build();
    }
}
