package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.component.LiveOutputSink;
import me.golemcore.scheduler.domain.component.ToolCapability;
import me.golemcore.scheduler.domain.model.ApprovalDecision;
import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.ToolCallRequest;
import me.golemcore.scheduler.domain.model.ToolCallResponse;
import me.golemcore.scheduler.domain.model.ToolResult;
import me.golemcore.scheduler.domain.scheduler.SchedulerRegistry;
import me.golemcore.scheduler.domain.scheduler.ToolSchedulerBinding;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ApprovalAuthorityPort;
import me.golemcore.scheduler.port.outbound.ConversationResultPort;
import me.golemcore.scheduler.port.outbound.HookConfigurationPort;
import me.golemcore.scheduler.port.outbound.HookMediatorPort;
import me.golemcore.scheduler.port.outbound.SubagentResultPort;
import me.golemcore.scheduler.port.outbound.ToolRegistryPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class ToolSchedulingServiceTest {

    private static final String SESSION_ID = "session-1";

    private ExecutorService executor;
    private SchedulerRegistry registry;
    private ConversationResultPort conversationResultPort;
    private SubagentResultPort subagentResultPort;
    private HookConfigurationPort hookConfiguration;
    private ToolSchedulingService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        registry = new SchedulerRegistry();
        conversationResultPort = mock(ConversationResultPort.class);
        subagentResultPort = mock(SubagentResultPort.class);

        ToolCapability echo = new ToolCapability() {
            @Override
            public String getToolName() {
                return "echo";
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, CancellationToken token,
                    LiveOutputSink liveOutput) {
                return CompletableFuture.completedFuture(ToolResult.success(String.valueOf(parameters.get("text"))));
            }
        };
        ToolRegistryPort toolRegistry = mock(ToolRegistryPort.class);
        when(toolRegistry.resolve("echo")).thenReturn(Optional.of(echo));
        when(toolRegistry.getToolNames()).thenReturn(Set.of("echo"));

        ApprovalAuthorityPort approvalAuthority = mock(ApprovalAuthorityPort.class);
        when(approvalAuthority.decide(any())).thenReturn(CompletableFuture.completedFuture(ApprovalDecision.allow()));

        hookConfiguration = mock(HookConfigurationPort.class);
        when(hookConfiguration.loadHooks(any())).thenReturn(CompletableFuture.completedFuture(HookMediatorPort.noop()));

        SchedulerProperties properties = new SchedulerProperties();
        SchedulerDependenciesFactory factory = new SchedulerDependenciesFactory(toolRegistry, approvalAuthority,
                hookConfiguration, executor, Clock.systemUTC(), properties);
        service = new ToolSchedulingService(registry, factory,
                new ToolResultRouter(conversationResultPort, subagentResultPort), properties);
    }

    @AfterEach
    void tearDown() {
        registry.disposeAll();
        executor.shutdownNow();
    }

    @Test
    void shouldReturnPrimaryResultsToConversation() throws Exception {
        try (ToolSchedulerBinding binding = service.bindPrimary(SESSION_ID, null)) {
            binding.schedule(List.of(echo("c1", "hello")), CancellationToken.create()).get(5, TimeUnit.SECONDS);
        }

        ArgumentCaptor<List<ToolCallResponse>> captor = ArgumentCaptor.forClass(List.class);
        verify(conversationResultPort).submitToolResponses(eq(SESSION_ID),
                captor.capture());
        assertEquals("hello", captor.getValue().get(0).toModelContent());
        assertEquals("primary", captor.getValue().get(0).agentId());
        verify(subagentResultPort, never()).deliver(anyString(), anyString(), any());
    }

    @Test
    void shouldKeepSubagentResultsOutOfConversation() throws Exception {
        try (ToolSchedulerBinding binding = service.bind(SESSION_ID, "researcher", null)) {
            binding.schedule(List.of(echo("c1", "notes")), CancellationToken.create()).get(5, TimeUnit.SECONDS);
        }

        ArgumentCaptor<List<ToolCallResponse>> captor = ArgumentCaptor.forClass(List.class);
        verify(subagentResultPort).deliver(eq(SESSION_ID),
                eq("researcher"), captor.capture());
        assertEquals("researcher", captor.getValue().get(0).agentId());
        verify(conversationResultPort, never()).submitToolResponses(anyString(), any());
    }

    @Test
    void shouldDeliverOnceWhenTwoBindingsShareScheduler() throws Exception {
        ToolSchedulerBinding first = service.bindPrimary(SESSION_ID, null);
        ToolSchedulerBinding second = service.bindPrimary(SESSION_ID, null);

        first.schedule(List.of(echo("c1", "once")), CancellationToken.create()).get(5, TimeUnit.SECONDS);
        first.close();
        second.close();

        verify(conversationResultPort, times(1)).submitToolResponses(anyString(), any());
        verify(hookConfiguration, times(1)).loadHooks(any());
    }

    @Test
    void shouldBindUnderConfiguredDefaultAgent() {
        try (ToolSchedulerBinding binding = service.bindPrimary(SESSION_ID, null)) {
            assertEquals("primary", binding.getKey().agentId());
            assertSame(SESSION_ID, binding.getKey().sessionId());
        }
    }

    @Test
    void shouldTreatBlankAgentIdAsDefaultAgent() {
        try (ToolSchedulerBinding blank = service.bind(SESSION_ID, "  ", null);
                ToolSchedulerBinding missing = service.bind(SESSION_ID, null, null)) {
            assertEquals("primary", blank.getKey().agentId());
            assertEquals("primary", missing.getKey().agentId());
            assertEquals(2, registry.getReferenceCount(SESSION_ID, "primary"));
        }
    }

    private static ToolCallRequest echo(String callId, String text) {
        return ToolCallRequest.builder().callId(callId).name("echo").args(Map.of("text", text)).build();
    }
}
