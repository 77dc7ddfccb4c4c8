package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.ApprovalDecision;
import me.golemcore.scheduler.domain.model.ApprovalRequest;
import me.golemcore.scheduler.domain.model.ConfirmationRequest;
import me.golemcore.scheduler.domain.model.PolicyDecision;
import me.golemcore.scheduler.domain.model.ToolConfirmationOutcome;
import me.golemcore.scheduler.port.outbound.ConfirmationPort;
import me.golemcore.scheduler.port.outbound.PolicyEnginePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolApprovalServiceTest {

    private static final String SESSION_ID = "session-1";
    private static final String SHELL = "run_shell_command";

    private PolicyEnginePort policyEngine;
    private ConfirmationPort confirmationPort;
    private ToolApprovalService service;

    @BeforeEach
    void setUp() {
        policyEngine = mock(PolicyEnginePort.class);
        confirmationPort = mock(ConfirmationPort.class);
        when(confirmationPort.isAvailable()).thenReturn(true);
        service = new ToolApprovalService(policyEngine, confirmationPort, new ToolConfirmationPolicy());
    }

    // ==================== decide ====================

    @Test
    void shouldAllowWhenPolicyAllows() {
        when(policyEngine.evaluate(eq(SHELL), anyMap())).thenReturn(PolicyDecision.ALLOW);

        ApprovalDecision decision = service.decide(request(false, null)).join();

        assertTrue(decision.isAllowed());
    }

    @Test
    void shouldDenyWithToolNameWhenPolicyDenies() {
        when(policyEngine.evaluate(eq(SHELL), anyMap())).thenReturn(PolicyDecision.DENY);

        ApprovalDecision decision = service.decide(request(false, null)).join();

        assertEquals(PolicyDecision.DENY, decision.decision());
        assertEquals("Tool \"run_shell_command\" is denied by policy.", decision.reason());
    }

    @Test
    void shouldAskUserWhenHookRequestedApproval() {
        when(policyEngine.evaluate(eq(SHELL), anyMap())).thenReturn(PolicyDecision.ALLOW);

        ApprovalDecision decision = service.decide(request(true, "touches prod")).join();

        assertEquals(PolicyDecision.ASK_USER, decision.decision());
    }

    @Test
    void shouldKeepDenialEvenWhenHookAsked() {
        when(policyEngine.evaluate(eq(SHELL), anyMap())).thenReturn(PolicyDecision.DENY);

        ApprovalDecision decision = service.decide(request(true, "touches prod")).join();

        assertEquals(PolicyDecision.DENY, decision.decision());
    }

    @Test
    void shouldDenyWhenConfirmationIsNeededButUnavailable() {
        when(policyEngine.evaluate(eq(SHELL), anyMap())).thenReturn(PolicyDecision.ASK_USER);
        when(confirmationPort.isAvailable()).thenReturn(false);

        ApprovalDecision decision = service.decide(request(false, null)).join();

        assertEquals(PolicyDecision.DENY, decision.decision());
        assertEquals("Tool \"run_shell_command\" requires confirmation but no confirmation channel is available.",
                decision.reason());
    }

    // ==================== requestConfirmation ====================

    @Test
    void shouldAllowOnceWithoutRemembering() {
        when(policyEngine.evaluate(eq(SHELL), anyMap())).thenReturn(PolicyDecision.ASK_USER);
        when(confirmationPort.requestConfirmation(any()))
                .thenReturn(CompletableFuture.completedFuture(ToolConfirmationOutcome.PROCEED_ONCE));

        assertTrue(service.requestConfirmation(request(false, null)).join().isAllowed());
        assertEquals(PolicyDecision.ASK_USER, service.decide(request(false, null)).join().decision());
    }

    @Test
    void shouldRememberAlwaysAllowForSession() {
        when(policyEngine.evaluate(eq(SHELL), anyMap())).thenReturn(PolicyDecision.ASK_USER);
        when(confirmationPort.requestConfirmation(any()))
                .thenReturn(CompletableFuture.completedFuture(ToolConfirmationOutcome.PROCEED_ALWAYS));

        ApprovalDecision answer = service.requestConfirmation(request(false, null)).join();
        assertTrue(answer.isAllowed());
        assertTrue(answer.sessionWide());

        assertTrue(service.decide(request(false, null)).join().isAllowed());
        ApprovalRequest otherSession = ApprovalRequest.builder()
                .sessionId("session-2").callId("c9").toolName(SHELL).args(Map.of()).build();
        assertEquals(PolicyDecision.ASK_USER, service.decide(otherSession).join().decision());
    }

    @Test
    void shouldForgetAlwaysAllowWhenSessionEnds() {
        when(policyEngine.evaluate(eq(SHELL), anyMap())).thenReturn(PolicyDecision.ASK_USER);
        when(confirmationPort.requestConfirmation(any()))
                .thenReturn(CompletableFuture.completedFuture(ToolConfirmationOutcome.PROCEED_ALWAYS));
        service.requestConfirmation(request(false, null)).join();

        service.forgetSession(SESSION_ID);

        assertEquals(PolicyDecision.ASK_USER, service.decide(request(false, null)).join().decision());
    }

    @Test
    void shouldDenyWhenUserCancels() {
        when(confirmationPort.requestConfirmation(any()))
                .thenReturn(CompletableFuture.completedFuture(ToolConfirmationOutcome.CANCEL));

        ApprovalDecision decision = service.requestConfirmation(request(false, null)).join();

        assertEquals(PolicyDecision.DENY, decision.decision());
        assertEquals("User did not allow tool call", decision.reason());
    }

    @Test
    void shouldDescribeActionInPrompt() {
        when(confirmationPort.requestConfirmation(any()))
                .thenReturn(CompletableFuture.completedFuture(ToolConfirmationOutcome.PROCEED_ONCE));

        service.requestConfirmation(request(true, "touches prod")).join();

        ArgumentCaptor<ConfirmationRequest> captor = ArgumentCaptor.forClass(ConfirmationRequest.class);
        verify(confirmationPort).requestConfirmation(captor.capture());
        assertEquals("Run command: rm -rf build (touches prod)", captor.getValue().description());
        assertEquals("c1", captor.getValue().callId());
    }

    @Test
    void shouldWithdrawPromptWhenDecisionIsCancelled() {
        CompletableFuture<ToolConfirmationOutcome> outcome = new CompletableFuture<>();
        when(confirmationPort.requestConfirmation(any())).thenReturn(outcome);

        CompletableFuture<ApprovalDecision> decision = service.requestConfirmation(request(false, null));
        decision.cancel(false);

        assertTrue(outcome.isCancelled());
        verify(policyEngine, never()).evaluate(any(), any());
    }

    private static ApprovalRequest request(boolean hookRequestedApproval, String hookReason) {
        return ApprovalRequest.builder()
                .sessionId(SESSION_ID)
                .agentId("primary")
                .callId("c1")
                .toolName(SHELL)
                .args(Map.of("command", "rm -rf build"))
                .hookRequestedApproval(hookRequestedApproval)
                .hookReason(hookReason)
                .build();
    }
}
