package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.ToolCallDisplay;
import me.golemcore.scheduler.domain.model.ToolCallDisplayStatus;
import me.golemcore.scheduler.domain.model.ToolCallRequest;
import me.golemcore.scheduler.domain.model.ToolCallResponse;
import me.golemcore.scheduler.domain.model.ToolCallStatus;
import me.golemcore.scheduler.domain.model.ToolErrorKind;
import me.golemcore.scheduler.domain.model.ToolResult;
import me.golemcore.scheduler.domain.scheduler.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolCallDisplayMapperTest {

    private final ToolCallDisplayMapper mapper = new ToolCallDisplayMapper();

    @Test
    void shouldMapEveryStatus() {
        assertEquals(ToolCallDisplayStatus.PENDING, mapper.toDisplayStatus(ToolCallStatus.SCHEDULED));
        assertEquals(ToolCallDisplayStatus.PENDING, mapper.toDisplayStatus(ToolCallStatus.VALIDATING));
        assertEquals(ToolCallDisplayStatus.CONFIRMING, mapper.toDisplayStatus(ToolCallStatus.AWAITING_APPROVAL));
        assertEquals(ToolCallDisplayStatus.EXECUTING, mapper.toDisplayStatus(ToolCallStatus.EXECUTING));
        assertEquals(ToolCallDisplayStatus.SUCCESS, mapper.toDisplayStatus(ToolCallStatus.SUCCESS));
        assertEquals(ToolCallDisplayStatus.ERROR, mapper.toDisplayStatus(ToolCallStatus.ERROR));
        assertEquals(ToolCallDisplayStatus.CANCELED, mapper.toDisplayStatus(ToolCallStatus.CANCELLED));
    }

    @Test
    void shouldShowLiveOutputWhileExecuting() {
        ToolCall call = call(ToolCallStatus.EXECUTING, null, "compiling...");

        ToolCallDisplay display = mapper.toDisplay(call);

        assertEquals(ToolCallDisplayStatus.EXECUTING, display.status());
        assertEquals("compiling...", display.resultDisplay());
        assertEquals("{command=make}", display.description());
        assertEquals("primary", display.agentId());
    }

    @Test
    void shouldHideResultWhileAwaitingApproval() {
        ToolCallDisplay display = mapper.toDisplay(call(ToolCallStatus.AWAITING_APPROVAL, null, ""));

        assertEquals(ToolCallDisplayStatus.CONFIRMING, display.status());
        assertNull(display.resultDisplay());
    }

    @Test
    void shouldShowModelContentOnceTerminal() {
        ToolCallResponse response = ToolCallResponse.builder()
                .callId("c1")
                .errorKind(ToolErrorKind.HOOK_BLOCKED)
                .errorMessage("blocked by guard")
                .suppressOutput(true)
                .build();

        ToolCallDisplay display = mapper.toDisplay(call(ToolCallStatus.ERROR, response, ""));

        assertEquals("Error: blocked by guard", display.resultDisplay());
        assertTrue(display.suppressOutput());
    }

    @Test
    void shouldMapListInOrder() {
        ToolCallResponse ok = ToolCallResponse.builder().callId("c1").result(ToolResult.success("done")).build();

        List<ToolCallDisplay> displays = mapper.toDisplays(List.of(
                call(ToolCallStatus.SUCCESS, ok, ""),
                call(ToolCallStatus.SCHEDULED, null, "")));

        assertEquals(2, displays.size());
        assertEquals("done", displays.get(0).resultDisplay());
        assertFalse(displays.get(1).suppressOutput());
    }

    private static ToolCall call(ToolCallStatus status, ToolCallResponse response, String liveOutput) {
        ToolCall call = mock(ToolCall.class);
        when(call.getCallId()).thenReturn("c1");
        when(call.getStatus()).thenReturn(status);
        when(call.getResponse()).thenReturn(response);
        when(call.getLiveOutput()).thenReturn(liveOutput);
        when(call.getRequest()).thenReturn(ToolCallRequest.builder()
                .callId("c1")
                .name("run_shell_command")
                .args(Map.of("command", "make"))
                .agentId("primary")
                .build());
        return call;
    }
}
