package me.golemcore.scheduler.adapter.outbound.results;

import me.golemcore.scheduler.domain.model.SchedulerEvent;
import me.golemcore.scheduler.domain.model.ToolCallResponse;
import me.golemcore.scheduler.domain.model.ToolResult;
import me.golemcore.scheduler.domain.model.ToolResultsEvent;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class EventBusResultAdapterTest {

    private SpringEventBus eventBus;
    private EventBusResultAdapter adapter;
    private List<ToolCallResponse> responses;

    @BeforeEach
    void setUp() {
        eventBus = mock(SpringEventBus.class);
        adapter = new EventBusResultAdapter(eventBus, new SchedulerProperties());
        responses = List.of(ToolCallResponse.builder().callId("c1").result(ToolResult.success("ok")).build());
    }

    @Test
    void shouldPublishPrimaryResults() {
        adapter.submitToolResponses("session-1", responses);

        ToolResultsEvent event = captureEvent();
        assertEquals("session-1", event.sessionId());
        assertEquals("primary", event.agentId());
        assertTrue(event.primary());
        assertEquals(responses, event.responses());
    }

    @Test
    void shouldPublishSubagentResults() {
        adapter.deliver("session-1", "researcher", responses);

        ToolResultsEvent event = captureEvent();
        assertEquals("researcher", event.agentId());
        assertFalse(event.primary());
    }

    private ToolResultsEvent captureEvent() {
        ArgumentCaptor<SchedulerEvent> captor = ArgumentCaptor.forClass(SchedulerEvent.class);
        verify(eventBus).publish(captor.capture());
        return (ToolResultsEvent) captor.getValue();
    }
}
