package me.golemcore.scheduler.infrastructure.event;

import me.golemcore.scheduler.domain.model.ConfirmationRequest;
import me.golemcore.scheduler.domain.model.ToolConfirmationRequestedEvent;
import me.golemcore.scheduler.domain.model.ToolResultsEvent;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SpringEventBusTest {

    @Test
    void shouldPublishThroughApplicationEventPublisher() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        SpringEventBus eventBus = new SpringEventBus(publisher);
        ToolResultsEvent event = new ToolResultsEvent("session-1", "primary", true, List.of());

        eventBus.publish(event);

        verify(publisher).publishEvent(event);
    }

    @Test
    void shouldExposeSessionOfConfirmationPrompt() {
        ConfirmationRequest request = ConfirmationRequest.builder()
                .sessionId("session-7").callId("c1").toolName("run_shell_command").args(Map.of()).build();

        assertEquals("session-7", new ToolConfirmationRequestedEvent("corr-1", request).sessionId());
    }

    @Test
    void shouldSurfaceListenerFailureToPublisher() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        doThrow(new IllegalStateException("listener broke")).when(publisher).publishEvent(any(Object.class));
        SpringEventBus eventBus = new SpringEventBus(publisher);

        assertThrows(IllegalStateException.class,
                () -> eventBus.publish(new ToolResultsEvent("session-1", "primary", true, List.of())));
    }
}
