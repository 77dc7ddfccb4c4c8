package me.golemcore.scheduler.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationTokenTest {

    @Test
    void shouldNotifyListenersOnce() {
        CancellationToken token = CancellationToken.create();
        List<String> reasons = new ArrayList<>();
        token.onCancel(reasons::add);

        assertTrue(token.cancel("first"));
        assertFalse(token.cancel("second"));

        assertEquals(List.of("first"), reasons);
        assertEquals("first", token.getReason());
    }

    @Test
    void shouldInvokeLateListenerImmediately() {
        CancellationToken token = CancellationToken.create();
        token.cancel("done");
        List<String> reasons = new ArrayList<>();

        token.onCancel(reasons::add);

        assertEquals(List.of("done"), reasons);
    }

    @Test
    void shouldNotNotifyClosedRegistration() {
        CancellationToken token = CancellationToken.create();
        List<String> reasons = new ArrayList<>();
        token.onCancel(reasons::add).close();

        token.cancel("ignored");

        assertTrue(reasons.isEmpty());
    }

    @Test
    void shouldPropagateFromParentToChild() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = CancellationToken.linkedTo(parent);

        parent.cancel("parent stopped");

        assertTrue(child.isCancelled());
        assertEquals("parent stopped", child.getReason());
    }

    @Test
    void shouldNotPropagateFromChildToParent() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = CancellationToken.linkedTo(parent);

        child.cancel("child stopped");

        assertFalse(parent.isCancelled());
    }

    @Test
    void shouldStopPropagatingAfterDetach() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = CancellationToken.linkedTo(parent);

        child.detach();
        parent.cancel("late");

        assertFalse(child.isCancelled());
    }

    @Test
    void shouldAcceptMissingParent() {
        CancellationToken child = CancellationToken.linkedTo(null);

        assertFalse(child.isCancelled());
    }

    @Test
    void shouldThrowWhenCancelled() {
        CancellationToken token = CancellationToken.create();
        assertDoesNotThrow(token::throwIfCancelled);

        token.cancel("stop");

        ToolCancelledException error = assertThrows(ToolCancelledException.class, token::throwIfCancelled);
        assertEquals("stop", error.getMessage());
    }

    @Test
    void shouldKeepNotifyingWhenListenerFails() {
        CancellationToken token = CancellationToken.create();
        List<String> reasons = new ArrayList<>();
        token.onCancel(reason -> {
            throw new IllegalStateException("listener bug");
        });
        token.onCancel(reasons::add);

        token.cancel("stop");

        assertEquals(List.of("stop"), reasons);
    }
}
