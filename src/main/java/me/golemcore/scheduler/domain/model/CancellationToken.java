package me.golemcore.scheduler.domain.model;

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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Cooperative cancellation signal shared by every call of a batch.
 *
 * <p>
 * Cancellation is one-shot: the first {@link #cancel(String)} wins and its
 * reason is kept. Listeners registered after cancellation run immediately on
 * the registering thread. Tools poll {@link #isCancelled()} or call
 * {@link #throwIfCancelled()} during long operations.
 */
@Slf4j
public final class CancellationToken {

    private final Object lock = new Object();
    private final List<Consumer<String>> listeners = new ArrayList<>();
    private volatile String reason;
    private volatile boolean cancelled;
    private Registration parentRegistration;

    private CancellationToken() {
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Creates a token that is cancelled whenever {@code parent} is cancelled.
     * Cancelling the child does not affect the parent. Call {@link #detach()}
     * once the child is no longer needed so the parent drops its listener.
     */
    public static CancellationToken linkedTo(CancellationToken parent) {
        CancellationToken child = new CancellationToken();
        if (parent != null) {
            Registration registration = parent.onCancel(child::cancel);
            synchronized (child.lock) {
                child.parentRegistration = registration;
            }
        }
        return child;
    }

    /**
     * Cancels the token.
     *
     * @return true if this invocation performed the cancellation, false if the
     *         token was already cancelled
     */
    public boolean cancel(String cancelReason) {
        List<Consumer<String>> toNotify;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            reason = cancelReason != null ? cancelReason : "Cancelled";
            cancelled = true;
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Consumer<String> listener : toNotify) {
            try {
                listener.accept(reason);
            } catch (RuntimeException e) {
                log.warn("[Cancellation] listener failed: {}", e.getMessage(), e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new ToolCancelledException(reason);
        }
    }

    /**
     * Registers a listener invoked with the cancellation reason.
     */
    public Registration onCancel(Consumer<String> listener) {
        synchronized (lock) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.accept(reason);
        return () -> {
        };
    }

    /**
     * Drops the link to the parent token, if any.
     */
    public void detach() {
        Registration registration;
        synchronized (lock) {
            registration = parentRegistration;
            parentRegistration = null;
        }
        if (registration != null) {
            registration.close();
        }
    }

    /**
     * Handle returned by {@link #onCancel(Consumer)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
