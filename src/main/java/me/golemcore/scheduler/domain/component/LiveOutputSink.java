package me.golemcore.scheduler.domain.component;

/**
 * Receives incremental output from a streaming tool.
 */
@FunctionalInterface
public interface LiveOutputSink {

    LiveOutputSink NOOP = chunk -> {
    };

    void accept(String chunk);
}
