package me.golemcore.scheduler.domain.model;

/**
 * Event the scheduler publishes for the layers that own user interaction and
 * the conversation loop.
 */
public interface SchedulerEvent {

    String sessionId();
}
