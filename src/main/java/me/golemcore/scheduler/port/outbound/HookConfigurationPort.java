package me.golemcore.scheduler.port.outbound;

import me.golemcore.scheduler.domain.model.SchedulerKey;

import java.util.concurrent.CompletableFuture;

/**
 * Port for loading the hook configuration of a scheduler instance. Loading may
 * read files, so it completes asynchronously.
 */
public interface HookConfigurationPort {

    CompletableFuture<HookMediatorPort> loadHooks(SchedulerKey key);
}
