package me.golemcore.scheduler.infrastructure.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Worker pool running tool-call state-machine steps and tool executions.
 */
@Configuration
@Slf4j
public class SchedulerExecutorConfiguration {

    private final int threads;
    private ExecutorService executor;

    public SchedulerExecutorConfiguration(SchedulerProperties properties) {
        this.threads = Math.max(1, properties.getExecutor().getThreads());
    }

    @Bean(name = "toolSchedulerExecutor")
    public synchronized ExecutorService toolSchedulerExecutor() {
        if (executor == null) {
            executor = Executors.newFixedThreadPool(threads, runnable -> {
                Thread thread = new Thread(runnable, "tool-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            log.info("[Scheduler] Executor started with {} thread(s)", threads);
        }
        return executor;
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
