package com.streamrelay.streamrelay.service.egress;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Single worker thread, so orchestration steps never run in parallel with each other.
 */
@Component
public class ExecutorEgressTaskScheduler implements EgressTaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorEgressTaskScheduler.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "egress-orchestrator");
        t.setDaemon(true);
        return t;
    });

    @Override
    public void schedule(Runnable task, long delayMillis) {
        scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Egress task failed", e);
            }
        }, delayMillis, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
