package com.notegraph.core.service.persistence.idle;

import com.notegraph.core.service.ingest.IngestionQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Waits until the ingestion queue has been drained before running the task.
 *
 * The queue is re-checked on the task scheduler; after {@code maxWaitMs} the task runs
 * regardless of the queue state.
 */
@Slf4j
@RequiredArgsConstructor
public class IngestionIdleTaskRunner implements IdleTaskRunner {

    static final long POLL_INTERVAL_MS = 50;

    private final IngestionQueue queue;
    private final TaskScheduler taskScheduler;
    private final Executor executor;
    private final Clock clock;
    private final long maxWaitMs;

    @Override
    public void runWhenIdle(Runnable task) {
        long deadline = clock.millis() + maxWaitMs;
        taskScheduler.schedule(() -> checkIdle(task, deadline), clock.instant());
    }

    private void checkIdle(Runnable task, long deadline) {
        if (queue.isIdle()) {
            executor.execute(task);
            return;
        }
        if (clock.millis() >= deadline) {
            log.debug("Ingestion still busy after {}ms, running idle task anyway", maxWaitMs);
            executor.execute(task);
            return;
        }
        taskScheduler.schedule(() -> checkIdle(task, deadline), clock.instant().plusMillis(POLL_INTERVAL_MS));
    }
}
