package com.notegraph.core.service.persistence;

import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.persistence.idle.IdleTaskRunner;
import com.notegraph.core.service.persistence.store.StorageDestinations;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * PersistenceScheduler that exports dirty domains through a {@link StorageExporter}
 * and writes the payloads to {@link StorageDestinations}.
 *
 * All scheduler state (dirty set, running flush, rerun flag, idle timer) is guarded by one lock.
 * The lock is never held while exporting or writing.
 */
@Slf4j
public class StoragePersistenceScheduler implements PersistenceScheduler {

    private final StorageExporter exporter;
    private final StorageDestinations destinations;
    private final TaskScheduler taskScheduler;
    private final IdleTaskRunner idleTaskRunner;
    private final Executor writeExecutor;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final long defaultIdleTimeoutMs;

    private final Object lock = new Object();
    private final EnumSet<StorageDomain> dirty = EnumSet.noneOf(StorageDomain.class);
    private CompletableFuture<Void> inflight;
    private boolean rerunRequested;
    private ScheduledFuture<?> idleTimer;
    private volatile String lastFailure;

    public StoragePersistenceScheduler(StorageExporter exporter,
                                       StorageDestinations destinations,
                                       TaskScheduler taskScheduler,
                                       IdleTaskRunner idleTaskRunner,
                                       Executor writeExecutor,
                                       MetricsConfig metricsConfig,
                                       Clock clock,
                                       long defaultIdleTimeoutMs) {
        this.exporter = exporter;
        this.destinations = destinations;
        this.taskScheduler = taskScheduler;
        this.idleTaskRunner = idleTaskRunner;
        this.writeExecutor = writeExecutor;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.defaultIdleTimeoutMs = defaultIdleTimeoutMs;
    }

    // ==================== Dirty Tracking ====================

    @Override
    public void schedule(Set<StorageDomain> domains) {
        if (domains.isEmpty()) {
            return;
        }
        synchronized (lock) {
            dirty.addAll(domains);
        }
        log.debug("Marked dirty: {}", domains);
    }

    // ==================== Idle Flush ====================

    @Override
    public void flushWhenIdle() {
        flushWhenIdle(defaultIdleTimeoutMs);
    }

    @Override
    public void flushWhenIdle(long idleTimeoutMs) {
        synchronized (lock) {
            cancelIdleTimer();
            idleTimer = taskScheduler.schedule(this::onIdleTimeout, clock.instant().plusMillis(idleTimeoutMs));
        }
    }

    private void onIdleTimeout() {
        log.debug("Idle timeout reached, handing flush to {}", idleTaskRunner.getClass().getSimpleName());
        idleTaskRunner.runWhenIdle(this::flush);
    }

    @Override
    public void dispose() {
        synchronized (lock) {
            cancelIdleTimer();
        }
    }

    private void cancelIdleTimer() {
        if (idleTimer != null) {
            idleTimer.cancel(false);
            idleTimer = null;
        }
    }

    // ==================== Flush ====================

    @Override
    public CompletableFuture<Void> flush() {
        CompletableFuture<Void> shared;
        synchronized (lock) {
            if (inflight != null) {
                rerunRequested = true;
                return inflight;
            }
            if (dirty.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            inflight = new CompletableFuture<>();
            shared = inflight;
        }
        runCycle(shared);
        return shared;
    }

    private void runCycle(CompletableFuture<Void> shared) {
        Set<StorageDomain> captured;
        synchronized (lock) {
            captured = EnumSet.copyOf(dirty);
            dirty.clear();
            rerunRequested = false;
        }
        if (captured.isEmpty()) {
            finish(shared);
            return;
        }

        log.debug("Flushing domains: {}", captured);
        var sample = Timer.start(metricsConfig.getRegistry());
        CompletableFuture<Map<StorageDomain, StoragePayload>> exported;
        try {
            exported = exporter.export(captured);
        } catch (RuntimeException e) {
            exported = CompletableFuture.failedFuture(e);
        }

        exported.thenCompose(this::writeAll)
                .whenComplete((ignored, error) -> {
                    sample.stop(metricsConfig.getFlushTimer());
                    if (error != null) {
                        onCycleFailed(shared, captured, unwrap(error));
                    } else {
                        onCycleCompleted(shared, captured);
                    }
                });
    }

    private CompletableFuture<Void> writeAll(Map<StorageDomain, StoragePayload> payloads) {
        var writes = new ArrayList<CompletableFuture<Void>>(payloads.size());
        payloads.forEach((domain, payload) ->
                writes.add(CompletableFuture.runAsync(() -> destinations.write(domain, payload), writeExecutor)));
        return CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]));
    }

    private void onCycleCompleted(CompletableFuture<Void> shared, Set<StorageDomain> captured) {
        metricsConfig.getFlushesCompleted().increment();
        lastFailure = null;
        log.info("Persisted {}", captured);

        boolean again;
        synchronized (lock) {
            again = rerunRequested && !dirty.isEmpty();
            if (!again) {
                rerunRequested = false;
                inflight = null;
            }
        }
        if (again) {
            runCycle(shared);
        } else {
            shared.complete(null);
        }
    }

    private void onCycleFailed(CompletableFuture<Void> shared, Set<StorageDomain> captured, Throwable cause) {
        metricsConfig.getFlushesFailed().increment();
        lastFailure = cause.getMessage();
        log.error("Flush of {} failed, domains stay dirty", captured, cause);

        synchronized (lock) {
            dirty.addAll(captured);
            rerunRequested = false;
            inflight = null;
        }
        shared.completeExceptionally(cause);
    }

    private void finish(CompletableFuture<Void> shared) {
        synchronized (lock) {
            rerunRequested = false;
            inflight = null;
        }
        shared.complete(null);
    }

    // ==================== Monitoring ====================

    @Override
    public PersistenceStatus status() {
        synchronized (lock) {
            return new PersistenceStatus(
                    dirty.isEmpty() ? Set.of() : Set.copyOf(dirty),
                    inflight != null,
                    idleTimer != null && !idleTimer.isDone(),
                    lastFailure
            );
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
