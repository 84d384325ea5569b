package com.notegraph.core.service.ingest;

import com.notegraph.core.service.config.IngestionConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Drains the ingestion queue on one background thread.
 *
 * Changes are applied strictly in queue order, so a removal never overtakes the upsert
 * it follows. A failing item is logged and skipped.
 */
@Slf4j
@Service
public class IngestionWorker {

    private static final String THREAD_NAME = "ingestion-worker";

    private final IngestionQueue queue;
    private final IngestionConfig ingestionConfig;
    private final Map<Class<?>, Consumer<IngestionWorkItem>> routes = new HashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService executorService;

    public IngestionWorker(IngestionQueue queue,
                           List<IngestionHandler<? extends IngestionWorkItem>> handlers,
                           IngestionConfig ingestionConfig) {
        this.queue = queue;
        this.ingestionConfig = ingestionConfig;
        handlers.forEach(this::route);
    }

    private <T extends IngestionWorkItem> void route(IngestionHandler<T> handler) {
        var type = handler.getSupportedType();
        var previous = routes.put(type, item -> handler.handle(type.cast(item)));
        if (previous != null) {
            throw new IllegalStateException("Two ingestion handlers for " + type.getSimpleName());
        }
    }

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        executorService = Executors.newSingleThreadExecutor(runnable -> {
            var thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        running.set(true);
        executorService.submit(this::drainLoop);
        log.info("Ingestion worker started, handling {}", routes.keySet().stream()
                .map(Class::getSimpleName)
                .sorted()
                .toList());
    }

    @PreDestroy
    void stop() {
        running.set(false);
        executorService.shutdown();
        try {
            long timeout = ingestionConfig.getWorker().getShutdownTimeoutSeconds();
            if (!executorService.awaitTermination(timeout, TimeUnit.SECONDS)) {
                log.warn("Ingestion worker did not stop within {}s, interrupting", timeout);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
        log.info("Ingestion worker stopped, {} changes left unprocessed", queue.pending());
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== Processing ====================

    private void drainLoop() {
        long pollTimeoutMs = ingestionConfig.getWorker().getPollTimeoutMs();
        while (running.get()) {
            try {
                queue.poll(pollTimeoutMs).ifPresent(this::process);
            } catch (RuntimeException e) {
                log.error("Ingestion worker loop failed, continuing", e);
            }
        }
    }

    void process(IngestionWorkItem item) {
        try {
            var handler = routes.get(item.getClass());
            if (handler == null) {
                log.warn("No handler for {}, dropping {}", item.getClass().getSimpleName(), item.getEntityId());
                return;
            }
            handler.accept(item);
        } catch (IngestionException e) {
            log.error("Ingestion of {} failed [{}]: {}", e.getDocumentId(), e.getReason(), e.getMessage(), e.getCause());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while ingesting {}", item.getEntityId(), e);
        } finally {
            queue.markProcessed();
        }
    }
}
