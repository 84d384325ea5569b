package com.notegraph.core.service.ingest;

import com.notegraph.core.service.config.IngestionConfig;
import com.notegraph.core.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * IngestionQueue over a LinkedBlockingQueue sized from {@code notegraph.ingest.queue.capacity}.
 */
@Slf4j
@Component
public class DefaultIngestionQueue implements IngestionQueue {

    private final MetricsConfig metricsConfig;
    private final BlockingQueue<IngestionWorkItem> items;
    private final int capacity;
    private final AtomicInteger inProgress = new AtomicInteger();

    public DefaultIngestionQueue(IngestionConfig config, MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
        this.capacity = config.getQueue().getCapacity();
        this.items = new LinkedBlockingQueue<>(capacity);
    }

    @PostConstruct
    void registerGauges() {
        metricsConfig.registerQueueGauge(
                "notegraph.ingest.queue.size",
                "Document changes waiting for the ingestion worker",
                this::pending
        );
        metricsConfig.registerQueueGauge(
                "notegraph.ingest.queue.utilization",
                "Ingestion queue utilization percentage",
                this::utilizationPercent
        );
        log.info("Ingestion queue ready, capacity {}", capacity);
    }

    @Override
    public boolean offer(IngestionWorkItem item, long timeoutMs) {
        try {
            if (items.offer(item, timeoutMs, TimeUnit.MILLISECONDS)) {
                log.debug("Queued {} for {}", item.getClass().getSimpleName(), item.getEntityId());
                return true;
            }
            log.warn("Ingestion queue full after {}ms, dropping change for {}", timeoutMs, item.getEntityId());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while queueing change for {}", item.getEntityId());
            return false;
        }
    }

    @Override
    public Optional<IngestionWorkItem> poll(long timeoutMs) {
        try {
            var item = items.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (item == null) {
                return Optional.empty();
            }
            // counted only once taken, so an empty wait never looks busy
            inProgress.incrementAndGet();
            return Optional.of(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void markProcessed() {
        inProgress.updateAndGet(current -> Math.max(0, current - 1));
    }

    @Override
    public int pending() {
        return items.size();
    }

    @Override
    public int inProgress() {
        return inProgress.get();
    }

    @Override
    public int capacity() {
        return capacity;
    }
}
