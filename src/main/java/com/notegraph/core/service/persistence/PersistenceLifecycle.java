package com.notegraph.core.service.persistence;

import com.notegraph.core.service.config.NoteGraphConfig;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletionException;

/**
 * Writes every dirty domain before the application context closes, then stops the idle timer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PersistenceLifecycle {

    private final PersistenceScheduler persistenceScheduler;
    private final NoteGraphConfig noteGraphConfig;

    @PreDestroy
    void shutdown() {
        try {
            if (noteGraphConfig.getFeatures().isFlushOnShutdown()) {
                flushAndWait();
            }
        } finally {
            persistenceScheduler.dispose();
        }
    }

    private void flushAndWait() {
        var dirty = persistenceScheduler.status().dirtyDomains();
        log.info("Flushing {} before shutdown", dirty);
        try {
            persistenceScheduler.flush().join();
        } catch (CompletionException e) {
            log.error("Final flush failed, unsaved domains: {}",
                    persistenceScheduler.status().dirtyDomains(), e.getCause());
        }
    }
}
