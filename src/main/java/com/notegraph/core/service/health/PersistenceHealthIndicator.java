package com.notegraph.core.service.health;

import com.notegraph.core.service.persistence.PersistenceScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports pending snapshot work; down while the last flush cycle has failed.
 */
@Component
@RequiredArgsConstructor
public class PersistenceHealthIndicator implements HealthIndicator {

    private final PersistenceScheduler persistenceScheduler;

    @Override
    public Health health() {
        var status = persistenceScheduler.status();

        Health.Builder builder = status.lastFailure() != null
                ? Health.down().withDetail("lastFailure", status.lastFailure())
                : Health.up();

        return builder
                .withDetail("dirtyDomains", status.dirtyDomains())
                .withDetail("flushInProgress", status.flushInProgress())
                .withDetail("idleFlushPending", status.idleFlushPending())
                .build();
    }
}
