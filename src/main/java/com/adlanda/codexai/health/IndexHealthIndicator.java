package com.adlanda.codexai.health;

import com.adlanda.codexai.model.RebuildResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for project index rebuilds.
 *
 * Reports the last rebuild: project, document counts and timestamp, or the
 * error that made it fail.
 */
@Component
public class IndexHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(true, null, null, null, null)
    );

    public void markHealthy(String projectId, RebuildResult result) {
        state.set(new HealthState(true, projectId, result, null, Instant.now()));
    }

    public void markUnhealthy(String projectId, String error) {
        state.set(new HealthState(false, projectId, null, error, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.healthy()) {
            Health.Builder builder = Health.up()
                    .withDetail("lastRebuild", current.timestamp() != null ? current.timestamp().toString() : "never");

            if (current.result() != null) {
                builder.withDetail("project", current.projectId())
                       .withDetail("documentsDeleted", current.result().documentsDeleted())
                       .withDetail("documentsIndexed", current.result().documentsIndexed())
                       .withDetail("documentsSkipped", current.result().documentsSkipped());
            }

            return builder.build();
        }

        return Health.down()
                .withDetail("project", current.projectId())
                .withDetail("error", current.error())
                .withDetail("lastAttempt", current.timestamp().toString())
                .build();
    }

    /**
     * Internal state holder for thread-safe health updates.
     */
    private record HealthState(
            boolean healthy,
            String projectId,
            RebuildResult result,
            String error,
            Instant timestamp
    ) {}
}
