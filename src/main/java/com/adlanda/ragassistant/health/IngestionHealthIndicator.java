package com.adlanda.ragassistant.health;

import com.adlanda.ragassistant.model.IngestionReport;
import com.adlanda.ragassistant.repository.ChunkStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the chunk store and ingestion.
 *
 * Reports:
 * - Number of chunks in the store (DOWN when the store cannot be read)
 * - Outcome of the last ingestion, with its timestamp
 * - Error message of the last failed ingestion
 */
@Component
public class IngestionHealthIndicator implements HealthIndicator {

    private final ChunkStore chunkStore;

    private final AtomicReference<IngestionState> state = new AtomicReference<>(
            new IngestionState(true, null, null, null)
    );

    public IngestionHealthIndicator(ChunkStore chunkStore) {
        this.chunkStore = chunkStore;
    }

    /**
     * Records a successful ingestion.
     */
    public void markHealthy(IngestionReport report) {
        state.set(new IngestionState(true, report, null, Instant.now()));
    }

    /**
     * Records a failed ingestion with the given error message.
     */
    public void markUnhealthy(String error) {
        state.set(new IngestionState(false, null, error, Instant.now()));
    }

    @Override
    public Health health() {
        long chunks;
        try {
            chunks = chunkStore.count();
        } catch (RuntimeException e) {
            return Health.down(e).build();
        }

        IngestionState current = state.get();
        Health.Builder builder = Health.up()
                .withDetail("chunksIndexed", chunks)
                .withDetail("lastIngestion", current.timestamp() != null ? current.timestamp().toString() : "never");

        if (current.report() != null) {
            builder.withDetail("lastSource", current.report().sourceName())
                   .withDetail("lastSourceType", current.report().sourceType())
                   .withDetail("lastChunksProduced", current.report().chunksProduced())
                   .withDetail("lastSkipped", current.report().skipped());
        }
        if (!current.succeeded()) {
            builder.withDetail("lastError", current.error());
        }

        return builder.build();
    }

    /**
     * Internal state holder for thread-safe updates.
     */
    private record IngestionState(
            boolean succeeded,
            IngestionReport report,
            String error,
            Instant timestamp
    ) {}
}
