package dev.maplecms.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for content writes and slug contention, exposed under {@code cms.*}.
 */
@Component
public class ContentMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter slugCollisions;
    private final Counter slugWriteRetries;
    private final Counter slugExhausted;

    public ContentMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.slugCollisions = Counter.builder("cms.slug.collisions")
                .description("Candidate slugs found taken during resolution")
                .register(meterRegistry);
        this.slugWriteRetries = Counter.builder("cms.slug.write.retries")
                .description("Create/update units re-run after a slug unique violation at commit")
                .register(meterRegistry);
        this.slugExhausted = Counter.builder("cms.slug.exhausted")
                .description("Slug resolutions that ran out of attempts")
                .register(meterRegistry);
    }

    public void entityCreated(String entityType) {
        meterRegistry.counter("cms.entities.created", "type", entityType).increment();
    }

    public void entityDeleted(String entityType) {
        meterRegistry.counter("cms.entities.deleted", "type", entityType).increment();
    }

    public void slugCollision() {
        slugCollisions.increment();
    }

    public void slugWriteRetry() {
        slugWriteRetries.increment();
    }

    public void slugExhausted() {
        slugExhausted.increment();
    }

    public void login(boolean success) {
        meterRegistry.counter("cms.auth.logins", "result", success ? "success" : "failure").increment();
    }
}
