package com.cratemind.core.metrics;

import com.cratemind.core.model.Category;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for classification runs.
 */
@Service
public class CratemindMetrics {

    private final MeterRegistry registry;

    public CratemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBackendCall(String provider, long ms) {
        Timer.builder("cratemind.backend.duration")
                .tag("provider", provider)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome one of {@code accepted}, {@code below_threshold}, {@code transport_failure}
     */
    public void recordAttempt(String provider, String outcome) {
        Counter.builder("cratemind.attempts.total")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordBatchResult(boolean accepted, int attempts) {
        Counter.builder("cratemind.batches.total")
                .tag("result", accepted ? "accepted" : "exhausted")
                .register(registry)
                .increment();
        DistributionSummary.builder("cratemind.batch.attempts")
                .register(registry)
                .record(attempts);
    }

    public void recordClassification(Category category) {
        Counter.builder("cratemind.tracks.classified")
                .tag("category", category != null ? category.label() : "unclassified")
                .register(registry)
                .increment();
    }
}
