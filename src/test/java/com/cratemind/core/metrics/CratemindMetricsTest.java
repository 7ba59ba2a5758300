package com.cratemind.core.metrics;

import com.cratemind.core.model.Category;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CratemindMetricsTest {

    private SimpleMeterRegistry registry;
    private CratemindMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CratemindMetrics(registry);
    }

    @Test
    @DisplayName("recordBackendCall creates a timer per provider")
    void recordBackendCall() {
        metrics.recordBackendCall("openai", 1200);
        metrics.recordBackendCall("openai", 800);
        var timer = registry.find("cratemind.backend.duration").tag("provider", "openai").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("recordAttempt increments counter by outcome")
    void recordAttempt() {
        metrics.recordAttempt("anthropic", "accepted");
        metrics.recordAttempt("anthropic", "transport_failure");
        metrics.recordAttempt("anthropic", "transport_failure");

        var failures = registry.find("cratemind.attempts.total")
                .tag("provider", "anthropic").tag("outcome", "transport_failure").counter();
        assertNotNull(failures);
        assertEquals(2.0, failures.count());
    }

    @Test
    @DisplayName("recordBatchResult tags accepted and exhausted batches and tracks attempts")
    void recordBatchResult() {
        metrics.recordBatchResult(true, 1);
        metrics.recordBatchResult(false, 3);

        assertEquals(1.0, registry.find("cratemind.batches.total").tag("result", "accepted").counter().count());
        assertEquals(1.0, registry.find("cratemind.batches.total").tag("result", "exhausted").counter().count());
        var attempts = registry.find("cratemind.batch.attempts").summary();
        assertNotNull(attempts);
        assertEquals(4.0, attempts.totalAmount());
    }

    @Test
    @DisplayName("recordClassification tags by category label, null as unclassified")
    void recordClassification() {
        metrics.recordClassification(Category.DANCE_POP);
        metrics.recordClassification(null);

        assertEquals(1.0, registry.find("cratemind.tracks.classified").tag("category", "Dance Pop").counter().count());
        assertEquals(1.0, registry.find("cratemind.tracks.classified").tag("category", "unclassified").counter().count());
    }
}
