package com.cratemind.core.classify;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "cratemind.classifier")
public class ClassifierProperties {

    private int batchSize = BatchClassifier.DEFAULT_BATCH_SIZE;
    private int maxRetries = RetryPolicy.DEFAULT_MAX_ATTEMPTS;

    /**
     * One backoff/pacing unit. Backoff after attempt {@code a} waits {@code 2^a}
     * units; batches are separated by one unit.
     */
    private Duration timeUnit = Duration.ofSeconds(1);

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getTimeUnit() {
        return timeUnit;
    }

    public void setTimeUnit(Duration timeUnit) {
        this.timeUnit = timeUnit;
    }
}
