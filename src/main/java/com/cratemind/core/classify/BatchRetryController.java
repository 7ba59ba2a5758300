package com.cratemind.core.classify;

import com.cratemind.core.llm.BackendTransportException;
import com.cratemind.core.llm.ClassificationBackend;
import com.cratemind.core.logging.MdcContext;
import com.cratemind.core.metrics.CratemindMetrics;
import com.cratemind.core.model.Category;
import com.cratemind.core.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Drives the attempts for a single batch.
 * <p>
 * The prompt is built once and re-sent verbatim. Each attempt's parse is judged
 * on its own against the acceptance threshold; a transport failure counts as a
 * failed attempt. Between failed attempts the controller backs off
 * exponentially, and once the budget is spent the batch resolves to all nulls.
 * Never throws for backend or parse problems.
 */
public class BatchRetryController {

    private static final Logger log = LoggerFactory.getLogger(BatchRetryController.class);

    private final ClassificationBackend backend;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final CratemindMetrics metrics;

    public BatchRetryController(ClassificationBackend backend, RetryPolicy policy, Sleeper sleeper) {
        this(backend, policy, sleeper, null);
    }

    public BatchRetryController(ClassificationBackend backend, RetryPolicy policy, Sleeper sleeper,
                                CratemindMetrics metrics) {
        this.backend = backend;
        this.policy = policy;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public BatchOutcome classify(List<Track> batch) {
        if (batch.isEmpty()) {
            return BatchOutcome.accepted(List.of(), 0);
        }
        String prompt = PromptBuilder.build(batch);
        int batchSize = batch.size();

        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            MdcContext.setAttempt(attempt + 1);
            List<Category> parsed = attempt(prompt, batchSize, attempt);
            if (parsed != null) {
                int resolved = ResponseParser.countResolved(parsed);
                if (policy.accepts(resolved, batchSize)) {
                    recordAttempt("accepted");
                    recordBatch(true, attempt + 1);
                    return BatchOutcome.accepted(parsed, attempt + 1);
                }
                recordAttempt("below_threshold");
                log.warn("Low success rate ({}) on attempt {}/{}: {}/{} tracks resolved",
                        percent(RetryPolicy.successRate(resolved, batchSize)),
                        attempt + 1, policy.maxAttempts(), resolved, batchSize);
            }
            if (policy.hasAttemptAfter(attempt)) {
                Duration backoff = policy.backoffAfter(attempt);
                log.info("Retrying in {}ms (attempt {}/{} next)", backoff.toMillis(), attempt + 2, policy.maxAttempts());
                sleeper.pause(backoff);
            }
        }

        log.warn("Batch of {} tracks exhausted {} attempts, leaving it unclassified", batchSize, policy.maxAttempts());
        recordBatch(false, policy.maxAttempts());
        return BatchOutcome.exhausted(batchSize, policy.maxAttempts());
    }

    /**
     * Runs one backend call and parse; returns null when the call failed.
     * Any runtime exception from the backend counts as a transport failure.
     */
    private List<Category> attempt(String prompt, int batchSize, int attempt) {
        long start = System.currentTimeMillis();
        String reply;
        try {
            reply = backend.send(prompt);
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ClassificationAbortedException("Classification interrupted during backend call", e);
            }
            recordAttempt("transport_failure");
            log.warn("Classification attempt {}/{} failed: {}", attempt + 1, policy.maxAttempts(),
                    e instanceof BackendTransportException ? e.getMessage() : e.toString());
            return null;
        } finally {
            if (metrics != null) {
                metrics.recordBackendCall(backend.provider().id(), System.currentTimeMillis() - start);
            }
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new ClassificationAbortedException("Classification interrupted during backend call", null);
        }
        log.debug("Raw reply on attempt {}: {}", attempt + 1, reply);
        return ResponseParser.parse(reply, batchSize);
    }

    private void recordAttempt(String outcome) {
        if (metrics != null) {
            metrics.recordAttempt(backend.provider().id(), outcome);
        }
    }

    private void recordBatch(boolean accepted, int attempts) {
        if (metrics != null) {
            metrics.recordBatchResult(accepted, attempts);
        }
    }

    private static String percent(double rate) {
        return String.format("%.0f%%", rate * 100);
    }
}
