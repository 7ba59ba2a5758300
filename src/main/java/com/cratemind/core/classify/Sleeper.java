package com.cratemind.core.classify;

import java.time.Duration;

/**
 * Blocking delay used for retry backoff and batch pacing. Swapped for a
 * recording implementation in tests so no real time passes.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeps for {@code duration}. An interrupt aborts the whole run: the
     * interrupt flag is restored and {@link ClassificationAbortedException} is thrown.
     */
    default void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClassificationAbortedException("Classification interrupted while waiting " + duration.toMillis() + "ms", e);
        }
    }
}
