package com.cratemind.core.classify;

import com.cratemind.core.model.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Final result of one batch: the classifications (aligned with the batch, null
 * where unresolved), how many attempts were spent and whether one was accepted.
 */
public record BatchOutcome(List<Category> classifications, int attempts, boolean accepted) {

    public static BatchOutcome accepted(List<Category> classifications, int attempts) {
        return new BatchOutcome(classifications, attempts, true);
    }

    /**
     * All-null result for a batch whose attempts all fell short; partial parses
     * from the failed attempts are not kept.
     */
    public static BatchOutcome exhausted(int batchSize, int attempts) {
        return new BatchOutcome(Collections.unmodifiableList(new ArrayList<>(Collections.nCopies(batchSize, null))),
                attempts, false);
    }

    public int resolved() {
        return ResponseParser.countResolved(classifications);
    }
}
