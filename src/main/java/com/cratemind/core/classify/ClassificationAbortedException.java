package com.cratemind.core.classify;

import com.cratemind.core.model.ClassifiedTrack;

import java.util.List;

/**
 * Thrown when a classification run is interrupted during a backend call or a
 * backoff/pacing wait. Carries the tracks of the batches that completed before
 * the interrupt; those results are final.
 */
public class ClassificationAbortedException extends RuntimeException {

    private final List<ClassifiedTrack> completedTracks;

    public ClassificationAbortedException(String message, Throwable cause) {
        this(message, cause, List.of());
    }

    public ClassificationAbortedException(String message, Throwable cause, List<ClassifiedTrack> completedTracks) {
        super(message, cause);
        this.completedTracks = List.copyOf(completedTracks);
    }

    public List<ClassifiedTrack> getCompletedTracks() {
        return completedTracks;
    }
}
