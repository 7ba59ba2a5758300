package com.cratemind.core.engine;

import com.cratemind.core.model.ClassificationSummary;
import com.cratemind.core.model.ClassifiedTrack;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a full classification run.
 *
 * @param resultsFile   null when nothing was written (no tracks found)
 * @param playlistFiles empty when playlist export was skipped
 */
public record WorkflowResult(
        String runId,
        String provider,
        List<ClassifiedTrack> tracks,
        ClassificationSummary summary,
        Path resultsFile,
        List<Path> playlistFiles
) {

    public static WorkflowResult noTracks(String runId, String provider) {
        return new WorkflowResult(runId, provider, List.of(), ClassificationSummary.empty(), null, List.of());
    }

    public boolean hasTracks() {
        return !tracks.isEmpty();
    }
}
