package com.cratemind.dispatch.cli;

import com.cratemind.core.engine.ClassificationEngine;
import com.cratemind.core.model.AudioFeatures;
import com.cratemind.core.model.Track;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: cratemind inspect &lt;tracks.json&gt;
 * <p>
 * Loads the catalog without classifying it and shows what the classifier
 * would see for the first track.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true,
        description = "Load a track catalog and show sample track info without classifying")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Enriched track catalog (JSON array of tracks)")
    private Path catalogFile;

    private final ClassificationEngine engine;

    public InspectCommand(ClassificationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<Track> tracks;
        try {
            tracks = engine.loadCatalog(catalogFile);
        } catch (Exception e) {
            ConsoleOutput.error("Could not load catalog: " + ClassifyCommand.rootCauseMessage(e));
            return 1;
        }

        ConsoleOutput.info("Found " + tracks.size() + " tracks");
        if (tracks.isEmpty()) {
            return 0;
        }

        Track sample = tracks.get(0);
        AudioFeatures features = sample.audioFeatures();
        System.out.println();
        System.out.println("SAMPLE TRACK");
        System.out.println("──────────────────────────────────");
        System.out.println("  Name:         " + sample.name());
        System.out.println("  Artists:      " + String.join(", ", sample.artists()));
        System.out.println("  Genres:       " + String.join(", ", sample.genres()));
        System.out.println("  Tempo:        " + orNa(features.tempo()));
        System.out.println("  Energy:       " + orNa(features.energy()));
        System.out.println("  Danceability: " + orNa(features.danceability()));
        return 0;
    }

    private static String orNa(Optional<Double> value) {
        return value.map(String::valueOf).orElse("N/A");
    }
}
