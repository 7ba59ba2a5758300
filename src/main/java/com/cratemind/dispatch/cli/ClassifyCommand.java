package com.cratemind.dispatch.cli;

import com.cratemind.core.classify.ClassificationAbortedException;
import com.cratemind.core.engine.ClassificationEngine;
import com.cratemind.core.engine.RunOptions;
import com.cratemind.core.engine.WorkflowResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: cratemind classify &lt;tracks.json&gt;
 * <p>
 * Classifies every track in the catalog, prints the summary, saves the results
 * file and (unless disabled) writes one playlist file per category.
 */
@Command(name = "classify", mixinStandardHelpOptions = true,
        description = "Classify tracks into Dance Pop, House or Bass")
@Component
public class ClassifyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Enriched track catalog (JSON array of tracks)")
    private Path catalogFile;

    @Option(names = {"--provider", "-p"},
            description = "LLM provider: openai or anthropic (default: from LLM_PROVIDER or openai)")
    private String provider;

    @Option(names = {"--batch-size", "-b"},
            description = "Tracks per backend call (default: from BATCH_SIZE or 25)")
    private Integer batchSize;

    @Option(names = {"--max-retries", "-r"},
            description = "Attempts per batch (default: from MAX_RETRIES or 3)")
    private Integer maxRetries;

    @Option(names = {"--output", "-o"},
            description = "Results file (default: cratemind_classifications_<timestamp>.json)")
    private Path output;

    @Option(names = "--playlist-dir", description = "Directory for playlist files", defaultValue = "playlists")
    private Path playlistDir;

    @Option(names = "--no-playlists", description = "Skip creating playlist files")
    private boolean noPlaylists;

    private final ClassificationEngine engine;

    public ClassifyCommand(ClassificationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Classifying tracks from " + catalogFile + "...");

        WorkflowResult result;
        try {
            result = engine.run(new RunOptions(catalogFile, provider, batchSize, maxRetries, output,
                    !noPlaylists, playlistDir));
        } catch (ClassificationAbortedException e) {
            ConsoleOutput.error("Classification interrupted after "
                    + e.getCompletedTracks().size() + " tracks");
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Classification failed: " + rootCauseMessage(e));
            return 1;
        }

        if (!result.hasTracks()) {
            ConsoleOutput.error("No tracks found");
            return 1;
        }

        ConsoleOutput.summary(result.summary());
        System.out.println();
        ConsoleOutput.fileWritten("Results saved to", result.resultsFile());
        for (Path playlist : result.playlistFiles()) {
            ConsoleOutput.fileWritten("Playlist", playlist);
        }
        System.out.println();
        ConsoleOutput.success("Classification complete (" + result.provider() + ", run " + result.runId() + ").");
        return 0;
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
