package com.cratemind.core.engine;

import com.cratemind.catalog.TrackCatalogReader;
import com.cratemind.core.classify.BatchClassifier;
import com.cratemind.core.classify.BatchRetryController;
import com.cratemind.core.classify.ClassifierProperties;
import com.cratemind.core.classify.RetryPolicy;
import com.cratemind.core.classify.Sleeper;
import com.cratemind.core.classify.SummaryAggregator;
import com.cratemind.core.llm.BackendFactory;
import com.cratemind.core.llm.ClassificationBackend;
import com.cratemind.core.llm.LlmProperties;
import com.cratemind.core.logging.MdcContext;
import com.cratemind.core.metrics.CratemindMetrics;
import com.cratemind.core.model.ClassificationSummary;
import com.cratemind.core.model.ClassifiedTrack;
import com.cratemind.core.model.Track;
import com.cratemind.export.PlaylistExporter;
import com.cratemind.export.ResultsWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates a classification run: load the catalog, classify every track,
 * summarise, write the results file and export playlists.
 * <p>
 * The backend is selected and constructed before the catalog is read, so an
 * unsupported provider or a missing key fails the run up front.
 */
@Service
public class ClassificationEngine {

    private static final Logger log = LoggerFactory.getLogger(ClassificationEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final BackendFactory backendFactory;
    private final LlmProperties llmProperties;
    private final ClassifierProperties classifierProperties;
    private final TrackCatalogReader catalogReader;
    private final ResultsWriter resultsWriter;
    private final PlaylistExporter playlistExporter;
    private final CratemindMetrics metrics;
    private final Sleeper sleeper;

    @Autowired
    public ClassificationEngine(BackendFactory backendFactory, LlmProperties llmProperties,
                                ClassifierProperties classifierProperties, TrackCatalogReader catalogReader,
                                ResultsWriter resultsWriter, PlaylistExporter playlistExporter,
                                CratemindMetrics metrics) {
        this(backendFactory, llmProperties, classifierProperties, catalogReader, resultsWriter,
                playlistExporter, metrics, Sleeper.SYSTEM);
    }

    ClassificationEngine(BackendFactory backendFactory, LlmProperties llmProperties,
                         ClassifierProperties classifierProperties, TrackCatalogReader catalogReader,
                         ResultsWriter resultsWriter, PlaylistExporter playlistExporter,
                         CratemindMetrics metrics, Sleeper sleeper) {
        this.backendFactory = backendFactory;
        this.llmProperties = llmProperties;
        this.classifierProperties = classifierProperties;
        this.catalogReader = catalogReader;
        this.resultsWriter = resultsWriter;
        this.playlistExporter = playlistExporter;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public WorkflowResult run(RunOptions options) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            return run(runId, options);
        } finally {
            MdcContext.clear();
        }
    }

    private WorkflowResult run(String runId, RunOptions options) {
        String providerId = options.provider() != null ? options.provider() : llmProperties.getProvider();
        int batchSize = options.batchSize() != null ? options.batchSize() : classifierProperties.getBatchSize();
        int maxRetries = options.maxRetries() != null ? options.maxRetries() : classifierProperties.getMaxRetries();

        ClassificationBackend backend = backendFactory.create(providerId);
        BatchClassifier classifier = newClassifier(backend, batchSize, maxRetries);
        String provider = backend.provider().id();
        log.info("Run {} started: provider={}, batchSize={}, maxRetries={}", runId, provider, batchSize, maxRetries);

        List<Track> tracks = catalogReader.read(options.catalogFile());
        if (tracks.isEmpty()) {
            log.warn("No tracks found in {}", options.catalogFile());
            return WorkflowResult.noTracks(runId, provider);
        }

        List<ClassifiedTrack> classified = classifier.classifyTracks(tracks);
        ClassificationSummary summary = SummaryAggregator.summarize(classified);

        Path resultsFile = resultsWriter.write(classified, summary, provider, batchSize, options.outputFile());
        List<Path> playlistFiles = options.exportPlaylists()
                ? playlistExporter.export(playlistExporter.categorize(classified), options.playlistDir())
                : List.of();

        log.info("Run {} complete: {}/{} tracks classified", runId, summary.classified(), summary.totalTracks());
        return new WorkflowResult(runId, provider, classified, summary, resultsFile, playlistFiles);
    }

    /**
     * Loads the catalog without classifying it.
     */
    public List<Track> loadCatalog(Path catalogFile) {
        return catalogReader.read(catalogFile);
    }

    BatchClassifier newClassifier(ClassificationBackend backend, int batchSize, int maxRetries) {
        var policy = RetryPolicy.of(maxRetries, classifierProperties.getTimeUnit());
        var controller = new BatchRetryController(backend, policy, sleeper, metrics);
        return new BatchClassifier(controller, batchSize, classifierProperties.getTimeUnit(), sleeper, metrics);
    }

    private String generateRunId() {
        int seq = RUN_COUNTER.incrementAndGet();
        return String.format("CRATE-%d-%04d", LocalDate.now().getYear(), seq);
    }
}
