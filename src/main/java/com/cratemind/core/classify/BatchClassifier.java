package com.cratemind.core.classify;

import com.cratemind.core.llm.ClassifierConfigurationException;
import com.cratemind.core.logging.MdcContext;
import com.cratemind.core.metrics.CratemindMetrics;
import com.cratemind.core.model.Category;
import com.cratemind.core.model.ClassifiedTrack;
import com.cratemind.core.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a full track list in fixed-size batches, strictly one batch at a
 * time, pausing between batches to stay inside backend rate limits.
 * <p>
 * Input tracks are never modified; each result is a new {@link ClassifiedTrack}.
 * A batch that exhausts its attempts does not stop the batches after it.
 */
public class BatchClassifier {

    private static final Logger log = LoggerFactory.getLogger(BatchClassifier.class);

    public static final int DEFAULT_BATCH_SIZE = 25;

    private final BatchRetryController retryController;
    private final int batchSize;
    private final Duration pacing;
    private final Sleeper sleeper;
    private final CratemindMetrics metrics;

    public BatchClassifier(BatchRetryController retryController, int batchSize, Duration pacing, Sleeper sleeper) {
        this(retryController, batchSize, pacing, sleeper, null);
    }

    public BatchClassifier(BatchRetryController retryController, int batchSize, Duration pacing, Sleeper sleeper,
                           CratemindMetrics metrics) {
        if (batchSize < 1) {
            throw new ClassifierConfigurationException("batch size must be a positive integer, got " + batchSize);
        }
        this.retryController = retryController;
        this.batchSize = batchSize;
        this.pacing = pacing;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Classifies one batch. Returns one entry per track, null where unresolved;
     * an empty batch returns an empty list without calling the backend.
     */
    public List<Category> classifyBatch(List<Track> batch) {
        return retryController.classify(batch).classifications();
    }

    public List<ClassifiedTrack> classifyTracks(List<Track> tracks) {
        if (tracks.isEmpty()) {
            return List.of();
        }
        List<List<Track>> batches = partition(tracks, batchSize);
        log.info("Classifying {} tracks in {} batches", tracks.size(), batches.size());

        List<ClassifiedTrack> classified = new ArrayList<>(tracks.size());
        try {
            for (int i = 0; i < batches.size(); i++) {
                List<Track> batch = batches.get(i);
                int batchNumber = i + 1;
                MdcContext.setBatch(batchNumber);
                log.info("Processing batch {}/{} ({} tracks)...", batchNumber, batches.size(), batch.size());

                BatchOutcome outcome = retryController.classify(batch);
                List<Category> classifications = outcome.classifications();
                for (int j = 0; j < batch.size(); j++) {
                    Category category = classifications.get(j);
                    classified.add(batch.get(j).classifiedAs(category));
                    if (metrics != null) {
                        metrics.recordClassification(category);
                    }
                }
                log.info("Batch {} complete: {}/{} classified successfully",
                        batchNumber, outcome.resolved(), batch.size());

                if (batchNumber < batches.size()) {
                    sleeper.pause(pacing);
                }
            }
        } catch (ClassificationAbortedException e) {
            throw new ClassificationAbortedException(e.getMessage(), e, classified);
        } finally {
            MdcContext.clearBatch();
        }

        long resolved = classified.stream().filter(ClassifiedTrack::isClassified).count();
        log.info("Classification complete: {}/{} tracks classified ({} success rate)",
                resolved, classified.size(), String.format("%.1f%%", resolved * 100.0 / classified.size()));
        return List.copyOf(classified);
    }

    /**
     * Splits {@code items} into consecutive, order-preserving slices of at most {@code size}.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> slices = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            slices.add(List.copyOf(items.subList(from, Math.min(from + size, items.size()))));
        }
        return slices;
    }
}
