package com.cratemind.export;

import com.cratemind.core.model.ClassificationSummary;
import com.cratemind.core.model.ClassifiedTrack;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a classification run to a single JSON document with run metadata,
 * the summary and every classified track.
 */
@Component
public class ResultsWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultsWriter.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Clock clock;

    @Autowired
    public ResultsWriter() {
        this(Clock.systemDefaultZone());
    }

    ResultsWriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Default output file name for a run started now.
     */
    public Path defaultOutputFile() {
        return Path.of("cratemind_classifications_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".json");
    }

    /**
     * @param outputFile target file, or null for {@link #defaultOutputFile()}
     * @return the path written
     */
    public Path write(List<ClassifiedTrack> tracks, ClassificationSummary summary, String provider,
                      int batchSize, Path outputFile) {
        Path target = outputFile != null ? outputFile : defaultOutputFile();

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("timestamp", LocalDateTime.now(clock).toString());
        metadata.put("total_tracks", tracks.size());
        metadata.put("llm_provider", provider);
        metadata.put("batch_size", batchSize);

        var document = new LinkedHashMap<String, Object>();
        document.put("metadata", metadata);
        document.put("summary", summaryNode(summary));
        document.put("tracks", tracks);

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write results to " + target, e);
        }
        log.info("Results saved to {}", target);
        return target;
    }

    static Map<String, Object> summaryNode(ClassificationSummary summary) {
        var node = new LinkedHashMap<String, Object>();
        node.put("total_tracks", summary.totalTracks());
        node.put("categories", summary.countsByLabel());
        node.put("unclassified", summary.unclassified());
        node.put("success_rate", summary.successRate());
        return node;
    }
}
