package com.cratemind.export;

import com.cratemind.core.model.Category;
import com.cratemind.core.model.ClassifiedTrack;
import com.cratemind.core.model.Track;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groups classified tracks by crate and writes one plain-text playlist per crate.
 */
@Component
public class PlaylistExporter {

    private static final Logger log = LoggerFactory.getLogger(PlaylistExporter.class);

    public static final String UNCLASSIFIED = "Unclassified";
    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    @Autowired
    public PlaylistExporter() {
        this(Clock.systemDefaultZone());
    }

    PlaylistExporter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Groups tracks by label: the categories in declared order, then
     * {@value #UNCLASSIFIED}. Every group is present, possibly empty.
     */
    public Map<String, List<ClassifiedTrack>> categorize(List<ClassifiedTrack> tracks) {
        Map<String, List<ClassifiedTrack>> groups = new LinkedHashMap<>();
        for (Category category : Category.values()) {
            groups.put(category.label(), new ArrayList<>());
        }
        groups.put(UNCLASSIFIED, new ArrayList<>());

        for (ClassifiedTrack track : tracks) {
            String key = track.isClassified() ? track.classification().label() : UNCLASSIFIED;
            groups.get(key).add(track);
        }
        return groups;
    }

    /**
     * Writes a playlist file for every non-empty group into {@code outputDir}.
     *
     * @return the files created, in group order
     */
    public List<Path> export(Map<String, List<ClassifiedTrack>> groups, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create playlist directory " + outputDir, e);
        }
        String generatedAt = LocalDateTime.now(clock).format(GENERATED_AT);
        List<Path> created = new ArrayList<>();
        for (var entry : groups.entrySet()) {
            List<ClassifiedTrack> tracks = entry.getValue();
            if (tracks.isEmpty()) {
                continue;
            }
            Path file = outputDir.resolve(fileName(entry.getKey()));
            try {
                Files.writeString(file, render(entry.getKey(), tracks, generatedAt));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write playlist " + file, e);
            }
            created.add(file);
            log.info("Created {} playlist: {} ({} tracks)", entry.getKey(), file, tracks.size());
        }
        return created;
    }

    static String fileName(String label) {
        return label.toLowerCase(Locale.ROOT).replace(' ', '_') + "_playlist.txt";
    }

    static String render(String label, List<ClassifiedTrack> tracks, String generatedAt) {
        var sb = new StringBuilder();
        sb.append("# ").append(label).append(" Playlist\n");
        sb.append("# Generated on ").append(generatedAt).append('\n');
        sb.append("# ").append(tracks.size()).append(" tracks\n\n");
        for (ClassifiedTrack classified : tracks) {
            Track track = classified.track();
            String artists = track.artists().isEmpty() ? "Unknown" : String.join(", ", track.artists());
            sb.append(track.name() != null ? track.name() : "Unknown").append(" - ").append(artists).append('\n');
            if (track.externalUrl() != null && !track.externalUrl().isBlank()) {
                sb.append("  ").append(track.externalUrl()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
