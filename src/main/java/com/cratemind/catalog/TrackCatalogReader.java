package com.cratemind.catalog;

import com.cratemind.core.model.Track;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads an enriched track catalog from a JSON file (an array of track objects
 * with snake_case keys).
 * <p>
 * Tracks without an id are dropped and duplicates are collapsed by id, keeping
 * the first occurrence, so a track saved both as a liked song and in a playlist
 * is classified once.
 */
@Component
public class TrackCatalogReader {

    private static final Logger log = LoggerFactory.getLogger(TrackCatalogReader.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    public List<Track> read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Track catalog not found: " + file);
        }
        List<Track> raw;
        try {
            raw = objectMapper.readValue(file.toFile(), new TypeReference<List<Track>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read track catalog " + file, e);
        }
        List<Track> tracks = deduplicate(raw != null ? raw : List.of());
        log.info("Loaded {} unique tracks from {} ({} records)", tracks.size(), file, raw != null ? raw.size() : 0);
        return tracks;
    }

    static List<Track> deduplicate(List<Track> tracks) {
        Set<String> seen = new HashSet<>();
        List<Track> unique = new ArrayList<>();
        for (Track track : tracks) {
            if (track == null || track.id() == null || track.id().isBlank()) {
                continue;
            }
            if (seen.add(track.id())) {
                unique.add(track);
            }
        }
        return unique;
    }
}
