package com.cratemind.catalog;

import com.cratemind.core.model.Track;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TrackCatalogReaderTest {

    @TempDir
    Path tempDir;

    private final TrackCatalogReader reader = new TrackCatalogReader();

    private Path catalog(String json) throws IOException {
        Path file = tempDir.resolve("tracks.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    @DisplayName("reads snake_case track records with audio features")
    void readsTracks() throws IOException {
        Path file = catalog("""
                [
                  {
                    "id": "4uLU6hMCjMI75M1A2tKUQC",
                    "name": "One Kiss",
                    "artists": ["Calvin Harris", "Dua Lipa"],
                    "genres": ["dance pop", "edm"],
                    "album": "One Kiss",
                    "external_url": "https://open.spotify.com/track/4uLU6hMCjMI75M1A2tKUQC",
                    "source": "liked_songs",
                    "popularity": 81,
                    "audio_features": {"tempo": 123.9, "energy": 0.86, "danceability": 0.79, "valence": 0.59}
                  }
                ]
                """);

        List<Track> tracks = reader.read(file);

        assertEquals(1, tracks.size());
        Track track = tracks.get(0);
        assertEquals("One Kiss", track.name());
        assertEquals(List.of("Calvin Harris", "Dua Lipa"), track.artists());
        assertEquals("https://open.spotify.com/track/4uLU6hMCjMI75M1A2tKUQC", track.externalUrl());
        assertEquals("liked_songs", track.source());
        assertEquals(Optional.of(123.9), track.audioFeatures().tempo());
        assertEquals(0.59, track.audioFeatures().values().get("valence"));
    }

    @Test
    @DisplayName("missing fields and null audio features are tolerated")
    void sparseRecords() throws IOException {
        Path file = catalog("""
                [{"id": "a", "name": "Bare", "audio_features": null}]
                """);

        Track track = reader.read(file).get(0);

        assertEquals(List.of(), track.artists());
        assertEquals(List.of(), track.genres());
        assertEquals(Optional.empty(), track.audioFeatures().tempo());
    }

    @Test
    @DisplayName("duplicates collapse to the first occurrence and records without id are dropped")
    void deduplicates() throws IOException {
        Path file = catalog("""
                [
                  {"id": "a", "name": "First", "source": "liked_songs"},
                  {"name": "No id"},
                  {"id": "", "name": "Blank id"},
                  {"id": "b", "name": "Second"},
                  {"id": "a", "name": "First again", "source": "playlist"}
                ]
                """);

        List<Track> tracks = reader.read(file);

        assertEquals(List.of("First", "Second"), tracks.stream().map(Track::name).toList());
        assertEquals("liked_songs", tracks.get(0).source());
    }

    @Test
    @DisplayName("an empty array yields no tracks")
    void emptyCatalog() throws IOException {
        assertTrue(reader.read(catalog("[]")).isEmpty());
    }

    @Test
    @DisplayName("a missing file is rejected before parsing")
    void missingFile() {
        var ex = assertThrows(IllegalArgumentException.class,
                () -> reader.read(tempDir.resolve("absent.json")));
        assertTrue(ex.getMessage().startsWith("Track catalog not found"));
    }

    @Test
    @DisplayName("malformed JSON surfaces as UncheckedIOException")
    void malformedJson() throws IOException {
        Path file = catalog("[{\"id\": ");
        assertThrows(UncheckedIOException.class, () -> reader.read(file));
    }

    @Test
    @DisplayName("deduplicate skips null entries")
    void deduplicateSkipsNulls() {
        var track = new Track("x", "X", null, null, null);
        assertEquals(List.of(track), TrackCatalogReader.deduplicate(Arrays.asList(null, track, null)));
    }
}
