package com.cratemind.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TrackTest {

    @Test
    @DisplayName("classifiedAs returns a new value and leaves the track untouched")
    void classifiedAsCopies() {
        var track = new Track("t1", "Song", List.of("A"), List.of("house"), AudioFeatures.of(125, 0.9, 0.8));

        ClassifiedTrack classified = track.classifiedAs(Category.HOUSE);

        assertSame(track, classified.track());
        assertEquals(Category.HOUSE, classified.classification());
        assertTrue(classified.isClassified());
        assertEquals(Optional.of(Category.HOUSE), classified.category());
    }

    @Test
    @DisplayName("null classification means undetermined")
    void unclassified() {
        ClassifiedTrack classified = new Track("t1", "Song", null, null, null).classifiedAs(null);

        assertFalse(classified.isClassified());
        assertEquals(Optional.empty(), classified.category());
    }

    @Test
    @DisplayName("list fields are defensive copies and never null")
    void defensiveCopies() {
        List<String> artists = new ArrayList<>(List.of("A"));
        var track = new Track("t1", "Song", artists, null, null);
        artists.add("B");

        assertEquals(List.of("A"), track.artists());
        assertEquals(List.of(), track.genres());
        assertThrows(UnsupportedOperationException.class, () -> track.artists().add("C"));
        assertTrue(track.audioFeatures().values().isEmpty());
    }

    @Test
    @DisplayName("audio features expose numeric values only and keep extra fields")
    void audioFeatures() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("tempo", 128);
        raw.put("energy", "high");
        raw.put("valence", 0.4);
        var features = new AudioFeatures(raw);

        assertEquals(Optional.of(128.0), features.tempo());
        assertEquals(Optional.empty(), features.energy());
        assertEquals(Optional.empty(), features.danceability());
        assertEquals(0.4, features.values().get("valence"));
    }

    @Test
    @DisplayName("category lookup by label is exact")
    void categoryFromLabel() {
        assertEquals(Optional.of(Category.DANCE_POP), Category.fromLabel("Dance Pop"));
        assertEquals(Optional.empty(), Category.fromLabel("dance pop"));
        assertEquals("Bass", Category.BASS.toString());
    }
}
