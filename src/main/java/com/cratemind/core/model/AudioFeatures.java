package com.cratemind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Audio analysis attached to a track by the catalog enrichment step.
 * <p>
 * Only tempo, energy and danceability are read by the classifier. Every other
 * field (key, loudness, valence, ...) is carried through untouched so it ends up
 * in the exported results unchanged.
 */
public record AudioFeatures(Map<String, Object> values) implements Serializable {

    public static final String TEMPO = "tempo";
    public static final String ENERGY = "energy";
    public static final String DANCEABILITY = "danceability";

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public AudioFeatures {
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static AudioFeatures empty() {
        return new AudioFeatures(Map.of());
    }

    public static AudioFeatures of(double tempo, double energy, double danceability) {
        var map = new LinkedHashMap<String, Object>();
        map.put(TEMPO, tempo);
        map.put(ENERGY, energy);
        map.put(DANCEABILITY, danceability);
        return new AudioFeatures(map);
    }

    @Override
    @JsonValue
    public Map<String, Object> values() {
        return values;
    }

    public Optional<Double> tempo() {
        return number(TEMPO);
    }

    public Optional<Double> energy() {
        return number(ENERGY);
    }

    public Optional<Double> danceability() {
        return number(DANCEABILITY);
    }

    /**
     * Returns the named feature when it is present and numeric; strings such as
     * "fast" or nulls count as absent.
     */
    public Optional<Double> number(String name) {
        Object value = values.get(name);
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        return Optional.empty();
    }
}
