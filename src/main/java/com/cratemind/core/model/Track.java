package com.cratemind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.io.Serializable;
import java.util.List;

/**
 * A deduplicated, enriched track as delivered by the catalog.
 * Treated as read-only: classification produces a {@link ClassifiedTrack} instead.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Track(
        String id,
        String name,
        List<String> artists,
        List<String> genres,
        AudioFeatures audioFeatures,
        String album,
        String externalUrl,
        String source
) implements Serializable {

    public Track {
        artists = artists == null ? List.of() : List.copyOf(artists);
        genres = genres == null ? List.of() : List.copyOf(genres);
        audioFeatures = audioFeatures == null ? AudioFeatures.empty() : audioFeatures;
    }

    public Track(String id, String name, List<String> artists, List<String> genres, AudioFeatures audioFeatures) {
        this(id, name, artists, genres, audioFeatures, null, null, null);
    }

    public ClassifiedTrack classifiedAs(Category classification) {
        return new ClassifiedTrack(this, classification);
    }
}
