package com.cratemind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.io.Serializable;
import java.util.Optional;

/**
 * A track together with the crate it was sorted into.
 * {@code classification} is null when no category could be determined.
 */
public record ClassifiedTrack(
        @JsonUnwrapped Track track,
        @JsonInclude(JsonInclude.Include.ALWAYS) Category classification
) implements Serializable {

    @JsonIgnore
    public boolean isClassified() {
        return classification != null;
    }

    @JsonIgnore
    public Optional<Category> category() {
        return Optional.ofNullable(classification);
    }
}
