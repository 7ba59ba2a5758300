package com.cratemind.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The three crates a track can be sorted into. Declaration order is significant:
 * fuzzy label recovery tries categories in this order and takes the first match.
 */
public enum Category {

    DANCE_POP("Dance Pop"),
    HOUSE("House"),
    BASS("Bass");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Exact, case-sensitive lookup by display label.
     */
    public static Optional<Category> fromLabel(String label) {
        for (Category category : values()) {
            if (category.label.equals(label)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
