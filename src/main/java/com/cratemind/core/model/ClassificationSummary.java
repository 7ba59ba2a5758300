package com.cratemind.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tally of a classification run: per-category counts (all categories present),
 * unclassified count and overall success rate.
 */
public record ClassificationSummary(
        int totalTracks,
        Map<Category, Integer> categories,
        int unclassified,
        double successRate
) implements Serializable {

    public ClassificationSummary {
        var filled = new EnumMap<Category, Integer>(Category.class);
        for (Category category : Category.values()) {
            filled.put(category, categories != null ? categories.getOrDefault(category, 0) : 0);
        }
        categories = Collections.unmodifiableMap(filled);
    }

    public static ClassificationSummary empty() {
        return new ClassificationSummary(0, Map.of(), 0, 0.0);
    }

    public int count(Category category) {
        return categories.get(category);
    }

    public int classified() {
        return totalTracks - unclassified;
    }

    /**
     * Share of all tracks that landed in {@code category}, in percent; 0 for an empty run.
     */
    public double percentage(Category category) {
        return totalTracks > 0 ? count(category) * 100.0 / totalTracks : 0.0;
    }

    /**
     * Category counts keyed by label, in declared category order.
     */
    public Map<String, Integer> countsByLabel() {
        var byLabel = new LinkedHashMap<String, Integer>();
        categories.forEach((category, count) -> byLabel.put(category.label(), count));
        return byLabel;
    }
}
