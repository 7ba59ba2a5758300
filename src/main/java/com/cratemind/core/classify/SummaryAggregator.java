package com.cratemind.core.classify;

import com.cratemind.core.model.Category;
import com.cratemind.core.model.ClassificationSummary;
import com.cratemind.core.model.ClassifiedTrack;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tallies classified tracks into a {@link ClassificationSummary}.
 */
public final class SummaryAggregator {

    private SummaryAggregator() {}

    public static ClassificationSummary summarize(List<ClassifiedTrack> tracks) {
        if (tracks.isEmpty()) {
            return ClassificationSummary.empty();
        }
        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        int unclassified = 0;
        for (ClassifiedTrack track : tracks) {
            Category category = track.classification();
            if (category != null) {
                counts.merge(category, 1, Integer::sum);
            } else {
                unclassified++;
            }
        }
        int total = tracks.size();
        return new ClassificationSummary(total, counts, unclassified, (double) (total - unclassified) / total);
    }
}
