package com.cratemind.core.classify;

import com.cratemind.core.model.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts per-track predictions from a backend reply.
 * <p>
 * The reply is expected to hold lines of the form {@code Track 3: **House**}, but
 * nothing enforces that, so parsing never fails: labels are matched leniently,
 * track numbers outside the batch are ignored, and anything unresolvable is left
 * as {@code null}.
 */
public final class ResponseParser {

    static final Pattern PREDICTION = Pattern.compile(
            "Track\\s+(\\d+):\\s*\\*\\*([^*]+)\\*\\*", Pattern.CASE_INSENSITIVE);

    private ResponseParser() {}

    /**
     * Parses a reply for a batch of {@code trackCount} tracks.
     *
     * @return a list of exactly {@code trackCount} entries, positionally aligned
     *         with the batch; an entry is null when its track was not resolved
     */
    public static List<Category> parse(String reply, int trackCount) {
        Map<Integer, Category> byTrackNumber = new HashMap<>();
        if (reply != null) {
            Matcher matcher = PREDICTION.matcher(reply);
            while (matcher.find()) {
                int trackNumber;
                try {
                    trackNumber = Integer.parseInt(matcher.group(1));
                } catch (NumberFormatException e) {
                    continue;
                }
                resolve(matcher.group(2)).ifPresent(category -> byTrackNumber.put(trackNumber, category));
            }
        }

        List<Category> classifications = new ArrayList<>(trackCount);
        for (int trackNumber = 1; trackNumber <= trackCount; trackNumber++) {
            classifications.add(byTrackNumber.get(trackNumber));
        }
        return Collections.unmodifiableList(classifications);
    }

    /**
     * Maps a raw label to a category: exact match first, then case-insensitive
     * containment in either direction, trying categories in declared order.
     */
    public static Optional<Category> resolve(String rawLabel) {
        String label = rawLabel.trim();
        Optional<Category> exact = Category.fromLabel(label);
        if (exact.isPresent()) {
            return exact;
        }
        String lower = label.toLowerCase(Locale.ROOT);
        for (Category category : Category.values()) {
            String canonical = category.label().toLowerCase(Locale.ROOT);
            if (lower.contains(canonical) || canonical.contains(lower)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public static int countResolved(List<Category> classifications) {
        int resolved = 0;
        for (Category category : classifications) {
            if (category != null) {
                resolved++;
            }
        }
        return resolved;
    }
}
