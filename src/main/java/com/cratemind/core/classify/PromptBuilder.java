package com.cratemind.core.classify;

import com.cratemind.core.model.AudioFeatures;
import com.cratemind.core.model.Track;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Renders a batch of tracks into a single classification prompt: category
 * descriptions, three worked examples, one numbered block per track and the
 * reply-format instruction.
 * Pure function, no Spring dependencies.
 */
public final class PromptBuilder {

    static final String UNKNOWN = "Unknown";

    static final String HEADER = """
            You are an expert in electronic music categorization, helping DJs classify tracks into broad electronic genres. The available categories are:

            - Dance Pop: melodic, catchy, often vocal-heavy tracks intended for mainstream dance audiences. Think Dua Lipa, Calvin Harris, or remixes of pop hits.
            - House: rhythm-driven tracks with 4/4 beats, consistent grooves, minimal vocals, and strong club energy. Think deep house, tech house, or progressive house.
            - Bass: includes genres like dubstep, trap, future bass, or other subgenres focused on heavy low-end, syncopated beats, or experimental production.

            Categorize each song based on the metadata provided.

            ### Example 1
            Track: "One Kiss"
            Artist: Calvin Harris, Dua Lipa
            Genres: dance pop, pop, EDM
            Tempo: 124 BPM
            Energy: 0.8
            Danceability: 0.85
            Prediction: **Dance Pop**

            ### Example 2
            Track: "Losing It"
            Artist: Fisher
            Genres: tech house, house
            Tempo: 125 BPM
            Energy: 0.9
            Danceability: 0.82
            Prediction: **House**

            ### Example 3
            Track: "Core"
            Artist: RL Grime
            Genres: trap, bass, electronic
            Tempo: 150 BPM
            Energy: 0.95
            Danceability: 0.6
            Prediction: **Bass**
            """;

    static final String FOOTER = """
            Respond with ONLY the predictions in this exact format for each track:
            Track X: **Category**

            Do not include any other text, explanations, or formatting.""";

    private PromptBuilder() {}

    public static String build(List<Track> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a prompt for an empty batch");
        }
        var sb = new StringBuilder(HEADER);
        for (int i = 0; i < batch.size(); i++) {
            sb.append('\n');
            appendTrack(sb, batch.get(i), i + 1);
        }
        sb.append('\n').append(FOOTER);
        return sb.toString();
    }

    static void appendTrack(StringBuilder sb, Track track, int number) {
        AudioFeatures features = track.audioFeatures();
        sb.append("### Track ").append(number).append('\n');
        sb.append("Track: \"").append(track.name() != null ? track.name() : UNKNOWN).append("\"\n");
        sb.append("Artist: ").append(joinOrUnknown(track.artists())).append('\n');
        sb.append("Genres: ").append(joinOrUnknown(track.genres())).append('\n');
        sb.append("Tempo: ").append(formatTempo(features.tempo())).append('\n');
        sb.append("Energy: ").append(formatRatio(features.energy())).append('\n');
        sb.append("Danceability: ").append(formatRatio(features.danceability())).append('\n');
        sb.append("Prediction:\n");
    }

    /**
     * Rounds half-to-even on the exact binary value, so 124.5 renders as 124.
     */
    static String formatTempo(Optional<Double> tempo) {
        return tempo.map(bpm -> (long) Math.rint(bpm) + " BPM").orElse(UNKNOWN);
    }

    /**
     * Two decimals, half-to-even on the exact binary value: 0.145 is stored
     * just below the midpoint and renders as 0.14, 0.125 renders as 0.12.
     */
    static String formatRatio(Optional<Double> value) {
        return value.map(v -> new BigDecimal(v).setScale(2, RoundingMode.HALF_EVEN).toPlainString())
                .orElse(UNKNOWN);
    }

    private static String joinOrUnknown(List<String> values) {
        return values.isEmpty() ? UNKNOWN : String.join(", ", values);
    }
}
