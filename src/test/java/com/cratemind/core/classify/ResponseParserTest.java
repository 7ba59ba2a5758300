package com.cratemind.core.classify;

import com.cratemind.core.model.Category;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.cratemind.core.model.Category.*;
import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("well-formed reply maps every track in order")
        void wellFormed() {
            String reply = """
                    Track 1: **Dance Pop**
                    Track 2: **House**
                    Track 3: **Bass**""";

            assertEquals(List.of(DANCE_POP, HOUSE, BASS), ResponseParser.parse(reply, 3));
        }

        @Test
        @DisplayName("fewer predictions than tracks leaves the remainder null")
        void partialReply() {
            String reply = "Track 1: **House**\nTrack 2: **Bass**";

            List<Category> result = ResponseParser.parse(reply, 4);

            assertEquals(Arrays.asList(HOUSE, BASS, null, null), result);
            assertEquals(2, ResponseParser.countResolved(result));
        }

        @Test
        @DisplayName("unknown category yields null at that position")
        void unknownCategory() {
            String reply = """
                    Track 1: **Dance Pop**
                    Track 2: **Invalid Category**
                    Track 3: **House**""";

            assertEquals(Arrays.asList(DANCE_POP, null, HOUSE), ResponseParser.parse(reply, 3));
        }

        @Test
        @DisplayName("fuzzy labels resolve by case-insensitive containment")
        void fuzzyLabels() {
            String reply = """
                    Track 1: **dance pop**
                    Track 2: **HOUSE**
                    Track 3: **bass music**""";

            assertEquals(List.of(DANCE_POP, HOUSE, BASS), ResponseParser.parse(reply, 3));
        }

        @Test
        @DisplayName("the word Track is matched case-insensitively and spacing is tolerated")
        void tolerantFormatting() {
            String reply = "TRACK 1:**House**\ntrack   2:   ** Bass **";

            assertEquals(List.of(HOUSE, BASS), ResponseParser.parse(reply, 2));
        }

        @Test
        @DisplayName("predictions are keyed by track number, not by line order")
        void outOfOrder() {
            String reply = "Track 2: **Bass**\nTrack 1: **House**";

            assertEquals(List.of(HOUSE, BASS), ResponseParser.parse(reply, 2));
        }

        @Test
        @DisplayName("track numbers outside the batch are ignored")
        void outOfRange() {
            String reply = "Track 0: **House**\nTrack 1: **Bass**\nTrack 7: **House**";

            assertEquals(Arrays.asList(BASS, null), ResponseParser.parse(reply, 2));
        }

        @Test
        @DisplayName("a later prediction for the same track wins")
        void duplicatesLaterWins() {
            String reply = "Track 1: **House**\nTrack 1: **Bass**";

            assertEquals(List.of(BASS), ResponseParser.parse(reply, 1));
        }

        @Test
        @DisplayName("an unresolvable later prediction does not erase an earlier one")
        void duplicateUnresolvedKeepsEarlier() {
            String reply = "Track 1: **House**\nTrack 1: **Polka**";

            assertEquals(List.of(HOUSE), ResponseParser.parse(reply, 1));
        }

        @Test
        @DisplayName("surrounding chatter is ignored")
        void chatter() {
            String reply = """
                    Sure! Here are the predictions:

                    Track 1: **House** (strong 4/4 groove)
                    Track 2: **Dance Pop**

                    Let me know if you need anything else.""";

            assertEquals(List.of(HOUSE, DANCE_POP), ResponseParser.parse(reply, 2));
        }

        @Test
        @DisplayName("reply without predictions yields all nulls and never throws")
        void garbage() {
            assertEquals(Arrays.asList(null, null, null), ResponseParser.parse("I cannot help with that.", 3));
            assertEquals(Arrays.asList(null, null), ResponseParser.parse("", 2));
            assertEquals(Arrays.asList((Category) null), ResponseParser.parse(null, 1));
        }

        @Test
        @DisplayName("track numbers too large for an int are skipped")
        void hugeTrackNumber() {
            String reply = "Track 99999999999999999999: **House**\nTrack 1: **Bass**";

            assertEquals(List.of(BASS), ResponseParser.parse(reply, 1));
        }

        @Test
        @DisplayName("result always has the requested length")
        void alignedLength() {
            assertEquals(25, ResponseParser.parse(Tracks.reply(30, "House"), 25).size());
            assertEquals(0, ResponseParser.parse(Tracks.reply(3, "House"), 0).size());
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("exact label after trimming")
        void exact() {
            assertEquals(Optional.of(HOUSE), ResponseParser.resolve("  House "));
        }

        @Test
        @DisplayName("canonical label contained in longer text")
        void canonicalInText() {
            assertEquals(Optional.of(BASS), ResponseParser.resolve("bass music"));
            assertEquals(Optional.of(HOUSE), ResponseParser.resolve("Deep House"));
        }

        @Test
        @DisplayName("text contained in canonical label")
        void textInCanonical() {
            assertEquals(Optional.of(DANCE_POP), ResponseParser.resolve("pop"));
        }

        @Test
        @DisplayName("first category in declared order wins when several match")
        void declaredOrderWins() {
            assertEquals(Optional.of(DANCE_POP), ResponseParser.resolve("Dance Pop / House / Bass"));
            assertEquals(Optional.of(HOUSE), ResponseParser.resolve("bass house"));
        }

        @Test
        @DisplayName("no match yields empty")
        void noMatch() {
            assertEquals(Optional.empty(), ResponseParser.resolve("Techno"));
        }
    }
}
