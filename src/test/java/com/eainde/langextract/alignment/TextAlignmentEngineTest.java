package com.eainde.langextract.alignment;

import com.eainde.langextract.RequestContext;
import com.eainde.langextract.document.CharInterval;
import com.eainde.langextract.extraction.AlignmentStatus;
import com.eainde.langextract.extraction.Extraction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextAlignmentEngineTest {

    private static final String SOURCE = "John Smith works at Google Inc.";

    private final TextAlignmentEngine engine = new TextAlignmentEngine();
    private final AlignmentOptions defaults = AlignmentOptions.defaults();

    // =========================================================================
    //  Exact and normalized matching
    // =========================================================================

    @Nested
    @DisplayName("Exact and normalized matches")
    class ExactAndNormalized {

        @Test
        @DisplayName("should align \"Google Inc.\" exactly at [20,31)")
        void exactScenario() {
            AlignmentResult result = engine.alignExtraction("Google Inc.", SOURCE, defaults);

            assertThat(result.interval()).isEqualTo(CharInterval.of(20, 31));
            assertThat(result.status()).isEqualTo(AlignmentStatus.EXACT);
            assertThat(result.quality()).isEqualTo(100);
            assertThat(result.alignedText()).isEqualTo("Google Inc.");
            assertThat(result.method()).isEqualTo("exact");
        }

        @ParameterizedTest(name = "\"{0}\" round-trips")
        @CsvSource({"John", "Smith works", "at Google", "Inc.", "n"})
        @DisplayName("every exact substring aligns to itself with quality 100")
        void roundTrip(String substring) {
            AlignmentResult result = engine.alignExtraction(substring, SOURCE, defaults);

            assertThat(result.status()).isEqualTo(AlignmentStatus.EXACT);
            assertThat(result.quality()).isEqualTo(100);
            assertThat(SOURCE.substring(result.interval().start(), result.interval().end())).isEqualTo(substring);
        }

        @Test
        @DisplayName("case differences fall back to FUZZY_CASE")
        void caseFold() {
            AlignmentResult result = engine.alignExtraction("google inc.", SOURCE, defaults);

            assertThat(result.status()).isEqualTo(AlignmentStatus.FUZZY_CASE);
            assertThat(result.quality()).isEqualTo(85);
            assertThat(result.interval()).isEqualTo(CharInterval.of(20, 31));
        }

        @Test
        @DisplayName("whitespace differences map back to the original span")
        void whitespace() {
            String source = "John   Smith\n works at Google";

            AlignmentResult result = engine.alignExtraction("John Smith works", source, defaults);

            assertThat(result.status()).isEqualTo(AlignmentStatus.FUZZY_WHITESPACE);
            assertThat(result.quality()).isEqualTo(70);
            assertThat(result.alignedText()).isEqualTo("John   Smith\n works");
        }

        @Test
        @DisplayName("punctuation is only ignored when enabled")
        void punctuation() {
            String source = "Contact: Smith, John (CEO).";
            AlignmentOptions noApproximate = defaults.toBuilder().maxDistance(0).build();

            assertThat(engine.alignExtraction("Smith John CEO", source, noApproximate).status())
                    .isEqualTo(AlignmentStatus.NONE);

            AlignmentResult result = engine.alignExtraction("Smith John CEO", source,
                    noApproximate.toBuilder().ignorePunctuation(true).build());
            assertThat(result.status()).isEqualTo(AlignmentStatus.FUZZY_WHITESPACE);
            assertThat(result.quality()).isEqualTo(55);
            assertThat(result.alignedText()).isEqualTo("Smith, John (CEO");

            Extraction extraction = new Extraction("PERSON", "Smith John CEO");
            extraction.setCharInterval(result.interval());
            extraction.setAlignmentStatus(result.status());
            extraction.setAlignmentQuality(result.quality());
            assertThat(result.status().isWellGrounded()).isTrue();
            assertThat(extraction.isWellGrounded()).isFalse();
        }

        @Test
        @DisplayName("position hint picks the nearest occurrence")
        void hintPicksNearest() {
            String source = "Apple sells apples. Apple is big. Apple again.";

            AlignmentResult noHint = engine.alignExtraction("Apple", source, defaults);
            AlignmentResult hinted = engine.alignExtraction("Apple", source, defaults, 30, RequestContext.background());

            assertThat(noHint.interval().start()).isZero();
            assertThat(hinted.interval().start()).isEqualTo(34);
        }
    }

    // =========================================================================
    //  Approximate matching
    // =========================================================================

    @Nested
    @DisplayName("Approximate matches")
    class Approximate {

        @Test
        @DisplayName("a one-edit typo is found with a distance-based quality")
        void typo() {
            AlignmentResult result = engine.alignExtraction("Google Inc.", "John Smith works at Gogle Inc.", defaults);

            assertThat(result.status()).isEqualTo(AlignmentStatus.FUZZY_APPROXIMATE);
            assertThat(result.editDistance()).isEqualTo(1);
            assertThat(result.quality()).isEqualTo(91);
            assertThat(result.alignedText()).isEqualTo("Gogle Inc.");
        }

        @Test
        @DisplayName("matches below the minimum confidence are rejected")
        void belowMinConfidence() {
            AlignmentOptions strict = defaults.toBuilder().minConfidence(0.95).build();

            AlignmentResult result = engine.alignExtraction("Google Inc.", "John Smith works at Gogle Inc.", strict);

            assertThat(result.status()).isEqualTo(AlignmentStatus.NONE);
        }

        @Test
        @DisplayName("raising the edit budget never lowers the best quality")
        void monotonic() {
            String source = "The quarterly report was filed by Jonathan Smyth yesterday.";
            int previous = -1;
            for (int distance = 0; distance <= 6; distance++) {
                AlignmentOptions options = defaults.toBuilder().maxDistance(distance).minConfidence(0.0).build();
                int quality = engine.alignExtraction("Jonathon Smith", source, options).quality();
                assertThat(quality).as("maxDistance=%d", distance).isGreaterThanOrEqualTo(previous);
                previous = quality;
            }
        }
    }

    // =========================================================================
    //  Totality, batch and validation
    // =========================================================================

    @Nested
    @DisplayName("Totality and batch alignment")
    class TotalityAndBatch {

        @Test
        @DisplayName("no match returns NONE with the [0,0) interval")
        void noMatch() {
            AlignmentResult result = engine.alignExtraction("Microsoft", SOURCE, defaults);

            assertThat(result.status()).isEqualTo(AlignmentStatus.NONE);
            assertThat(result.interval()).isEqualTo(CharInterval.EMPTY);
            assertThat(result.quality()).isZero();
            assertThat(result.isMatched()).isFalse();
        }

        @Test
        @DisplayName("null and empty inputs never throw")
        void degenerateInputs() {
            assertThat(engine.alignExtraction(null, SOURCE, defaults).status()).isEqualTo(AlignmentStatus.NONE);
            assertThat(engine.alignExtraction("", SOURCE, defaults).status()).isEqualTo(AlignmentStatus.NONE);
            assertThat(engine.alignExtraction("John", null, defaults).status()).isEqualTo(AlignmentStatus.NONE);
            assertThat(engine.alignExtraction("John", "", defaults).interval()).isEqualTo(CharInterval.EMPTY);
        }

        @Test
        @DisplayName("a cancelled context ends the search as timed out")
        void cancelledContext() {
            RequestContext context = RequestContext.background();
            context.cancel();

            AlignmentResult result = engine.alignExtraction("John", SOURCE, defaults, null, context);

            assertThat(result.status()).isEqualTo(AlignmentStatus.NONE);
            assertThat(result.timedOut()).isTrue();
        }

        @Test
        @DisplayName("batch alignment uses the previous match as the hint for the next")
        void batchUsesHints() {
            String source = "Smith met Jones. Later, Smith called Jones again.";

            List<AlignmentResult> results = engine.alignExtractions(
                    List.of("Smith", "called", "Jones"), source, defaults, RequestContext.background());

            assertThat(results).extracting(r -> r.interval().start()).containsExactly(0, 30, 37);
        }

        @Test
        @DisplayName("findBestAlignment keeps the highest-quality strategy")
        void findBest() {
            AlignmentResult result = engine.findBestAlignment("Google Inc.", SOURCE, defaults);

            assertThat(result.status()).isEqualTo(AlignmentStatus.EXACT);
            assertThat(result.attemptedMethods()).contains("exact", "fuzzy_case", "approximate");
        }

        @Test
        @DisplayName("validateAlignment scores the text under the interval")
        void validate() {
            assertThat(engine.validateAlignment("Google Inc.", SOURCE, CharInterval.of(20, 31))).isEqualTo(1.0);
            assertThat(engine.validateAlignment("google inc.", SOURCE, CharInterval.of(20, 31))).isEqualTo(1.0);
            assertThat(engine.validateAlignment("Google Inc.", SOURCE, CharInterval.of(0, 10))).isLessThan(0.5);
            assertThatThrownBy(() -> engine.validateAlignment("x", SOURCE, CharInterval.of(0, 99)))
                    .isInstanceOf(AlignmentException.class);
        }
    }

    @Test
    @DisplayName("options reject out-of-range values")
    void optionsValidation() {
        assertThatThrownBy(() -> AlignmentOptions.builder().minConfidence(1.5).build())
                .isInstanceOf(AlignmentException.class);
        assertThatThrownBy(() -> AlignmentOptions.builder().maxDistance(-1).build())
                .isInstanceOf(AlignmentException.class);
        assertThatThrownBy(() -> AlignmentOptions.builder().timeoutMs(0).build())
                .isInstanceOf(AlignmentException.class);
    }
}
