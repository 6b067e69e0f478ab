package com.eainde.langextract.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CharIntervalTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject a negative start")
        void negativeStart() {
            assertThatThrownBy(() -> new CharInterval(-1, 3))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("negative");
        }

        @Test
        @DisplayName("should reject an end before the start")
        void endBeforeStart() {
            assertThatThrownBy(() -> new CharInterval(5, 4))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should allow the empty interval used for unanchored extractions")
        void emptyInterval() {
            assertThat(CharInterval.EMPTY.isEmpty()).isTrue();
            assertThat(CharInterval.EMPTY.length()).isZero();
            assertThat(CharInterval.EMPTY).hasToString("[0:0)");
        }
    }

    @Nested
    @DisplayName("Overlap arithmetic")
    class Overlap {

        @Test
        @DisplayName("half-open intervals that only touch do not overlap")
        void touchingIntervals() {
            assertThat(CharInterval.of(0, 5).overlaps(CharInterval.of(5, 9))).isFalse();
        }

        @Test
        @DisplayName("should overlap when max(start) < min(end)")
        void overlapping() {
            CharInterval a = CharInterval.of(0, 6);
            CharInterval b = CharInterval.of(5, 9);
            assertThat(a.overlaps(b)).isTrue();
            assertThat(b.overlaps(a)).isTrue();
            assertThat(a.intersection(b)).contains(CharInterval.of(5, 6));
            assertThat(a.union(b)).isEqualTo(CharInterval.of(0, 9));
        }

        @Test
        @DisplayName("intersection of disjoint intervals is empty")
        void disjointIntersection() {
            assertThat(CharInterval.of(0, 2).intersection(CharInterval.of(3, 4))).isEmpty();
        }

        @Test
        @DisplayName("contains is inclusive at start and exclusive at end")
        void contains() {
            CharInterval interval = CharInterval.of(2, 4);
            assertThat(interval.contains(2)).isTrue();
            assertThat(interval.contains(3)).isTrue();
            assertThat(interval.contains(4)).isFalse();
        }

        @Test
        @DisplayName("fitsWithin checks the end against the text length")
        void fitsWithin() {
            assertThat(CharInterval.of(2, 10).fitsWithin(10)).isTrue();
            assertThat(CharInterval.of(2, 11).fitsWithin(10)).isFalse();
        }
    }
}
