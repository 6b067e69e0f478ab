package com.eainde.langextract.alignment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EditDistanceTest {

    @ParameterizedTest(name = "d({0}, {1}) = {2}")
    @CsvSource({
            "kitten, sitting, 3",
            "google, gogle, 1",
            "abc, abc, 0",
            "'', abc, 3",
            "flaw, lawn, 2"
    })
    @DisplayName("levenshtein computes unit-cost distances")
    void levenshtein(String a, String b, int expected) {
        assertThat(EditDistance.levenshtein(a, b)).isEqualTo(expected);
        assertThat(EditDistance.levenshtein(b, a)).isEqualTo(expected);
    }

    @Test
    @DisplayName("search reports the substring that matches with the fewest edits")
    void searchFindsSubstring() {
        List<AlignmentCandidate> found = new ArrayList<>();

        boolean completed = EditDistance.search("google", "works at gogle now", 0, 18, 1, () -> false, found::add);

        assertThat(completed).isTrue();
        assertThat(found).anySatisfy(c -> {
            assertThat(c.start()).isEqualTo(9);
            assertThat(c.end()).isEqualTo(14);
            assertThat(c.editDistance()).isEqualTo(1);
        });
        assertThat(found).allSatisfy(c -> assertThat(c.editDistance()).isLessThanOrEqualTo(1));
    }

    @Test
    @DisplayName("search honours the stop signal")
    void searchStops() {
        List<AlignmentCandidate> found = new ArrayList<>();

        boolean completed = EditDistance.search("abc", "xxabcxx", 0, 7, 0, () -> true, found::add);

        assertThat(completed).isFalse();
        assertThat(found).isEmpty();
    }

    @Test
    @DisplayName("search stays inside the requested window")
    void searchWindow() {
        List<AlignmentCandidate> found = new ArrayList<>();

        EditDistance.search("abc", "abc---abc", 3, 9, 0, () -> false, found::add);

        assertThat(found).extracting(AlignmentCandidate::start).containsExactly(6);
    }
}
