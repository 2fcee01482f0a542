package com.jsearch.query;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class EditDistanceTest {
    @ParameterizedTest
    @CsvSource({
        "godfather, godfather, 0",
        "godfahter, godfather, 1",
        "knight, night, 1",
        "matrix, matrxi, 1",
        "star, stars, 1",
        "heat, beat, 1",
        "club, clue, 1",
        "inception, deception, 2",
        "ab, ba, 1",
        "abc, ca, 3"
    })
    void shouldComputeOptimalStringAlignmentDistance(String a, String b, int expected) {
        assertThat(EditDistance.distance(a, b)).isEqualTo(expected);
        assertThat(EditDistance.distance(b, a)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "godfahter, godfather, 1, true",
        "gump, forrest, 2, false",
        "inception, deception, 1, false",
        "héros, heros, 1, true"
    })
    void shouldBoundDistance(String a, String b, int maxEdits, boolean expected) {
        assertThat(EditDistance.withinDistance(a, b, maxEdits)).isEqualTo(expected);
    }
}
