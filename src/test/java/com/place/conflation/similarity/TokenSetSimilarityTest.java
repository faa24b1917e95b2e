package com.place.conflation.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class TokenSetSimilarityTest {

    private final TokenSetSimilarity similarity = new TokenSetSimilarity();

    @Test
    @DisplayName("Identical strings should score 100")
    void testIdentical() {
        assertEquals(100.0, similarity.score("tony s pizzeria", "tony s pizzeria"));
    }

    @Test
    @DisplayName("Token order should not matter")
    void testOrderIndependent() {
        assertEquals(100.0, similarity.score("main st 12", "12 main st"));
    }

    @Test
    @DisplayName("A token subset should score 100")
    void testSubset() {
        assertEquals(100.0, similarity.score("green garden cafe", "green garden cafe portland"));
    }

    @Test
    @DisplayName("Disjoint or empty inputs should score 0")
    void testNoOverlap() {
        assertEquals(0.0, similarity.score("abc", "xyz"));
        assertEquals(0.0, similarity.score("", "xyz"));
        assertEquals(0.0, similarity.score(null, "xyz"));
    }

    @ParameterizedTest
    @DisplayName("Should score partially overlapping token sets")
    @CsvSource({
            "tony s pizzeria,tonys pizzeria,89.655",
            "sushi zen,sushi palace,71.429",
            "45 oak ave portland or 97201,45 oak avenue portland or 97201,94.915"
    })
    void testPartialOverlap(String a, String b, double expected) {
        assertEquals(expected, similarity.score(a, b), 0.001);
        assertEquals(expected, similarity.score(b, a), 0.001);
    }

    @Test
    @DisplayName("Indel ratio should follow 2 * LCS / total length")
    void testRatio() {
        assertEquals(100.0, TokenSetSimilarity.ratio("", ""));
        assertEquals(50.0, TokenSetSimilarity.ratio("ab", "cb"), 0.001);
        assertEquals("TokenSet", similarity.getName());
    }
}
