package io.github.jbellis.smartmatch.query;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class RelevanceScorerTest {

    @ParameterizedTest(name = "''{0}'' in ''{1}'' = {2}")
    @CsvSource({
            "pizza,        Pizza,             1.0",
            "pizza,        Pizza Margherita,  0.8",
            "margherita,   Pizza Margherita,  0.6",
            "spicy pizza,  Pizza Margherita,  0.2",
            "sushi,        Pizza Margherita,  0.0"
    })
    void scoresByMatchKind(String query, String text, double expected) {
        assertEquals(expected, RelevanceScorer.score(query, text), 1e-9);
    }

    @Test
    void emptyOrNullScoresZero() {
        assertEquals(0.0, RelevanceScorer.score("", "pizza"));
        assertEquals(0.0, RelevanceScorer.score("pizza", "  "));
        assertEquals(0.0, RelevanceScorer.score(null, "pizza"));
        assertEquals(0.0, RelevanceScorer.score("pizza", null));
    }
}
