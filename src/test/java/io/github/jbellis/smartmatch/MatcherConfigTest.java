package io.github.jbellis.smartmatch;

import io.github.jbellis.smartmatch.lexicon.Lexicon;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MatcherConfigTest {

    @Test
    void defaults() {
        var config = MatcherConfig.defaults();
        assertEquals(0.70, config.similarityThreshold());
        assertEquals(0.60, config.bestMatchThreshold());
        assertEquals(10_000, config.normalizationCacheSize());
        assertEquals(2_000, config.variationCacheSize());
        assertEquals(4, config.maxNormalizationPasses());
        assertEquals(Lexicon.BUILT_IN_RESOURCE, config.lexiconResource());
    }

    @Test
    void bundledPropertiesMatchDefaults() {
        var loaded = MatcherConfig.load();
        assertEquals(MatcherConfig.defaults().toString(), loaded.toString());
    }

    @Test
    void systemPropertiesOverrideBundledFile() {
        System.setProperty(MatcherConfig.SIMILARITY_THRESHOLD_KEY, "0.8");
        try {
            var loaded = MatcherConfig.load();
            assertEquals(0.8, loaded.similarityThreshold());
            assertEquals(0.60, loaded.bestMatchThreshold());
        } finally {
            System.clearProperty(MatcherConfig.SIMILARITY_THRESHOLD_KEY);
        }
    }

    @Test
    void fromProperties() {
        var props = new Properties();
        props.setProperty(MatcherConfig.SIMILARITY_THRESHOLD_KEY, " 0.75 ");
        props.setProperty(MatcherConfig.BEST_MATCH_THRESHOLD_KEY, "0.5");
        props.setProperty(MatcherConfig.NORMALIZATION_CACHE_SIZE_KEY, "0");
        props.setProperty(MatcherConfig.VARIATION_CACHE_SIZE_KEY, "50");
        props.setProperty(MatcherConfig.MAX_PASSES_KEY, "2");
        props.setProperty(MatcherConfig.LEXICON_RESOURCE_KEY, "/smartmatch/test-lexicon.json");

        var config = MatcherConfig.fromProperties(props);

        assertEquals(0.75, config.similarityThreshold());
        assertEquals(0.5, config.bestMatchThreshold());
        assertEquals(0, config.normalizationCacheSize());
        assertEquals(50, config.variationCacheSize());
        assertEquals(2, config.maxNormalizationPasses());
        assertEquals("/smartmatch/test-lexicon.json", config.lexiconResource());
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "1.5", "-0.1", "NaN"})
    void badThresholdFallsBackToDefault(String value) {
        var props = new Properties();
        props.setProperty(MatcherConfig.SIMILARITY_THRESHOLD_KEY, value);
        assertEquals(MatcherConfig.DEFAULT_SIMILARITY_THRESHOLD, MatcherConfig.fromProperties(props).similarityThreshold());
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-3", "four"})
    void badPassCountFallsBackToDefault(String value) {
        var props = new Properties();
        props.setProperty(MatcherConfig.MAX_PASSES_KEY, value);
        assertEquals(MatcherConfig.DEFAULT_MAX_PASSES, MatcherConfig.fromProperties(props).maxNormalizationPasses());
    }

    @Test
    void builderRejectsInvalidValues() {
        var builder = MatcherConfig.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.similarityThreshold(1.01));
        assertThrows(IllegalArgumentException.class, () -> builder.bestMatchThreshold(-0.01));
        assertThrows(IllegalArgumentException.class, () -> builder.bestMatchThreshold(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> builder.maxNormalizationPasses(0));
        assertThrows(IllegalArgumentException.class, () -> builder.lexiconResource(" "));
    }

    @Test
    void toBuilderCopiesEverySetting() {
        var config = MatcherConfig.builder()
                .similarityThreshold(0.8)
                .bestMatchThreshold(0.65)
                .normalizationCacheSize(5)
                .variationCacheSize(6)
                .maxNormalizationPasses(3)
                .lexiconResource("/smartmatch/test-lexicon.json")
                .build();

        var copy = config.toBuilder().build();
        assertEquals(config.toString(), copy.toString());

        var changed = config.toBuilder().similarityThreshold(0.9).build();
        assertEquals(0.9, changed.similarityThreshold());
        assertEquals(0.65, changed.bestMatchThreshold());
    }
}
