package io.github.jbellis.smartmatch;

import io.github.jbellis.smartmatch.lexicon.Lexicon;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Tunables of a {@link TextMatcher}. Immutable; use {@link #defaults()}, {@link #load()} or {@link #builder()}.
 */
public final class MatcherConfig {
    private static final Logger logger = LogManager.getLogger(MatcherConfig.class);

    public static final String PROPERTIES_RESOURCE = "/smartmatch.properties";

    public static final String SIMILARITY_THRESHOLD_KEY = "smartmatch.similarity.threshold";
    public static final String BEST_MATCH_THRESHOLD_KEY = "smartmatch.bestMatch.threshold";
    public static final String NORMALIZATION_CACHE_SIZE_KEY = "smartmatch.cache.normalization.maxSize";
    public static final String VARIATION_CACHE_SIZE_KEY = "smartmatch.cache.variation.maxSize";
    public static final String MAX_PASSES_KEY = "smartmatch.normalization.maxPasses";
    public static final String LEXICON_RESOURCE_KEY = "smartmatch.lexicon.resource";

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.70;
    // distinct from DEFAULT_SIMILARITY_THRESHOLD, do not unify
    public static final double DEFAULT_BEST_MATCH_THRESHOLD = 0.60;
    public static final long DEFAULT_NORMALIZATION_CACHE_SIZE = 10_000;
    public static final long DEFAULT_VARIATION_CACHE_SIZE = 2_000;
    public static final int DEFAULT_MAX_PASSES = 4;

    private static final MatcherConfig DEFAULTS = builder().build();

    private final double similarityThreshold;
    private final double bestMatchThreshold;
    private final long normalizationCacheSize;
    private final long variationCacheSize;
    private final int maxNormalizationPasses;
    private final String lexiconResource;

    private MatcherConfig(Builder b) {
        this.similarityThreshold = b.similarityThreshold;
        this.bestMatchThreshold = b.bestMatchThreshold;
        this.normalizationCacheSize = b.normalizationCacheSize;
        this.variationCacheSize = b.variationCacheSize;
        this.maxNormalizationPasses = b.maxNormalizationPasses;
        this.lexiconResource = b.lexiconResource;
    }

    public static MatcherConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@value #PROPERTIES_RESOURCE} from the classpath if present, then applies JVM system
     * properties with the same keys on top.
     */
    public static MatcherConfig load() {
        var props = new Properties();
        try (InputStream in = MatcherConfig.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            logger.warn("Error loading {}: {}", PROPERTIES_RESOURCE, e.getMessage());
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("smartmatch.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(props);
    }

    /**
     * Builds a config from the given properties. Values that cannot be parsed or are out of range
     * are logged and replaced by their defaults.
     */
    public static MatcherConfig fromProperties(Properties props) {
        var b = builder();
        b.similarityThreshold = readThreshold(props, SIMILARITY_THRESHOLD_KEY, DEFAULT_SIMILARITY_THRESHOLD);
        b.bestMatchThreshold = readThreshold(props, BEST_MATCH_THRESHOLD_KEY, DEFAULT_BEST_MATCH_THRESHOLD);
        b.normalizationCacheSize = readLong(props, NORMALIZATION_CACHE_SIZE_KEY, DEFAULT_NORMALIZATION_CACHE_SIZE);
        b.variationCacheSize = readLong(props, VARIATION_CACHE_SIZE_KEY, DEFAULT_VARIATION_CACHE_SIZE);

        long passes = readLong(props, MAX_PASSES_KEY, DEFAULT_MAX_PASSES);
        if (passes < 1 || passes > Integer.MAX_VALUE) {
            logger.warn("Ignoring {}={}: must be at least 1", MAX_PASSES_KEY, passes);
            passes = DEFAULT_MAX_PASSES;
        }
        b.maxNormalizationPasses = (int) passes;

        String resource = props.getProperty(LEXICON_RESOURCE_KEY);
        if (resource != null && !resource.isBlank()) {
            b.lexiconResource = resource.trim();
        }
        return b.build();
    }

    private static double readThreshold(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (parsed < 0.0 || parsed > 1.0 || Double.isNaN(parsed)) {
                logger.warn("Ignoring {}={}: must be between 0 and 1", key, value);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not a number", key, value);
            return defaultValue;
        }
    }

    private static long readLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not an integer", key, value);
            return defaultValue;
        }
    }

    /** Strict lower bound for {@link TextMatcher#isSimilar}. */
    public double similarityThreshold() {
        return similarityThreshold;
    }

    /** Strict lower bound for {@link TextMatcher#findBestMatch} and {@link TextMatcher#rankMatches}. */
    public double bestMatchThreshold() {
        return bestMatchThreshold;
    }

    public long normalizationCacheSize() {
        return normalizationCacheSize;
    }

    public long variationCacheSize() {
        return variationCacheSize;
    }

    public int maxNormalizationPasses() {
        return maxNormalizationPasses;
    }

    public String lexiconResource() {
        return lexiconResource;
    }

    public Builder toBuilder() {
        var b = new Builder();
        b.similarityThreshold = similarityThreshold;
        b.bestMatchThreshold = bestMatchThreshold;
        b.normalizationCacheSize = normalizationCacheSize;
        b.variationCacheSize = variationCacheSize;
        b.maxNormalizationPasses = maxNormalizationPasses;
        b.lexiconResource = lexiconResource;
        return b;
    }

    @Override
    public String toString() {
        return "MatcherConfig{similarityThreshold=%s, bestMatchThreshold=%s, normalizationCacheSize=%d, variationCacheSize=%d, maxNormalizationPasses=%d, lexiconResource=%s}"
                .formatted(similarityThreshold, bestMatchThreshold, normalizationCacheSize, variationCacheSize,
                           maxNormalizationPasses, lexiconResource);
    }

    public static class Builder {
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private double bestMatchThreshold = DEFAULT_BEST_MATCH_THRESHOLD;
        private long normalizationCacheSize = DEFAULT_NORMALIZATION_CACHE_SIZE;
        private long variationCacheSize = DEFAULT_VARIATION_CACHE_SIZE;
        private int maxNormalizationPasses = DEFAULT_MAX_PASSES;
        private String lexiconResource = Lexicon.BUILT_IN_RESOURCE;

        private Builder() {
        }

        public Builder similarityThreshold(double threshold) {
            this.similarityThreshold = checkThreshold("similarityThreshold", threshold);
            return this;
        }

        public Builder bestMatchThreshold(double threshold) {
            this.bestMatchThreshold = checkThreshold("bestMatchThreshold", threshold);
            return this;
        }

        /** Zero or negative means unbounded. */
        public Builder normalizationCacheSize(long maxSize) {
            this.normalizationCacheSize = maxSize;
            return this;
        }

        /** Zero or negative means unbounded. */
        public Builder variationCacheSize(long maxSize) {
            this.variationCacheSize = maxSize;
            return this;
        }

        public Builder maxNormalizationPasses(int passes) {
            if (passes < 1) {
                throw new IllegalArgumentException("maxNormalizationPasses must be at least 1, got " + passes);
            }
            this.maxNormalizationPasses = passes;
            return this;
        }

        public Builder lexiconResource(String resource) {
            if (resource.isBlank()) {
                throw new IllegalArgumentException("lexiconResource must not be blank");
            }
            this.lexiconResource = resource;
            return this;
        }

        private static double checkThreshold(String name, double value) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException("%s must be between 0 and 1, got %s".formatted(name, value));
            }
            return value;
        }

        public MatcherConfig build() {
            return new MatcherConfig(this);
        }
    }
}
