package io.github.jbellis.smartmatch;

import io.github.jbellis.smartmatch.cache.CacheStats;
import io.github.jbellis.smartmatch.cache.MatchCaches;
import io.github.jbellis.smartmatch.lexicon.Lexicon;
import io.github.jbellis.smartmatch.query.ProcessedQuery;
import io.github.jbellis.smartmatch.query.QueryProcessor;
import io.github.jbellis.smartmatch.query.RelevanceScorer;
import io.github.jbellis.smartmatch.similarity.ScoredMatch;
import io.github.jbellis.smartmatch.similarity.SimilarityEngine;
import io.github.jbellis.smartmatch.text.TextNormalizer;
import io.github.jbellis.smartmatch.text.VariationGenerator;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * Typo-, accent- and spelling-variant-tolerant matching for food search.
 * <p>
 * Every operation is a pure, synchronous computation over in-memory strings and never throws for
 * any input; "no match" is reported as {@code false}, {@code null} or an empty list. A matcher
 * owns its caches and may be shared between threads.
 *
 * <pre>{@code
 * var matcher = new TextMatcher();
 * matcher.isSimilar("burguer", "Burger");                          // true
 * matcher.findBestMatch("piza", List.of("Pizza", "Pasta"));        // "Pizza"
 * matcher.generateVariations("crépe");                             // [krepe, crépe, ..., crepe, crepes]
 * }</pre>
 */
public class TextMatcher {
    private final Lexicon lexicon;
    private final MatcherConfig config;
    private final MatchCaches caches;
    private final TextNormalizer normalizer;
    private final VariationGenerator variationGenerator;
    private final SimilarityEngine similarityEngine;
    private final QueryProcessor queryProcessor;

    /**
     * A matcher configured by {@link MatcherConfig#load()} over the lexicon it names.
     */
    public TextMatcher() {
        this(MatcherConfig.load());
    }

    public TextMatcher(MatcherConfig config) {
        this(Lexicon.BUILT_IN_RESOURCE.equals(config.lexiconResource())
             ? Lexicon.builtIn()
             : Lexicon.fromResource(config.lexiconResource()),
             config);
    }

    public TextMatcher(Lexicon lexicon, MatcherConfig config) {
        this.lexicon = lexicon;
        this.config = config;
        this.caches = new MatchCaches(config.normalizationCacheSize(), config.variationCacheSize());
        this.normalizer = new TextNormalizer(lexicon, caches, config.maxNormalizationPasses());
        this.variationGenerator = new VariationGenerator(lexicon, normalizer, caches);
        this.similarityEngine = new SimilarityEngine(normalizer, config.similarityThreshold(), config.bestMatchThreshold());
        this.queryProcessor = new QueryProcessor(lexicon, normalizer);
    }

    /**
     * Canonical form of {@code text}; see {@link TextNormalizer}.
     */
    public String normalize(@Nullable String text) {
        return normalizer.normalize(text);
    }

    /**
     * Spellings of {@code query} worth searching stored data for. Never empty; {@code [""]} for empty input.
     */
    public List<String> generateVariations(@Nullable String query) {
        return variationGenerator.generate(query);
    }

    public boolean isSimilar(@Nullable String a, @Nullable String b) {
        return similarityEngine.isSimilar(a, b);
    }

    public @Nullable String findBestMatch(@Nullable String query, @Nullable Collection<String> candidates) {
        return similarityEngine.findBestMatch(query, candidates);
    }

    public List<ScoredMatch> rankMatches(@Nullable String query, @Nullable Collection<String> candidates) {
        return similarityEngine.rankMatches(query, candidates, 0);
    }

    public List<ScoredMatch> rankMatches(@Nullable String query, @Nullable Collection<String> candidates, int limit) {
        return similarityEngine.rankMatches(query, candidates, limit);
    }

    /**
     * True when some variation of {@code query} is similar to one of {@code fields}, e.g. a menu
     * item's name or description. Null and blank fields are ignored.
     */
    public boolean matches(@Nullable String query, @Nullable String... fields) {
        if (query == null || query.isEmpty() || fields == null) {
            return false;
        }
        for (String variation : generateVariations(query)) {
            for (String field : fields) {
                if (field != null && !field.isBlank() && isSimilar(variation, field)) {
                    return true;
                }
            }
        }
        return false;
    }

    public ProcessedQuery processQuery(@Nullable String rawQuery) {
        return queryProcessor.process(rawQuery, false);
    }

    public ProcessedQuery processQuery(@Nullable String rawQuery, boolean voiceSearch) {
        return queryProcessor.process(rawQuery, voiceSearch);
    }

    /**
     * Coarse relevance of {@code text} to {@code query}; see {@link RelevanceScorer}.
     */
    public double relevance(@Nullable String query, @Nullable String text) {
        return RelevanceScorer.score(query, text);
    }

    /**
     * Empties both the normalization and the variation cache.
     */
    public void clearCache() {
        caches.clear();
    }

    public CacheStats getCacheStats() {
        return caches.stats();
    }

    public Lexicon getLexicon() {
        return lexicon;
    }

    public MatcherConfig getConfig() {
        return config;
    }
}
