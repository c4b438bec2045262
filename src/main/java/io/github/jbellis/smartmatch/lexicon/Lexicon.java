package io.github.jbellis.smartmatch.lexicon;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.jbellis.smartmatch.util.Json;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * The linguistic tables behind normalization and variation generation: diacritic folding,
 * typo corrections, phonetic simplifications, abbreviations and the food vocabulary, plus the
 * synonym, intent and filler-phrase tables used for query processing.
 * <p>
 * A Lexicon is immutable. The built-in one is read from {@value #BUILT_IN_RESOURCE} the first time
 * {@link #builtIn()} is called; custom lexicons use the same JSON layout.
 */
public final class Lexicon {
    private static final Logger logger = LogManager.getLogger(Lexicon.class);

    public static final String BUILT_IN_RESOURCE = "/smartmatch/lexicon.json";

    private final ImmutableMap<Integer, String> diacritics;
    private final ImmutableMap<String, String> corrections;
    private final ImmutableList<Map.Entry<String, String>> correctionsLongestFirst;
    private final ImmutableMap<String, String> phonetics;
    private final ImmutableList<Map.Entry<String, String>> phoneticsLongestFirst;
    private final ImmutableMap<String, String> abbreviations;
    private final ImmutableList<String> vocabulary;
    private final ImmutableMap<String, ImmutableList<String>> synonyms;
    private final ImmutableMap<String, ImmutableList<String>> intents;
    private final ImmutableList<String> fillerPhrases;

    /**
     * Raw JSON shape of a lexicon file. Missing sections are read as null and treated as empty.
     */
    record LexiconData(@Nullable Map<String, String> diacritics,
                       @Nullable Map<String, String> corrections,
                       @Nullable Map<String, String> phonetics,
                       @Nullable Map<String, String> abbreviations,
                       @Nullable List<String> vocabulary,
                       @Nullable Map<String, List<String>> synonyms,
                       @Nullable Map<String, List<String>> intents,
                       @Nullable List<String> fillerPhrases) {
    }

    private Lexicon(LexiconData data) {
        this.diacritics = toCodePointMap(orEmpty(data.diacritics()));
        this.corrections = copyPatternTable("corrections", orEmpty(data.corrections()));
        this.phonetics = copyPatternTable("phonetics", orEmpty(data.phonetics()));
        this.abbreviations = copyPatternTable("abbreviations", orEmpty(data.abbreviations()));
        this.correctionsLongestFirst = longestFirst(corrections);
        this.phoneticsLongestFirst = longestFirst(phonetics);
        this.vocabulary = data.vocabulary() == null ? ImmutableList.of() : ImmutableList.copyOf(data.vocabulary());
        this.synonyms = copyListTable(data.synonyms());
        this.intents = copyListTable(data.intents());
        this.fillerPhrases = data.fillerPhrases() == null ? ImmutableList.of() : ImmutableList.copyOf(data.fillerPhrases());
    }

    /**
     * Returns the lexicon bundled with the library.
     *
     * @throws LexiconException if the bundled resource is missing or corrupt
     */
    public static Lexicon builtIn() {
        return BuiltInHolder.INSTANCE;
    }

    private static class BuiltInHolder {
        static final Lexicon INSTANCE = fromResource(BUILT_IN_RESOURCE);
    }

    /**
     * Loads a lexicon from a classpath resource.
     *
     * @throws LexiconException if the resource does not exist or is not a valid lexicon
     */
    public static Lexicon fromResource(String resource) {
        try (InputStream in = Lexicon.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new LexiconException("Lexicon resource not found: " + resource);
            }
            var lexicon = new Lexicon(Json.read(in, LexiconData.class));
            logger.info("Loaded lexicon {}: {}", resource, lexicon.describe());
            return lexicon;
        } catch (IOException e) {
            throw new LexiconException("Unable to read lexicon " + resource, e);
        }
    }

    /**
     * Parses a lexicon from a JSON document.
     *
     * @throws LexiconException if the document is not a valid lexicon
     */
    public static Lexicon fromJson(String json) {
        try {
            return new Lexicon(Json.read(json, LexiconData.class));
        } catch (IOException e) {
            throw new LexiconException("Invalid lexicon JSON: " + e.getMessage(), e);
        }
    }

    private static <K, V> Map<K, V> orEmpty(@Nullable Map<K, V> map) {
        return map == null ? Map.of() : map;
    }

    private static ImmutableMap<Integer, String> toCodePointMap(Map<String, String> source) {
        var builder = ImmutableMap.<Integer, String>builder();
        for (var entry : source.entrySet()) {
            String key = entry.getKey();
            if (key.codePointCount(0, key.length()) != 1) {
                throw new LexiconException("Diacritic key must be a single character: '%s'".formatted(key));
            }
            if (entry.getValue() == null) {
                throw new LexiconException("Diacritic '%s' has no replacement".formatted(key));
            }
            builder.put(key.codePointAt(0), entry.getValue());
        }
        return builder.buildOrThrow();
    }

    private static ImmutableMap<String, String> copyPatternTable(String table, Map<String, String> source) {
        var builder = ImmutableMap.<String, String>builder();
        for (var entry : source.entrySet()) {
            if (entry.getKey().isEmpty()) {
                throw new LexiconException("Empty pattern in " + table);
            }
            if (entry.getValue() == null) {
                throw new LexiconException("Pattern '%s' in %s has no replacement".formatted(entry.getKey(), table));
            }
            builder.put(entry.getKey(), entry.getValue());
        }
        return builder.buildOrThrow();
    }

    private static ImmutableMap<String, ImmutableList<String>> copyListTable(@Nullable Map<String, List<String>> source) {
        if (source == null) {
            return ImmutableMap.of();
        }
        var builder = ImmutableMap.<String, ImmutableList<String>>builder();
        source.forEach((key, values) -> builder.put(key, values == null ? ImmutableList.of() : ImmutableList.copyOf(values)));
        return builder.buildOrThrow();
    }

    // stable sort, so equal-length keys keep declaration order
    private static ImmutableList<Map.Entry<String, String>> longestFirst(ImmutableMap<String, String> table) {
        return table.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed())
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Code point to ASCII replacement.
     */
    public ImmutableMap<Integer, String> diacritics() {
        return diacritics;
    }

    /**
     * Typo corrections in declaration order.
     */
    public ImmutableMap<String, String> corrections() {
        return corrections;
    }

    /**
     * Typo corrections ordered by descending key length, declaration order on ties.
     * This is the order in which normalization applies them.
     */
    public ImmutableList<Map.Entry<String, String>> correctionsLongestFirst() {
        return correctionsLongestFirst;
    }

    public ImmutableMap<String, String> phonetics() {
        return phonetics;
    }

    public ImmutableList<Map.Entry<String, String>> phoneticsLongestFirst() {
        return phoneticsLongestFirst;
    }

    public ImmutableMap<String, String> abbreviations() {
        return abbreviations;
    }

    /**
     * Canonical dish names and common search words.
     */
    public ImmutableList<String> vocabulary() {
        return vocabulary;
    }

    public ImmutableMap<String, ImmutableList<String>> synonyms() {
        return synonyms;
    }

    /**
     * Intent name to keywords, in detection priority order.
     */
    public ImmutableMap<String, ImmutableList<String>> intents() {
        return intents;
    }

    public ImmutableList<String> fillerPhrases() {
        return fillerPhrases;
    }

    @VisibleForTesting
    String describe() {
        return "%d diacritics, %d corrections, %d phonetics, %d abbreviations, %d vocabulary words, %d synonyms"
                .formatted(diacritics.size(), corrections.size(), phonetics.size(), abbreviations.size(),
                           vocabulary.size(), synonyms.size());
    }
}
