package io.github.jbellis.smartmatch.text;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import io.github.jbellis.smartmatch.cache.MatchCaches;
import io.github.jbellis.smartmatch.lexicon.Lexicon;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Expands a search query into the spellings it is likely to take in stored data, so that a
 * correctly spelled query still finds a misspelled menu item and the other way round.
 */
public class VariationGenerator {
    private static final Logger logger = LogManager.getLogger(VariationGenerator.class);

    private final Lexicon lexicon;
    private final TextNormalizer normalizer;
    private final MatchCaches caches;
    private final ImmutableListMultimap<String, String> vocabularyByStem;

    public VariationGenerator(Lexicon lexicon, TextNormalizer normalizer, MatchCaches caches) {
        this.lexicon = lexicon;
        this.normalizer = normalizer;
        this.caches = caches;

        var byStem = ImmutableListMultimap.<String, String>builder();
        for (String term : lexicon.vocabulary()) {
            String stem = stem(normalizer.normalizeUncached(term));
            if (!stem.isEmpty()) {
                byStem.put(stem, term);
            }
        }
        this.vocabularyByStem = byStem.build();
    }

    /**
     * Returns the de-duplicated variations of {@code query}, the normalized form first.
     * Empty input yields a single empty string.
     */
    public ImmutableList<String> generate(@Nullable String query) {
        if (query == null || query.isEmpty()) {
            return ImmutableList.of("");
        }

        var cached = caches.getVariations(query);
        if (cached != null) {
            return cached;
        }

        Set<String> variations = new LinkedHashSet<>();
        String normalized = normalizer.normalize(query);
        String minimal = TextNormalizer.clean(query.toLowerCase(Locale.ROOT));

        variations.add(normalized);
        variations.add(minimal);
        addReplacements(variations, normalized, lexicon.phonetics(), false);
        addReplacements(variations, normalized, lexicon.abbreviations(), false);
        addReplacements(variations, minimal, lexicon.abbreviations(), false);
        addReplacements(variations, normalized, lexicon.corrections(), true);
        addPluralTwin(variations, normalized);
        addVocabularyForms(variations, normalized);

        var result = ImmutableList.copyOf(variations);
        caches.putVariations(query, result);
        logger.debug("{} variations for \"{}\": {}", result.size(), query, result);
        return result;
    }

    /**
     * For each rule whose pattern occurs in {@code text}, adds {@code text} with that rule applied.
     * Reversed rules map the replacement back to the pattern, which turns a correction table into a
     * misspelling generator.
     */
    private static void addReplacements(Set<String> out, String text, Map<String, String> rules, boolean reversed) {
        if (text.isEmpty()) {
            return;
        }
        for (var rule : rules.entrySet()) {
            String from = reversed ? rule.getValue() : rule.getKey();
            String to = reversed ? rule.getKey() : rule.getValue();
            if (!from.isEmpty() && text.contains(from)) {
                out.add(Substitutions.replaceAll(text, from, to));
            }
        }
    }

    private static void addPluralTwin(Set<String> out, String normalized) {
        if (normalized.isEmpty()) {
            return;
        }
        String stem = stem(normalized);
        out.add(stem.equals(normalized) ? normalized + "s" : stem);
    }

    private void addVocabularyForms(Set<String> out, String normalized) {
        if (normalized.isEmpty()) {
            return;
        }
        out.addAll(vocabularyByStem.get(stem(normalized)));
    }

    /**
     * Drops a trailing plural 's' from strings longer than three characters.
     */
    public static String stem(String text) {
        if (text.length() > 3 && text.endsWith("s")) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }
}
