package io.github.jbellis.smartmatch.query;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.jbellis.smartmatch.lexicon.Lexicon;
import io.github.jbellis.smartmatch.similarity.Levenshtein;
import io.github.jbellis.smartmatch.text.TextNormalizer;
import io.github.jbellis.smartmatch.text.VariationGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Analyses a raw search query: strips voice-assistant filler, folds accents and plurals, snaps
 * near-miss words onto the vocabulary, expands synonyms and guesses the shopper's intent.
 */
public class QueryProcessor {
    private static final Logger logger = LogManager.getLogger(QueryProcessor.class);

    private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final Joiner SPACE = Joiner.on(' ');
    private static final int MAX_CORRECTION_DISTANCE = 1;

    private final Lexicon lexicon;
    private final TextNormalizer normalizer;
    private final List<Pattern> fillerPatterns;
    private final ImmutableMap<SearchIntent, Pattern> intentPatterns;

    public QueryProcessor(Lexicon lexicon, TextNormalizer normalizer) {
        this.lexicon = lexicon;
        this.normalizer = normalizer;
        this.fillerPatterns = lexicon.fillerPhrases().stream()
                .map(phrase -> Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b"))
                .collect(ImmutableList.toImmutableList());

        var intents = ImmutableMap.<SearchIntent, Pattern>builder();
        lexicon.intents().forEach((name, keywords) -> {
            SearchIntent intent;
            try {
                intent = SearchIntent.valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring unknown search intent '{}' in lexicon", name);
                return;
            }
            if (intent == SearchIntent.GENERAL || keywords.isEmpty()) {
                return;
            }
            String alternatives = keywords.stream().map(Pattern::quote).collect(Collectors.joining("|"));
            intents.put(intent, Pattern.compile("\\b(?:" + alternatives + ")\\b"));
        });
        this.intentPatterns = intents.buildKeepingLast();
    }

    public ProcessedQuery process(@Nullable String rawQuery, boolean voiceSearch) {
        String original = rawQuery == null ? "" : rawQuery;
        String normalized = original.toLowerCase(Locale.ROOT).strip();
        if (voiceSearch) {
            normalized = stripFillers(normalized);
        }
        normalized = normalizer.foldDiacritics(normalized);
        normalized = VariationGenerator.stem(normalized);

        String corrected = correctWords(normalized);
        return new ProcessedQuery(original, normalized, corrected, expandSynonyms(corrected), detectIntent(normalized));
    }

    /**
     * Removes phrases such as "i want" or "show me". A query made only of filler is kept as is.
     */
    String stripFillers(String query) {
        String result = query;
        for (Pattern filler : fillerPatterns) {
            result = filler.matcher(result).replaceAll("");
        }
        result = SPACE.join(WORDS.split(result));
        return result.isEmpty() ? query : result;
    }

    /**
     * Replaces each word by the first vocabulary word within one edit of it.
     */
    String correctWords(String query) {
        var corrected = new ArrayList<String>();
        for (String word : WORDS.split(query)) {
            String best = word;
            int bestDistance = MAX_CORRECTION_DISTANCE + 1;
            for (String candidate : lexicon.vocabulary()) {
                int distance = Levenshtein.distance(word, candidate);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = candidate;
                }
            }
            corrected.add(best);
        }
        return SPACE.join(corrected);
    }

    List<String> expandSynonyms(String corrected) {
        var terms = new LinkedHashSet<String>();
        terms.add(corrected);
        for (String word : WORDS.split(corrected)) {
            var synonyms = lexicon.synonyms().get(word);
            if (synonyms != null) {
                terms.addAll(synonyms);
            }
        }
        return List.copyOf(terms);
    }

    SearchIntent detectIntent(String normalized) {
        for (var entry : intentPatterns.entrySet()) {
            if (entry.getValue().matcher(normalized).find()) {
                return entry.getKey();
            }
        }
        return SearchIntent.GENERAL;
    }
}
