package io.github.jbellis.smartmatch.text;

import io.github.jbellis.smartmatch.cache.MatchCaches;
import io.github.jbellis.smartmatch.lexicon.Lexicon;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns arbitrary text into the canonical form used for comparison: lowercase, diacritics folded,
 * typos corrected, phonetically simplified, and stripped of everything but letters, digits and
 * single spaces.
 * <p>
 * The pipeline is re-run on its own output until it stops changing (bounded by
 * {@code maxPasses}), so normalizing a normalized string returns it unchanged.
 */
public class TextNormalizer {
    private static final Logger logger = LogManager.getLogger(TextNormalizer.class);

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final int VERBOSE_LOG_LIMIT = 100;

    private final Lexicon lexicon;
    private final MatchCaches caches;
    private final int maxPasses;

    public TextNormalizer(Lexicon lexicon, MatchCaches caches, int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1, got " + maxPasses);
        }
        this.lexicon = lexicon;
        this.caches = caches;
        this.maxPasses = maxPasses;
    }

    /**
     * Returns the canonical form of {@code text}. Empty input is returned unchanged, null is treated as empty.
     */
    public String normalize(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        var cached = caches.getNormalized(text);
        if (cached != null) {
            return cached;
        }

        String normalized = normalizeUncached(text);
        caches.putNormalized(text, normalized);
        if (caches.normalizedSize() < VERBOSE_LOG_LIMIT) {
            logger.debug("Normalized \"{}\" -> \"{}\"", text, normalized);
        }
        return normalized;
    }

    /**
     * Runs the pipeline to a fixed point without touching the cache.
     */
    public String normalizeUncached(String text) {
        String current = singlePass(text);
        for (int pass = 1; pass < maxPasses; pass++) {
            String next = singlePass(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        return current;
    }

    private String singlePass(String text) {
        String result = text.toLowerCase(Locale.ROOT).strip();
        result = foldDiacritics(result);
        result = correctTypos(result);
        result = applyPhonetics(result);
        return clean(result);
    }

    /**
     * Replaces every character found in the diacritic table; everything else passes through.
     */
    public String foldDiacritics(String text) {
        var diacritics = lexicon.diacritics();
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            String replacement = diacritics.get(cp);
            if (replacement != null && sb == null) {
                sb = new StringBuilder(text.length() + 8);
                sb.append(text, 0, i);
            }
            if (sb != null) {
                if (replacement != null) {
                    sb.append(replacement);
                } else {
                    sb.appendCodePoint(cp);
                }
            }
            i += Character.charCount(cp);
        }
        return sb == null ? text : sb.toString();
    }

    /**
     * Applies the typo corrections longest key first, so a short rule can never split a longer
     * pattern that contains it.
     */
    public String correctTypos(String text) {
        String result = text;
        for (var entry : lexicon.correctionsLongestFirst()) {
            result = Substitutions.replaceAll(result, entry.getKey(), entry.getValue());
        }
        return result;
    }

    public String applyPhonetics(String text) {
        String result = text;
        for (var entry : lexicon.phoneticsLongestFirst()) {
            result = Substitutions.replaceAll(result, entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Removes everything that is not a letter, digit or whitespace, then collapses and trims whitespace.
     */
    public static String clean(String text) {
        String stripped = NON_ALPHANUMERIC.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(stripped).replaceAll(" ").strip();
    }
}
