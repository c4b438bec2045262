package io.github.jbellis.smartmatch.query;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Coarse text relevance of a search result, case-insensitive:
 * 1.0 exact, 0.8 prefix, 0.6 substring, otherwise up to 0.4 by the share of query words found.
 */
public final class RelevanceScorer {
    private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private RelevanceScorer() {
    }

    public static double score(@Nullable String query, @Nullable String text) {
        if (query == null || text == null) {
            return 0.0;
        }
        String q = query.toLowerCase(Locale.ROOT).strip();
        String t = text.toLowerCase(Locale.ROOT).strip();
        if (q.isEmpty() || t.isEmpty()) {
            return 0.0;
        }

        if (t.equals(q)) {
            return 1.0;
        }
        if (t.startsWith(q)) {
            return 0.8;
        }
        if (t.contains(q)) {
            return 0.6;
        }

        List<String> words = WORDS.splitToList(q);
        long found = words.stream().filter(t::contains).count();
        return (double) found / words.size() * 0.4;
    }
}
