package io.github.jbellis.smartmatch.query;

import java.util.List;

/**
 * A search query after analysis.
 *
 * @param original      the query exactly as typed or spoken
 * @param normalized    lowercased, filler-free, accent-free, singular
 * @param corrected     {@code normalized} with each word snapped to a vocabulary word one edit away
 * @param expandedTerms {@code corrected} followed by synonyms of its words, without duplicates
 * @param intent        the detected intent, {@link SearchIntent#GENERAL} when nothing matched
 */
public record ProcessedQuery(String original,
                             String normalized,
                             String corrected,
                             List<String> expandedTerms,
                             SearchIntent intent) {
    public ProcessedQuery {
        expandedTerms = List.copyOf(expandedTerms);
    }
}
