package io.github.jbellis.smartmatch.similarity;

/**
 * A candidate together with its similarity to the query, 1.0 for an exact normalized match.
 */
public record ScoredMatch(String candidate, double score) {
}
