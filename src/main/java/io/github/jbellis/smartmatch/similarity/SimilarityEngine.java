package io.github.jbellis.smartmatch.similarity;

import io.github.jbellis.smartmatch.text.TextNormalizer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Compares normalized strings by containment and edit distance.
 * <p>
 * Two thresholds are in play and both are strict: {@code similarityThreshold} decides
 * {@link #isSimilar}, the lower {@code bestMatchThreshold} decides which candidates
 * {@link #findBestMatch} and {@link #rankMatches} accept.
 */
public class SimilarityEngine {
    private final TextNormalizer normalizer;
    private final double similarityThreshold;
    private final double bestMatchThreshold;

    public SimilarityEngine(TextNormalizer normalizer, double similarityThreshold, double bestMatchThreshold) {
        this.normalizer = normalizer;
        this.similarityThreshold = similarityThreshold;
        this.bestMatchThreshold = bestMatchThreshold;
    }

    /**
     * True when the normalized forms are equal, one contains the other, or their edit-distance
     * similarity exceeds the similarity threshold. Empty input, or input without any letter or
     * digit, is never similar to anything.
     */
    public boolean isSimilar(@Nullable String a, @Nullable String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return false;
        }
        String left = normalizer.normalize(a);
        String right = normalizer.normalize(b);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        if (left.equals(right) || left.contains(right) || right.contains(left)) {
            return true;
        }
        return Levenshtein.similarity(left, right) > similarityThreshold;
    }

    /**
     * Returns the first candidate whose normalized form equals the normalized query, otherwise the
     * highest-scoring candidate above the best-match threshold (the earliest one on ties), or null.
     */
    public @Nullable String findBestMatch(@Nullable String query, @Nullable Collection<String> candidates) {
        if (query == null || query.isEmpty() || candidates == null || candidates.isEmpty()) {
            return null;
        }
        String normalizedQuery = normalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return null;
        }

        String bestMatch = null;
        double bestScore = 0.0;
        for (String candidate : candidates) {
            if (candidate == null || candidate.isEmpty()) {
                continue;
            }
            String normalizedCandidate = normalizer.normalize(candidate);
            if (normalizedCandidate.isEmpty()) {
                continue;
            }
            if (normalizedCandidate.equals(normalizedQuery)) {
                return candidate;
            }
            double score = Levenshtein.similarity(normalizedQuery, normalizedCandidate);
            if (score > bestScore && score > bestMatchThreshold) {
                bestScore = score;
                bestMatch = candidate;
            }
        }
        return bestMatch;
    }

    /**
     * Scores every candidate against the query and returns those above the best-match threshold,
     * best first. Candidates with equal scores keep their input order.
     *
     * @param limit maximum number of results, or zero or less for all of them
     */
    public List<ScoredMatch> rankMatches(@Nullable String query, @Nullable Collection<String> candidates, int limit) {
        if (query == null || query.isEmpty() || candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        String normalizedQuery = normalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return List.of();
        }

        var scored = new ArrayList<ScoredMatch>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isEmpty()) {
                continue;
            }
            String normalizedCandidate = normalizer.normalize(candidate);
            if (normalizedCandidate.isEmpty()) {
                continue;
            }
            double score = normalizedCandidate.equals(normalizedQuery)
                           ? 1.0
                           : Levenshtein.similarity(normalizedQuery, normalizedCandidate);
            if (score > bestMatchThreshold) {
                scored.add(new ScoredMatch(candidate, score));
            }
        }

        // List.sort is stable
        scored.sort(Comparator.comparingDouble(ScoredMatch::score).reversed());
        if (limit > 0 && scored.size() > limit) {
            return List.copyOf(scored.subList(0, limit));
        }
        return List.copyOf(scored);
    }
}
