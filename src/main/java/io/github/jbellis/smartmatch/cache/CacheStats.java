package io.github.jbellis.smartmatch.cache;

/**
 * Point-in-time view of the normalization and variation caches.
 */
public record CacheStats(long normalizationEntries,
                         long variationEntries,
                         long normalizationHits,
                         long normalizationMisses,
                         long variationHits,
                         long variationMisses) {

    public long totalEntries() {
        return normalizationEntries + variationEntries;
    }
}
