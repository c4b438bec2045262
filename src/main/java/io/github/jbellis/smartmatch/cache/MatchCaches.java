package io.github.jbellis.smartmatch.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

/**
 * The two memo tables of a matcher: raw text to normalized text, and raw query to its variations.
 * <p>
 * Both are thread-safe LRU caches. A size limit of zero or less leaves the cache unbounded.
 * Lookups and stores are separate steps, so two threads racing on the same key may both compute
 * the value; normalization is a pure function, so either result is the right one.
 */
public class MatchCaches {
    private final Cache<String, String> normalized;
    private final Cache<String, ImmutableList<String>> variations;

    public MatchCaches(long normalizationMaxSize, long variationMaxSize) {
        this.normalized = newCache(normalizationMaxSize);
        this.variations = newCache(variationMaxSize);
    }

    private static <V> Cache<String, V> newCache(long maxSize) {
        var builder = CacheBuilder.newBuilder().recordStats();
        if (maxSize > 0) {
            builder.maximumSize(maxSize);
        }
        return builder.build();
    }

    public @Nullable String getNormalized(String raw) {
        return normalized.getIfPresent(raw);
    }

    public void putNormalized(String raw, String value) {
        normalized.put(raw, value);
    }

    public long normalizedSize() {
        return normalized.size();
    }

    public @Nullable ImmutableList<String> getVariations(String query) {
        return variations.getIfPresent(query);
    }

    public void putVariations(String query, ImmutableList<String> value) {
        variations.put(query, value);
    }

    public void clear() {
        normalized.invalidateAll();
        variations.invalidateAll();
    }

    public CacheStats stats() {
        var n = normalized.stats();
        var v = variations.stats();
        return new CacheStats(normalized.size(), variations.size(),
                              n.hitCount(), n.missCount(),
                              v.hitCount(), v.missCount());
    }
}
