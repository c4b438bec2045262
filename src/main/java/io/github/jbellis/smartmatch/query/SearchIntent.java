package io.github.jbellis.smartmatch.query;

/**
 * What a shopper is mostly after, inferred from keywords in the query.
 */
public enum SearchIntent {
    LOCATION,
    PRICE,
    SPEED,
    DIETARY,
    POPULARITY,
    GENERAL
}
