package io.github.jbellis.smartmatch;

import io.github.jbellis.smartmatch.lexicon.LexiconException;
import io.github.jbellis.smartmatch.query.SearchIntent;
import io.github.jbellis.smartmatch.similarity.ScoredMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TextMatcherTest {
    private static final List<String> MENU = List.of(
            "Pizza Margherita", "Classic Burger", "Chicken Tikka", "Crêpes au chocolat", "Couscous royal",
            "Tajine d'agneau", "Chorba frik", "Salade niçoise", "Café crème", "Sushi");

    @Test
    void facadeDelegatesToEveryComponent() {
        var matcher = new TextMatcher(MatcherConfig.defaults());

        assertEquals("burger", matcher.normalize("Burguer"));
        assertTrue(matcher.generateVariations("crépe").contains("crepes"));
        assertTrue(matcher.isSimilar("burguer", "Burger"));
        assertEquals("Pizza", matcher.findBestMatch("piza", List.of("Pasta", "Pizza")));
        assertEquals(List.of(new ScoredMatch("Sushi", 1.0)), matcher.rankMatches("sushi", MENU));
        assertEquals(SearchIntent.LOCATION, matcher.processQuery("tajine nearby").intent());
        assertEquals(0.8, matcher.relevance("pizza", "Pizza Margherita"));
    }

    @Test
    @DisplayName("matches finds menu items by name or description through query variations")
    void matchesAgainstItemFields() {
        var matcher = new TextMatcher();

        assertTrue(matcher.matches("burguer", "Classic Burger", "beef, cheddar"));
        assertTrue(matcher.matches("chk", "Chicken Tikka"));
        assertTrue(matcher.matches("crépe", null, "", "Crêpes au chocolat"));
        assertFalse(matcher.matches("sushi", "Pizza Margherita", "tomato, mozzarella"));
        assertFalse(matcher.matches("", "Pizza"));
        assertFalse(matcher.matches("pizza", (String[]) null));
    }

    @Test
    void filtersAMenu() {
        var matcher = new TextMatcher();
        var hits = MENU.stream().filter(item -> matcher.matches("tagine", item)).toList();
        assertEquals(List.of("Tajine d'agneau"), hits);
    }

    @Test
    void clearCacheKeepsResults() {
        var matcher = new TextMatcher(MatcherConfig.defaults());

        String first = matcher.normalize("Crêpes");
        matcher.normalize("Crêpes");
        matcher.generateVariations("crépe");

        var stats = matcher.getCacheStats();
        assertEquals(2, stats.normalizationEntries());
        assertEquals(1, stats.normalizationHits());
        assertEquals(1, stats.variationEntries());

        matcher.clearCache();
        assertEquals(0, matcher.getCacheStats().totalEntries());
        assertEquals(first, matcher.normalize("Crêpes"));
    }

    @Test
    void customLexiconThroughConfig() {
        var config = MatcherConfig.builder().lexiconResource("/smartmatch/test-lexicon.json").build();
        var matcher = new TextMatcher(config);

        assertEquals("y2", matcher.normalize("ABCD"));
        assertSame(config, matcher.getConfig());
        assertTrue(matcher.getLexicon().abbreviations().isEmpty());
    }

    @Test
    void missingLexiconFailsAtConstruction() {
        var config = MatcherConfig.builder().lexiconResource("/smartmatch/missing.json").build();
        assertThrows(LexiconException.class, () -> new TextMatcher(config));
    }

    @Test
    void sharedMatcherGivesSameAnswersAcrossThreads() throws Exception {
        var matcher = new TextMatcher(MatcherConfig.builder().normalizationCacheSize(8).variationCacheSize(4).build());
        var reference = new TextMatcher(MatcherConfig.defaults());
        List<String> queries = List.of("piza", "burguer", "crépe", "tajin", "chiken", "Café", "sushi", "zalat");

        var executor = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<Boolean>>();
            for (int t = 0; t < 16; t++) {
                tasks.add(() -> {
                    for (int i = 0; i < 200; i++) {
                        String query = queries.get(i % queries.size());
                        if (!matcher.normalize(query).equals(reference.normalize(query))
                                || !matcher.generateVariations(query).equals(reference.generateVariations(query))
                                || !String.valueOf(matcher.findBestMatch(query, MENU))
                                        .equals(String.valueOf(reference.findBestMatch(query, MENU)))) {
                            return false;
                        }
                    }
                    return true;
                });
            }
            for (Future<Boolean> result : executor.invokeAll(tasks)) {
                assertTrue(result.get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
    }
}
