package com.williamcallahan.crossref.service.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

/**
 * Verifies merge, sort and group keys for index entries.
 */
class SortKeyNormalizerTest {

    private final SortKeyNormalizer normalizer = new SortKeyNormalizer(Locale.US, false, List.of("a", "an", "the"));

    @Test
    void stripsLeadingArticleAndDiacritics() {
        assertEquals("eclair recipe", normalizer.sortKey("The Éclair  Recipe"));
        assertEquals("apple", normalizer.sortKey("an apple"));
        assertEquals("the", normalizer.sortKey("The"));
    }

    @Test
    void mergeKeyFoldsCaseUnlessCaseSensitive() {
        SortKeyNormalizer sensitive = new SortKeyNormalizer(Locale.US, true, List.of("the"));

        assertEquals(normalizer.mergeKey("Java"), normalizer.mergeKey("JAVA"));
        assertNotEquals(sensitive.mergeKey("Java"), sensitive.mergeKey("JAVA"));
        assertEquals("Java", sensitive.mergeKey("the Java"));
    }

    @Test
    void groupsNonLettersUnderSymbols() {
        assertEquals("#", normalizer.groupKey("404 errors"));
        assertEquals("#", normalizer.groupKey("@Override"));
        assertEquals("E", normalizer.groupKey("Éclair"));
        assertEquals("#", normalizer.groupLetter(""));
    }

    @Test
    void groupKeyIsStableOnItsOwnOutput() {
        for (String text : List.of("The Zebra", "ångström", "42", "über", "a Banana")) {
            String group = normalizer.groupKey(text);
            assertEquals(group, normalizer.groupKey(group), text);
        }
    }
}
