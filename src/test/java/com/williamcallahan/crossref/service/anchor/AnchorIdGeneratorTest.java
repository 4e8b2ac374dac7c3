package com.williamcallahan.crossref.service.anchor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Verifies id derivation, truncation and hash-suffix disambiguation.
 */
class AnchorIdGeneratorTest {

    @Test
    void derivesReadableIdFromLabelAndContent() {
        AnchorIdGenerator generator = new AnchorIdGenerator("ref", 50, 6, 1000);

        assertEquals("ref-heading-introduction-to-java", generator.deriveBase("heading", "Introduction to Java"));
        assertEquals("ref-figure-cafe-menu", generator.deriveBase("figure", "Café  menu!"));
        assertEquals("ref-table", generator.deriveBase("table", "   "));
    }

    @Test
    void truncatedBaseLeavesRoomForSuffix() {
        AnchorIdGenerator generator = new AnchorIdGenerator("ref", 30, 6, 1000);

        String base = generator.deriveBase("heading", "A very long heading that keeps on going");

        assertTrue(base.length() <= 30 - 6 - 1, base);
        assertFalse(base.endsWith("-"));
        String suffixed = generator.disambiguate(base, candidate -> candidate.equals(base));
        assertTrue(suffixed.length() <= 30, suffixed);
    }

    @Test
    void disambiguationIsDeterministic() {
        Set<String> taken = Set.of("ref-heading-introduction");

        String first = new AnchorIdGenerator("ref", 50, 6, 1000).disambiguate("ref-heading-introduction", taken::contains);
        String second = new AnchorIdGenerator("ref", 50, 6, 1000).disambiguate("ref-heading-introduction", taken::contains);

        assertEquals(first, second);
        assertTrue(first.matches("ref-heading-introduction-[0-9a-f]{6}"), first);
    }

    @Test
    void repeatedCollisionsYieldDistinctIds() {
        AnchorIdGenerator generator = new AnchorIdGenerator("ref", 50, 6, 1000);
        Set<String> taken = new HashSet<>();
        taken.add("ref-heading-notes");

        for (int count = 0; count < 20; count++) {
            String id = generator.disambiguate("ref-heading-notes", taken::contains);
            assertTrue(taken.add(id), "duplicate id " + id);
        }
        assertEquals(21, taken.size());
    }

    @Test
    void freeBaseIsReturnedUnchanged() {
        AnchorIdGenerator generator = new AnchorIdGenerator("ref", 50, 6, 1000);

        assertEquals("chapter-one", generator.disambiguate("chapter-one", candidate -> false));
    }

    @Test
    void exhaustedAttemptsThrow() {
        AnchorIdGenerator generator = new AnchorIdGenerator("ref", 50, 1, 3);

        IdCollisionExhaustedException exception = assertThrows(IdCollisionExhaustedException.class,
            () -> generator.disambiguate("ref-table", candidate -> true));

        assertEquals("ref-table", exception.getBaseId());
        assertEquals(3, exception.getAttempts());
    }

    @Test
    void rejectsUnsafePrefix() {
        assertThrows(IllegalArgumentException.class, () -> new AnchorIdGenerator("1ref", 50, 6, 10));
        assertThrows(IllegalArgumentException.class, () -> new AnchorIdGenerator("ref", 8, 6, 10));
    }

    @Test
    void recognizesSafeIds() {
        assertTrue(AnchorIdGenerator.isSafeId("fig_2-a"));
        assertFalse(AnchorIdGenerator.isSafeId("1.2"));
        assertFalse(AnchorIdGenerator.isSafeId("has space"));
        assertFalse(AnchorIdGenerator.isSafeId(null));
        assertNotEquals(AnchorIdGenerator.isSafeId("a"), AnchorIdGenerator.isSafeId(""));
    }
}
