package com.williamcallahan.crossref.domain.notes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Verifies note label formatting per numbering style.
 */
class NumberingStyleTest {

    @Test
    void formatsEachStyle() {
        assertEquals("12", NumberingStyle.NUMERIC.format(12));
        assertEquals("xiv", NumberingStyle.ROMAN.format(14));
        assertEquals("mcmxc", NumberingStyle.ROMAN.format(1990));
        assertEquals("c", NumberingStyle.ALPHA.format(3));
        assertEquals("aa", NumberingStyle.ALPHA.format(27));
        assertEquals("‡", NumberingStyle.SYMBOLS.format(3));
        assertEquals("**", NumberingStyle.SYMBOLS.format(7));
    }

    @Test
    void rejectsNumbersBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> NumberingStyle.ROMAN.format(0));
    }
}
