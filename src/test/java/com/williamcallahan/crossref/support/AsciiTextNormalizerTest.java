package com.williamcallahan.crossref.support;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Verifies slug, case and whitespace normalization.
 */
class AsciiTextNormalizerTest {

    @Test
    void slugifyStripsDiacriticsAndPunctuation() {
        assertEquals("cafe-creme-brulee", AsciiTextNormalizer.slugify("Café  Crème -- Brûlée!"));
        assertEquals("section_12", AsciiTextNormalizer.slugify(" Section_1.2 "));
    }

    @Test
    void slugifyOfSymbolsOnlyIsEmpty() {
        assertEquals("", AsciiTextNormalizer.slugify("¿?!"));
        assertEquals("", AsciiTextNormalizer.slugify(null));
    }

    @Test
    void lowerCasingTouchesOnlyAsciiLetters() {
        assertEquals("istanbul İ", AsciiTextNormalizer.toLowerAscii("ISTANBUL İ"));
    }

    @Test
    void collapsesWhitespaceIncludingNonBreakingSpaces() {
        assertEquals("a b c", AsciiTextNormalizer.collapseWhitespace("  a  b \n\tc  "));
    }
}
