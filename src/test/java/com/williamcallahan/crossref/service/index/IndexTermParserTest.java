package com.williamcallahan.crossref.service.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.crossref.domain.index.IndexTerm;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies parsing of index marker text into terms, sub-terms and cross-reference clauses.
 */
class IndexTermParserTest {

    @Test
    void parsesHierarchy() {
        IndexTerm term = IndexTermParser.parse("Programming : syntax : loops").orElseThrow();

        assertEquals("Programming", term.mainText());
        assertEquals(List.of("syntax", "loops"), term.subTerms());
        assertEquals(List.of("Programming", "syntax", "loops"), term.path());
        assertFalse(term.emphasis());
    }

    @Test
    void extractsSeeAndSeeAlsoClauses() {
        IndexTerm term = IndexTermParser.parse("Lambdas; see Closures; see also Functions: higher-order.").orElseThrow();

        assertEquals("Lambdas", term.mainText());
        assertEquals(List.of("Closures"), term.seeRefs());
        assertEquals(List.of("Functions: higher-order"), term.seeAlsoRefs());
        assertTrue(term.subTerms().isEmpty());
    }

    @Test
    void readsEmphasisAndPrimaryMarks() {
        IndexTerm emphasized = IndexTermParser.parse("*Monads*").orElseThrow();
        IndexTerm primary = IndexTermParser.parse("**Streams**:parallel").orElseThrow();

        assertTrue(emphasized.emphasis());
        assertFalse(emphasized.primary());
        assertEquals("Monads", emphasized.mainText());
        assertTrue(primary.primary());
        assertEquals("Streams", primary.mainText());
    }

    @Test
    void rejectsMarkersWithoutMainTerm() {
        assertTrue(IndexTermParser.parse(null).isEmpty());
        assertTrue(IndexTermParser.parse("   ").isEmpty());
        assertTrue(IndexTermParser.parse(":syntax").isEmpty());
        assertTrue(IndexTermParser.parse("see Other").isEmpty());
    }
}
