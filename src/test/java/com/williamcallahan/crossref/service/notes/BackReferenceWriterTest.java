package com.williamcallahan.crossref.service.notes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.williamcallahan.crossref.service.markup.XhtmlMarkup;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

/**
 * Verifies back-link placement and that augmenting twice adds nothing.
 */
class BackReferenceWriterTest {

    private final BackReferenceWriter writer = new BackReferenceWriter("↩", "Return to text");

    @Test
    void appendsOneLinkPerCallInCallOrder() {
        BackReferenceWriter.Augmented augmented = writer.augment("<p>A note.</p>", calls("c1", "c2"));

        Document fragment = XhtmlMarkup.parseFragment(augmented.content());
        List<String> hrefs = fragment.select("p > span.note-back-refs > a.note-back-ref").eachAttr("href");
        assertEquals(List.of("#c1", "#c2"), hrefs);
        assertEquals(2, augmented.appended());
        Element first = fragment.selectFirst("a.note-back-ref");
        assertNotNull(first);
        assertEquals("doc-backlink", first.attr("role"));
        assertEquals("Return to text", first.attr("title"));
    }

    @Test
    void augmentingTwiceIsIdempotent() {
        String once = writer.augment("<p>A note.</p>", calls("c1", "c2")).content();
        BackReferenceWriter.Augmented twice = writer.augment(once, calls("c1", "c2"));

        assertEquals(once, twice.content());
        assertEquals(0, twice.appended());
        assertEquals(2, BackReferenceWriter.countBackReferences(twice.content()));
    }

    @Test
    void refreshesMovedCallsAndAddsNewOnes() {
        String once = writer.augment("<p>A note.</p>", calls("c1")).content();
        Map<String, String> moved = new LinkedHashMap<>();
        moved.put("c1", "ch1.xhtml#c1");
        moved.put("c3", "ch1.xhtml#c3");

        BackReferenceWriter.Augmented augmented = writer.augment(once, moved);

        Document fragment = XhtmlMarkup.parseFragment(augmented.content());
        assertEquals(List.of("ch1.xhtml#c1", "ch1.xhtml#c3"), fragment.select("a.note-back-ref").eachAttr("href"));
        assertEquals(1, augmented.appended());
    }

    @Test
    void contentWithoutParagraphGetsTrailingSpan() {
        BackReferenceWriter.Augmented augmented = writer.augment("Plain text", calls("c9"));

        Document fragment = XhtmlMarkup.parseFragment(augmented.content());
        assertEquals("#c9", fragment.selectFirst("span.note-back-refs > a").attr("href"));
    }

    private static Map<String, String> calls(String... ids) {
        Map<String, String> hrefs = new LinkedHashMap<>();
        for (String id : ids) {
            hrefs.put(id, "#" + id);
        }
        return hrefs;
    }
}
