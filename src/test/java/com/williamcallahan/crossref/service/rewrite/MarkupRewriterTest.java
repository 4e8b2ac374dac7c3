package com.williamcallahan.crossref.service.rewrite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.crossref.domain.anchor.AnchorKind;
import com.williamcallahan.crossref.domain.anchor.AnchorTarget;
import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import com.williamcallahan.crossref.domain.anchor.ResolvedReference;
import com.williamcallahan.crossref.domain.anchor.ResolvedReference.MatchStrategy;
import com.williamcallahan.crossref.domain.markup.DocumentChunk;
import com.williamcallahan.crossref.domain.markup.RewrittenChunk;
import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.service.markup.XhtmlMarkup;
import com.williamcallahan.crossref.service.rewrite.RewritePlan.CallRewrite;
import com.williamcallahan.crossref.service.scan.ChunkScan;
import com.williamcallahan.crossref.service.scan.MarkerScanner;
import com.williamcallahan.crossref.service.scan.ReferenceMarker;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

/**
 * Verifies that plans are applied by node position and that unplanned markup is left alone.
 */
class MarkupRewriterTest {

    private static final String FILE = "a.xhtml";

    private final MarkerScanner scanner = new MarkerScanner();
    private final MarkupRewriter rewriter = new MarkupRewriter();

    @Test
    void appliesIdsAndWrapsReferencesInLinks() {
        DocumentChunk chunk = DocumentChunk.of("<div><h1>Intro</h1><p><!-- REF Intro -->see intro<!-- /REF --> and "
            + "<span class=\"crossref\" data-ref=\"Intro\">the <em>intro</em></span>.<!-- XE \"Term\" --></p></div>", FILE);
        ChunkScan scan = scanner.scan(chunk);
        int headingPosition = scan.targets().get(0).position();
        AnchorTarget heading = new AnchorTarget("ref-heading-intro", null, AnchorKind.HEADING, "Intro", "Intro",
            FILE, headingPosition, 1, null);

        Map<Integer, String> targetIds = new HashMap<>();
        targetIds.put(headingPosition, heading.id());
        targetIds.put(scan.indexMarkers().get(0).position(), "ref-indexterm-term");
        Map<Integer, ResolvedReference> references = new HashMap<>();
        for (ReferenceMarker marker : scan.references()) {
            ReferenceCall call = new ReferenceCall(marker.callId(), marker.targetKey(), FILE, marker.position(),
                marker.displayText(), marker.origin());
            references.put(marker.position(), ResolvedReference.resolved(call, "#" + heading.id(), heading, MatchStrategy.FUZZY_TEXT));
        }
        RewritePlan plan = new RewritePlan(FILE, NotePlacement.LINKED, targetIds, references, Map.of(), Map.of(), List.of(), "Notes");

        RewrittenChunk rewritten = rewriter.rewrite(chunk, plan);
        Document document = XhtmlMarkup.parse(rewritten.markup());

        assertEquals("ref-heading-intro", document.selectFirst("h1").id());
        List<Element> links = document.select("a.cross-ref");
        assertEquals(2, links.size());
        assertEquals("see intro", links.get(0).text());
        assertEquals("#ref-heading-intro", links.get(1).attr("href"));
        assertNotNull(links.get(1).selectFirst("em"));
        assertTrue(document.select("span.crossref").isEmpty());
        assertFalse(rewritten.markup().contains("REF"));
        Element anchor = document.selectFirst("span.index-anchor");
        assertNotNull(anchor);
        assertEquals("ref-indexterm-term", anchor.id());
        assertTrue(rewritten.markup().contains("<!-- XE \"Term\" -->"));
    }

    @Test
    void emptyPlanLeavesMarkupUntouched() {
        String markup = "<div><p>See <!-- REF Nowhere -->nothing<!-- /REF --> or <a href=\"#gone\">this</a>.</p></div>";

        RewrittenChunk rewritten = rewriter.rewrite(DocumentChunk.of(markup, FILE),
            new RewritePlan(FILE, NotePlacement.INLINE, Map.of(), Map.of(), Map.of(), Map.of(), List.of(), "Notes"));

        assertEquals(markup, rewritten.markup());
    }

    @Test
    void rewritesNoteCallOnItsWrapper() {
        DocumentChunk chunk = DocumentChunk.of("<p>Text<sup class=\"note-call\" id=\"c1\"><a href=\"#fn1\">*</a></sup></p>", FILE);
        int position = scanner.scan(chunk).noteCalls().get(0).position();

        RewrittenChunk rewritten = rewriter.rewrite(chunk, new RewritePlan(FILE, NotePlacement.CONSOLIDATED, Map.of(),
            Map.of(), Map.of(position, new CallRewrite("c1", "notes.xhtml#fn1", true, "1")), Map.of(), List.of(), "Notes"));
        Document document = XhtmlMarkup.parse(rewritten.markup());

        Element link = document.selectFirst("sup > a");
        assertEquals("c1", document.selectFirst("sup").id());
        assertEquals("notes.xhtml#fn1", link.attr("href"));
        assertEquals("noteref", link.attr("epub:type"));
        assertEquals("doc-noteref", link.attr("role"));
        assertEquals("1", link.text());
        assertFalse(link.hasAttr("id"));
    }
}
