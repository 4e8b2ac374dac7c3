package com.williamcallahan.crossref.service.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.crossref.domain.index.IndexModel;
import com.williamcallahan.crossref.domain.markup.GeneratedPage;
import com.williamcallahan.crossref.service.EngineOptions.AnchorOptions;
import com.williamcallahan.crossref.service.EngineOptions.IndexOptions;
import com.williamcallahan.crossref.service.markup.XhtmlMarkup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

/**
 * Verifies the generated index page structure, depth limit and per-letter limit.
 */
class IndexPageRendererTest {

    @Test
    void rendersSectionsEntriesAndOccurrenceLinks() {
        IndexModel model = new IndexBuilder(IndexOptions.defaults(), AnchorOptions.defaults())
            .build(IndexBuilderTest.occurrences("Programming", "Programming:syntax", "Lambdas; see Programming"));

        GeneratedPage page = new IndexPageRenderer(IndexOptions.defaults(), "styles.css").render(model);
        Document document = XhtmlMarkup.parse(page.markup());

        assertEquals("index.xhtml", page.fileName());
        assertTrue(page.markup().startsWith("<?xml"));
        assertNotNull(document.selectFirst("link[href=styles.css]"));
        assertEquals(2, document.select("div.index-section").size());
        assertNotNull(document.getElementById("index-p"));

        Element programming = document.getElementById(model.mainEntryByText("Programming").orElseThrow().id());
        assertNotNull(programming);
        assertEquals("ch1.xhtml#ref-indexterm-ch1-xhtml-1", programming.selectFirst("> a.index-occurrence").attr("href"));
        assertEquals(1, programming.select("ul.index-subentries > li.index-level-2").size());

        Element see = document.selectFirst("span.index-see a");
        assertNotNull(see);
        assertEquals("#" + programming.id(), see.attr("href"));
        assertEquals("Programming", see.text());
    }

    @Test
    void cutsNestingBelowMaxDepth() {
        IndexModel model = new IndexBuilder(IndexOptions.defaults(), AnchorOptions.defaults())
            .build(IndexBuilderTest.occurrences("A:b:c:d"));

        GeneratedPage page = new IndexPageRenderer(IndexOptions.defaults().withMaxTocDepth(2), "").render(model);
        Document document = XhtmlMarkup.parse(page.markup());

        assertEquals(1, document.select("li.index-level-2").size());
        assertTrue(document.select("li.index-level-3").isEmpty());
        assertTrue(document.select("link").isEmpty());
    }

    @Test
    void limitsMainEntriesPerLetter() {
        IndexModel model = new IndexBuilder(IndexOptions.defaults(), AnchorOptions.defaults())
            .build(IndexBuilderTest.occurrences("Alpha", "Apex", "Arrow", "Beta"));

        GeneratedPage page = new IndexPageRenderer(IndexOptions.defaults().withMaxEntriesPerLetter(2), "").render(model);
        Document document = XhtmlMarkup.parse(page.markup());

        assertEquals(2, document.select("#index-a li.index-level-1").size());
        assertEquals(1, document.select("#index-b li.index-level-1").size());
    }
}
