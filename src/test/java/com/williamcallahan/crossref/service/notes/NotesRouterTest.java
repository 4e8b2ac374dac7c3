package com.williamcallahan.crossref.service.notes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import com.williamcallahan.crossref.domain.anchor.ReferenceOrigin;
import com.williamcallahan.crossref.domain.markup.Chapter;
import com.williamcallahan.crossref.domain.markup.GeneratedPage;
import com.williamcallahan.crossref.domain.notes.Note;
import com.williamcallahan.crossref.domain.notes.NoteDeclaration;
import com.williamcallahan.crossref.domain.notes.NoteKind;
import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.domain.notes.NotesRouting;
import com.williamcallahan.crossref.service.EngineOptions.NotesOptions;
import com.williamcallahan.crossref.service.markup.XhtmlMarkup;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

/**
 * Verifies call linking, placement policies, back-links and orphan detection.
 */
class NotesRouterTest {

    private static final List<Chapter> CHAPTERS = List.of(
        new Chapter(0, "ch1.xhtml", "One"),
        new Chapter(1, "ch2.xhtml", "Two"));

    @Test
    void footnoteCitedTwiceGetsTwoBackLinksInCallOrder() {
        NotesRouting routing = router(NotePlacement.LINKED).route(
            List.of(footnote("fn1", "fn1", "ch1.xhtml", 1)),
            List.of(call("c1", "fn1", "ch1.xhtml", 3), call("c2", "fn1", "ch1.xhtml", 8)),
            CHAPTERS);

        Note note = routing.notes().get(0);
        Document content = XhtmlMarkup.parseFragment(note.content());
        assertEquals(List.of("#c1", "#c2"), content.select("a.note-back-ref").eachAttr("href"));
        assertEquals("#fn1", routing.callHrefs().get("c1"));
        assertEquals("#fn1", routing.callHrefs().get("c2"));
        assertEquals(1, routing.backReferencesGenerated());
        assertEquals(List.of("c1", "c2"), List.copyOf(note.backReferences().keySet()));
    }

    @Test
    void inlinePlacementMovesFootnotesToTheChapterOfTheirFirstCall() {
        NotesRouting routing = router(NotePlacement.INLINE).route(
            List.of(footnote("fn1", "fn1", "notes-src.xhtml", 1), endnote("en1", "en1", "notes-src.xhtml", 1)),
            List.of(call("c1", "fn1", "ch2.xhtml", 3), call("c2", "en1", "ch1.xhtml", 4)),
            CHAPTERS);

        Note footnote = routing.note("fn1").orElseThrow();
        assertEquals("ch2.xhtml", footnote.targetFile());
        assertEquals("Two", footnote.chapterTitle());
        assertTrue(footnote.relocated());
        assertEquals("#fn1", routing.callHrefs().get("c1"));

        Note endnote = routing.note("en1").orElseThrow();
        assertEquals("notes-src.xhtml", endnote.targetFile());
        assertEquals("notes-src.xhtml#en1", routing.callHrefs().get("c2"));
        assertEquals("ch1.xhtml#c2", XhtmlMarkup.parseFragment(endnote.content()).selectFirst("a.note-back-ref").attr("href"));
    }

    @Test
    void consolidatedPlacementBuildsOnePageGroupedByChapter() {
        NotesRouting routing = router(NotePlacement.CONSOLIDATED).route(
            List.of(footnote("fn1", "fn1", "ch2.xhtml", 1), footnote("fn1-b", "fn1", "ch1.xhtml", 1)),
            List.of(call("a1", "fn1", "ch1.xhtml", 2), call("b1", "fn1", "ch2.xhtml", 2)),
            CHAPTERS);

        GeneratedPage page = new NotesPageRenderer(NotesOptions.defaults().withPlacement(NotePlacement.CONSOLIDATED),
            "styles.css").render(routing.chapters(), Map.of());
        assertEquals("notes.xhtml", page.fileName());
        assertEquals("notes.xhtml#fn1-b", routing.callHrefs().get("a1"));
        assertEquals("notes.xhtml#fn1", routing.callHrefs().get("b1"));

        Document document = XhtmlMarkup.parse(page.markup());
        assertEquals(List.of("One", "Two"), document.select("section.chapter-notes h2").eachText());
        assertEquals(List.of("fn1-b", "fn1"), document.select("ol.footnotes > li").eachAttr("id"));
        assertEquals("ch1.xhtml#a1", document.getElementById("fn1-b").selectFirst("a.note-back-ref").attr("href"));
    }

    @Test
    void callsWithoutNoteAreOrphans() {
        NotesRouting routing = router(NotePlacement.LINKED).route(
            List.of(footnote("fn1", "fn1", "ch1.xhtml", 1)),
            List.of(call("c1", "fn9", "ch1.xhtml", 3)),
            CHAPTERS);

        assertEquals(1, routing.orphanCalls().size());
        assertFalse(routing.callHrefs().containsKey("c1"));
        assertEquals(1, routing.callCount());
        assertTrue(routing.notes().get(0).calls().isEmpty());
        assertEquals("ch1.xhtml", routing.notes().get(0).chapterFile());
    }

    @Test
    void callNamingAFileFindsTheNoteDeclaredThere() {
        NotesRouting routing = router(NotePlacement.LINKED).route(
            List.of(footnote("fn1", "fn1", "ch1.xhtml", 1), footnote("fn1-b", "fn1", "ch2.xhtml", 2)),
            List.of(new ReferenceCall("c1", "fn1", "ch1.xhtml", 3, "1", ReferenceOrigin.NOTE_CALL, "ch2.xhtml")),
            CHAPTERS);

        assertEquals("ch2.xhtml#fn1-b", routing.callHrefs().get("c1"));
        assertTrue(routing.note("fn1").orElseThrow().calls().isEmpty());
        assertEquals(1, routing.note("fn1-b").orElseThrow().calls().size());
    }

    @Test
    void disabledBackLinksLeaveContentAsAuthored() {
        NotesRouting routing = new NotesRouter(NotesOptions.defaults().withBackRefs(false)).route(
            List.of(footnote("fn1", "fn1", "ch1.xhtml", 1)),
            List.of(call("c1", "fn1", "ch1.xhtml", 3)),
            CHAPTERS);

        Note note = routing.notes().get(0);
        assertEquals("<p>Footnote fn1.</p>", note.content());
        assertTrue(note.backReferences().isEmpty());
        assertEquals(0, routing.backReferencesGenerated());
    }

    @Test
    void popupKeepsNotesInTheirOwnFile() {
        NotesRouting routing = router(NotePlacement.POPUP).route(
            List.of(endnote("en1", "en1", "back.xhtml", 1)),
            List.of(call("c1", "en1", "ch1.xhtml", 3)),
            CHAPTERS);

        assertEquals("back.xhtml#en1", routing.callHrefs().get("c1"));
        assertFalse(routing.notes().get(0).relocated());
    }

    private static NotesRouter router(NotePlacement placement) {
        return new NotesRouter(NotesOptions.defaults().withPlacement(placement));
    }

    private static NoteDeclaration footnote(String id, String originalId, String file, int number) {
        return new NoteDeclaration(id, originalId, NoteKind.FOOTNOTE, number, "<p>Footnote " + id + ".</p>",
            "Footnote " + id + ".", file, 10, 3);
    }

    private static NoteDeclaration endnote(String id, String originalId, String file, int number) {
        return new NoteDeclaration(id, originalId, NoteKind.ENDNOTE, number, "<p>Endnote " + id + ".</p>",
            "Endnote " + id + ".", file, 20, 3);
    }

    private static ReferenceCall call(String id, String key, String file, int position) {
        return new ReferenceCall(id, key, file, position, "1", ReferenceOrigin.NOTE_CALL);
    }
}
