package com.williamcallahan.crossref.service.notes;

import com.williamcallahan.crossref.domain.markup.GeneratedPage;
import com.williamcallahan.crossref.domain.notes.ChapterNotes;
import com.williamcallahan.crossref.domain.notes.Note;
import com.williamcallahan.crossref.service.EngineOptions.NotesOptions;
import com.williamcallahan.crossref.service.markup.XhtmlMarkup;
import com.williamcallahan.crossref.service.markup.XhtmlPageBuilder;
import com.williamcallahan.crossref.support.AsciiTextNormalizer;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jsoup.nodes.Element;

/**
 * Renders the consolidated notes page: one group per chapter in reading order, headed by the
 * chapter title, footnotes before endnotes.
 */
public final class NotesPageRenderer {

    private final NotesOptions options;
    private final String stylesheet;

    public NotesPageRenderer(NotesOptions options, String stylesheet) {
        this.options = Objects.requireNonNull(options, "Notes options cannot be null");
        this.stylesheet = stylesheet;
    }

    /**
     * @param chapters notes grouped per chapter
     * @param noteContents rewritten body markup by note id; a note without an entry renders its routed content
     */
    public GeneratedPage render(List<ChapterNotes> chapters, Map<String, String> noteContents) {
        XhtmlPageBuilder page = XhtmlPageBuilder.page(options.title(), stylesheet);
        Element container = page.body().appendElement("section")
            .addClass("notes")
            .attr("epub:type", "endnotes")
            .attr("role", "doc-endnotes");
        container.appendElement("h1").text(options.title());

        for (ChapterNotes chapter : chapters) {
            if (chapter.isEmpty()) {
                continue;
            }
            Element group = container.appendElement("section")
                .addClass("chapter-notes")
                .attr("id", "notes-" + chapterSlug(chapter.chapterFile()));
            if (options.includeChapterHeadings()) {
                group.appendElement("h2").addClass("chapter-title")
                    .appendElement("a").attr("href", chapter.chapterFile()).text(chapter.chapterTitle());
            }
            renderList(group, chapter.footnotes(), noteContents);
            renderList(group, chapter.endnotes(), noteContents);
        }
        return new GeneratedPage(options.fileName(), options.title(), page.render());
    }

    private void renderList(Element group, List<Note> notes, Map<String, String> noteContents) {
        if (notes.isEmpty()) {
            return;
        }
        Element list = group.appendElement("ol").addClass(notes.get(0).kind().cssClass() + "s");
        for (Note note : notes) {
            Element item = list.appendElement("li")
                .attr("id", note.id())
                .addClass(note.kind().cssClass())
                .attr("epub:type", note.kind().epubType())
                .attr("role", note.kind().ariaRole());
            item.appendElement("span").addClass("note-number")
                .text(options.numberingFor(note.kind()).format(note.number()));
            item.appendText(" ");
            XhtmlMarkup.appendMarkup(item, noteContents.getOrDefault(note.id(), note.content()));
        }
    }

    private static String chapterSlug(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String slug = AsciiTextNormalizer.slugify(stem);
        return slug.isEmpty() ? "chapter" : slug;
    }
}
