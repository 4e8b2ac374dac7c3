package com.williamcallahan.crossref.service.index;

import com.williamcallahan.crossref.domain.index.IndexEntry;
import com.williamcallahan.crossref.domain.index.IndexModel;
import com.williamcallahan.crossref.domain.index.IndexOccurrence;
import com.williamcallahan.crossref.domain.index.IndexSection;
import com.williamcallahan.crossref.domain.markup.GeneratedPage;
import com.williamcallahan.crossref.service.EngineOptions.IndexOptions;
import com.williamcallahan.crossref.service.markup.XhtmlPageBuilder;
import com.williamcallahan.crossref.support.AsciiTextNormalizer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.jsoup.nodes.Element;

/**
 * Default renderer for the generated index page.
 *
 * <p>Entries are walked depth-first with an explicit stack, never recursively; nesting below
 * {@code maxTocDepth} is cut off and each section renders at most {@code maxEntriesPerLetter}
 * main entries.</p>
 */
public final class IndexPageRenderer {

    private final IndexOptions options;
    private final String stylesheet;

    public IndexPageRenderer(IndexOptions options, String stylesheet) {
        this.options = Objects.requireNonNull(options, "Index options cannot be null");
        this.stylesheet = stylesheet;
    }

    /**
     * Renders the index page.
     *
     * @param model built index
     * @return standalone XHTML page
     */
    public GeneratedPage render(IndexModel model) {
        XhtmlPageBuilder page = XhtmlPageBuilder.page(options.title(), stylesheet);
        Element container = page.body().appendElement("section")
            .addClass("index")
            .attr("epub:type", "index")
            .attr("role", "doc-index");
        container.appendElement("h1").text(options.title());

        for (IndexSection section : model.sections()) {
            Element sectionElement = container.appendElement("div")
                .addClass("index-section")
                .attr("id", sectionId(section));
            if (options.showLetterHeaders()) {
                sectionElement.appendElement("h2").addClass("index-letter").text(section.letter());
            }
            Element list = sectionElement.appendElement("ul").addClass("index-entries");
            List<String> mainIds = section.entryIds();
            int limit = Math.min(mainIds.size(), options.maxEntriesPerLetter());
            for (int position = 0; position < limit; position++) {
                renderTree(model, mainIds.get(position), list);
            }
        }
        return new GeneratedPage(options.fileName(), options.title(), page.render());
    }

    private void renderTree(IndexModel model, String mainId, Element mainList) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(mainId, 1, mainList));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            IndexEntry entry = model.entry(frame.entryId())
                .orElseThrow(() -> new IllegalStateException("Index entry missing from arena: " + frame.entryId()));
            Element item = renderEntry(model, entry, frame);
            if (entry.childIds().isEmpty() || frame.depth() >= options.maxTocDepth()) {
                continue;
            }
            Element childList = item.appendElement("ul").addClass("index-subentries");
            List<String> children = entry.childIds();
            for (int index = children.size() - 1; index >= 0; index--) {
                stack.push(new Frame(children.get(index), frame.depth() + 1, childList));
            }
        }
    }

    private Element renderEntry(IndexModel model, IndexEntry entry, Frame frame) {
        Element item = frame.list().appendElement("li")
            .attr("id", entry.id())
            .addClass("index-entry")
            .addClass("index-level-" + frame.depth());
        Element term = entry.emphasis() ? item.appendElement("strong") : item.appendElement("span");
        term.addClass("index-term").text(entry.text());
        if (options.showOccurrenceCount() && !entry.occurrences().isEmpty()) {
            item.appendText(" ");
            item.appendElement("span").addClass("index-count").text("(" + entry.occurrences().size() + ")");
        }

        List<IndexOccurrence> occurrences = entry.occurrences();
        for (int index = 0; index < occurrences.size(); index++) {
            IndexOccurrence occurrence = occurrences.get(index);
            item.appendText(index == 0 ? " " : ", ");
            item.appendElement("a")
                .attr("href", occurrence.href())
                .addClass(occurrence.primary() ? "index-primary" : "index-occurrence")
                .text(Integer.toString(index + 1));
        }
        appendCrossReferences(model, item, "index-see", "See", entry.resolvedSeeIds());
        appendCrossReferences(model, item, "index-see-also", "See also", entry.resolvedSeeAlsoIds());
        return item;
    }

    private void appendCrossReferences(IndexModel model, Element item, String cssClass, String label, List<String> targetIds) {
        if (targetIds.isEmpty()) {
            return;
        }
        item.appendText(". ");
        Element span = item.appendElement("span").addClass(cssClass);
        span.appendElement("em").text(label);
        span.appendText(" ");
        for (int index = 0; index < targetIds.size(); index++) {
            if (index > 0) {
                span.appendText("; ");
            }
            String targetId = targetIds.get(index);
            span.appendElement("a").attr("href", "#" + targetId).text(displayPath(model, targetId));
        }
    }

    private static String displayPath(IndexModel model, String entryId) {
        IndexEntry entry = model.entry(entryId).orElseThrow();
        return entry.parent()
            .flatMap(model::entry)
            .map(parent -> parent.text() + ": " + entry.text())
            .orElse(entry.text());
    }

    private static String sectionId(IndexSection section) {
        if (section.isSymbols()) {
            return "index-symbols";
        }
        String letter = AsciiTextNormalizer.slugify(section.letter());
        return letter.isEmpty() ? "index-letter-" + Integer.toHexString(section.letter().codePointAt(0)) : "index-" + letter;
    }

    private record Frame(String entryId, int depth, Element list) {}
}
