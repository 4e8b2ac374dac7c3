package com.williamcallahan.crossref.service.notes;

import com.williamcallahan.crossref.service.markup.XhtmlMarkup;
import com.williamcallahan.crossref.service.scan.MarkerScanner;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Appends back-links from a note body to its call sites.
 *
 * <p>Links live in one {@code <span class="note-back-refs">}. Existing links are matched by the
 * call id in their fragment: a matching link gets its href refreshed, a missing one is appended,
 * so applying the writer again never duplicates links.</p>
 */
public final class BackReferenceWriter {

    private final String symbol;
    private final String title;

    public BackReferenceWriter(String symbol, String title) {
        this.symbol = Objects.requireNonNull(symbol, "Back-reference symbol cannot be null");
        this.title = title == null ? "" : title;
    }

    /**
     * Adds back-links to note content.
     *
     * @param content inner markup of the note body
     * @param callHrefs href of each call site in call order, keyed by call id
     * @return augmented content and the number of links appended
     */
    public Augmented augment(String content, Map<String, String> callHrefs) {
        Objects.requireNonNull(callHrefs, "Call hrefs cannot be null");
        if (callHrefs.isEmpty()) {
            return new Augmented(content, 0);
        }
        Document fragment = XhtmlMarkup.parseFragment(content);
        Element span = fragment.selectFirst("span." + MarkerScanner.NOTE_BACK_REFS_CLASS);
        if (span == null) {
            span = new Element("span").addClass(MarkerScanner.NOTE_BACK_REFS_CLASS);
            hostFor(fragment).appendText(" ").appendChild(span);
        }

        Map<String, Element> existing = new LinkedHashMap<>();
        for (Element link : span.select("a." + MarkerScanner.NOTE_BACK_REF_CLASS)) {
            existing.putIfAbsent(fragmentOf(link.attr("href")), link);
        }

        int appended = 0;
        for (Map.Entry<String, String> call : callHrefs.entrySet()) {
            Element link = existing.get(call.getKey());
            if (link != null) {
                link.attr("href", call.getValue());
                continue;
            }
            if (!span.children().isEmpty()) {
                span.appendText(" ");
            }
            Element backLink = span.appendElement("a")
                .attr("href", call.getValue())
                .addClass(MarkerScanner.NOTE_BACK_REF_CLASS)
                .attr("role", "doc-backlink")
                .text(symbol);
            if (!title.isEmpty()) {
                backLink.attr("title", title);
            }
            appended++;
        }
        return new Augmented(XhtmlMarkup.serializeFragment(fragment), appended);
    }

    /**
     * Counts back-links already present in note content.
     */
    public static int countBackReferences(String content) {
        Document fragment = XhtmlMarkup.parseFragment(content);
        List<Element> links = fragment.select("span." + MarkerScanner.NOTE_BACK_REFS_CLASS
            + " a." + MarkerScanner.NOTE_BACK_REF_CLASS);
        return links.size();
    }

    // Back-links read best at the end of the last paragraph.
    private static Element hostFor(Document fragment) {
        Element last = fragment.children().isEmpty() ? null : fragment.children().last();
        if (last != null && XhtmlMarkup.tagName(last).equals("p")) {
            return last;
        }
        return fragment;
    }

    private static String fragmentOf(String href) {
        int hash = href.indexOf('#');
        return hash < 0 ? href : href.substring(hash + 1);
    }

    /**
     * Content after augmentation.
     *
     * @param content augmented markup
     * @param appended links added by this call
     */
    public record Augmented(String content, int appended) {}
}
