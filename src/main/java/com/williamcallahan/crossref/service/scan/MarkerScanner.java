package com.williamcallahan.crossref.service.scan;

import com.williamcallahan.crossref.domain.anchor.AnchorKind;
import com.williamcallahan.crossref.domain.anchor.ReferenceOrigin;
import com.williamcallahan.crossref.domain.index.IndexTerm;
import com.williamcallahan.crossref.domain.markup.DocumentChunk;
import com.williamcallahan.crossref.domain.markup.MarkerWarning;
import com.williamcallahan.crossref.domain.markup.MarkerWarning.WarningType;
import com.williamcallahan.crossref.domain.notes.NoteKind;
import com.williamcallahan.crossref.service.index.IndexTermParser;
import com.williamcallahan.crossref.service.markup.XhtmlMarkup;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts typed markers from one chunk. Stateless and safe to call from several threads.
 *
 * <p>Each node is classified at most once, in document order. Precedence for an element is:
 * generated link (ignored), note call, note body, target, index marker, cross-reference.
 * Malformed markers are skipped with a warning.</p>
 */
public final class MarkerScanner {

    private static final Logger log = LoggerFactory.getLogger(MarkerScanner.class);

    public static final String NOTE_BACK_REF_CLASS = "note-back-ref";
    public static final String NOTE_BACK_REFS_CLASS = "note-back-refs";
    public static final String INDEX_ANCHOR_CLASS = "index-anchor";
    public static final String CROSS_REF_CLASS = "cross-ref";
    public static final String GENERATED_FOOTNOTES_CLASS = "footnotes";

    private static final Pattern XE_COMMENT = Pattern.compile("^XE\\s+\"(.*)\"$", Pattern.DOTALL);
    private static final Pattern REF_OPEN = Pattern.compile("^REF(?:\\s+(.*))?$", Pattern.DOTALL);
    private static final String REF_CLOSE = "/REF";
    private static final Pattern HEADING_TAG = Pattern.compile("h[1-6]");
    private static final Pattern NOTE_LIST_ITEM_ID = Pattern.compile("(?i)(footnote|endnote|fn|en)[-_]?\\d+.*");
    private static final Pattern FILE_LINK = Pattern.compile("^([^/:?#\\s]+\\.x?html?)#(.+)$", Pattern.CASE_INSENSITIVE);

    /**
     * Scans a chunk.
     *
     * @param chunk chunk to scan
     * @return markers and warnings in document order
     */
    public ChunkScan scan(DocumentChunk chunk) {
        Document document = XhtmlMarkup.parse(chunk.markup());
        ScanState state = new ScanState(chunk.fileName());
        List<Node> nodes = XhtmlMarkup.nodesInOrder(document);
        for (int position = 0; position < nodes.size(); position++) {
            Node node = nodes.get(position);
            if (node instanceof Comment comment) {
                classifyComment(comment, position, state);
            } else if (node instanceof Element element) {
                classifyElement(element, position, state);
            }
        }
        log.debug("Scanned {}: {} targets, {} references, {} index markers, {} note calls, {} note bodies, {} warnings",
            chunk.fileName(), state.targets.size(), state.references.size(), state.indexMarkers.size(),
            state.noteCalls.size(), state.noteBodies.size(), state.warnings.size());
        return new ChunkScan(chunk.fileName(), state.firstHeading, state.targets, state.references,
            state.indexMarkers, state.noteCalls, state.noteBodies, state.warnings);
    }

    private void classifyComment(Comment comment, int position, ScanState state) {
        String data = comment.getData().trim();
        Matcher xe = XE_COMMENT.matcher(data);
        if (xe.matches()) {
            Optional<IndexTerm> term = IndexTermParser.parse(xe.group(1));
            if (term.isEmpty()) {
                state.warn(WarningType.MALFORMED_INDEX_MARKER, "XE comment has no entry text", position);
                return;
            }
            String anchorId = followingIndexAnchor(comment).map(Element::id).orElse(null);
            state.indexMarkers.add(new IndexMarker(term.get(), blankToNull(anchorId), position, true));
            return;
        }
        if (data.startsWith("XE")) {
            state.warn(WarningType.MALFORMED_INDEX_MARKER, "XE comment without quoted entry: " + data, position);
            return;
        }
        if (data.equals(REF_CLOSE)) {
            return;
        }
        Matcher ref = REF_OPEN.matcher(data);
        if (!ref.matches()) {
            return;
        }
        String key = ref.group(1) == null ? "" : ref.group(1).trim();
        if (key.isEmpty()) {
            state.warn(WarningType.MALFORMED_REFERENCE, "REF comment without key", position);
            return;
        }
        Optional<Comment> closing = closingRefComment(comment);
        if (closing.isEmpty()) {
            state.warn(WarningType.MALFORMED_REFERENCE, "REF comment '" + key + "' is never closed", position);
            return;
        }
        String display = textBetween(comment, closing.get());
        state.references.add(new ReferenceMarker(state.nextCallId(), key, display, position, ReferenceOrigin.REF_COMMENT,
            null));
    }

    private void classifyElement(Element element, int position, ScanState state) {
        String tag = XhtmlMarkup.tagName(element);
        if (isGeneratedMarkup(element)) {
            return;
        }
        if (tag.equals("a") && isNoteCall(element)) {
            addNoteCall(element, position, state);
            return;
        }
        Optional<NoteKind> noteKind = noteBodyKind(element, tag);
        if (noteKind.isPresent()) {
            addNoteBody(element, noteKind.get(), position, state);
            return;
        }
        if (classifyTarget(element, tag, position, state)) {
            return;
        }
        if (classifyIndexElement(element, tag, position, state)) {
            return;
        }
        classifyReference(element, tag, position, state);
    }

    private boolean classifyTarget(Element element, String tag, int position, ScanState state) {
        if (HEADING_TAG.matcher(tag).matches()) {
            String text = XhtmlMarkup.plainText(element);
            if (text.isEmpty() || isGeneratedSectionHeading(element)) {
                return true;
            }
            if (state.firstHeading == null) {
                state.firstHeading = text;
            }
            int level = tag.charAt(1) - '0';
            state.targets.add(new TargetMarker(AnchorKind.HEADING, blankToNull(element.id()), text, text, position, level, null));
            return true;
        }
        if (tag.equals("figure") || (tag.equals("div") && XhtmlMarkup.hasClass(element, "figure"))) {
            String number = Integer.toString(++state.figureCount);
            String caption = figureCaption(element).orElse("Figure " + number);
            state.targets.add(new TargetMarker(AnchorKind.FIGURE, blankToNull(element.id()), caption,
                XhtmlMarkup.plainText(element), position, 0, number));
            return true;
        }
        if (tag.equals("img") && !element.attr("alt").isBlank() && !insideFigure(element)) {
            String number = Integer.toString(++state.figureCount);
            String alt = element.attr("alt").trim();
            state.targets.add(new TargetMarker(AnchorKind.FIGURE, blankToNull(element.id()), alt, alt, position, 0, number));
            return true;
        }
        if (tag.equals("table")) {
            String number = Integer.toString(++state.tableCount);
            Element caption = element.selectFirst("> caption");
            String title = caption == null || XhtmlMarkup.plainText(caption).isEmpty()
                ? "Table " + number
                : XhtmlMarkup.plainText(caption);
            state.targets.add(new TargetMarker(AnchorKind.TABLE, blankToNull(element.id()), title,
                XhtmlMarkup.plainText(element), position, 0, number));
            return true;
        }
        if (tag.equals("a") && element.hasAttr("name") && !element.hasAttr("href")) {
            String name = element.attr("name").trim();
            if (name.isEmpty()) {
                state.warn(WarningType.MALFORMED_TARGET, "Bookmark without a name", position);
                return true;
            }
            String candidate = element.id().isBlank() ? name : element.id();
            String text = XhtmlMarkup.plainText(element);
            state.targets.add(new TargetMarker(AnchorKind.BOOKMARK, candidate, text.isEmpty() ? name : text,
                text, position, 0, null));
            return true;
        }
        if (tag.equals("span") && element.hasAttr("data-bookmark") && !element.id().isBlank()) {
            String label = element.attr("data-bookmark").trim();
            String text = XhtmlMarkup.plainText(element);
            String title = !label.isEmpty() ? label : text.isEmpty() ? element.id() : text;
            state.targets.add(new TargetMarker(AnchorKind.BOOKMARK, element.id(), title, text, position, 0, null));
            return true;
        }
        return false;
    }

    private boolean classifyIndexElement(Element element, String tag, int position, ScanState state) {
        String entryText;
        if (tag.equals("span") && element.hasAttr("data-index-entry")) {
            entryText = element.attr("data-index-entry");
        } else if (tag.equals("index-entry") && element.hasAttr("entry")) {
            entryText = element.attr("entry");
        } else if (tag.equals("span") && XhtmlMarkup.hasClass(element, "index-marker") && element.hasAttr("data-entry")) {
            entryText = element.attr("data-entry");
        } else {
            return false;
        }
        Optional<IndexTerm> term = IndexTermParser.parse(entryText);
        if (term.isEmpty()) {
            state.warn(WarningType.MALFORMED_INDEX_MARKER, "Index marker has no entry text", position);
            return true;
        }
        state.indexMarkers.add(new IndexMarker(term.get(), blankToNull(element.id()), position, false));
        return true;
    }

    private void classifyReference(Element element, String tag, int position, ScanState state) {
        if (tag.equals("a") && element.hasAttr("href")) {
            String href = element.attr("href");
            linkTargetKey(href).ifPresent(key -> state.references.add(new ReferenceMarker(callId(element, state), key,
                XhtmlMarkup.plainText(element), position, ReferenceOrigin.LINK, linkFile(href).orElse(null))));
            return;
        }
        if (tag.equals("span") && (XhtmlMarkup.hasClass(element, "crossref") || XhtmlMarkup.hasClass(element, CROSS_REF_CLASS))) {
            String text = XhtmlMarkup.plainText(element);
            String key = element.hasAttr("data-ref") ? element.attr("data-ref").trim() : text;
            if (key.isEmpty()) {
                state.warn(WarningType.MALFORMED_REFERENCE, "Cross-reference span without key", position);
                return;
            }
            state.references.add(new ReferenceMarker(callId(element, state), key, text, position, ReferenceOrigin.CROSS_REF_SPAN,
                null));
        }
    }

    private void addNoteCall(Element link, int position, ScanState state) {
        String href = link.attr("href");
        Optional<String> key = fragment(href);
        if (key.isEmpty()) {
            state.warn(WarningType.MALFORMED_NOTE_CALL, "Note call without target fragment", position);
            return;
        }
        Element wrapper = noteCallWrapper(link);
        boolean idOnWrapper = link.id().isBlank() && wrapper != null && !wrapper.id().isBlank();
        String candidate = idOnWrapper ? wrapper.id() : blankToNull(link.id());
        state.noteCalls.add(new NoteCallMarker(candidate, key.get(), XhtmlMarkup.plainText(link), position, idOnWrapper,
            linkFile(href).orElse(null)));
    }

    private void addNoteBody(Element body, NoteKind kind, int position, ScanState state) {
        if (body.id().isBlank()) {
            state.warn(WarningType.MALFORMED_NOTE_BODY, kind.epubType() + " body without id", position);
            return;
        }
        state.noteBodies.add(new NoteBodyMarker(kind, body.id().trim(), body.html(), XhtmlMarkup.plainText(body), position,
            XhtmlMarkup.descendantCount(body)));
    }

    /**
     * Whether a link is a note call: classed or typed as one, or a fragment link wrapped
     * in a note-call {@code sup} or footnote-ref {@code span}.
     */
    static boolean isNoteCall(Element link) {
        if (XhtmlMarkup.hasClass(link, "noteref") || XhtmlMarkup.hasClass(link, "note-call")
                || XhtmlMarkup.hasClass(link, "footnote-ref") || XhtmlMarkup.epubType(link).contains("noteref")) {
            return true;
        }
        return link.hasAttr("href") && noteCallWrapper(link) != null;
    }

    /**
     * Note kind of a body element, empty when the element is not a note body.
     */
    static Optional<NoteKind> noteBodyKind(Element element, String tag) {
        String epubType = XhtmlMarkup.epubType(element);
        if (tag.equals("aside")) {
            if (epubType.contains("endnote") || epubType.contains("rearnote")) {
                return Optional.of(NoteKind.ENDNOTE);
            }
            if (epubType.contains("footnote")) {
                return Optional.of(NoteKind.FOOTNOTE);
            }
            return Optional.empty();
        }
        if (tag.equals("div")) {
            if (XhtmlMarkup.hasClass(element, "endnote")) {
                return Optional.of(NoteKind.ENDNOTE);
            }
            if (XhtmlMarkup.hasClass(element, "footnote")) {
                return Optional.of(NoteKind.FOOTNOTE);
            }
            return Optional.empty();
        }
        if (tag.equals("li") && NOTE_LIST_ITEM_ID.matcher(element.id()).matches()) {
            boolean endnote = element.id().toLowerCase(Locale.ROOT).startsWith("en");
            return Optional.of(endnote ? NoteKind.ENDNOTE : NoteKind.FOOTNOTE);
        }
        return Optional.empty();
    }

    /**
     * The {@code sup.note-call} or {@code span.footnote-ref} directly wrapping a call link.
     */
    static Element noteCallWrapper(Element link) {
        Element parent = link.parent();
        if (parent == null) {
            return null;
        }
        String parentTag = XhtmlMarkup.tagName(parent);
        if ((parentTag.equals("sup") && XhtmlMarkup.hasClass(parent, "note-call"))
                || (parentTag.equals("span") && XhtmlMarkup.hasClass(parent, "footnote-ref"))) {
            return parent;
        }
        return null;
    }

    /**
     * Markup the engine itself generated: back-references and index anchors.
     */
    static boolean isGeneratedMarkup(Element element) {
        if (isIndexAnchor(element)) {
            return true;
        }
        if (!XhtmlMarkup.tagName(element).equals("a")) {
            return false;
        }
        if (XhtmlMarkup.hasClass(element, NOTE_BACK_REF_CLASS)) {
            return true;
        }
        Element parent = element.parent();
        return parent != null && XhtmlMarkup.hasClass(parent, NOTE_BACK_REFS_CLASS);
    }

    // Title of the footnotes section a previous run appended; rebuilt on every run.
    private static boolean isGeneratedSectionHeading(Element heading) {
        Element parent = heading.parent();
        return parent != null && XhtmlMarkup.tagName(parent).equals("section")
            && XhtmlMarkup.hasClass(parent, GENERATED_FOOTNOTES_CLASS)
            && XhtmlMarkup.epubType(parent).contains("footnotes");
    }

    /**
     * Key of a cross-reference link: the fragment of {@code #key} or {@code chapter.xhtml#key}.
     */
    static Optional<String> linkTargetKey(String href) {
        String trimmed = href == null ? "" : href.trim();
        if (trimmed.startsWith("#")) {
            return fragment(trimmed);
        }
        Matcher fileLink = FILE_LINK.matcher(trimmed);
        if (fileLink.matches()) {
            return Optional.of(fileLink.group(2).trim()).filter(key -> !key.isEmpty());
        }
        return Optional.empty();
    }

    /**
     * File part of a {@code file.xhtml#key} href.
     */
    static Optional<String> linkFile(String href) {
        Matcher fileLink = FILE_LINK.matcher(href == null ? "" : href.trim());
        return fileLink.matches() ? Optional.of(fileLink.group(1)) : Optional.empty();
    }

    static Optional<String> fragment(String href) {
        if (href == null) {
            return Optional.empty();
        }
        int hash = href.indexOf('#');
        if (hash < 0) {
            return Optional.empty();
        }
        return Optional.of(href.substring(hash + 1).trim()).filter(key -> !key.isEmpty());
    }

    /**
     * The index anchor a previous run inserted right after an XE comment.
     */
    public static Optional<Element> followingIndexAnchor(Comment comment) {
        Node sibling = comment.nextSibling();
        while (sibling instanceof TextNode text && text.isBlank()) {
            sibling = sibling.nextSibling();
        }
        if (sibling instanceof Element element && isIndexAnchor(element)) {
            return Optional.of(element);
        }
        return Optional.empty();
    }

    // Empty span written after an XE comment; older runs wrote an a element.
    private static boolean isIndexAnchor(Element element) {
        String tag = XhtmlMarkup.tagName(element);
        return (tag.equals("span") || tag.equals("a")) && XhtmlMarkup.hasClass(element, INDEX_ANCHOR_CLASS);
    }

    /**
     * The {@code <!-- /REF -->} sibling closing a REF comment.
     */
    public static Optional<Comment> closingRefComment(Comment opening) {
        Node sibling = opening.nextSibling();
        while (sibling != null) {
            if (sibling instanceof Comment candidate) {
                String data = candidate.getData().trim();
                if (data.equals(REF_CLOSE)) {
                    return Optional.of(candidate);
                }
                if (REF_OPEN.matcher(data).matches()) {
                    return Optional.empty();
                }
            }
            sibling = sibling.nextSibling();
        }
        return Optional.empty();
    }

    private static String textBetween(Comment opening, Comment closing) {
        StringBuilder text = new StringBuilder();
        Node sibling = opening.nextSibling();
        while (sibling != null && sibling != closing) {
            if (sibling instanceof TextNode textNode) {
                text.append(textNode.getWholeText());
            } else if (sibling instanceof Element element) {
                text.append(element.text());
            }
            sibling = sibling.nextSibling();
        }
        return text.toString().trim().replaceAll("\\s+", " ");
    }

    private static Optional<String> figureCaption(Element figure) {
        Element caption = figure.selectFirst("figcaption, p.caption, div.caption");
        return Optional.ofNullable(caption).map(XhtmlMarkup::plainText).filter(text -> !text.isEmpty());
    }

    private static boolean insideFigure(Element element) {
        Element parent = element.parent();
        while (parent != null) {
            String tag = XhtmlMarkup.tagName(parent);
            if (tag.equals("figure") || (tag.equals("div") && XhtmlMarkup.hasClass(parent, "figure"))) {
                return true;
            }
            parent = parent.parent();
        }
        return false;
    }

    private static String callId(Element element, ScanState state) {
        return element.id().isBlank() ? state.nextCallId() : element.id();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static final class ScanState {
        private final String fileName;
        private final List<TargetMarker> targets = new ArrayList<>();
        private final List<ReferenceMarker> references = new ArrayList<>();
        private final List<IndexMarker> indexMarkers = new ArrayList<>();
        private final List<NoteCallMarker> noteCalls = new ArrayList<>();
        private final List<NoteBodyMarker> noteBodies = new ArrayList<>();
        private final List<MarkerWarning> warnings = new ArrayList<>();
        private String firstHeading;
        private int figureCount;
        private int tableCount;
        private int callCount;

        private ScanState(String fileName) {
            this.fileName = fileName;
        }

        private String nextCallId() {
            return "crossref-" + (++callCount);
        }

        private void warn(WarningType type, String message, int position) {
            log.warn("Skipping malformed marker in {} at node {}: {}", fileName, position, message);
            warnings.add(new MarkerWarning(message, type, fileName, position));
        }
    }
}
