package com.williamcallahan.crossref.service.rewrite;

import com.williamcallahan.crossref.domain.anchor.ResolvedReference;
import com.williamcallahan.crossref.domain.markup.DocumentChunk;
import com.williamcallahan.crossref.domain.markup.RewrittenChunk;
import com.williamcallahan.crossref.domain.notes.Note;
import com.williamcallahan.crossref.domain.notes.NoteKind;
import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.service.markup.XhtmlMarkup;
import com.williamcallahan.crossref.service.notes.BackReferenceWriter;
import com.williamcallahan.crossref.service.rewrite.RewritePlan.CallRewrite;
import com.williamcallahan.crossref.service.scan.MarkerScanner;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link RewritePlan} to one chunk.
 *
 * <p>The chunk is parsed again and the plan's node positions are mapped to nodes before
 * anything is mutated, so edits never shift the positions of later markers. Broken references
 * and orphan note calls are left exactly as authored.</p>
 */
public final class MarkupRewriter {

    private static final Logger log = LoggerFactory.getLogger(MarkupRewriter.class);
    private static final Set<String> NOTE_CONTAINER_TYPES = Set.of("footnotes", "endnotes", "rearnotes");
    private static final Set<String> LIST_TAGS = Set.of("ol", "ul");

    /**
     * Rewrites a chunk whose notes all stay within the chunk or its own footnotes section.
     *
     * @param chunk original chunk
     * @param plan rewrite plan for this chunk
     * @return serialized result
     */
    public RewrittenChunk rewrite(DocumentChunk chunk, RewritePlan plan) {
        ChunkRewrite rewrite = apply(chunk, plan);
        return complete(rewrite, rewrite.noteContents());
    }

    /**
     * Applies ids, calls and references, then settles every note body: a body that stays is
     * refilled with its rewritten markup plus back-links, a body that leaves is removed and its
     * rewritten markup kept in {@link ChunkRewrite#noteContents()}.
     *
     * @param chunk original chunk
     * @param plan rewrite plan for this chunk
     * @return the rewritten tree, not serialized yet
     */
    public ChunkRewrite apply(DocumentChunk chunk, RewritePlan plan) {
        Objects.requireNonNull(chunk, "Chunk cannot be null");
        Objects.requireNonNull(plan, "Plan cannot be null");
        Document document = XhtmlMarkup.parse(chunk.markup());
        List<Node> nodes = XhtmlMarkup.nodesInOrder(document);

        plan.targetIds().forEach((position, id) -> applyTargetId(nodeAt(nodes, position), id));
        plan.calls().forEach((position, call) -> applyCall(nodeAt(nodes, position), call));
        plan.references().forEach((position, reference) -> applyReference(nodeAt(nodes, position), reference));

        Map<String, String> noteContents = new LinkedHashMap<>();
        List<Element> removed = new ArrayList<>();
        for (Map.Entry<Integer, Note> entry : new TreeMap<>(plan.noteBodies()).entrySet()) {
            Note note = entry.getValue();
            if (nodeAt(nodes, entry.getKey()) instanceof Element body) {
                String content = noteContent(body, note, plan.backReferences());
                noteContents.put(note.id(), content);
                if (leavesChunk(plan.placement(), note)) {
                    removed.add(body);
                } else {
                    applyNoteBody(body, note, plan.placement(), content);
                }
            }
        }
        removeNoteBodies(removed);
        return new ChunkRewrite(chunk.fileName(), document, plan, noteContents, removed.size());
    }

    /**
     * Appends relocated footnotes and serializes.
     *
     * @param rewrite result of {@link #apply(DocumentChunk, RewritePlan)}
     * @param noteContents rewritten note markup of the whole run, keyed by note id
     * @return serialized result
     */
    public RewrittenChunk complete(ChunkRewrite rewrite, Map<String, String> noteContents) {
        Objects.requireNonNull(rewrite, "Chunk rewrite cannot be null");
        Objects.requireNonNull(noteContents, "Note contents cannot be null");
        RewritePlan plan = rewrite.plan();
        if (!plan.relocatedFootnotes().isEmpty()) {
            appendFootnotesSection(rewrite.document(), plan, noteContents);
        }
        log.debug("Rewrote {}: {} ids, {} references, {} calls, {} note bodies ({} moved out)",
            rewrite.fileName(), plan.targetIds().size(), plan.references().size(), plan.calls().size(),
            plan.noteBodies().size(), rewrite.removedBodies());
        return new RewrittenChunk(rewrite.fileName(), XhtmlMarkup.serialize(rewrite.document()));
    }

    private void applyTargetId(Node node, String id) {
        if (node instanceof Element element) {
            element.attr("id", id);
        } else if (node instanceof Comment comment) {
            Optional<Element> anchor = MarkerScanner.followingIndexAnchor(comment);
            if (anchor.isPresent()) {
                anchor.get().attr("id", id);
            } else {
                Element inserted = new Element("span").attr("id", id).addClass(MarkerScanner.INDEX_ANCHOR_CLASS);
                comment.after(inserted);
            }
        }
    }

    private void applyCall(Node node, CallRewrite call) {
        if (!(node instanceof Element link)) {
            return;
        }
        Element wrapper = link.parent();
        if (call.idOnWrapper() && wrapper != null) {
            wrapper.attr("id", call.id());
        } else {
            link.attr("id", call.id());
        }
        link.attr("href", call.href());
        if (!XhtmlMarkup.epubType(link).contains("noteref")) {
            link.attr("epub:type", "noteref");
        }
        link.attr("role", "doc-noteref");
        if (call.label() != null) {
            link.text(call.label());
        }
    }

    private void applyReference(Node node, ResolvedReference reference) {
        String href = reference.href();
        switch (reference.call().origin()) {
            case LINK -> {
                if (node instanceof Element link) {
                    link.attr("href", href).addClass(MarkerScanner.CROSS_REF_CLASS);
                }
            }
            case CROSS_REF_SPAN -> {
                if (node instanceof Element span) {
                    Element link = crossRefLink(href);
                    if (!span.id().isBlank()) {
                        link.attr("id", span.id());
                    }
                    span.before(link);
                    for (Node child : new ArrayList<>(span.childNodes())) {
                        link.appendChild(child);
                    }
                    span.remove();
                }
            }
            case REF_COMMENT -> {
                if (node instanceof Comment opening) {
                    MarkerScanner.closingRefComment(opening).ifPresent(closing -> {
                        Element link = crossRefLink(href);
                        opening.before(link);
                        Node sibling = opening.nextSibling();
                        while (sibling != null && sibling != closing) {
                            Node next = sibling.nextSibling();
                            link.appendChild(sibling);
                            sibling = next;
                        }
                        opening.remove();
                        closing.remove();
                    });
                }
            }
            case NOTE_CALL -> log.debug("Note call {} is rewritten by the notes pass", reference.call().id());
        }
    }

    // Inner markup after ids, calls and references were applied, with back-links to its calls.
    private static String noteContent(Element body, Note note, BackReferenceWriter backReferences) {
        String content = body.html();
        if (backReferences == null || note.backReferences().isEmpty()) {
            return content;
        }
        return backReferences.augment(content, note.backReferences()).content();
    }

    private void applyNoteBody(Element body, Note note, NotePlacement placement, String content) {
        body.attr("id", note.id());
        if (!XhtmlMarkup.epubType(body).contains(note.kind().epubType())) {
            body.attr("epub:type", note.kind().epubType());
        }
        body.attr("role", note.kind().ariaRole());
        if (placement == NotePlacement.POPUP && XhtmlMarkup.tagName(body).equals("div")) {
            body.tagName("aside");
        }
        body.empty();
        XhtmlMarkup.appendMarkup(body, content);
    }

    private static boolean leavesChunk(NotePlacement placement, Note note) {
        return placement == NotePlacement.CONSOLIDATED
            || (placement == NotePlacement.INLINE && note.kind() == NoteKind.FOOTNOTE);
    }

    // Removes bodies, then note containers and lists they leave without content.
    private void removeNoteBodies(List<Element> bodies) {
        List<Element> parents = new ArrayList<>();
        for (Element body : bodies) {
            Element parent = body.parent();
            body.remove();
            if (parent != null) {
                parents.add(parent);
            }
        }
        for (Element parent : parents) {
            Element current = parent;
            while (current != null && current.parent() != null && isDisposableContainer(current)) {
                Element next = current.parent();
                current.remove();
                current = next;
            }
        }
    }

    private static boolean isDisposableContainer(Element element) {
        String tag = XhtmlMarkup.tagName(element);
        if (LIST_TAGS.contains(tag)) {
            return element.children().isEmpty() && element.ownText().isBlank();
        }
        boolean noteContainer = NOTE_CONTAINER_TYPES.stream().anyMatch(type ->
            XhtmlMarkup.hasClass(element, type) || XhtmlMarkup.epubType(element).contains(type));
        if (!noteContainer) {
            return false;
        }
        for (Element child : element.children()) {
            String childTag = XhtmlMarkup.tagName(child);
            if (!childTag.matches("h[1-6]") && !childTag.equals("hr")) {
                return false;
            }
        }
        return element.ownText().isBlank();
    }

    private void appendFootnotesSection(Document document, RewritePlan plan, Map<String, String> noteContents) {
        Element host = Optional.ofNullable(document.selectFirst("body")).orElse(document);
        Element section = new Element("section")
            .addClass(MarkerScanner.GENERATED_FOOTNOTES_CLASS)
            .attr("epub:type", "footnotes");
        if (!plan.notesSectionTitle().isBlank()) {
            section.appendElement("h2").text(plan.notesSectionTitle());
        }
        for (Note note : plan.relocatedFootnotes()) {
            Element aside = section.appendElement("aside")
                .attr("id", note.id())
                .addClass(note.kind().cssClass())
                .attr("epub:type", note.kind().epubType())
                .attr("role", note.kind().ariaRole());
            XhtmlMarkup.appendMarkup(aside, noteContents.getOrDefault(note.id(), note.content()));
        }
        host.appendChild(section);
    }

    private static Node nodeAt(List<Node> nodes, int position) {
        if (position < 0 || position >= nodes.size()) {
            throw new IllegalStateException("Marker position " + position + " is outside the parsed chunk");
        }
        return nodes.get(position);
    }

    private static Element crossRefLink(String href) {
        return new Element("a").attr("href", href).addClass(MarkerScanner.CROSS_REF_CLASS);
    }
}
