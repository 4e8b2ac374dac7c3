package com.williamcallahan.crossref.service.rewrite;

import com.williamcallahan.crossref.domain.anchor.ResolvedReference;
import com.williamcallahan.crossref.domain.notes.Note;
import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.service.notes.BackReferenceWriter;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the rewriter applies to one chunk, keyed by node position.
 *
 * @param fileName chunk file name
 * @param placement active note placement
 * @param targetIds final ids of targets and index markers
 * @param references resolved (never broken) references
 * @param calls note calls that found their note
 * @param noteBodies notes declared in this chunk
 * @param relocatedFootnotes footnotes to append at the end of this chunk
 * @param notesSectionTitle heading of the appended footnotes section
 * @param backReferences writer for the back-links of rewritten note bodies, null for none
 */
public record RewritePlan(
    String fileName,
    NotePlacement placement,
    Map<Integer, String> targetIds,
    Map<Integer, ResolvedReference> references,
    Map<Integer, CallRewrite> calls,
    Map<Integer, Note> noteBodies,
    List<Note> relocatedFootnotes,
    String notesSectionTitle,
    BackReferenceWriter backReferences
) {

    public RewritePlan {
        Objects.requireNonNull(fileName, "File name cannot be null");
        Objects.requireNonNull(placement, "Placement cannot be null");
        targetIds = targetIds == null ? Map.of() : Map.copyOf(targetIds);
        references = references == null ? Map.of() : Map.copyOf(references);
        calls = calls == null ? Map.of() : Map.copyOf(calls);
        noteBodies = noteBodies == null ? Map.of() : Map.copyOf(noteBodies);
        relocatedFootnotes = relocatedFootnotes == null ? List.of() : List.copyOf(relocatedFootnotes);
        notesSectionTitle = notesSectionTitle == null ? "" : notesSectionTitle;
    }

    public RewritePlan(String fileName, NotePlacement placement, Map<Integer, String> targetIds,
                       Map<Integer, ResolvedReference> references, Map<Integer, CallRewrite> calls,
                       Map<Integer, Note> noteBodies, List<Note> relocatedFootnotes, String notesSectionTitle) {
        this(fileName, placement, targetIds, references, calls, noteBodies, relocatedFootnotes, notesSectionTitle, null);
    }

    /**
     * How one note call is rewritten.
     *
     * @param id final call id
     * @param href link to the note's final location
     * @param idOnWrapper whether the id belongs on the wrapping {@code sup}/{@code span}
     * @param label new call text, null to keep the authored text
     */
    public record CallRewrite(String id, String href, boolean idOnWrapper, String label) {
        public CallRewrite {
            Objects.requireNonNull(id, "Call id cannot be null");
            Objects.requireNonNull(href, "Call href cannot be null");
        }
    }
}
