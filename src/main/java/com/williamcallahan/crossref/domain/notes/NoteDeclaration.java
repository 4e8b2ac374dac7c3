package com.williamcallahan.crossref.domain.notes;

import java.util.Objects;

/**
 * A note body as registered at the merge barrier, before calls are linked.
 *
 * @param id final id
 * @param originalId id the body carried in the markup
 * @param kind footnote or endnote
 * @param number sequence number per kind (restarted per chapter when configured)
 * @param content inner markup of the body
 * @param plainText markup-free text
 * @param originalFile file the body was declared in
 * @param position document-order position inside that file
 * @param extent number of nodes inside the body, which directly follow {@code position}
 */
public record NoteDeclaration(
    String id,
    String originalId,
    NoteKind kind,
    int number,
    String content,
    String plainText,
    String originalFile,
    int position,
    int extent
) {

    public NoteDeclaration {
        Objects.requireNonNull(id, "Note id cannot be null");
        Objects.requireNonNull(originalId, "Original note id cannot be null");
        Objects.requireNonNull(kind, "Note kind cannot be null");
        Objects.requireNonNull(originalFile, "Note file cannot be null");
        if (number < 1) {
            throw new IllegalArgumentException("Note number must be positive");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Note position must be non-negative");
        }
        if (extent < 0) {
            throw new IllegalArgumentException("Note extent must be non-negative");
        }
        content = content == null ? "" : content;
        plainText = plainText == null ? "" : plainText;
    }

    /**
     * Whether the node at {@code nodePosition} of the declaring file is the body or lies inside it.
     */
    public boolean covers(int nodePosition) {
        return nodePosition >= position && nodePosition <= position + extent;
    }
}
