package com.williamcallahan.crossref.service.scan;

import com.williamcallahan.crossref.domain.notes.NoteKind;
import java.util.Objects;

/**
 * A footnote or endnote body.
 *
 * @param kind footnote or endnote
 * @param candidateId id the body carries
 * @param content inner markup of the body
 * @param plainText markup-free text
 * @param position document-order position of the body element
 * @param extent number of nodes inside the body
 */
public record NoteBodyMarker(NoteKind kind, String candidateId, String content, String plainText, int position,
                             int extent) {

    public NoteBodyMarker {
        Objects.requireNonNull(kind, "Note kind cannot be null");
        Objects.requireNonNull(candidateId, "Note body id cannot be null");
        content = content == null ? "" : content;
        plainText = plainText == null ? "" : plainText;
    }
}
