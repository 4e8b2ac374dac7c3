package com.williamcallahan.crossref.service.scan;

import java.util.Objects;

/**
 * A footnote or endnote citation.
 *
 * @param candidateId id of the call link, or of its wrapper when {@code idOnWrapper}
 * @param noteKey fragment the call points at
 * @param displayText visible call text
 * @param position document-order position of the call link
 * @param idOnWrapper whether the id lives on the {@code sup}/{@code span} wrapper
 * @param noteFile file named before the fragment of the call href, null for a same-file fragment
 */
public record NoteCallMarker(String candidateId, String noteKey, String displayText, int position, boolean idOnWrapper,
                             String noteFile) {

    public NoteCallMarker {
        Objects.requireNonNull(noteKey, "Note key cannot be null");
        displayText = displayText == null ? "" : displayText;
    }
}
