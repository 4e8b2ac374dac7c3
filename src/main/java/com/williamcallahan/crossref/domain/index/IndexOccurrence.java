package com.williamcallahan.crossref.domain.index;

import java.util.Objects;

/**
 * One place in the document where an index term was marked.
 *
 * @param file output file holding the marker
 * @param anchorId final id of the occurrence anchor
 * @param position document-order position inside the chunk
 * @param primary whether the occurrence is the main discussion of the term
 */
public record IndexOccurrence(String file, String anchorId, int position, boolean primary) {

    public IndexOccurrence {
        Objects.requireNonNull(file, "Occurrence file cannot be null");
        Objects.requireNonNull(anchorId, "Occurrence anchor id cannot be null");
        if (position < 0) {
            throw new IllegalArgumentException("Occurrence position must be non-negative");
        }
    }

    /**
     * @return link from the index page to the occurrence
     */
    public String href() {
        return file + "#" + anchorId;
    }
}
