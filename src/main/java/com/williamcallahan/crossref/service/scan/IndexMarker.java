package com.williamcallahan.crossref.service.scan;

import com.williamcallahan.crossref.domain.index.IndexTerm;
import java.util.Objects;

/**
 * An index marker with its entry text already parsed.
 *
 * @param term parsed entry
 * @param candidateId id found on the marker element or on the anchor following an XE comment
 * @param position document-order position of the marker element or comment
 * @param comment whether the marker is an XE comment, which needs an inserted anchor element
 */
public record IndexMarker(IndexTerm term, String candidateId, int position, boolean comment) {

    public IndexMarker {
        Objects.requireNonNull(term, "Index term cannot be null");
    }
}
