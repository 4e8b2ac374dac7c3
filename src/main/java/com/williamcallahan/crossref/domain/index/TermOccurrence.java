package com.williamcallahan.crossref.domain.index;

import java.util.Objects;

/**
 * A parsed index marker paired with the anchor it was given at the merge barrier.
 */
public record TermOccurrence(IndexTerm term, IndexOccurrence occurrence) {

    public TermOccurrence {
        Objects.requireNonNull(term, "Index term cannot be null");
        Objects.requireNonNull(occurrence, "Index occurrence cannot be null");
    }
}
