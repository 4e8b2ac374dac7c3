package com.williamcallahan.crossref.domain.index;

import java.util.Objects;

/**
 * A "see" / "see also" clause that could not be linked to an entry.
 *
 * @param entryText entry carrying the clause
 * @param reference raw clause target
 * @param seeAlso true for "see also", false for "see"
 * @param reason why it was dropped
 */
public record UnresolvedIndexReference(String entryText, String reference, boolean seeAlso, Reason reason) {

    public UnresolvedIndexReference {
        Objects.requireNonNull(entryText, "Entry text cannot be null");
        Objects.requireNonNull(reference, "Reference cannot be null");
        Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public enum Reason {
        /** No entry with that normalized key exists. */
        NO_SUCH_ENTRY,
        /** The clause points back at the entry itself. */
        SELF_REFERENCE
    }
}
