package com.williamcallahan.crossref.domain.notes;

/**
 * Where note bodies end up after routing. The policies are mutually exclusive.
 */
public enum NotePlacement {
    /** Footnotes move to the end of their chapter file; endnotes stay where they are. */
    INLINE,
    /** Every note leaves the chapter files and lands on one generated notes page. */
    CONSOLIDATED,
    /** Notes stay in place; only ids and links are added. */
    LINKED,
    /** Like {@link #LINKED}, with note bodies turned into {@code aside} elements for reader pop-ups. */
    POPUP
}
