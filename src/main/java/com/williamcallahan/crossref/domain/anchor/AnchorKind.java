package com.williamcallahan.crossref.domain.anchor;

/**
 * Kinds of addressable elements. The label is the middle segment of derived ids
 * ({@code ref-heading-introduction}).
 */
public enum AnchorKind {
    HEADING("heading", true),
    FIGURE("figure", true),
    TABLE("table", true),
    BOOKMARK("bookmark", true),
    FOOTNOTE("footnote", false),
    ENDNOTE("endnote", false),
    INDEX_TERM("indexterm", false),
    NOTE_CALL("notecall", false);

    private final String label;
    private final boolean textMatchable;

    AnchorKind(String label, boolean textMatchable) {
        this.label = label;
        this.textMatchable = textMatchable;
    }

    /**
     * @return lowercase label used when deriving ids
     */
    public String label() {
        return label;
    }

    /**
     * Whether free-text references may match this kind by title containment.
     * Notes, call sites and index occurrences are only reachable by id.
     *
     * @return true for headings, figures, tables and bookmarks
     */
    public boolean textMatchable() {
        return textMatchable;
    }
}
