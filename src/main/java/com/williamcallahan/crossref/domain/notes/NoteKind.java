package com.williamcallahan.crossref.domain.notes;

import com.williamcallahan.crossref.domain.anchor.AnchorKind;

/**
 * Footnote or endnote, with the EPUB semantics used when rewriting markup.
 */
public enum NoteKind {
    FOOTNOTE("footnote", "doc-footnote", AnchorKind.FOOTNOTE),
    ENDNOTE("endnote", "doc-endnote", AnchorKind.ENDNOTE);

    private final String epubType;
    private final String ariaRole;
    private final AnchorKind anchorKind;

    NoteKind(String epubType, String ariaRole, AnchorKind anchorKind) {
        this.epubType = epubType;
        this.ariaRole = ariaRole;
        this.anchorKind = anchorKind;
    }

    public String epubType() {
        return epubType;
    }

    public String ariaRole() {
        return ariaRole;
    }

    public AnchorKind anchorKind() {
        return anchorKind;
    }

    /** CSS class used on rendered note bodies. */
    public String cssClass() {
        return epubType;
    }
}
