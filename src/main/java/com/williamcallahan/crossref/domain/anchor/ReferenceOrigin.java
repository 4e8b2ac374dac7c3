package com.williamcallahan.crossref.domain.anchor;

/**
 * Markup construct a reference call was read from.
 */
public enum ReferenceOrigin {
    /** {@code <a href="#key">} or {@code <a href="file.xhtml#key">} */
    LINK,
    /** {@code <span class="crossref" data-ref="key">} */
    CROSS_REF_SPAN,
    /** {@code <!-- REF key -->text<!-- /REF -->} */
    REF_COMMENT,
    /** footnote or endnote citation */
    NOTE_CALL
}
