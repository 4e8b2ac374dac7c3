package com.williamcallahan.crossref.domain.markup;

import java.util.Objects;

/**
 * A standalone XHTML page produced by the engine (index page, consolidated notes page).
 */
public record GeneratedPage(String fileName, String title, String markup) {

    public GeneratedPage {
        Objects.requireNonNull(fileName, "Page file name cannot be null");
        Objects.requireNonNull(title, "Page title cannot be null");
        Objects.requireNonNull(markup, "Page markup cannot be null");
    }
}
