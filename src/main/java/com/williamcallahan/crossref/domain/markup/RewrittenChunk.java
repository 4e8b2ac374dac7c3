package com.williamcallahan.crossref.domain.markup;

import java.util.Objects;

/**
 * A chunk after ids, hrefs and notes were applied.
 */
public record RewrittenChunk(String fileName, String markup) {

    public RewrittenChunk {
        Objects.requireNonNull(fileName, "Chunk file name cannot be null");
        Objects.requireNonNull(markup, "Chunk markup cannot be null");
    }
}
