package com.williamcallahan.crossref.domain.markup;

import java.util.Objects;

/**
 * A chunk's place in reading order with its resolved chapter title.
 */
public record Chapter(int index, String fileName, String title) {

    public Chapter {
        Objects.requireNonNull(fileName, "Chapter file name cannot be null");
        Objects.requireNonNull(title, "Chapter title cannot be null");
        if (index < 0) {
            throw new IllegalArgumentException("Chapter index must be non-negative");
        }
    }
}
