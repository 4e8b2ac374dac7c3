package com.williamcallahan.crossref.domain.markup;

import java.util.Objects;
import java.util.Optional;

/**
 * One output file produced by the upstream splitter.
 *
 * @param markup XHTML document or fragment
 * @param fileName output file name, used verbatim in cross-file hrefs
 * @param chapterTitle chapter title, null to derive one
 */
public record DocumentChunk(String markup, String fileName, String chapterTitle) {

    public DocumentChunk {
        Objects.requireNonNull(markup, "Chunk markup cannot be null");
        Objects.requireNonNull(fileName, "Chunk file name cannot be null");
        if (fileName.isBlank()) {
            throw new IllegalArgumentException("Chunk file name cannot be blank");
        }
        if (fileName.contains("#")) {
            throw new IllegalArgumentException("Chunk file name cannot contain '#': " + fileName);
        }
    }

    public static DocumentChunk of(String markup, String fileName) {
        return new DocumentChunk(markup, fileName, null);
    }

    public Optional<String> chapterTitleValue() {
        return Optional.ofNullable(chapterTitle).filter(title -> !title.isBlank());
    }
}
