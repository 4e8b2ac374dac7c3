package com.williamcallahan.crossref.domain.notes;

import java.util.List;
import java.util.Objects;

/**
 * Notes grouped under one chapter, footnotes and endnotes each ordered by number.
 */
public record ChapterNotes(String chapterTitle, String chapterFile, List<Note> footnotes, List<Note> endnotes) {

    public ChapterNotes {
        Objects.requireNonNull(chapterTitle, "Chapter title cannot be null");
        Objects.requireNonNull(chapterFile, "Chapter file cannot be null");
        footnotes = footnotes == null ? List.of() : List.copyOf(footnotes);
        endnotes = endnotes == null ? List.of() : List.copyOf(endnotes);
    }

    public boolean isEmpty() {
        return footnotes.isEmpty() && endnotes.isEmpty();
    }
}
