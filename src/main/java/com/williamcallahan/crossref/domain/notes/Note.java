package com.williamcallahan.crossref.domain.notes;

import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A routed footnote or endnote: its calls, where it renders, and its content with back-links.
 *
 * @param declaration the registered body
 * @param calls call sites in document order
 * @param content body markup, augmented with back-references when enabled
 * @param chapterFile file of the chapter the note belongs to (first call, else its own file)
 * @param chapterTitle title of that chapter
 * @param targetFile file the body renders in after placement
 * @param backReferences href of each call site keyed by call id, empty when back-links are off
 */
public record Note(
    NoteDeclaration declaration,
    List<ReferenceCall> calls,
    String content,
    String chapterFile,
    String chapterTitle,
    String targetFile,
    Map<String, String> backReferences
) {

    public Note {
        Objects.requireNonNull(declaration, "Note declaration cannot be null");
        Objects.requireNonNull(chapterFile, "Chapter file cannot be null");
        Objects.requireNonNull(chapterTitle, "Chapter title cannot be null");
        Objects.requireNonNull(targetFile, "Target file cannot be null");
        calls = calls == null ? List.of() : List.copyOf(calls);
        content = content == null ? "" : content;
        backReferences = backReferences == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(backReferences));
    }

    public String id() {
        return declaration.id();
    }

    public NoteKind kind() {
        return declaration.kind();
    }

    public int number() {
        return declaration.number();
    }

    public String originalFile() {
        return declaration.originalFile();
    }

    public boolean relocated() {
        return !targetFile.equals(declaration.originalFile());
    }
}
