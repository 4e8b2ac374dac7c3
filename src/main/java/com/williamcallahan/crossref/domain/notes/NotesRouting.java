package com.williamcallahan.crossref.domain.notes;

import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of routing notes: where every note renders and what every call links to.
 *
 * @param placement policy that was applied
 * @param notes routed notes in registration order
 * @param callHrefs note call id to href of its note
 * @param orphanCalls calls whose note does not exist
 * @param chapters notes grouped per chapter in reading order
 * @param backReferencesGenerated number of notes that received back-links in this run
 */
public record NotesRouting(
    NotePlacement placement,
    List<Note> notes,
    Map<String, String> callHrefs,
    List<ReferenceCall> orphanCalls,
    List<ChapterNotes> chapters,
    int backReferencesGenerated
) {

    public NotesRouting {
        Objects.requireNonNull(placement, "Placement cannot be null");
        notes = notes == null ? List.of() : List.copyOf(notes);
        callHrefs = callHrefs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(callHrefs));
        orphanCalls = orphanCalls == null ? List.of() : List.copyOf(orphanCalls);
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }

    public Optional<Note> note(String id) {
        return notes.stream().filter(note -> note.id().equals(id)).findFirst();
    }

    public long count(NoteKind kind) {
        return notes.stream().filter(note -> note.kind() == kind).count();
    }

    public int callCount() {
        return notes.stream().mapToInt(note -> note.calls().size()).sum() + orphanCalls.size();
    }
}
