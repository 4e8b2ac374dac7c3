package com.williamcallahan.crossref.service.anchor;

import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import com.williamcallahan.crossref.domain.index.TermOccurrence;
import com.williamcallahan.crossref.domain.markup.Chapter;
import com.williamcallahan.crossref.domain.markup.MarkerWarning;
import com.williamcallahan.crossref.domain.notes.NoteDeclaration;
import com.williamcallahan.crossref.domain.report.IdAssignmentFailure;
import com.williamcallahan.crossref.service.scan.ChunkScan;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State of a run after the merge barrier. The registry is frozen; everything here is read-only.
 *
 * @param registry frozen registry
 * @param chapters chunks in reading order with resolved titles
 * @param scans scan results in input order
 * @param assignedIds per file, final ids keyed by node position
 * @param references cross-reference calls in file then discovery order
 * @param noteCalls note calls carrying their final ids, same order
 * @param noteDeclarations note bodies in registration order
 * @param termOccurrences index markers with their anchors
 * @param idFailures targets left without an id
 * @param warnings malformed markers from every chunk
 */
public record MergedDocument(
    AnchorRegistry registry,
    List<Chapter> chapters,
    List<ChunkScan> scans,
    Map<String, Map<Integer, String>> assignedIds,
    List<ReferenceCall> references,
    List<ReferenceCall> noteCalls,
    List<NoteDeclaration> noteDeclarations,
    List<TermOccurrence> termOccurrences,
    List<IdAssignmentFailure> idFailures,
    List<MarkerWarning> warnings
) {

    public MergedDocument {
        Objects.requireNonNull(registry, "Registry cannot be null");
        if (!registry.isFrozen()) {
            throw new IllegalArgumentException("Merged document needs a frozen registry");
        }
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
        scans = scans == null ? List.of() : List.copyOf(scans);
        Map<String, Map<Integer, String>> ids = new LinkedHashMap<>();
        if (assignedIds != null) {
            assignedIds.forEach((file, byPosition) ->
                ids.put(file, Collections.unmodifiableMap(new LinkedHashMap<>(byPosition))));
        }
        assignedIds = Collections.unmodifiableMap(ids);
        references = references == null ? List.of() : List.copyOf(references);
        noteCalls = noteCalls == null ? List.of() : List.copyOf(noteCalls);
        noteDeclarations = noteDeclarations == null ? List.of() : List.copyOf(noteDeclarations);
        termOccurrences = termOccurrences == null ? List.of() : List.copyOf(termOccurrences);
        idFailures = idFailures == null ? List.of() : List.copyOf(idFailures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Final ids assigned in one file, keyed by node position.
     */
    public Map<Integer, String> idsIn(String file) {
        return assignedIds.getOrDefault(file, Map.of());
    }

    public Optional<Chapter> chapter(String file) {
        return chapters.stream().filter(chapter -> chapter.fileName().equals(file)).findFirst();
    }

    public int indexMarkersFound() {
        return scans.stream().mapToInt(scan -> scan.indexMarkers().size()).sum();
    }
}
