package com.williamcallahan.crossref.service.scan;

import com.williamcallahan.crossref.domain.markup.MarkerWarning;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the scanner found in one chunk, each list in document order.
 *
 * @param fileName chunk file name
 * @param firstHeading text of the first non-empty heading, null when the chunk has none
 * @param targets headings, figures, tables and bookmarks
 * @param references cross-references
 * @param indexMarkers index markers
 * @param noteCalls note citations
 * @param noteBodies note bodies
 * @param warnings malformed markers that were skipped
 */
public record ChunkScan(
    String fileName,
    String firstHeading,
    List<TargetMarker> targets,
    List<ReferenceMarker> references,
    List<IndexMarker> indexMarkers,
    List<NoteCallMarker> noteCalls,
    List<NoteBodyMarker> noteBodies,
    List<MarkerWarning> warnings
) {

    public ChunkScan {
        Objects.requireNonNull(fileName, "File name cannot be null");
        targets = targets == null ? List.of() : List.copyOf(targets);
        references = references == null ? List.of() : List.copyOf(references);
        indexMarkers = indexMarkers == null ? List.of() : List.copyOf(indexMarkers);
        noteCalls = noteCalls == null ? List.of() : List.copyOf(noteCalls);
        noteBodies = noteBodies == null ? List.of() : List.copyOf(noteBodies);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Optional<String> firstHeadingValue() {
        return Optional.ofNullable(firstHeading);
    }
}
