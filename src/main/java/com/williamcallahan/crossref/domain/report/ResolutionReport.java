package com.williamcallahan.crossref.domain.report;

import com.williamcallahan.crossref.domain.anchor.AnchorKind;
import com.williamcallahan.crossref.domain.index.UnresolvedIndexReference;
import com.williamcallahan.crossref.domain.markup.MarkerWarning;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Statistics and problems of one resolution run.
 *
 * @param runId identifier of the run, also used in pipeline logs
 * @param targetsByKind registered targets per kind
 * @param references reference call statistics
 * @param index index statistics
 * @param notes note statistics
 * @param collisionsResolved ids that needed a disambiguation suffix
 * @param idFailures targets whose id could not be assigned
 * @param warnings malformed markers that were skipped
 * @param status terminal status derived from the counts above
 */
public record ResolutionReport(
    String runId,
    Map<AnchorKind, Integer> targetsByKind,
    ReferenceStats references,
    IndexStats index,
    NoteStats notes,
    int collisionsResolved,
    List<IdAssignmentFailure> idFailures,
    List<MarkerWarning> warnings,
    RunStatus status
) {

    public ResolutionReport {
        Objects.requireNonNull(runId, "Run id cannot be null");
        Objects.requireNonNull(references, "Reference stats cannot be null");
        Objects.requireNonNull(index, "Index stats cannot be null");
        Objects.requireNonNull(notes, "Note stats cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        EnumMap<AnchorKind, Integer> counts = new EnumMap<>(AnchorKind.class);
        if (targetsByKind != null) {
            counts.putAll(targetsByKind);
        }
        targetsByKind = Collections.unmodifiableMap(counts);
        idFailures = idFailures == null ? List.of() : List.copyOf(idFailures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Builds a report, deriving the status from broken and unresolved counts.
     */
    public static ResolutionReport of(
            String runId,
            Map<AnchorKind, Integer> targetsByKind,
            ReferenceStats references,
            IndexStats index,
            NoteStats notes,
            int collisionsResolved,
            List<IdAssignmentFailure> idFailures,
            List<MarkerWarning> warnings) {
        boolean anythingBroken = references.broken() > 0
            || index.crossReferencesUnresolved() > 0
            || notes.orphanCalls() > 0
            || (idFailures != null && !idFailures.isEmpty());
        RunStatus status = anythingBroken ? RunStatus.COMPLETED_WITH_BROKEN_REFS : RunStatus.COMPLETED;
        return new ResolutionReport(runId, targetsByKind, references, index, notes,
            collisionsResolved, idFailures, warnings, status);
    }

    public int targetsFound() {
        return targetsByKind.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int targets(AnchorKind kind) {
        return targetsByKind.getOrDefault(kind, 0);
    }

    /**
     * Renders a plain-text summary for logs and the command line.
     */
    public String summary() {
        StringBuilder summary = new StringBuilder();
        summary.append("Cross-reference resolution summary (").append(runId).append(")\n");
        summary.append("===========================================\n");
        summary.append("Status: ").append(status).append('\n');
        summary.append("Targets: ").append(targetsFound()).append('\n');
        targetsByKind.forEach((kind, count) ->
            summary.append("  - ").append(kind.label()).append(": ").append(count).append('\n'));
        summary.append("Collisions resolved: ").append(collisionsResolved).append('\n');
        summary.append("Id assignment failures: ").append(idFailures.size()).append('\n');
        summary.append("References: ").append(references.found())
            .append(" found, ").append(references.resolved()).append(" resolved, ")
            .append(references.broken()).append(" broken\n");
        summary.append("Index: ").append(index.markersFound()).append(" markers, ")
            .append(index.entries()).append(" entries, ")
            .append(index.crossReferencesResolved()).append(" cross-references resolved, ")
            .append(index.crossReferencesUnresolved()).append(" unresolved\n");
        summary.append("Notes: ").append(notes.footnotes()).append(" footnotes, ")
            .append(notes.endnotes()).append(" endnotes, ")
            .append(notes.calls()).append(" calls, ")
            .append(notes.orphanCalls()).append(" orphan calls, ")
            .append(notes.backReferencesGenerated()).append(" back-referenced\n");
        summary.append("Warnings: ").append(warnings.size()).append('\n');
        return summary.toString();
    }

    /**
     * Reference resolution counts with the broken calls listed.
     */
    public record ReferenceStats(int found, int resolved, List<BrokenReference> brokenReferences) {
        public ReferenceStats {
            brokenReferences = brokenReferences == null ? List.of() : List.copyOf(brokenReferences);
            if (found < 0 || resolved < 0) {
                throw new IllegalArgumentException("Reference counts must be non-negative");
            }
            if (resolved + brokenReferences.size() != found) {
                throw new IllegalArgumentException("Resolved and broken references must add up to found references");
            }
        }

        public int broken() {
            return brokenReferences.size();
        }
    }

    /**
     * Index counts with the dropped cross-references listed.
     */
    public record IndexStats(
        int markersFound,
        int entries,
        int occurrences,
        int crossReferencesResolved,
        List<UnresolvedIndexReference> unresolvedReferences
    ) {
        public IndexStats {
            unresolvedReferences = unresolvedReferences == null ? List.of() : List.copyOf(unresolvedReferences);
        }

        public int crossReferencesUnresolved() {
            return unresolvedReferences.size();
        }

        public static IndexStats empty() {
            return new IndexStats(0, 0, 0, 0, List.of());
        }
    }

    /**
     * Note counts with the orphan calls listed.
     */
    public record NoteStats(
        int footnotes,
        int endnotes,
        int calls,
        List<BrokenReference> orphanCallReferences,
        int backReferencesGenerated
    ) {
        public NoteStats {
            orphanCallReferences = orphanCallReferences == null ? List.of() : List.copyOf(orphanCallReferences);
        }

        public int orphanCalls() {
            return orphanCallReferences.size();
        }
    }
}
