package com.williamcallahan.crossref.service.anchor;

import com.williamcallahan.crossref.domain.anchor.AnchorKind;
import com.williamcallahan.crossref.domain.anchor.AnchorTarget;
import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import com.williamcallahan.crossref.domain.anchor.ReferenceOrigin;
import com.williamcallahan.crossref.domain.index.IndexOccurrence;
import com.williamcallahan.crossref.domain.index.TermOccurrence;
import com.williamcallahan.crossref.domain.markup.Chapter;
import com.williamcallahan.crossref.domain.markup.DocumentChunk;
import com.williamcallahan.crossref.domain.markup.MarkerWarning;
import com.williamcallahan.crossref.domain.notes.NoteDeclaration;
import com.williamcallahan.crossref.domain.notes.NoteKind;
import com.williamcallahan.crossref.domain.report.IdAssignmentFailure;
import com.williamcallahan.crossref.service.EngineOptions;
import com.williamcallahan.crossref.service.anchor.AnchorRegistry.Registration;
import com.williamcallahan.crossref.service.scan.ChunkScan;
import com.williamcallahan.crossref.service.scan.IndexMarker;
import com.williamcallahan.crossref.service.scan.NoteBodyMarker;
import com.williamcallahan.crossref.service.scan.NoteCallMarker;
import com.williamcallahan.crossref.service.scan.ReferenceMarker;
import com.williamcallahan.crossref.service.scan.TargetMarker;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The merge barrier: registers every marker of every chunk in file order, then discovery order,
 * numbers notes, and freezes the registry.
 *
 * <p>Runs on one thread. An exhausted id for one marker is recorded as a failure and the
 * merge continues.</p>
 */
public final class RegistryMerger {

    private static final Logger log = LoggerFactory.getLogger(RegistryMerger.class);

    /**
     * Merges scan results into a frozen registry.
     *
     * @param chunks input chunks in reading order
     * @param scans scan result for each chunk, same order
     * @param options run options
     * @return merged, read-only state
     */
    public MergedDocument merge(List<DocumentChunk> chunks, List<ChunkScan> scans, EngineOptions options) {
        Objects.requireNonNull(chunks, "Chunks cannot be null");
        Objects.requireNonNull(scans, "Scans cannot be null");
        if (chunks.size() != scans.size()) {
            throw new IllegalArgumentException("Every chunk needs exactly one scan result");
        }
        MergeState state = new MergeState(new AnchorRegistry(options.anchors()));

        for (int index = 0; index < chunks.size(); index++) {
            DocumentChunk chunk = chunks.get(index);
            ChunkScan scan = scans.get(index);
            String title = chunk.chapterTitleValue()
                .or(scan::firstHeadingValue)
                .orElse("Chapter " + (index + 1));
            state.chapters.add(new Chapter(index, chunk.fileName(), title));
            state.warnings.addAll(scan.warnings());
            if (options.notes().restartNumberingPerChapter()) {
                state.noteNumbers.clear();
            }
            mergeChunk(scan, state);
        }

        state.registry.freeze();
        log.info("Merged {} chunks: {} targets registered, {} collisions resolved, {} id failures",
            chunks.size(), state.registry.size(), state.registry.collisionsResolved(), state.failures.size());
        return new MergedDocument(state.registry, state.chapters, scans, state.assignedIds, state.references,
            state.noteCalls, state.declarations, state.termOccurrences, state.failures, state.warnings);
    }

    private void mergeChunk(ChunkScan scan, MergeState state) {
        String file = scan.fileName();
        Map<Integer, String> ids = state.assignedIds.computeIfAbsent(file, key -> new LinkedHashMap<>());

        List<Object> markers = new ArrayList<>();
        markers.addAll(scan.targets());
        markers.addAll(scan.noteBodies());
        markers.addAll(scan.noteCalls());
        markers.addAll(scan.indexMarkers());
        markers.sort(Comparator.comparingInt(RegistryMerger::positionOf));

        for (Object marker : markers) {
            if (marker instanceof TargetMarker target) {
                register(state, file, target.position(), new Registration(target.candidateId(), target.kind(),
                    target.title(), target.title(), target.plainText(), file, target.position(), target.level(),
                    target.number()))
                    .ifPresent(registered -> ids.put(target.position(), registered.id()));
            } else if (marker instanceof NoteBodyMarker body) {
                mergeNoteBody(body, file, ids, state);
            } else if (marker instanceof NoteCallMarker call) {
                register(state, file, call.position(), new Registration(call.candidateId(), AnchorKind.NOTE_CALL,
                    call.noteKey(), call.displayText(), call.displayText(), file, call.position(), 0, null))
                    .ifPresent(registered -> {
                        ids.put(call.position(), registered.id());
                        state.noteCalls.add(new ReferenceCall(registered.id(), call.noteKey(), file, call.position(),
                            call.displayText(), ReferenceOrigin.NOTE_CALL, call.noteFile()));
                    });
            } else if (marker instanceof IndexMarker indexMarker) {
                String path = String.join(" ", indexMarker.term().path());
                register(state, file, indexMarker.position(), new Registration(indexMarker.candidateId(),
                    AnchorKind.INDEX_TERM, path, indexMarker.term().mainText(), path, file, indexMarker.position(), 0, null))
                    .ifPresent(registered -> {
                        ids.put(indexMarker.position(), registered.id());
                        state.termOccurrences.add(new TermOccurrence(indexMarker.term(), new IndexOccurrence(file,
                            registered.id(), indexMarker.position(), indexMarker.term().primary())));
                    });
            }
        }

        for (ReferenceMarker reference : scan.references()) {
            state.references.add(new ReferenceCall(reference.callId(), reference.targetKey(), file,
                reference.position(), reference.displayText(), reference.origin(), reference.targetFile()));
        }
    }

    private void mergeNoteBody(NoteBodyMarker body, String file, Map<Integer, String> ids, MergeState state) {
        NoteKind kind = body.kind();
        int number = state.noteNumbers.getOrDefault(kind, 0) + 1;
        register(state, file, body.position(), new Registration(body.candidateId(), kind.anchorKind(),
            body.plainText(), body.plainText(), body.plainText(), file, body.position(), 0, Integer.toString(number)))
            .ifPresent(registered -> {
                state.noteNumbers.put(kind, number);
                ids.put(body.position(), registered.id());
                state.declarations.add(new NoteDeclaration(registered.id(), body.candidateId(), kind, number,
                    body.content(), body.plainText(), file, body.position(), body.extent()));
            });
    }

    private Optional<AnchorTarget> register(MergeState state, String file, int position, Registration registration) {
        try {
            return Optional.of(state.registry.register(registration));
        } catch (IdCollisionExhaustedException e) {
            log.warn("Id assignment failed for {} in {} at node {}: {}",
                registration.kind().label(), file, position, e.getMessage());
            state.failures.add(new IdAssignmentFailure(file, position, registration.kind().label(),
                e.getBaseId(), e.getAttempts(), e.getMessage()));
            return Optional.empty();
        }
    }

    private static int positionOf(Object marker) {
        if (marker instanceof TargetMarker target) {
            return target.position();
        }
        if (marker instanceof NoteBodyMarker body) {
            return body.position();
        }
        if (marker instanceof NoteCallMarker call) {
            return call.position();
        }
        if (marker instanceof IndexMarker indexMarker) {
            return indexMarker.position();
        }
        throw new IllegalArgumentException("Unknown marker type: " + marker.getClass().getName());
    }

    private static final class MergeState {
        private final AnchorRegistry registry;
        private final List<Chapter> chapters = new ArrayList<>();
        private final Map<String, Map<Integer, String>> assignedIds = new LinkedHashMap<>();
        private final List<ReferenceCall> references = new ArrayList<>();
        private final List<ReferenceCall> noteCalls = new ArrayList<>();
        private final List<NoteDeclaration> declarations = new ArrayList<>();
        private final List<TermOccurrence> termOccurrences = new ArrayList<>();
        private final List<IdAssignmentFailure> failures = new ArrayList<>();
        private final List<MarkerWarning> warnings = new ArrayList<>();
        private final Map<NoteKind, Integer> noteNumbers = new EnumMap<>(NoteKind.class);

        private MergeState(AnchorRegistry registry) {
            this.registry = registry;
        }
    }
}
