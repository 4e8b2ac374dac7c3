package com.williamcallahan.crossref.service;

import com.williamcallahan.crossref.domain.anchor.AnchorManifestEntry;
import com.williamcallahan.crossref.domain.anchor.AnchorTarget;
import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import com.williamcallahan.crossref.domain.anchor.ResolvedReference;
import com.williamcallahan.crossref.domain.index.IndexModel;
import com.williamcallahan.crossref.domain.index.IndexOccurrence;
import com.williamcallahan.crossref.domain.index.TermOccurrence;
import com.williamcallahan.crossref.domain.markup.DocumentChunk;
import com.williamcallahan.crossref.domain.markup.GeneratedPage;
import com.williamcallahan.crossref.domain.markup.RewrittenChunk;
import com.williamcallahan.crossref.domain.notes.Note;
import com.williamcallahan.crossref.domain.notes.NoteDeclaration;
import com.williamcallahan.crossref.domain.notes.NoteKind;
import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.domain.notes.NotesRouting;
import com.williamcallahan.crossref.domain.report.BrokenReference;
import com.williamcallahan.crossref.domain.report.CrossReferenceResult;
import com.williamcallahan.crossref.domain.report.ResolutionReport;
import com.williamcallahan.crossref.domain.report.ResolutionReport.IndexStats;
import com.williamcallahan.crossref.domain.report.ResolutionReport.NoteStats;
import com.williamcallahan.crossref.domain.report.ResolutionReport.ReferenceStats;
import com.williamcallahan.crossref.domain.report.RunStatus;
import com.williamcallahan.crossref.service.anchor.AnchorRegistry;
import com.williamcallahan.crossref.service.anchor.MergedDocument;
import com.williamcallahan.crossref.service.anchor.RegistryMerger;
import com.williamcallahan.crossref.service.index.IndexBuilder;
import com.williamcallahan.crossref.service.index.IndexPageRenderer;
import com.williamcallahan.crossref.service.notes.NotesPageRenderer;
import com.williamcallahan.crossref.service.notes.NotesRouter;
import com.williamcallahan.crossref.service.resolve.ReferenceResolver;
import com.williamcallahan.crossref.service.resolve.TargetLocator;
import com.williamcallahan.crossref.service.rewrite.ChunkRewrite;
import com.williamcallahan.crossref.service.rewrite.MarkupRewriter;
import com.williamcallahan.crossref.service.rewrite.RewritePlan;
import com.williamcallahan.crossref.service.rewrite.RewritePlanner;
import com.williamcallahan.crossref.service.scan.ChunkScan;
import com.williamcallahan.crossref.service.scan.MarkerScanner;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the cross-reference pipeline over an ordered set of chunks.
 *
 * <p>{@code Scan (parallel) -> Merge (barrier, one writer) -> Resolve (read-only) -> Rewrite (parallel)}.
 * Scan and rewrite run on a pool of {@code parallelism} workers, or on the calling thread when
 * it is 1; results always come back in input order. Rewrite takes two passes with a barrier in
 * between: the first rewrites every chunk and collects the rewritten note bodies, the second
 * places bodies that move to another file. The engine keeps no state between runs.</p>
 */
@Service
public class CrossReferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(CrossReferenceEngine.class);
    private static final AtomicLong RUN_SEQUENCE = new AtomicLong();

    private final MarkerScanner scanner = new MarkerScanner();
    private final RegistryMerger merger = new RegistryMerger();
    private final MarkupRewriter rewriter = new MarkupRewriter();

    /**
     * Processes one document.
     *
     * @param chunks chunks in reading order; file names must be unique
     * @param options run options
     * @return rewritten chunks, generated pages, report and manifest
     * @throws IllegalArgumentException on duplicate file names
     * @throws CrossReferenceProcessingException when the run is interrupted or a worker fails
     */
    public CrossReferenceResult process(List<DocumentChunk> chunks, EngineOptions options) {
        Objects.requireNonNull(chunks, "Chunks cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        requireUniqueFileNames(chunks);
        String runId = "RUN-" + System.currentTimeMillis() + "-" + RUN_SEQUENCE.incrementAndGet();

        int workers = Math.max(1, Math.min(options.parallelism(), chunks.size()));
        ExecutorService executor = workers > 1 ? Executors.newFixedThreadPool(workers) : null;
        try {
            long started = System.currentTimeMillis();
            List<ChunkScan> scans = runInOrder(executor, chunks, scanner::scan, DocumentChunk::fileName, "scan");
            log.info("[{}] Scanned {} chunks in {}ms", runId, chunks.size(), System.currentTimeMillis() - started);

            MergedDocument merged = merger.merge(chunks, scans, options);

            NotesRouting routing = new NotesRouter(options.notes())
                .route(merged.noteDeclarations(), merged.noteCalls(), merged.chapters());
            TargetLocator locator = noteAwareLocator(routing);
            ReferenceResolver resolver = new ReferenceResolver(merged.registry(), locator);
            List<ResolvedReference> resolved = resolver.resolveAll(merged.references());
            IndexModel index = options.index().enabled()
                ? new IndexBuilder(options.index(), options.anchors()).build(relocate(merged.termOccurrences(), locator))
                : IndexModel.empty();

            List<GeneratedPage> pages = new ArrayList<>();
            if (!index.isEmpty()) {
                pages.add(new IndexPageRenderer(options.index(), options.stylesheet()).render(index));
            }

            Map<String, RewritePlan> plans = new RewritePlanner(options.notes()).plan(merged, resolved, routing);
            started = System.currentTimeMillis();
            List<ChunkRewrite> applied = runInOrder(executor, chunks,
                chunk -> rewriter.apply(chunk, plans.get(chunk.fileName())), DocumentChunk::fileName, "rewrite");
            Map<String, String> noteContents = new HashMap<>();
            applied.forEach(rewrite -> noteContents.putAll(rewrite.noteContents()));
            List<RewrittenChunk> rewritten = runInOrder(executor, applied,
                rewrite -> rewriter.complete(rewrite, noteContents), ChunkRewrite::fileName, "rewrite");
            if (routing.placement() == NotePlacement.CONSOLIDATED && !routing.notes().isEmpty()) {
                pages.add(new NotesPageRenderer(options.notes(), options.stylesheet())
                    .render(routing.chapters(), noteContents));
            }
            log.info("[{}] Rewrote {} chunks in {}ms", runId, chunks.size(), System.currentTimeMillis() - started);

            ResolutionReport report = report(runId, merged, resolved, index, routing);
            if (report.status() == RunStatus.COMPLETED) {
                log.info("[{}] Completed: {} targets, {} references resolved", runId,
                    report.targetsFound(), report.references().resolved());
            } else {
                log.warn("[{}] Completed with problems: {} broken references, {} unresolved index cross-references, "
                        + "{} orphan note calls, {} id failures", runId, report.references().broken(),
                    report.index().crossReferencesUnresolved(), report.notes().orphanCalls(), report.idFailures().size());
            }
            return new CrossReferenceResult(rewritten, pages, report, manifest(merged.registry(), routing, locator),
                index.occurrenceMapping());
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    private ResolutionReport report(String runId, MergedDocument merged, List<ResolvedReference> resolved,
                                    IndexModel index, NotesRouting routing) {
        List<BrokenReference> broken = resolved.stream()
            .filter(ResolvedReference::broken)
            .map(reference -> BrokenReference.of(reference.call()))
            .toList();
        ReferenceStats references = new ReferenceStats(resolved.size(), resolved.size() - broken.size(), broken);
        IndexStats indexStats = new IndexStats(merged.indexMarkersFound(), index.entries().size(),
            merged.termOccurrences().size(), index.crossReferencesResolved(), index.unresolvedReferences());
        NoteStats notes = new NoteStats(
            (int) routing.count(NoteKind.FOOTNOTE),
            (int) routing.count(NoteKind.ENDNOTE),
            routing.callCount(),
            routing.orphanCalls().stream().map(BrokenReference::of).toList(),
            routing.backReferencesGenerated());
        return ResolutionReport.of(runId, merged.registry().countsByKind(), references, indexStats, notes,
            merged.registry().collisionsResolved(), merged.idFailures(), merged.warnings());
    }

    // A note body that placement moves takes the nodes inside it along.
    private static TargetLocator noteAwareLocator(NotesRouting routing) {
        Map<String, List<NoteDeclaration>> moved = new HashMap<>();
        for (Note note : routing.notes()) {
            if (note.relocated()) {
                moved.computeIfAbsent(note.originalFile(), file -> new ArrayList<>()).add(note.declaration());
            }
        }
        Map<String, String> targetFiles = new HashMap<>();
        routing.notes().forEach(note -> targetFiles.put(note.id(), note.targetFile()));
        return (file, position) -> {
            for (NoteDeclaration declaration : moved.getOrDefault(file, List.of())) {
                if (declaration.covers(position)) {
                    return targetFiles.get(declaration.id());
                }
            }
            return file;
        };
    }

    private static List<TermOccurrence> relocate(List<TermOccurrence> occurrences, TargetLocator locator) {
        return occurrences.stream()
            .map(occurrence -> {
                IndexOccurrence at = occurrence.occurrence();
                String file = locator.fileOf(at.file(), at.position());
                if (file.equals(at.file())) {
                    return occurrence;
                }
                return new TermOccurrence(occurrence.term(),
                    new IndexOccurrence(file, at.anchorId(), at.position(), at.primary()));
            })
            .toList();
    }

    // Ids that end up in the output, under the file holding them. An orphan call keeps its
    // authored markup, so an id derived for it is never written.
    private static Map<String, AnchorManifestEntry> manifest(AnchorRegistry registry, NotesRouting routing,
                                                             TargetLocator locator) {
        Set<String> unwritten = new HashSet<>();
        for (ReferenceCall orphan : routing.orphanCalls()) {
            registry.findById(orphan.id())
                .filter(target -> !target.id().equals(target.originalId()))
                .ifPresent(target -> unwritten.add(target.id()));
        }
        Map<String, AnchorManifestEntry> manifest = new LinkedHashMap<>();
        for (AnchorTarget target : registry.targets()) {
            if (!unwritten.contains(target.id())) {
                manifest.put(target.id(), AnchorManifestEntry.from(target, locator.fileOf(target)));
            }
        }
        return manifest;
    }

    private static <I, T> List<T> runInOrder(ExecutorService executor, List<I> items, Function<I, T> task,
                                             Function<I, String> fileName, String phase) {
        List<T> results = new ArrayList<>(items.size());
        if (executor == null) {
            for (I item : items) {
                results.add(task.apply(item));
            }
            return results;
        }
        List<Future<T>> futures = new ArrayList<>(items.size());
        for (I item : items) {
            Callable<T> work = () -> task.apply(item);
            futures.add(executor.submit(work));
        }
        for (int index = 0; index < futures.size(); index++) {
            try {
                results.add(futures.get(index).get());
            } catch (InterruptedException interruptedException) {
                Thread.currentThread().interrupt();
                throw new CrossReferenceProcessingException("Cross-reference " + phase + " was interrupted",
                    interruptedException);
            } catch (ExecutionException executionException) {
                Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
                throw new CrossReferenceProcessingException("Cross-reference " + phase + " failed for "
                    + fileName.apply(items.get(index)) + ": " + cause.getMessage(), cause);
            }
        }
        return results;
    }

    private static void requireUniqueFileNames(List<DocumentChunk> chunks) {
        Set<String> seen = new HashSet<>();
        for (DocumentChunk chunk : chunks) {
            Objects.requireNonNull(chunk, "Chunk cannot be null");
            if (!seen.add(chunk.fileName())) {
                throw new IllegalArgumentException("Duplicate chunk file name: " + chunk.fileName());
            }
        }
    }
}
