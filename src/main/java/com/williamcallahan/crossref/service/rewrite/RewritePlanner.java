package com.williamcallahan.crossref.service.rewrite;

import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import com.williamcallahan.crossref.domain.anchor.ResolvedReference;
import com.williamcallahan.crossref.domain.notes.ChapterNotes;
import com.williamcallahan.crossref.domain.notes.Note;
import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.domain.notes.NotesRouting;
import com.williamcallahan.crossref.service.EngineOptions.NotesOptions;
import com.williamcallahan.crossref.service.anchor.MergedDocument;
import com.williamcallahan.crossref.service.notes.BackReferenceWriter;
import com.williamcallahan.crossref.service.rewrite.RewritePlan.CallRewrite;
import com.williamcallahan.crossref.service.scan.ChunkScan;
import com.williamcallahan.crossref.service.scan.IndexMarker;
import com.williamcallahan.crossref.service.scan.NoteBodyMarker;
import com.williamcallahan.crossref.service.scan.NoteCallMarker;
import com.williamcallahan.crossref.service.scan.TargetMarker;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the read-only results of the resolve phase into one {@link RewritePlan} per chunk.
 */
public final class RewritePlanner {

    private final NotesOptions notesOptions;

    public RewritePlanner(NotesOptions notesOptions) {
        this.notesOptions = notesOptions;
    }

    /**
     * Plans every chunk.
     *
     * @param merged merged state
     * @param resolved resolution of every cross-reference call
     * @param routing note routing
     * @return plans keyed by file name, in input order
     */
    public Map<String, RewritePlan> plan(MergedDocument merged, List<ResolvedReference> resolved, NotesRouting routing) {
        Map<String, Map<Integer, ResolvedReference>> referencesByFile = new HashMap<>();
        for (ResolvedReference reference : resolved) {
            if (!reference.broken()) {
                referencesByFile.computeIfAbsent(reference.call().file(), file -> new HashMap<>())
                    .put(reference.call().position(), reference);
            }
        }
        Map<String, Note> notesById = new HashMap<>();
        Map<String, Note> notesByCallId = new HashMap<>();
        for (Note note : routing.notes()) {
            notesById.put(note.id(), note);
            for (ReferenceCall call : note.calls()) {
                notesByCallId.put(call.id(), note);
            }
        }

        BackReferenceWriter backReferences = new BackReferenceWriter(notesOptions.backRefSymbol(),
            notesOptions.backRefTitle());
        Map<String, RewritePlan> plans = new LinkedHashMap<>();
        for (ChunkScan scan : merged.scans()) {
            String file = scan.fileName();
            Map<Integer, String> assigned = merged.idsIn(file);

            Map<Integer, String> targetIds = new HashMap<>();
            for (TargetMarker target : scan.targets()) {
                putIfAssigned(targetIds, assigned, target.position());
            }
            for (IndexMarker marker : scan.indexMarkers()) {
                putIfAssigned(targetIds, assigned, marker.position());
            }

            Map<Integer, CallRewrite> calls = new HashMap<>();
            for (NoteCallMarker marker : scan.noteCalls()) {
                String callId = assigned.get(marker.position());
                String href = callId == null ? null : routing.callHrefs().get(callId);
                if (href == null) {
                    continue;
                }
                Note note = notesByCallId.get(callId);
                String label = notesOptions.renumberCalls() && note != null
                    ? notesOptions.numberingFor(note.kind()).format(note.number())
                    : null;
                calls.put(marker.position(), new CallRewrite(callId, href, marker.idOnWrapper(), label));
            }

            Map<Integer, Note> noteBodies = new HashMap<>();
            for (NoteBodyMarker body : scan.noteBodies()) {
                String noteId = assigned.get(body.position());
                Note note = noteId == null ? null : notesById.get(noteId);
                if (note != null) {
                    noteBodies.put(body.position(), note);
                }
            }

            plans.put(file, new RewritePlan(file, routing.placement(), targetIds,
                referencesByFile.getOrDefault(file, Map.of()), calls, noteBodies,
                relocatedFootnotes(routing, file), notesOptions.title(), backReferences));
        }
        return plans;
    }

    private static List<Note> relocatedFootnotes(NotesRouting routing, String file) {
        if (routing.placement() != NotePlacement.INLINE) {
            return List.of();
        }
        return routing.chapters().stream()
            .filter(chapter -> chapter.chapterFile().equals(file))
            .map(ChapterNotes::footnotes)
            .findFirst()
            .orElse(List.of());
    }

    private static void putIfAssigned(Map<Integer, String> ids, Map<Integer, String> assigned, int position) {
        String id = assigned.get(position);
        if (id != null) {
            ids.put(position, id);
        }
    }
}
