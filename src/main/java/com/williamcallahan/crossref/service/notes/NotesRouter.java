package com.williamcallahan.crossref.service.notes;

import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import com.williamcallahan.crossref.domain.markup.Chapter;
import com.williamcallahan.crossref.domain.notes.ChapterNotes;
import com.williamcallahan.crossref.domain.notes.Note;
import com.williamcallahan.crossref.domain.notes.NoteDeclaration;
import com.williamcallahan.crossref.domain.notes.NoteKind;
import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.domain.notes.NotesRouting;
import com.williamcallahan.crossref.service.EngineOptions.NotesOptions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Links note bodies to their calls, decides where every body renders and plans back-links.
 *
 * <p>A call finds its note by key. A call naming a file ({@code notes.xhtml#fn1}) looks in that
 * file first. Then come an original id in the call's own file, a final id and an original id
 * anywhere. A note belongs to the chapter of its first call, or to its own file when it is never
 * cited.</p>
 */
public final class NotesRouter {

    private static final Logger log = LoggerFactory.getLogger(NotesRouter.class);

    private final NotesOptions options;

    public NotesRouter(NotesOptions options) {
        this.options = Objects.requireNonNull(options, "Notes options cannot be null");
    }

    /**
     * Routes all notes of a run.
     *
     * @param declarations note bodies in registration order
     * @param calls note calls in file then discovery order, carrying final call ids
     * @param chapters chunks in reading order
     * @return placement of every note, call hrefs and orphans
     */
    public NotesRouting route(List<NoteDeclaration> declarations, List<ReferenceCall> calls, List<Chapter> chapters) {
        Objects.requireNonNull(declarations, "Declarations cannot be null");
        Objects.requireNonNull(calls, "Calls cannot be null");
        Objects.requireNonNull(chapters, "Chapters cannot be null");
        NotePlacement placement = options.placement();

        Map<String, NoteDeclaration> byFinalId = new HashMap<>();
        Map<String, List<NoteDeclaration>> byOriginalId = new HashMap<>();
        for (NoteDeclaration declaration : declarations) {
            byFinalId.put(declaration.id(), declaration);
            byOriginalId.computeIfAbsent(declaration.originalId(), key -> new ArrayList<>()).add(declaration);
        }

        Map<String, List<ReferenceCall>> callsByNote = new LinkedHashMap<>();
        List<ReferenceCall> orphans = new ArrayList<>();
        for (ReferenceCall call : calls) {
            Optional<NoteDeclaration> note = findNote(call, byFinalId, byOriginalId);
            if (note.isPresent()) {
                callsByNote.computeIfAbsent(note.get().id(), key -> new ArrayList<>()).add(call);
            } else {
                log.warn("Orphan note call {} in {}: no note '{}'", call.id(), call.file(), call.targetKey());
                orphans.add(call);
            }
        }

        Map<String, String> chapterTitles = new HashMap<>();
        chapters.forEach(chapter -> chapterTitles.put(chapter.fileName(), chapter.title()));
        BackReferenceWriter writer = new BackReferenceWriter(options.backRefSymbol(), options.backRefTitle());

        List<Note> notes = new ArrayList<>();
        Map<String, String> callHrefs = new LinkedHashMap<>();
        int backReferenced = 0;
        for (NoteDeclaration declaration : declarations) {
            List<ReferenceCall> noteCalls = callsByNote.getOrDefault(declaration.id(), List.of());
            String chapterFile = noteCalls.isEmpty() ? declaration.originalFile() : noteCalls.get(0).file();
            String chapterTitle = chapterTitles.getOrDefault(chapterFile, chapterFile);
            String targetFile = targetFile(declaration, chapterFile, placement);

            String content = declaration.content();
            Map<String, String> backHrefs = new LinkedHashMap<>();
            if (options.generateBackRefs()) {
                for (ReferenceCall call : noteCalls) {
                    backHrefs.put(call.id(), href(call.file(), targetFile, call.id()));
                }
                BackReferenceWriter.Augmented augmented = writer.augment(content, backHrefs);
                content = augmented.content();
                if (augmented.appended() > 0) {
                    backReferenced++;
                }
            }
            for (ReferenceCall call : noteCalls) {
                callHrefs.put(call.id(), href(targetFile, call.file(), declaration.id()));
            }
            notes.add(new Note(declaration, noteCalls, content, chapterFile, chapterTitle, targetFile, backHrefs));
        }

        List<ChapterNotes> grouped = groupByChapter(notes, chapters);
        log.info("Routed {} notes ({} placement): {} calls linked, {} orphan calls, {} notes back-referenced",
            notes.size(), placement, callHrefs.size(), orphans.size(), backReferenced);
        return new NotesRouting(placement, notes, callHrefs, orphans, grouped, backReferenced);
    }

    private Optional<NoteDeclaration> findNote(ReferenceCall call, Map<String, NoteDeclaration> byFinalId,
                                               Map<String, List<NoteDeclaration>> byOriginalId) {
        List<NoteDeclaration> sameKey = byOriginalId.getOrDefault(call.targetKey(), List.of());
        NoteDeclaration byId = byFinalId.get(call.targetKey());
        if (call.qualifiedFile().isPresent()) {
            String file = call.qualifiedFile().get();
            Optional<NoteDeclaration> inFile = sameKey.stream()
                .filter(candidate -> candidate.originalFile().equals(file))
                .findFirst();
            if (inFile.isPresent()) {
                return inFile;
            }
            if (byId != null && byId.originalFile().equals(file)) {
                return Optional.of(byId);
            }
        }
        for (NoteDeclaration candidate : sameKey) {
            if (candidate.originalFile().equals(call.file())) {
                return Optional.of(candidate);
            }
        }
        if (byId != null) {
            return Optional.of(byId);
        }
        return sameKey.stream().findFirst();
    }

    private String targetFile(NoteDeclaration declaration, String chapterFile, NotePlacement placement) {
        return switch (placement) {
            case INLINE -> declaration.kind() == NoteKind.FOOTNOTE ? chapterFile : declaration.originalFile();
            case CONSOLIDATED -> options.fileName();
            case LINKED, POPUP -> declaration.originalFile();
        };
    }

    private static List<ChapterNotes> groupByChapter(List<Note> notes, List<Chapter> chapters) {
        Comparator<Note> byNumber = Comparator.comparingInt(Note::number);
        List<ChapterNotes> grouped = new ArrayList<>();
        for (Chapter chapter : chapters) {
            List<Note> footnotes = new ArrayList<>();
            List<Note> endnotes = new ArrayList<>();
            for (Note note : notes) {
                if (note.chapterFile().equals(chapter.fileName())) {
                    (note.kind() == NoteKind.FOOTNOTE ? footnotes : endnotes).add(note);
                }
            }
            footnotes.sort(byNumber);
            endnotes.sort(byNumber);
            ChapterNotes chapterNotes = new ChapterNotes(chapter.title(), chapter.fileName(), footnotes, endnotes);
            if (!chapterNotes.isEmpty()) {
                grouped.add(chapterNotes);
            }
        }
        return grouped;
    }

    // "#id" when the link stays in its file, "file#id" otherwise
    private static String href(String targetFile, String sourceFile, String id) {
        return targetFile.equals(sourceFile) ? "#" + id : targetFile + "#" + id;
    }
}
