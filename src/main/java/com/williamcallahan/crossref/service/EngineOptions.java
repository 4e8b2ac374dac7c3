package com.williamcallahan.crossref.service;

import com.williamcallahan.crossref.domain.notes.NoteKind;
import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.domain.notes.NumberingStyle;
import com.williamcallahan.crossref.service.anchor.AnchorIdGenerator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable options for one resolution run. Bound from {@code crossref.*} properties by
 * {@link com.williamcallahan.crossref.config.CrossRefProperties}, or built directly.
 */
public record EngineOptions(AnchorOptions anchors, IndexOptions index, NotesOptions notes, int parallelism, String stylesheet) {

    public EngineOptions {
        Objects.requireNonNull(anchors, "Anchor options cannot be null");
        Objects.requireNonNull(index, "Index options cannot be null");
        Objects.requireNonNull(notes, "Notes options cannot be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1");
        }
        stylesheet = stylesheet == null ? "" : stylesheet;
    }

    public static EngineOptions defaults() {
        return new EngineOptions(AnchorOptions.defaults(), IndexOptions.defaults(), NotesOptions.defaults(),
            Math.max(1, Runtime.getRuntime().availableProcessors()), "styles.css");
    }

    public EngineOptions withAnchors(AnchorOptions anchorOptions) {
        return new EngineOptions(anchorOptions, index, notes, parallelism, stylesheet);
    }

    public EngineOptions withIndex(IndexOptions indexOptions) {
        return new EngineOptions(anchors, indexOptions, notes, parallelism, stylesheet);
    }

    public EngineOptions withNotes(NotesOptions notesOptions) {
        return new EngineOptions(anchors, index, notesOptions, parallelism, stylesheet);
    }

    public EngineOptions withParallelism(int workers) {
        return new EngineOptions(anchors, index, notes, workers, stylesheet);
    }

    /**
     * Id generation settings.
     *
     * @param idPrefix first segment of derived ids
     * @param maxIdLength upper bound for derived ids including the collision suffix
     * @param collisionSuffixLength hex characters appended on collision
     * @param maxCollisionAttempts cap on the disambiguation loop
     * @param fuzzyMinLength minimum length of the shorter side in a fuzzy title match
     */
    public record AnchorOptions(
        String idPrefix,
        int maxIdLength,
        int collisionSuffixLength,
        int maxCollisionAttempts,
        int fuzzyMinLength
    ) {
        public AnchorOptions {
            if (!AnchorIdGenerator.isSafeId(idPrefix)) {
                throw new IllegalArgumentException("Id prefix must match [A-Za-z][A-Za-z0-9_-]*: " + idPrefix);
            }
            if (collisionSuffixLength < 1 || collisionSuffixLength > 32) {
                throw new IllegalArgumentException("Collision suffix length must be between 1 and 32");
            }
            if (maxIdLength < idPrefix.length() + collisionSuffixLength + 12) {
                throw new IllegalArgumentException("Max id length is too small for prefix and suffix: " + maxIdLength);
            }
            if (maxCollisionAttempts < 1) {
                throw new IllegalArgumentException("Max collision attempts must be positive");
            }
            if (fuzzyMinLength < 1) {
                throw new IllegalArgumentException("Fuzzy minimum length must be positive");
            }
        }

        public static AnchorOptions defaults() {
            return new AnchorOptions("ref", 50, 6, 1000, 3);
        }
    }

    /**
     * Index building and rendering settings.
     */
    public record IndexOptions(
        boolean enabled,
        boolean caseSensitive,
        List<String> ignoreArticles,
        Locale locale,
        int maxEntriesPerLetter,
        int maxTocDepth,
        boolean showLetterHeaders,
        boolean showOccurrenceCount,
        String fileName,
        String title
    ) {
        public IndexOptions {
            ignoreArticles = ignoreArticles == null ? List.of() : List.copyOf(ignoreArticles);
            locale = locale == null ? Locale.ROOT : locale;
            if (maxEntriesPerLetter < 1) {
                throw new IllegalArgumentException("Max entries per letter must be positive");
            }
            if (maxTocDepth < 1) {
                throw new IllegalArgumentException("Max depth must be positive");
            }
            if (fileName == null || fileName.isBlank() || fileName.contains("#")) {
                throw new IllegalArgumentException("Index file name is invalid: " + fileName);
            }
            title = title == null || title.isBlank() ? "Index" : title;
        }

        public static IndexOptions defaults() {
            return new IndexOptions(true, false, List.of("a", "an", "the"), Locale.US,
                1000, 6, true, false, "index.xhtml", "Index");
        }

        public IndexOptions withCaseSensitive(boolean sensitive) {
            return new IndexOptions(enabled, sensitive, ignoreArticles, locale, maxEntriesPerLetter, maxTocDepth,
                showLetterHeaders, showOccurrenceCount, fileName, title);
        }

        public IndexOptions withMaxEntriesPerLetter(int limit) {
            return new IndexOptions(enabled, caseSensitive, ignoreArticles, locale, limit, maxTocDepth,
                showLetterHeaders, showOccurrenceCount, fileName, title);
        }

        public IndexOptions withMaxTocDepth(int depth) {
            return new IndexOptions(enabled, caseSensitive, ignoreArticles, locale, maxEntriesPerLetter, depth,
                showLetterHeaders, showOccurrenceCount, fileName, title);
        }
    }

    /**
     * Note routing and rendering settings.
     */
    public record NotesOptions(
        NotePlacement placement,
        boolean generateBackRefs,
        String backRefSymbol,
        String backRefTitle,
        boolean restartNumberingPerChapter,
        NumberingStyle footnoteNumbering,
        NumberingStyle endnoteNumbering,
        boolean renumberCalls,
        String fileName,
        String title,
        boolean includeChapterHeadings
    ) {
        public NotesOptions {
            Objects.requireNonNull(placement, "Note placement cannot be null");
            footnoteNumbering = footnoteNumbering == null ? NumberingStyle.NUMERIC : footnoteNumbering;
            endnoteNumbering = endnoteNumbering == null ? NumberingStyle.ROMAN : endnoteNumbering;
            backRefSymbol = backRefSymbol == null || backRefSymbol.isEmpty() ? "↩" : backRefSymbol;
            backRefTitle = backRefTitle == null ? "" : backRefTitle;
            if (fileName == null || fileName.isBlank() || fileName.contains("#")) {
                throw new IllegalArgumentException("Notes file name is invalid: " + fileName);
            }
            title = title == null || title.isBlank() ? "Notes" : title;
        }

        public static NotesOptions defaults() {
            return new NotesOptions(NotePlacement.INLINE, true, "↩", "Return to text", true,
                NumberingStyle.NUMERIC, NumberingStyle.ROMAN, false, "notes.xhtml", "Notes", true);
        }

        public NotesOptions withPlacement(NotePlacement notePlacement) {
            return new NotesOptions(notePlacement, generateBackRefs, backRefSymbol, backRefTitle,
                restartNumberingPerChapter, footnoteNumbering, endnoteNumbering, renumberCalls, fileName, title,
                includeChapterHeadings);
        }

        public NotesOptions withRenumberCalls(boolean renumber) {
            return new NotesOptions(placement, generateBackRefs, backRefSymbol, backRefTitle,
                restartNumberingPerChapter, footnoteNumbering, endnoteNumbering, renumber, fileName, title,
                includeChapterHeadings);
        }

        public NotesOptions withBackRefs(boolean generate) {
            return new NotesOptions(placement, generate, backRefSymbol, backRefTitle,
                restartNumberingPerChapter, footnoteNumbering, endnoteNumbering, renumberCalls, fileName, title,
                includeChapterHeadings);
        }

        public NumberingStyle numberingFor(NoteKind kind) {
            return kind == NoteKind.ENDNOTE ? endnoteNumbering : footnoteNumbering;
        }
    }
}
