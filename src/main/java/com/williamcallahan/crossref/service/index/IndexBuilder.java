package com.williamcallahan.crossref.service.index;

import com.williamcallahan.crossref.domain.index.IndexEntry;
import com.williamcallahan.crossref.domain.index.IndexModel;
import com.williamcallahan.crossref.domain.index.IndexOccurrence;
import com.williamcallahan.crossref.domain.index.IndexSection;
import com.williamcallahan.crossref.domain.index.IndexTerm;
import com.williamcallahan.crossref.domain.index.TermOccurrence;
import com.williamcallahan.crossref.domain.index.UnresolvedIndexReference;
import com.williamcallahan.crossref.domain.index.UnresolvedIndexReference.Reason;
import com.williamcallahan.crossref.service.EngineOptions.AnchorOptions;
import com.williamcallahan.crossref.service.EngineOptions.IndexOptions;
import com.williamcallahan.crossref.service.anchor.AnchorIdGenerator;
import com.williamcallahan.crossref.service.anchor.IdCollisionExhaustedException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the index model from parsed markers.
 *
 * <p>Each marker goes through parse (already done by the scanner), classify, merge-or-create
 * and link. After all markers are in, "see" and "see also" strings are resolved against the
 * same entry table, and main entries are sectioned by the letter fixed at creation time.</p>
 *
 * <p>Entries live in an arena keyed by entry id; parents are referenced by id only.</p>
 */
public final class IndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);
    private static final String ENTRY_ID_PREFIX = "index";
    private static final String ENTRY_LABEL = "entry";

    private final SortKeyNormalizer normalizer;
    private final AnchorOptions anchorOptions;

    public IndexBuilder(IndexOptions indexOptions, AnchorOptions anchorOptions) {
        this.normalizer = new SortKeyNormalizer(Objects.requireNonNull(indexOptions, "Index options cannot be null"));
        this.anchorOptions = Objects.requireNonNull(anchorOptions, "Anchor options cannot be null");
    }

    /**
     * Builds the model.
     *
     * @param occurrences index markers with their anchors, in registration order
     * @return entries, sections and cross-reference statistics
     */
    public IndexModel build(List<TermOccurrence> occurrences) {
        Objects.requireNonNull(occurrences, "Occurrences cannot be null");
        if (occurrences.isEmpty()) {
            return IndexModel.empty();
        }
        Arena arena = new Arena(new AnchorIdGenerator(ENTRY_ID_PREFIX, Math.max(anchorOptions.maxIdLength(), 64),
            anchorOptions.collisionSuffixLength(), anchorOptions.maxCollisionAttempts()));

        for (TermOccurrence termOccurrence : occurrences) {
            link(arena, termOccurrence.term(), termOccurrence.occurrence());
        }

        CrossReferenceOutcome crossReferences = resolveCrossReferences(arena);
        Comparator<DraftEntry> order = Comparator.comparing((DraftEntry entry) -> entry.sortKey)
            .thenComparing(entry -> entry.text);
        arena.entries.values().forEach(entry -> entry.children.sort(order));
        List<DraftEntry> mains = new ArrayList<>(arena.mainEntries.values());
        mains.sort(order);

        Map<String, IndexEntry> entries = new LinkedHashMap<>();
        for (DraftEntry draft : arena.entries.values()) {
            entries.put(draft.id, draft.freeze(crossReferences));
        }
        List<String> mainIds = mains.stream().map(entry -> entry.id).toList();
        IndexModel model = new IndexModel(entries, mainIds, section(mains), crossReferences.resolvedCount,
            crossReferences.unresolved);
        log.info("Built index: {} main entries, {} sub-entries, {} occurrences, {} cross-references resolved, {} unresolved",
            mainIds.size(), model.subEntryCount(), occurrences.size(), crossReferences.resolvedCount,
            crossReferences.unresolved.size());
        return model;
    }

    private void link(Arena arena, IndexTerm term, IndexOccurrence occurrence) {
        DraftEntry entry = arena.mainEntries.get(normalizer.mergeKey(term.mainText()));
        if (entry == null) {
            entry = arena.create(term.mainText(), null, term.path().subList(0, 1), normalizer);
            arena.mainEntries.put(normalizer.mergeKey(term.mainText()), entry);
        }
        entry.occurrences.add(occurrence);
        List<String> path = term.path();
        for (int depth = 1; depth < path.size(); depth++) {
            String subText = path.get(depth);
            String key = normalizer.mergeKey(subText);
            DraftEntry child = entry.childrenByKey.get(key);
            if (child == null) {
                child = arena.create(subText, entry.id, path.subList(0, depth + 1), normalizer);
                entry.childrenByKey.put(key, child);
                entry.children.add(child);
            }
            child.occurrences.add(occurrence);
            entry = child;
        }
        entry.emphasis |= term.emphasis();
        term.seeRefs().forEach(entry.seeRefs::add);
        term.seeAlsoRefs().forEach(entry.seeAlsoRefs::add);
    }

    private CrossReferenceOutcome resolveCrossReferences(Arena arena) {
        CrossReferenceOutcome outcome = new CrossReferenceOutcome();
        for (DraftEntry entry : arena.entries.values()) {
            resolveAll(arena, entry, entry.seeRefs, false, outcome);
            resolveAll(arena, entry, entry.seeAlsoRefs, true, outcome);
        }
        return outcome;
    }

    private void resolveAll(Arena arena, DraftEntry entry, Set<String> references, boolean seeAlso,
                            CrossReferenceOutcome outcome) {
        Set<String> resolved = new LinkedHashSet<>();
        for (String reference : references) {
            Optional<DraftEntry> target = lookup(arena, reference);
            if (target.isEmpty()) {
                log.warn("Index cross-reference '{}' from '{}' matches no entry", reference, entry.text);
                outcome.unresolved.add(new UnresolvedIndexReference(entry.text, reference, seeAlso, Reason.NO_SUCH_ENTRY));
            } else if (target.get() == entry) {
                log.warn("Index entry '{}' refers to itself", entry.text);
                outcome.unresolved.add(new UnresolvedIndexReference(entry.text, reference, seeAlso, Reason.SELF_REFERENCE));
            } else if (resolved.add(target.get().id)) {
                outcome.resolvedCount++;
            }
        }
        outcome.resolvedIds.put(key(entry, seeAlso), List.copyOf(resolved));
    }

    // "main:sub" references walk down the hierarchy
    private Optional<DraftEntry> lookup(Arena arena, String reference) {
        String[] levels = reference.split(":");
        DraftEntry current = arena.mainEntries.get(normalizer.mergeKey(levels[0].trim()));
        for (int depth = 1; current != null && depth < levels.length; depth++) {
            String level = levels[depth].trim();
            if (!level.isEmpty()) {
                current = current.childrenByKey.get(normalizer.mergeKey(level));
            }
        }
        return Optional.ofNullable(current);
    }

    private List<IndexSection> section(List<DraftEntry> mains) {
        Map<String, List<String>> byLetter = new TreeMap<>(Comparator
            .comparing((String letter) -> IndexSection.SYMBOLS.equals(letter))
            .thenComparing(Comparator.naturalOrder()));
        for (DraftEntry main : mains) {
            byLetter.computeIfAbsent(main.groupKey, letter -> new ArrayList<>()).add(main.id);
        }
        List<IndexSection> sections = new ArrayList<>();
        byLetter.forEach((letter, ids) -> sections.add(new IndexSection(letter, ids)));
        return sections;
    }

    private static String key(DraftEntry entry, boolean seeAlso) {
        return entry.id + (seeAlso ? "|also" : "|see");
    }

    private static final class Arena {
        private final AnchorIdGenerator idGenerator;
        private final Map<String, DraftEntry> entries = new LinkedHashMap<>();
        private final Map<String, DraftEntry> mainEntries = new LinkedHashMap<>();
        private final Set<String> usedIds = new HashSet<>();

        private Arena(AnchorIdGenerator idGenerator) {
            this.idGenerator = idGenerator;
        }

        private DraftEntry create(String text, String parentId, List<String> path, SortKeyNormalizer normalizer) {
            String id = assignId(String.join(" ", path));
            String sortKey = normalizer.sortKey(text);
            DraftEntry entry = new DraftEntry(id, text, sortKey, normalizer.groupLetter(sortKey), parentId);
            entries.put(id, entry);
            return entry;
        }

        private String assignId(String content) {
            String base = idGenerator.deriveBase(ENTRY_LABEL, content);
            String id;
            try {
                id = idGenerator.disambiguate(base, usedIds::contains);
            } catch (IdCollisionExhaustedException e) {
                id = ENTRY_ID_PREFIX + "-" + ENTRY_LABEL + "-" + (entries.size() + 1);
                log.warn("Falling back to sequential index entry id {}: {}", id, e.getMessage());
                while (usedIds.contains(id)) {
                    id = id + "x";
                }
            }
            usedIds.add(id);
            return id;
        }
    }

    private static final class DraftEntry {
        private final String id;
        private final String text;
        private final String sortKey;
        private final String groupKey;
        private final String parentId;
        private final List<DraftEntry> children = new ArrayList<>();
        private final Map<String, DraftEntry> childrenByKey = new HashMap<>();
        private final List<IndexOccurrence> occurrences = new ArrayList<>();
        private final Set<String> seeRefs = new LinkedHashSet<>();
        private final Set<String> seeAlsoRefs = new LinkedHashSet<>();
        private boolean emphasis;

        private DraftEntry(String id, String text, String sortKey, String groupKey, String parentId) {
            this.id = id;
            this.text = text;
            this.sortKey = sortKey;
            this.groupKey = groupKey;
            this.parentId = parentId;
        }

        private IndexEntry freeze(CrossReferenceOutcome crossReferences) {
            return new IndexEntry(id, text, sortKey, groupKey, parentId,
                children.stream().map(child -> child.id).toList(),
                occurrences, List.copyOf(seeRefs), List.copyOf(seeAlsoRefs),
                crossReferences.resolvedIds.getOrDefault(key(this, false), List.of()),
                crossReferences.resolvedIds.getOrDefault(key(this, true), List.of()),
                emphasis);
        }
    }

    private static final class CrossReferenceOutcome {
        private final Map<String, List<String>> resolvedIds = new HashMap<>();
        private final List<UnresolvedIndexReference> unresolved = new ArrayList<>();
        private int resolvedCount;
    }
}
