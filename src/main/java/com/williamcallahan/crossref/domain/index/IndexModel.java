package com.williamcallahan.crossref.domain.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The finished index: entry arena, sorted main entries, alphabetical sections and
 * cross-reference statistics.
 */
public record IndexModel(
    Map<String, IndexEntry> entries,
    List<String> mainEntryIds,
    List<IndexSection> sections,
    int crossReferencesResolved,
    List<UnresolvedIndexReference> unresolvedReferences
) {

    public IndexModel {
        Objects.requireNonNull(entries, "Entries cannot be null");
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        mainEntryIds = mainEntryIds == null ? List.of() : List.copyOf(mainEntryIds);
        sections = sections == null ? List.of() : List.copyOf(sections);
        unresolvedReferences = unresolvedReferences == null ? List.of() : List.copyOf(unresolvedReferences);
        if (crossReferencesResolved < 0) {
            throw new IllegalArgumentException("Resolved cross-reference count must be non-negative");
        }
    }

    public static IndexModel empty() {
        return new IndexModel(Map.of(), List.of(), List.of(), 0, List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<IndexEntry> entry(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    /**
     * Finds a main entry by its display text (exact match).
     *
     * @param text display text
     * @return the entry when present
     */
    public Optional<IndexEntry> mainEntryByText(String text) {
        return mainEntryIds.stream()
            .map(entries::get)
            .filter(entry -> entry.text().equals(text))
            .findFirst();
    }

    public int subEntryCount() {
        return entries.size() - mainEntryIds.size();
    }

    /**
     * Maps {@code main} and {@code main:sub} paths to the distinct files holding their occurrences.
     *
     * @return path to files, in index order
     */
    public Map<String, List<String>> occurrenceMapping() {
        Map<String, List<String>> mapping = new LinkedHashMap<>();
        for (String mainId : mainEntryIds) {
            IndexEntry main = entries.get(mainId);
            mapping.put(main.text(), distinctFiles(main));
            for (String childId : main.childIds()) {
                IndexEntry child = entries.get(childId);
                mapping.put(main.text() + ":" + child.text(), distinctFiles(child));
            }
        }
        return mapping;
    }

    private static List<String> distinctFiles(IndexEntry entry) {
        Set<String> files = new LinkedHashSet<>();
        entry.occurrences().forEach(occurrence -> files.add(occurrence.file()));
        return new ArrayList<>(files);
    }
}
