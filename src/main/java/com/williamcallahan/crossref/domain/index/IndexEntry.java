package com.williamcallahan.crossref.domain.index;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the index arena. Parent and children are referenced by entry id, never owned.
 *
 * @param id stable entry id, also the anchor id on the index page
 * @param text display text, never normalized
 * @param sortKey normalized ordering key (diacritics and leading article stripped)
 * @param groupKey alphabetical section, computed once when the entry was created
 * @param parentId parent entry id, null for main entries
 * @param childIds child entry ids in sort order
 * @param occurrences occurrences in appearance order
 * @param seeRefs raw "see" strings as authored
 * @param seeAlsoRefs raw "see also" strings as authored
 * @param resolvedSeeIds entry ids the "see" strings resolved to
 * @param resolvedSeeAlsoIds entry ids the "see also" strings resolved to
 * @param emphasis whether the entry is rendered emphasized
 */
public record IndexEntry(
    String id,
    String text,
    String sortKey,
    String groupKey,
    String parentId,
    List<String> childIds,
    List<IndexOccurrence> occurrences,
    List<String> seeRefs,
    List<String> seeAlsoRefs,
    List<String> resolvedSeeIds,
    List<String> resolvedSeeAlsoIds,
    boolean emphasis
) {

    public IndexEntry {
        Objects.requireNonNull(id, "Entry id cannot be null");
        Objects.requireNonNull(text, "Entry text cannot be null");
        Objects.requireNonNull(sortKey, "Entry sort key cannot be null");
        Objects.requireNonNull(groupKey, "Entry group key cannot be null");
        childIds = childIds == null ? List.of() : List.copyOf(childIds);
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
        seeRefs = seeRefs == null ? List.of() : List.copyOf(seeRefs);
        seeAlsoRefs = seeAlsoRefs == null ? List.of() : List.copyOf(seeAlsoRefs);
        resolvedSeeIds = resolvedSeeIds == null ? List.of() : List.copyOf(resolvedSeeIds);
        resolvedSeeAlsoIds = resolvedSeeAlsoIds == null ? List.of() : List.copyOf(resolvedSeeAlsoIds);
    }

    public Optional<String> parent() {
        return Optional.ofNullable(parentId);
    }
}
