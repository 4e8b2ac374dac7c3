package com.williamcallahan.crossref.domain.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed index marker: main term, ordered sub-terms and cross-reference clauses.
 *
 * @param rawText entry text as authored
 * @param mainText display text of the main entry
 * @param subTerms ordered sub-entry texts, outermost first
 * @param seeRefs raw "see" targets
 * @param seeAlsoRefs raw "see also" targets
 * @param emphasis whether the entry is rendered emphasized
 * @param primary whether this occurrence is the primary discussion of the term
 */
public record IndexTerm(
    String rawText,
    String mainText,
    List<String> subTerms,
    List<String> seeRefs,
    List<String> seeAlsoRefs,
    boolean emphasis,
    boolean primary
) {

    public IndexTerm {
        Objects.requireNonNull(rawText, "Raw index text cannot be null");
        Objects.requireNonNull(mainText, "Main index text cannot be null");
        if (mainText.isBlank()) {
            throw new IllegalArgumentException("Main index text cannot be blank");
        }
        subTerms = subTerms == null ? List.of() : List.copyOf(subTerms);
        seeRefs = seeRefs == null ? List.of() : List.copyOf(seeRefs);
        seeAlsoRefs = seeAlsoRefs == null ? List.of() : List.copyOf(seeAlsoRefs);
    }

    /**
     * @return main term followed by sub-terms, the path used for hierarchy
     */
    public List<String> path() {
        List<String> path = new ArrayList<>(subTerms.size() + 1);
        path.add(mainText);
        path.addAll(subTerms);
        return List.copyOf(path);
    }
}
