package com.williamcallahan.crossref.domain.index;

import java.util.List;
import java.util.Objects;

/**
 * All main entries sharing a group key, e.g. every entry under "A", or "#" for symbols.
 */
public record IndexSection(String letter, List<String> entryIds) {

    public static final String SYMBOLS = "#";

    public IndexSection {
        Objects.requireNonNull(letter, "Section letter cannot be null");
        entryIds = entryIds == null ? List.of() : List.copyOf(entryIds);
    }

    public boolean isSymbols() {
        return SYMBOLS.equals(letter);
    }
}
