package com.williamcallahan.crossref.domain.anchor;

import java.util.Objects;
import java.util.Optional;

/**
 * A symbolic link from running text to a target, as authored.
 *
 * @param id call-site id (back-reference target for note calls)
 * @param targetKey raw unresolved key: an id, a title fragment or free text
 * @param file file containing the call
 * @param position document-order position inside the chunk
 * @param displayText visible text of the call
 * @param origin markup construct the call was read from
 * @param targetFile file the author named with the key ({@code file.xhtml#key}), null when unqualified
 */
public record ReferenceCall(
    String id,
    String targetKey,
    String file,
    int position,
    String displayText,
    ReferenceOrigin origin,
    String targetFile
) {

    public ReferenceCall {
        Objects.requireNonNull(id, "Call id cannot be null");
        Objects.requireNonNull(targetKey, "Target key cannot be null");
        Objects.requireNonNull(file, "Call file cannot be null");
        Objects.requireNonNull(origin, "Call origin cannot be null");
        if (position < 0) {
            throw new IllegalArgumentException("Call position must be non-negative");
        }
        displayText = displayText == null ? "" : displayText;
        targetFile = targetFile == null || targetFile.isBlank() ? null : targetFile;
    }

    public ReferenceCall(String id, String targetKey, String file, int position, String displayText,
                         ReferenceOrigin origin) {
        this(id, targetKey, file, position, displayText, origin, null);
    }

    public Optional<String> qualifiedFile() {
        return Optional.ofNullable(targetFile);
    }
}
