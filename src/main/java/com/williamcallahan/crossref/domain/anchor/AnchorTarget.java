package com.williamcallahan.crossref.domain.anchor;

import java.util.Objects;
import java.util.Optional;

/**
 * An addressable element with its final, document-wide unique id.
 *
 * @param id final collision-free id
 * @param originalId author-supplied id, null when absent
 * @param kind element kind
 * @param title display title (caption, heading text, entry text)
 * @param plainText markup-free text of the element
 * @param file owning output file
 * @param position document-order position inside the owning chunk
 * @param level heading depth 1..6, 0 for other kinds
 * @param number sequence label such as the figure number, null when absent
 */
public record AnchorTarget(
    String id,
    String originalId,
    AnchorKind kind,
    String title,
    String plainText,
    String file,
    int position,
    int level,
    String number
) {

    public AnchorTarget {
        Objects.requireNonNull(id, "Target id cannot be null");
        Objects.requireNonNull(kind, "Target kind cannot be null");
        Objects.requireNonNull(file, "Target file cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Target id cannot be blank");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Target position must be non-negative");
        }
        if (level < 0 || level > 6) {
            throw new IllegalArgumentException("Heading level must be between 0 and 6");
        }
        title = title == null ? "" : title;
        plainText = plainText == null ? "" : plainText;
    }

    /**
     * @return the author-supplied id when one was present
     */
    public Optional<String> originalIdValue() {
        return Optional.ofNullable(originalId);
    }
}
