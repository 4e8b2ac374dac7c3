package com.williamcallahan.crossref.service.scan;

import com.williamcallahan.crossref.domain.anchor.AnchorKind;
import java.util.Objects;

/**
 * A heading, figure, table or bookmark found in a chunk.
 *
 * @param kind target kind
 * @param candidateId id the element carries, null when absent
 * @param title caption or heading text
 * @param plainText markup-free element text
 * @param position document-order position of the element
 * @param level heading level, 0 for other kinds
 * @param number per-chunk sequence number for figures and tables, null otherwise
 */
public record TargetMarker(
    AnchorKind kind,
    String candidateId,
    String title,
    String plainText,
    int position,
    int level,
    String number
) {

    public TargetMarker {
        Objects.requireNonNull(kind, "Target kind cannot be null");
        title = title == null ? "" : title;
        plainText = plainText == null ? "" : plainText;
    }
}
