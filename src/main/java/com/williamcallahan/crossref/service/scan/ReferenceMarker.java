package com.williamcallahan.crossref.service.scan;

import com.williamcallahan.crossref.domain.anchor.ReferenceOrigin;
import java.util.Objects;

/**
 * A cross-reference found in a chunk: a fragment link, a cross-ref span or a REF comment pair.
 *
 * @param callId id of the call site (authored, or synthetic {@code crossref-N})
 * @param targetKey raw key to resolve
 * @param displayText visible text of the call
 * @param position document-order position of the link, span or opening comment
 * @param origin construct the call was read from
 * @param targetFile file named before the fragment of a link, null when the key is unqualified
 */
public record ReferenceMarker(String callId, String targetKey, String displayText, int position, ReferenceOrigin origin,
                              String targetFile) {

    public ReferenceMarker {
        Objects.requireNonNull(callId, "Call id cannot be null");
        Objects.requireNonNull(targetKey, "Target key cannot be null");
        Objects.requireNonNull(origin, "Origin cannot be null");
        displayText = displayText == null ? "" : displayText;
    }
}
