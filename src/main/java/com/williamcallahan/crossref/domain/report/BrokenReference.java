package com.williamcallahan.crossref.domain.report;

import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import java.util.Objects;

/**
 * A reference or note call left unresolved, as surfaced to the caller.
 */
public record BrokenReference(String callId, String file, String targetKey, String displayText, String origin) {

    public BrokenReference {
        Objects.requireNonNull(callId, "Call id cannot be null");
        Objects.requireNonNull(file, "File cannot be null");
        Objects.requireNonNull(targetKey, "Target key cannot be null");
        displayText = displayText == null ? "" : displayText;
        origin = origin == null ? "" : origin;
    }

    public static BrokenReference of(ReferenceCall call) {
        return new BrokenReference(call.id(), call.file(), call.targetKey(), call.displayText(), call.origin().name());
    }
}
