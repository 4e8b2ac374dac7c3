package com.williamcallahan.crossref.domain.report;

import java.util.Objects;

/**
 * A target whose id could not be made unique within the attempt cap. The target is
 * left out of the registry; every other target is unaffected.
 */
public record IdAssignmentFailure(String file, int position, String kind, String baseId, int attempts, String message) {

    public IdAssignmentFailure {
        Objects.requireNonNull(file, "File cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(baseId, "Base id cannot be null");
        message = message == null ? "" : message;
    }
}
