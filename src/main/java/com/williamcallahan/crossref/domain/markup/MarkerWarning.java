package com.williamcallahan.crossref.domain.markup;

/**
 * Represents a non-fatal problem found while scanning markers.
 * The offending marker is skipped; the run continues.
 */
public record MarkerWarning(
    String message,
    WarningType type,
    String file,
    int position
) {

    public MarkerWarning {
        if (message == null || message.trim().isEmpty()) {
            throw new IllegalArgumentException("Warning message cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Warning type cannot be null");
        }
        if (file == null) {
            throw new IllegalArgumentException("Warning file cannot be null");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Warning position must be non-negative");
        }
    }

    /**
     * Warning types for categorization.
     */
    public enum WarningType {
        /**
         * Index marker with no usable entry text.
         */
        MALFORMED_INDEX_MARKER,

        /**
         * REF comment without key or without closing comment.
         */
        MALFORMED_REFERENCE,

        /**
         * Note call without a target fragment.
         */
        MALFORMED_NOTE_CALL,

        /**
         * Note body without an id.
         */
        MALFORMED_NOTE_BODY,

        /**
         * Target element that could not be turned into a record.
         */
        MALFORMED_TARGET
    }
}
