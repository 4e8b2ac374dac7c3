package com.williamcallahan.crossref.service;

/**
 * Signals that a whole resolution run failed (interruption or a worker failure).
 * No partial result is produced.
 */
public class CrossReferenceProcessingException extends IllegalStateException {

    /**
     * Creates a run failure with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public CrossReferenceProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
