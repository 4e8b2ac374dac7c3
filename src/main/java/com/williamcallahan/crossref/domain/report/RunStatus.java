package com.williamcallahan.crossref.domain.report;

/**
 * Terminal state of a resolution run. Neither state is a failure of the run itself.
 */
public enum RunStatus {
    /** Every target, reference, index cross-reference and note call was resolved. */
    COMPLETED,
    /** Output is complete, but some references, cross-references, note calls or ids could not be resolved. */
    COMPLETED_WITH_BROKEN_REFS
}
