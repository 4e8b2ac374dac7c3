package com.williamcallahan.crossref.service.anchor;

/**
 * Signals that the disambiguation loop ran out of attempts for one target.
 * The target gets no id; the run continues for every other target.
 */
public class IdCollisionExhaustedException extends RuntimeException {

    private final String baseId;
    private final int attempts;

    /**
     * Creates an exhaustion failure for a base id.
     *
     * @param baseId id that kept colliding
     * @param attempts number of suffixed candidates that were tried
     */
    public IdCollisionExhaustedException(String baseId, int attempts) {
        super("Could not find a free id for '" + baseId + "' after " + attempts + " attempts");
        this.baseId = baseId;
        this.attempts = attempts;
    }

    public String getBaseId() {
        return baseId;
    }

    public int getAttempts() {
        return attempts;
    }
}
