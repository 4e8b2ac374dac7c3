package com.williamcallahan.crossref.domain.anchor;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one {@link ReferenceCall}. Produced exactly once per call.
 *
 * @param call the call that was resolved
 * @param href {@code #id} or {@code file#id}; null when broken
 * @param target matched target; null when broken
 * @param strategy which lookup matched
 */
public record ResolvedReference(ReferenceCall call, String href, AnchorTarget target, MatchStrategy strategy) {

    public ResolvedReference {
        Objects.requireNonNull(call, "Resolved call cannot be null");
        Objects.requireNonNull(strategy, "Match strategy cannot be null");
        if (strategy == MatchStrategy.NONE && (href != null || target != null)) {
            throw new IllegalArgumentException("Broken references carry no href or target");
        }
        if (strategy != MatchStrategy.NONE && (href == null || target == null)) {
            throw new IllegalArgumentException("Resolved references need both href and target");
        }
    }

    public static ResolvedReference resolved(ReferenceCall call, String href, AnchorTarget target, MatchStrategy strategy) {
        return new ResolvedReference(call, href, target, strategy);
    }

    public static ResolvedReference broken(ReferenceCall call) {
        return new ResolvedReference(call, null, null, MatchStrategy.NONE);
    }

    public boolean broken() {
        return strategy == MatchStrategy.NONE;
    }

    public Optional<String> resolvedHref() {
        return Optional.ofNullable(href);
    }

    /**
     * Lookup that produced the match, in resolution order.
     */
    public enum MatchStrategy {
        FINAL_ID,
        ORIGINAL_ID,
        FUZZY_TEXT,
        NONE
    }
}
