package com.williamcallahan.crossref.service.anchor;

import com.williamcallahan.crossref.domain.anchor.AnchorKind;
import com.williamcallahan.crossref.domain.anchor.AnchorManifestEntry;
import com.williamcallahan.crossref.domain.anchor.AnchorTarget;
import com.williamcallahan.crossref.service.EngineOptions.AnchorOptions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every addressable target of a run and guarantees document-wide id uniqueness.
 *
 * <p>Lifecycle is {@code open -> merge -> freeze -> query}: targets are registered by a single
 * writer in file order, then in discovery order; after {@link #freeze()} the registry is
 * read-only and may be queried from any thread. Registration is append-only, so the same
 * registration sequence always produces the same ids.</p>
 */
public final class AnchorRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnchorRegistry.class);

    private final AnchorOptions options;
    private final AnchorIdGenerator idGenerator;
    private final List<AnchorTarget> targets = new ArrayList<>();
    private final Map<String, AnchorTarget> targetsById = new HashMap<>();
    private final Map<String, List<AnchorTarget>> targetsByOriginalId = new HashMap<>();
    private int collisionsResolved;
    private volatile boolean frozen;

    public AnchorRegistry(AnchorOptions options) {
        this.options = Objects.requireNonNull(options, "Anchor options cannot be null");
        this.idGenerator = new AnchorIdGenerator(options.idPrefix(), options.maxIdLength(),
            options.collisionSuffixLength(), options.maxCollisionAttempts());
    }

    /**
     * Registers a target and assigns its final id.
     *
     * <p>A safe, unused candidate is adopted verbatim. A safe candidate that is taken is
     * disambiguated; an unsafe or missing candidate falls back to an id derived from the
     * registration's fallback content.</p>
     *
     * @param registration target description
     * @return the registered target carrying its final id
     * @throws IdCollisionExhaustedException when no free id was found within the attempt cap
     * @throws IllegalStateException when the registry is already frozen
     */
    public AnchorTarget register(Registration registration) {
        Objects.requireNonNull(registration, "Registration cannot be null");
        if (frozen) {
            throw new IllegalStateException("Anchor registry is frozen; cannot register " + registration.kind());
        }
        String candidate = registration.candidateId();
        String base = AnchorIdGenerator.isSafeId(candidate)
            ? candidate
            : idGenerator.deriveBase(registration.kind().label(), registration.fallbackContent());
        String finalId = idGenerator.disambiguate(base, targetsById::containsKey);
        if (!finalId.equals(base)) {
            collisionsResolved++;
            log.debug("Id collision on {} resolved as {}", base, finalId);
        }

        AnchorTarget target = new AnchorTarget(finalId, candidate, registration.kind(), registration.title(),
            registration.plainText(), registration.file(), registration.position(), registration.level(),
            registration.number());
        targets.add(target);
        targetsById.put(finalId, target);
        if (candidate != null) {
            targetsByOriginalId.computeIfAbsent(candidate, key -> new ArrayList<>()).add(target);
        }
        return target;
    }

    /**
     * Convenience form of {@link #register(Registration)} returning only the final id.
     */
    public String register(String candidateId, AnchorKind kind, String fallbackContent, String file, int position) {
        return register(Registration.of(candidateId, kind, fallbackContent, file, position)).id();
    }

    /**
     * Ends the merge phase. Further registrations fail.
     */
    public void freeze() {
        frozen = true;
        log.debug("Anchor registry frozen with {} targets ({} collisions resolved)", targets.size(), collisionsResolved);
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Looks a target up by its final id.
     */
    public Optional<AnchorTarget> findById(String id) {
        return Optional.ofNullable(id).map(targetsById::get);
    }

    /**
     * Looks a target up by the id its author gave it, preferring the caller's file,
     * then registration order.
     */
    public Optional<AnchorTarget> findByOriginalId(String originalId, String callerFile) {
        if (originalId == null) {
            return Optional.empty();
        }
        List<AnchorTarget> matches = targetsByOriginalId.getOrDefault(originalId, List.of());
        return preferFile(matches, callerFile);
    }

    /**
     * Looks a key up inside one file only: final id first, then the id its author gave it.
     *
     * @param key final or original id
     * @param file file the target must have been declared in
     * @return target declared in {@code file}, if any
     */
    public Optional<AnchorTarget> findInFile(String key, String file) {
        if (key == null || file == null) {
            return Optional.empty();
        }
        AnchorTarget byId = targetsById.get(key);
        if (byId != null && byId.file().equals(file)) {
            return Optional.of(byId);
        }
        return targetsByOriginalId.getOrDefault(key, List.of()).stream()
            .filter(target -> target.file().equals(file))
            .findFirst();
    }

    /**
     * Best-effort title match: case-insensitive containment in either direction against the
     * title or plain text of headings, figures, tables and bookmarks. The shorter side of a
     * match must have at least the configured minimum length.
     *
     * @param text free text to match
     * @param callerFile file of the reference; matches there win
     * @return matched target, if any
     */
    public Optional<AnchorTarget> findByText(String text, String callerFile) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String needle = text.trim().toLowerCase(Locale.ROOT);
        AnchorTarget firstMatch = null;
        for (AnchorTarget target : targets) {
            if (!target.kind().textMatchable() || !matchesText(needle, target)) {
                continue;
            }
            if (target.file().equals(callerFile)) {
                return Optional.of(target);
            }
            if (firstMatch == null) {
                firstMatch = target;
            }
        }
        return Optional.ofNullable(firstMatch);
    }

    public List<AnchorTarget> targets() {
        return Collections.unmodifiableList(targets);
    }

    public List<AnchorTarget> targets(AnchorKind kind) {
        return targets.stream().filter(target -> target.kind() == kind).toList();
    }

    /**
     * Counts registered targets per kind.
     */
    public Map<AnchorKind, Integer> countsByKind() {
        Map<AnchorKind, Integer> counts = new EnumMap<>(AnchorKind.class);
        for (AnchorTarget target : targets) {
            counts.merge(target.kind(), 1, Integer::sum);
        }
        return counts;
    }

    public int size() {
        return targets.size();
    }

    public int collisionsResolved() {
        return collisionsResolved;
    }

    /**
     * Exports {@code id -> description} in registration order.
     */
    public Map<String, AnchorManifestEntry> manifest() {
        Map<String, AnchorManifestEntry> manifest = new LinkedHashMap<>();
        for (AnchorTarget target : targets) {
            manifest.put(target.id(), AnchorManifestEntry.from(target));
        }
        return manifest;
    }

    private boolean matchesText(String needle, AnchorTarget target) {
        return containsEitherWay(needle, target.title().toLowerCase(Locale.ROOT))
            || containsEitherWay(needle, target.plainText().toLowerCase(Locale.ROOT));
    }

    private boolean containsEitherWay(String needle, String haystack) {
        if (haystack.isEmpty()) {
            return false;
        }
        int shorter = Math.min(needle.length(), haystack.length());
        if (shorter < options.fuzzyMinLength()) {
            return false;
        }
        return haystack.contains(needle) || needle.contains(haystack);
    }

    private static Optional<AnchorTarget> preferFile(List<AnchorTarget> matches, String callerFile) {
        for (AnchorTarget match : matches) {
            if (match.file().equals(callerFile)) {
                return Optional.of(match);
            }
        }
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * Everything needed to register one target.
     *
     * @param candidateId author-supplied id, may be null
     * @param kind target kind
     * @param fallbackContent text the derived id is slugified from
     * @param title display title
     * @param plainText markup-free text
     * @param file owning file
     * @param position document-order position in the chunk
     * @param level heading level, 0 for other kinds
     * @param number sequence label, may be null
     */
    public record Registration(
        String candidateId,
        AnchorKind kind,
        String fallbackContent,
        String title,
        String plainText,
        String file,
        int position,
        int level,
        String number
    ) {
        public Registration {
            Objects.requireNonNull(kind, "Registration kind cannot be null");
            Objects.requireNonNull(file, "Registration file cannot be null");
            candidateId = candidateId == null || candidateId.isBlank() ? null : candidateId.trim();
            fallbackContent = fallbackContent == null ? "" : fallbackContent;
        }

        public static Registration of(String candidateId, AnchorKind kind, String fallbackContent, String file, int position) {
            return new Registration(candidateId, kind, fallbackContent, fallbackContent, fallbackContent, file, position, 0, null);
        }
    }
}
