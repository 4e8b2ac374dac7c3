package com.williamcallahan.crossref.service.resolve;

import com.williamcallahan.crossref.domain.anchor.AnchorTarget;
import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import com.williamcallahan.crossref.domain.anchor.ResolvedReference;
import com.williamcallahan.crossref.domain.anchor.ResolvedReference.MatchStrategy;
import com.williamcallahan.crossref.service.anchor.AnchorRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves reference calls against a frozen registry.
 *
 * <p>A key qualified with a file ({@code ch2.xhtml#intro}) is first looked up in that file only.
 * Otherwise, and when that fails, the first match wins: final id, then original id (caller's file
 * first), then fuzzy text containment on the key and then on the display text. The href is
 * {@code #id} when the target renders in the same output file as the call and {@code file#id}
 * otherwise. Targets are never modified.</p>
 */
public final class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final AnchorRegistry registry;
    private final TargetLocator locator;

    public ReferenceResolver(AnchorRegistry registry) {
        this(registry, TargetLocator.inPlace());
    }

    /**
     * @param registry frozen registry
     * @param locator output file of each target
     * @throws IllegalStateException when the registry is still open
     */
    public ReferenceResolver(AnchorRegistry registry, TargetLocator locator) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.locator = Objects.requireNonNull(locator, "Locator cannot be null");
        if (!registry.isFrozen()) {
            throw new IllegalStateException("References can only be resolved against a frozen registry");
        }
    }

    /**
     * Resolves one call.
     *
     * @param call the call to resolve
     * @return resolved link or a broken marker, never null
     */
    public ResolvedReference resolve(ReferenceCall call) {
        Objects.requireNonNull(call, "Reference call cannot be null");
        String key = call.targetKey().trim();

        Optional<AnchorTarget> inFile = call.qualifiedFile().flatMap(file -> registry.findInFile(key, file));
        if (inFile.isPresent()) {
            MatchStrategy strategy = inFile.get().id().equals(key) ? MatchStrategy.FINAL_ID : MatchStrategy.ORIGINAL_ID;
            return link(call, inFile.get(), strategy);
        }
        Optional<AnchorTarget> byId = registry.findById(key);
        if (byId.isPresent()) {
            return link(call, byId.get(), MatchStrategy.FINAL_ID);
        }
        Optional<AnchorTarget> byOriginal = registry.findByOriginalId(key, call.file());
        if (byOriginal.isPresent()) {
            return link(call, byOriginal.get(), MatchStrategy.ORIGINAL_ID);
        }
        Optional<AnchorTarget> byText = registry.findByText(key, call.file())
            .or(() -> registry.findByText(call.displayText(), call.file()));
        if (byText.isPresent()) {
            log.debug("Reference '{}' in {} matched '{}' by text", key, call.file(), byText.get().title());
            return link(call, byText.get(), MatchStrategy.FUZZY_TEXT);
        }
        log.warn("Broken reference {} in {}: no target for '{}'", call.id(), call.file(), key);
        return ResolvedReference.broken(call);
    }

    /**
     * Resolves calls independently; the result list has the input order.
     */
    public List<ResolvedReference> resolveAll(List<ReferenceCall> calls) {
        Objects.requireNonNull(calls, "Calls cannot be null");
        return calls.stream().map(this::resolve).toList();
    }

    /**
     * Same-file fragment or cross-file path plus fragment.
     *
     * @param target resolved target
     * @param callerFile output file holding the link
     */
    public String hrefFor(AnchorTarget target, String callerFile) {
        String targetFile = locator.fileOf(target);
        return targetFile.equals(callerFile) ? "#" + target.id() : targetFile + "#" + target.id();
    }

    private ResolvedReference link(ReferenceCall call, AnchorTarget target, MatchStrategy strategy) {
        String callerFile = locator.fileOf(call.file(), call.position());
        return ResolvedReference.resolved(call, hrefFor(target, callerFile), target, strategy);
    }
}
