package com.williamcallahan.crossref.service.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.crossref.domain.anchor.AnchorKind;
import com.williamcallahan.crossref.domain.anchor.ReferenceCall;
import com.williamcallahan.crossref.domain.anchor.ReferenceOrigin;
import com.williamcallahan.crossref.domain.anchor.ResolvedReference;
import com.williamcallahan.crossref.domain.anchor.ResolvedReference.MatchStrategy;
import com.williamcallahan.crossref.service.EngineOptions.AnchorOptions;
import com.williamcallahan.crossref.service.anchor.AnchorRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies lookup order, href shape and broken-reference handling.
 */
class ReferenceResolverTest {

    private AnchorRegistry registry;
    private String introA;
    private String introB;

    @BeforeEach
    void setUp() {
        registry = new AnchorRegistry(AnchorOptions.defaults());
        introA = registry.register(null, AnchorKind.HEADING, "Introduction", "a.xhtml", 2);
        registry.register(null, AnchorKind.HEADING, "Methods", "a.xhtml", 5);
        introB = registry.register(null, AnchorKind.HEADING, "Introduction", "b.xhtml", 2);
        registry.register("1.2", AnchorKind.FIGURE, "Overview diagram", "b.xhtml", 7);
        registry.freeze();
    }

    @Test
    void titleReferencePrefersCallerFileThenFallsBackAcrossFiles() {
        ReferenceResolver resolver = new ReferenceResolver(registry);

        ResolvedReference fromB = resolver.resolve(call("Introduction", "b.xhtml"));
        ResolvedReference fromC = resolver.resolve(call("Introduction", "c.xhtml"));

        assertEquals("#" + introB, fromB.href());
        assertEquals(MatchStrategy.FUZZY_TEXT, fromB.strategy());
        assertEquals("a.xhtml#" + introA, fromC.href());
    }

    @Test
    void finalIdWinsOverOriginalId() {
        ReferenceResolver resolver = new ReferenceResolver(registry);

        ResolvedReference byId = resolver.resolve(call(introB, "a.xhtml"));
        ResolvedReference byOriginal = resolver.resolve(call("1.2", "a.xhtml"));

        assertEquals(MatchStrategy.FINAL_ID, byId.strategy());
        assertEquals("b.xhtml#" + introB, byId.href());
        assertEquals(MatchStrategy.ORIGINAL_ID, byOriginal.strategy());
        assertEquals("b.xhtml#ref-figure-overview-diagram", byOriginal.href());
    }

    @Test
    void fallsBackToDisplayText() {
        ReferenceCall call = new ReferenceCall("crossref-1", "nowhere", "a.xhtml", 9, "the methods section",
            ReferenceOrigin.CROSS_REF_SPAN);

        ResolvedReference resolved = new ReferenceResolver(registry).resolve(call);

        assertEquals(AnchorKind.HEADING, resolved.target().kind());
        assertEquals("Methods", resolved.target().title());
    }

    @Test
    void unmatchedReferenceIsBroken() {
        ResolvedReference resolved = new ReferenceResolver(registry).resolve(call("Appendix Z", "a.xhtml"));

        assertTrue(resolved.broken());
        assertNull(resolved.href());
        assertTrue(resolved.resolvedHref().isEmpty());
    }

    @Test
    void everyResolvedHrefPointsAtARegisteredTarget() {
        List<ResolvedReference> resolved = new ReferenceResolver(registry).resolveAll(List.of(
            call("Introduction", "a.xhtml"), call("Methods", "b.xhtml"), call("1.2", "c.xhtml"), call("zzz", "a.xhtml")));

        assertEquals(4, resolved.size());
        for (ResolvedReference reference : resolved) {
            if (!reference.broken()) {
                String id = reference.href().substring(reference.href().indexOf('#') + 1);
                assertEquals(reference.target(), registry.findById(id).orElseThrow());
            }
        }
        assertEquals("zzz", resolved.get(3).call().targetKey());
    }

    @Test
    void locatorMovesTargetsToAnotherFile() {
        ReferenceResolver resolver = new ReferenceResolver(registry,
            (file, position) -> position == 2 ? "moved.xhtml" : file);

        assertEquals("moved.xhtml#" + introA, resolver.resolve(call(introA, "a.xhtml")).href());
    }

    @Test
    void callMovedWithItsNoteLinksBackToTheFileItLeft() {
        ReferenceResolver resolver = new ReferenceResolver(registry,
            (file, position) -> position == 1 ? "notes.xhtml" : file);

        assertEquals("a.xhtml#" + introA, resolver.resolve(call(introA, "a.xhtml")).href());
    }

    @Test
    void fileQualifiedKeyIsLookedUpInThatFileFirst() {
        AnchorRegistry twins = new AnchorRegistry(AnchorOptions.defaults());
        String first = twins.register("intro", AnchorKind.HEADING, "One", "ch1.xhtml", 2);
        String second = twins.register("intro", AnchorKind.HEADING, "Two", "ch2.xhtml", 2);
        twins.freeze();
        ReferenceResolver resolver = new ReferenceResolver(twins);

        ResolvedReference qualified = resolver.resolve(
            new ReferenceCall("crossref-1", "intro", "ch1.xhtml", 5, "the other", ReferenceOrigin.LINK, "ch2.xhtml"));
        ResolvedReference plain = resolver.resolve(call("intro", "ch1.xhtml"));

        assertEquals("intro", first);
        assertEquals("ch2.xhtml#" + second, qualified.href());
        assertEquals(MatchStrategy.ORIGINAL_ID, qualified.strategy());
        assertEquals("#intro", plain.href());
    }

    @Test
    void openRegistryIsRejected() {
        AnchorRegistry open = new AnchorRegistry(AnchorOptions.defaults());

        assertThrows(IllegalStateException.class, () -> new ReferenceResolver(open));
    }

    private static ReferenceCall call(String key, String file) {
        return new ReferenceCall("crossref-1", key, file, 1, key, ReferenceOrigin.LINK);
    }
}
