package com.williamcallahan.crossref.service.anchor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.crossref.domain.anchor.AnchorKind;
import com.williamcallahan.crossref.domain.anchor.AnchorTarget;
import com.williamcallahan.crossref.service.EngineOptions.AnchorOptions;
import com.williamcallahan.crossref.service.anchor.AnchorRegistry.Registration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Verifies id assignment, lookups and the frozen lifecycle of the anchor registry.
 */
class AnchorRegistryTest {

    @Test
    void adoptsSafeAuthorIdsVerbatim() {
        AnchorRegistry registry = new AnchorRegistry(AnchorOptions.defaults());

        String id = registry.register("intro", AnchorKind.HEADING, "Introduction", "ch1.xhtml", 3);

        assertEquals("intro", id);
        assertEquals(0, registry.collisionsResolved());
    }

    @Test
    void duplicateHeadingsGetDistinctDeterministicIds() {
        List<String> firstRun = registerTwoIntroductions();
        List<String> secondRun = registerTwoIntroductions();

        assertEquals("ref-heading-introduction", firstRun.get(0));
        assertTrue(firstRun.get(1).startsWith("ref-heading-introduction-"), firstRun.get(1));
        assertNotEquals(firstRun.get(0), firstRun.get(1));
        assertEquals(firstRun, secondRun);
    }

    @Test
    void everyRegisteredIdIsUnique() {
        AnchorRegistry registry = new AnchorRegistry(AnchorOptions.defaults());
        for (int index = 0; index < 50; index++) {
            registry.register("note", AnchorKind.FOOTNOTE, "same text", "ch" + (index % 3) + ".xhtml", index);
            registry.register(null, AnchorKind.HEADING, "Summary", "ch" + (index % 3) + ".xhtml", index + 100);
        }

        Set<String> ids = new HashSet<>();
        registry.targets().forEach(target -> assertTrue(ids.add(target.id()), "duplicate " + target.id()));
        assertEquals(100, registry.size());
        assertEquals(100, registry.manifest().size());
    }

    @Test
    void unsafeAuthorIdIsReplacedButStillFindable() {
        AnchorRegistry registry = new AnchorRegistry(AnchorOptions.defaults());
        String id = registry.register("1.2", AnchorKind.FIGURE, "Network layout", "ch2.xhtml", 7);
        registry.freeze();

        assertEquals("ref-figure-network-layout", id);
        AnchorTarget target = registry.findByOriginalId("1.2", "ch1.xhtml").orElseThrow();
        assertEquals(id, target.id());
        assertEquals("1.2", target.originalIdValue().orElseThrow());
    }

    @Test
    void originalIdLookupPrefersCallerFile() {
        AnchorRegistry registry = new AnchorRegistry(AnchorOptions.defaults());
        registry.register("fn1", AnchorKind.FOOTNOTE, "first", "ch1.xhtml", 4);
        String second = registry.register("fn1", AnchorKind.FOOTNOTE, "second", "ch2.xhtml", 4);
        registry.freeze();

        assertEquals(second, registry.findByOriginalId("fn1", "ch2.xhtml").orElseThrow().id());
        assertEquals("fn1", registry.findByOriginalId("fn1", "ch3.xhtml").orElseThrow().id());
    }

    @Test
    void fuzzyMatchHonorsMinimumLength() {
        AnchorRegistry registry = new AnchorRegistry(new AnchorOptions("ref", 50, 6, 1000, 4));
        registry.register(Registration.of(null, AnchorKind.HEADING, "Results", "ch1.xhtml", 2));
        registry.register(Registration.of("fn-res", AnchorKind.FOOTNOTE, "Results", "ch1.xhtml", 9));
        registry.freeze();

        assertTrue(registry.findByText("res", "ch1.xhtml").isEmpty());
        AnchorTarget match = registry.findByText("see the results", "ch2.xhtml").orElseThrow();
        assertEquals(AnchorKind.HEADING, match.kind());
        assertEquals("ref-heading-results", registry.findByText("results", "ch1.xhtml").orElseThrow().id());
    }

    @Test
    void frozenRegistryRejectsRegistration() {
        AnchorRegistry registry = new AnchorRegistry(AnchorOptions.defaults());
        registry.freeze();

        assertThrows(IllegalStateException.class,
            () -> registry.register("late", AnchorKind.BOOKMARK, "Late", "ch1.xhtml", 1));
    }

    @Test
    void collisionLoopStopsAtConfiguredCap() {
        AnchorRegistry registry = new AnchorRegistry(new AnchorOptions("ref", 50, 1, 2, 3));

        IdCollisionExhaustedException exception = assertThrows(IdCollisionExhaustedException.class, () -> {
            for (int index = 0; index < 4; index++) {
                registry.register("dup", AnchorKind.BOOKMARK, "Dup", "ch1.xhtml", index);
            }
        });

        assertEquals("dup", exception.getBaseId());
        assertEquals(2, exception.getAttempts());
    }

    @Test
    void countsTargetsPerKind() {
        AnchorRegistry registry = new AnchorRegistry(AnchorOptions.defaults());
        registry.register(null, AnchorKind.HEADING, "One", "ch1.xhtml", 1);
        registry.register(null, AnchorKind.HEADING, "Two", "ch1.xhtml", 2);
        registry.register(null, AnchorKind.TABLE, "Prices", "ch1.xhtml", 3);

        assertEquals(2, registry.countsByKind().get(AnchorKind.HEADING));
        assertEquals(1, registry.countsByKind().get(AnchorKind.TABLE));
        assertEquals(2, registry.targets(AnchorKind.HEADING).size());
    }

    private static List<String> registerTwoIntroductions() {
        AnchorRegistry registry = new AnchorRegistry(AnchorOptions.defaults());
        String first = registry.register(null, AnchorKind.HEADING, "Introduction", "a.xhtml", 2);
        String second = registry.register(null, AnchorKind.HEADING, "Introduction", "b.xhtml", 2);
        return List.of(first, second);
    }
}
