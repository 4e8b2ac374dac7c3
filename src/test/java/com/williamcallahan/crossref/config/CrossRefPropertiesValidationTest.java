package com.williamcallahan.crossref.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.service.EngineOptions;
import org.junit.jupiter.api.Test;

/**
 * Verifies property validation and the mapping into engine options.
 */
class CrossRefPropertiesValidationTest {

    @Test
    void defaultsAreValid() {
        CrossRefProperties properties = new CrossRefProperties();

        assertDoesNotThrow(properties::validateConfiguration);
    }

    @Test
    void rejectsUnsafeIdPrefix() {
        CrossRefProperties properties = new CrossRefProperties();
        properties.getAnchors().setIdPrefix("1ref");

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsMaxIdLengthTooSmallForSuffix() {
        CrossRefProperties properties = new CrossRefProperties();
        properties.getAnchors().setMaxIdLength(10);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveParallelism() {
        CrossRefProperties properties = new CrossRefProperties();
        properties.getEngine().setParallelism(0);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsNotesFileNameWithFragment() {
        CrossRefProperties properties = new CrossRefProperties();
        properties.getNotes().setFileName("notes.xhtml#top");

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsBlankInputDirectoryWhenCliEnabled() {
        CrossRefProperties properties = new CrossRefProperties();
        properties.getCli().setEnabled(true);
        properties.getCli().setInputDir(" ");

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void mapsPropertiesIntoEngineOptions() {
        CrossRefProperties properties = new CrossRefProperties();
        properties.getAnchors().setIdPrefix("xr");
        properties.getNotes().setPlacement(NotePlacement.POPUP);
        properties.getIndex().setMaxTocDepth(2);
        properties.getEngine().setParallelism(3);

        EngineOptions options = properties.toEngineOptions();

        assertEquals("xr", options.anchors().idPrefix());
        assertEquals(NotePlacement.POPUP, options.notes().placement());
        assertEquals(2, options.index().maxTocDepth());
        assertEquals(3, options.parallelism());
    }
}
