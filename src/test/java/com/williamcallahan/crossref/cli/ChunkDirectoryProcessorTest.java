package com.williamcallahan.crossref.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.crossref.config.CrossRefProperties;
import com.williamcallahan.crossref.domain.report.CrossReferenceResult;
import com.williamcallahan.crossref.domain.report.RunStatus;
import com.williamcallahan.crossref.service.CrossReferenceEngine;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies directory processing: which files are read and what lands in the output directory.
 */
class ChunkDirectoryProcessorTest {

    @TempDir
    Path workDir;

    private Path inputDir;
    private Path outputDir;
    private ChunkDirectoryProcessor processor;

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(workDir.resolve("chunks"));
        outputDir = workDir.resolve("out");
        copyFixture("ch01.xhtml");
        copyFixture("ch02.xhtml");
        CrossRefProperties properties = new CrossRefProperties();
        properties.getEngine().setParallelism(2);
        processor = new ChunkDirectoryProcessor(new CrossReferenceEngine(), properties);
    }

    @Test
    void writesChunksPagesReportAndManifest() throws IOException {
        CrossReferenceResult result = processor.processDirectory(inputDir, outputDir);

        assertEquals(2, result.chunks().size());
        assertTrue(Files.exists(outputDir.resolve("ch01.xhtml")));
        assertTrue(Files.exists(outputDir.resolve("ch02.xhtml")));
        assertTrue(Files.exists(outputDir.resolve("index.xhtml")));
        assertFalse(Files.exists(outputDir.resolve("notes.xhtml")));

        String chapterTwo = Files.readString(outputDir.resolve("ch02.xhtml"), StandardCharsets.UTF_8);
        assertTrue(chapterTwo.contains("href=\"ch01.xhtml#start\""), chapterTwo);
        assertTrue(chapterTwo.contains("href=\"#nowhere\""), chapterTwo);

        ObjectMapper mapper = new ObjectMapper();
        JsonNode report = mapper.readTree(outputDir.resolve(ChunkDirectoryProcessor.REPORT_FILE).toFile());
        assertEquals(RunStatus.COMPLETED_WITH_BROKEN_REFS.name(), report.get("status").asText());
        assertEquals(1, report.get("references").get("brokenReferences").size());
        assertEquals("nowhere", report.get("references").get("brokenReferences").get(0).get("targetKey").asText());

        JsonNode manifest = mapper.readTree(outputDir.resolve(ChunkDirectoryProcessor.MANIFEST_FILE).toFile());
        assertTrue(manifest.has("start"));
        assertTrue(manifest.has("tbl-versions"));
        assertEquals("ch01.xhtml", manifest.get("tbl-versions").get("file").asText());
    }

    @Test
    void skipsGeneratedPagesAndOtherFiles() throws IOException {
        Files.writeString(inputDir.resolve("index.xhtml"), "<html><body><h1>Old index</h1></body></html>");
        Files.writeString(inputDir.resolve("notes.txt"), "not markup");

        CrossReferenceResult result = processor.processDirectory(inputDir, outputDir);

        assertEquals(2, result.chunks().size());
        assertTrue(result.chunk("index.xhtml").isEmpty());
    }

    @Test
    void outputCanBeProcessedAgain() throws IOException {
        CrossReferenceResult first = processor.processDirectory(inputDir, outputDir);
        Path secondOutput = workDir.resolve("again");

        CrossReferenceResult second = processor.processDirectory(outputDir, secondOutput);

        assertEquals(first.chunks(), second.chunks());
        assertEquals(first.manifest().keySet(), second.manifest().keySet());
    }

    @Test
    void missingInputDirectoryFails() {
        assertThrows(IOException.class, () -> processor.processDirectory(workDir.resolve("absent"), outputDir));
    }

    private void copyFixture(String name) throws IOException {
        try (InputStream fixture = getClass().getResourceAsStream("/chunks/" + name)) {
            if (fixture == null) {
                throw new IOException("Missing test fixture " + name);
            }
            Files.copy(fixture, inputDir.resolve(name));
        }
    }
}
