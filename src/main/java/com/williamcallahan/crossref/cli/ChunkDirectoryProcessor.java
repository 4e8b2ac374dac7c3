package com.williamcallahan.crossref.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.williamcallahan.crossref.config.CrossRefProperties;
import com.williamcallahan.crossref.domain.markup.DocumentChunk;
import com.williamcallahan.crossref.domain.markup.GeneratedPage;
import com.williamcallahan.crossref.domain.markup.RewrittenChunk;
import com.williamcallahan.crossref.domain.report.CrossReferenceResult;
import com.williamcallahan.crossref.service.CrossReferenceEngine;
import com.williamcallahan.crossref.service.EngineOptions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the engine over a directory of chunk files and writes the results next to each other
 * in an output directory.
 *
 * <p>Chunks are the {@code .xhtml}, {@code .html} and {@code .htm} files of the input directory
 * in file name order. Generated index and notes pages from an earlier run are skipped so the
 * output directory can be fed back in.</p>
 */
@Component
public class ChunkDirectoryProcessor {
    private static final Logger log = LoggerFactory.getLogger(ChunkDirectoryProcessor.class);

    public static final String REPORT_FILE = "crossref-report.json";
    public static final String MANIFEST_FILE = "anchor-manifest.json";

    private final CrossReferenceEngine engine;
    private final CrossRefProperties properties;
    private final ObjectWriter jsonWriter;

    public ChunkDirectoryProcessor(CrossReferenceEngine engine, CrossRefProperties properties) {
        this.engine = engine;
        this.properties = properties;
        this.jsonWriter = new ObjectMapper().writerWithDefaultPrettyPrinter();
    }

    /**
     * Processes every chunk file of a directory.
     *
     * @param inputDir directory holding the chunk files
     * @param outputDir directory receiving chunks, pages, report and manifest; created when missing
     * @return the engine result
     * @throws IOException when a chunk cannot be read or an output file cannot be written
     */
    public CrossReferenceResult processDirectory(Path inputDir, Path outputDir) throws IOException {
        if (!Files.isDirectory(inputDir)) {
            throw new IOException("Input directory not found: " + inputDir);
        }
        EngineOptions options = properties.toEngineOptions();
        List<DocumentChunk> chunks = readChunks(inputDir, Set.of(options.index().fileName(), options.notes().fileName()));
        log.info("Read {} chunks from {}", chunks.size(), inputDir);

        CrossReferenceResult result = engine.process(chunks, options);

        Files.createDirectories(outputDir);
        for (RewrittenChunk chunk : result.chunks()) {
            Files.writeString(outputDir.resolve(chunk.fileName()), chunk.markup(), StandardCharsets.UTF_8);
        }
        for (GeneratedPage page : result.generatedPages()) {
            Files.writeString(outputDir.resolve(page.fileName()), page.markup(), StandardCharsets.UTF_8);
        }
        jsonWriter.writeValue(outputDir.resolve(REPORT_FILE).toFile(), result.report());
        jsonWriter.writeValue(outputDir.resolve(MANIFEST_FILE).toFile(), result.manifest());

        log.info("Wrote {} chunks and {} generated pages to {}", result.chunks().size(),
            result.generatedPages().size(), outputDir);
        return result;
    }

    private static List<DocumentChunk> readChunks(Path inputDir, Set<String> generatedPages) throws IOException {
        List<Path> files;
        try (Stream<Path> paths = Files.list(inputDir)) {
            files = paths
                .filter(Files::isRegularFile)
                .filter(path -> isChunkFile(path.getFileName().toString()))
                .filter(path -> !generatedPages.contains(path.getFileName().toString()))
                .sorted()
                .toList();
        }
        List<DocumentChunk> chunks = new ArrayList<>(files.size());
        for (Path file : files) {
            log.debug("Reading chunk {}", file.getFileName());
            chunks.add(DocumentChunk.of(Files.readString(file, StandardCharsets.UTF_8), file.getFileName().toString()));
        }
        return chunks;
    }

    private static boolean isChunkFile(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".xhtml") || lower.endsWith(".html") || lower.endsWith(".htm");
    }
}
