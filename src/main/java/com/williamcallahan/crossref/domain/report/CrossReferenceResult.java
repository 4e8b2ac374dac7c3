package com.williamcallahan.crossref.domain.report;

import com.williamcallahan.crossref.domain.anchor.AnchorManifestEntry;
import com.williamcallahan.crossref.domain.markup.GeneratedPage;
import com.williamcallahan.crossref.domain.markup.RewrittenChunk;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a run produces: rewritten chunks in input order, generated pages,
 * the report and the anchor manifest.
 */
public record CrossReferenceResult(
    List<RewrittenChunk> chunks,
    List<GeneratedPage> generatedPages,
    ResolutionReport report,
    Map<String, AnchorManifestEntry> manifest,
    Map<String, List<String>> indexOccurrenceMapping
) {

    public CrossReferenceResult {
        Objects.requireNonNull(report, "Report cannot be null");
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        generatedPages = generatedPages == null ? List.of() : List.copyOf(generatedPages);
        manifest = manifest == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(manifest));
        indexOccurrenceMapping = indexOccurrenceMapping == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(indexOccurrenceMapping));
    }

    public Optional<RewrittenChunk> chunk(String fileName) {
        return chunks.stream().filter(chunk -> chunk.fileName().equals(fileName)).findFirst();
    }

    public Optional<GeneratedPage> page(String fileName) {
        return generatedPages.stream().filter(page -> page.fileName().equals(fileName)).findFirst();
    }
}
