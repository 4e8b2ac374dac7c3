package com.williamcallahan.crossref.service.rewrite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jsoup.nodes.Document;

/**
 * A chunk whose markers have been rewritten but which is not serialized yet.
 *
 * <p>Holds the rewritten markup of every note body declared in the chunk, so bodies relocated
 * to another chunk or to the notes page carry the same rewritten content.</p>
 */
public final class ChunkRewrite {

    private final String fileName;
    private final Document document;
    private final RewritePlan plan;
    private final Map<String, String> noteContents;
    private final int removedBodies;

    ChunkRewrite(String fileName, Document document, RewritePlan plan, Map<String, String> noteContents,
                 int removedBodies) {
        this.fileName = Objects.requireNonNull(fileName, "File name cannot be null");
        this.document = Objects.requireNonNull(document, "Document cannot be null");
        this.plan = Objects.requireNonNull(plan, "Plan cannot be null");
        this.noteContents = Collections.unmodifiableMap(new LinkedHashMap<>(noteContents));
        this.removedBodies = removedBodies;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * Rewritten inner markup of each note body in this chunk, back-links included, keyed by note id.
     */
    public Map<String, String> noteContents() {
        return noteContents;
    }

    Document document() {
        return document;
    }

    RewritePlan plan() {
        return plan;
    }

    int removedBodies() {
        return removedBodies;
    }
}
