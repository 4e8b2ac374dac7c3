package com.williamcallahan.crossref.domain.anchor;

/**
 * Externally visible description of one anchor, keyed by its final id in the manifest.
 */
public record AnchorManifestEntry(String title, String kind, String file, String number, int level) {

    public static AnchorManifestEntry from(AnchorTarget target) {
        return from(target, target.file());
    }

    /**
     * @param target registered target
     * @param outputFile file the target is written to, when placement moved it
     */
    public static AnchorManifestEntry from(AnchorTarget target, String outputFile) {
        return new AnchorManifestEntry(
            target.title(),
            target.kind().label(),
            outputFile,
            target.number() == null ? "" : target.number(),
            target.level());
    }
}
