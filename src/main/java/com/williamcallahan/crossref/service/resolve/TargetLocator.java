package com.williamcallahan.crossref.service.resolve;

import com.williamcallahan.crossref.domain.anchor.AnchorTarget;

/**
 * Tells in which output file a node ends up. Differs from the file it was scanned in
 * only for note bodies that placement moves, and for everything inside them.
 */
@FunctionalInterface
public interface TargetLocator {

    /**
     * @param file file the node was scanned in
     * @param position document-order position of the node in that file
     * @return output file holding the node
     */
    String fileOf(String file, int position);

    default String fileOf(AnchorTarget target) {
        return fileOf(target.file(), target.position());
    }

    static TargetLocator inPlace() {
        return (file, position) -> file;
    }
}
