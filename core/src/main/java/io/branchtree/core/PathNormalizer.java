// file: src/main/java/io/branchtree/core/PathNormalizer.java
package io.branchtree.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Repairs the stored active path against the forest's real connectivity.
 * <p>
 * Rules:
 *  - If the first stored id exists, it is the current root and must be listed
 *    in the document's roots.
 *  - If the stored path is empty, or its first id does not exist, the walk
 *    starts from the first listed root.
 *  - Each following id is accepted only while it is a child of the previously
 *    accepted one; the remainder after the first break is discarded.
 * <p>
 * The result is never empty and normalizing a normalized path returns it
 * unchanged. Every engine read and write starts here, which is how documents
 * edited outside the engine are tolerated instead of rejected.
 */
public final class PathNormalizer {

    private PathNormalizer() {
        // utility
    }

    /** Normalized active path as node ids. */
    public static List<String> normalize(BranchDocument doc) {
        return doc.ids(normalizeHandles(doc));
    }

    static List<Integer> normalizeHandles(BranchDocument doc) {
        List<String> stored = doc.activePath();
        Integer first = stored.isEmpty() ? null : doc.handleOf(stored.get(0));

        var path = new ArrayList<Integer>(Math.max(1, stored.size()));
        if (first != null) {
            if (!doc.isListedRoot(first)) {
                throw BranchException.invalidDocument(
                        "active_path root '%s' not in roots array".formatted(stored.get(0)));
            }
            path.add(first);
        } else {
            List<Integer> roots = doc.rootHandles();
            if (roots.isEmpty()) {
                throw BranchException.invalidDocument("invalid doc: no valid root found in roots or active_path");
            }
            // A missing first id invalidates the whole stored path.
            path.add(roots.get(0));
            return path;
        }

        for (int i = 1; i < stored.size(); i++) {
            Integer next = doc.handleOf(stored.get(i));
            int prev = path.get(path.size() - 1);
            if (next == null || !doc.childHandles(prev).contains(next)) break;
            path.add(next);
        }
        return path;
    }
}
