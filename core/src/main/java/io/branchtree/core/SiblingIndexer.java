// file: src/main/java/io/branchtree/core/SiblingIndexer.java
package io.branchtree.core;

import java.util.List;

/**
 * Computes (j, n) for a depth of a normalized path.
 * <p>
 *  - depth 1: siblings are the document roots.
 *  - depth d >= 2: siblings are the children of path[d-2].
 */
public final class SiblingIndexer {

    private SiblingIndexer() {
        // utility
    }

    /**
     * @param path  a normalized path (see {@link PathNormalizer})
     * @param depth 1-based depth, between 1 and path.size()
     */
    public static SiblingPosition at(BranchDocument doc, List<String> path, int depth) {
        if (depth < 1 || depth > path.size()) {
            throw new IllegalArgumentException("depth %d outside 1..%d".formatted(depth, path.size()));
        }
        Integer node = doc.handleOf(path.get(depth - 1));
        List<Integer> siblings;
        if (depth == 1) {
            siblings = doc.rootHandles();
        } else {
            Integer parent = doc.handleOf(path.get(depth - 2));
            siblings = parent == null ? List.of() : doc.childHandles(parent);
        }
        int idx = node == null ? -1 : siblings.indexOf(node);
        return new SiblingPosition(idx < 0 ? null : idx + 1, siblings.size());
    }
}
