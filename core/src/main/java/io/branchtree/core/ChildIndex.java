// file: src/main/java/io/branchtree/core/ChildIndex.java
package io.branchtree.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered parent -> children index over arena handles.
 * <p>
 * The parent handle stored on each node is the single source of truth; this
 * index only remembers the sibling order, which parent links alone cannot
 * reconstruct. It is built once when a document is assembled and then kept
 * in step by every mutation, never recomputed mid-operation.
 * <p>
 * Invariants:
 *  - A parent with no children has no entry (empty lists are dropped).
 *  - A child appears in at most one list, at most once.
 */
final class ChildIndex {
    private final Map<Integer, List<Integer>> byParent = new HashMap<>();

    /** Children of {@code parent} in sibling order; empty when it has none. */
    List<Integer> of(int parent) {
        List<Integer> kids = byParent.get(parent);
        return kids == null ? List.of() : Collections.unmodifiableList(kids);
    }

    /** Append {@code child} to the end of {@code parent}'s list unless it is already there. */
    void append(int parent, int child) {
        List<Integer> kids = byParent.computeIfAbsent(parent, p -> new ArrayList<>());
        if (!kids.contains(child)) kids.add(child);
    }

    /**
     * Drop every removed handle: both the lists they own and any reference to
     * them from a surviving parent's list.
     */
    void removeAll(Set<Integer> removed) {
        for (Integer h : removed) byParent.remove(h);
        for (var it = byParent.entrySet().iterator(); it.hasNext(); ) {
            List<Integer> kids = it.next().getValue();
            kids.removeIf(removed::contains);
            if (kids.isEmpty()) it.remove();
        }
    }
}
