// file: src/main/java/io/branchtree/core/BranchDocument.java
package io.branchtree.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One branching conversation: a forest of message nodes plus the single
 * "current" traversal through it.
 * <p>
 * Representation:
 *  - Nodes live in an arena and are addressed internally by integer handles.
 *    A removed node leaves a null slot; handles are never reused.
 *  - String ids exist only at the boundary ({@link #node(String)},
 *    {@link #roots()}, {@link #children()}, {@link #activePath()}).
 *  - Each node stores its parent handle; sibling order lives in a
 *    {@link ChildIndex} for non-root nodes and in {@code roots} for roots.
 *  - The active path is kept as raw ids because externally edited documents
 *    may carry a drifted path; {@link PathNormalizer} repairs it on use.
 * <p>
 * Documents are built through {@link #builder()}, which restores the
 * structural invariants of the stored form, and are then mutated only by
 * {@link BranchEngine}. Instances are not thread safe: a document belongs to
 * the single operation that loaded it.
 */
public final class BranchDocument {
    static final int NO_PARENT = -1;

    private final List<Slot> arena = new ArrayList<>();
    private final Map<String, Integer> handles = new HashMap<>();
    private final List<Integer> roots = new ArrayList<>();
    private final ChildIndex children = new ChildIndex();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private List<String> activePath = new ArrayList<>();
    private String updatedAt;

    private BranchDocument() {}

    public static Builder builder() { return new Builder(); }

    // ---------- boundary views ----------

    /** Snapshot of the node with this id, or null if absent. */
    public BranchNode node(String id) {
        Integer h = handles.get(id);
        return h == null ? null : view(h);
    }

    public boolean contains(String id) { return handles.containsKey(id); }

    /** Number of live nodes. */
    public int size() { return handles.size(); }

    /** All live nodes in creation order. */
    public List<BranchNode> nodes() {
        var out = new ArrayList<BranchNode>(handles.size());
        for (int h = 0; h < arena.size(); h++) {
            if (arena.get(h) != null) out.add(view(h));
        }
        return out;
    }

    public List<String> roots() { return ids(roots); }

    /** Non-empty child lists keyed by parent id, parents in creation order. */
    public Map<String, List<String>> children() {
        var out = new LinkedHashMap<String, List<String>>();
        for (int h = 0; h < arena.size(); h++) {
            if (arena.get(h) == null) continue;
            List<Integer> kids = children.of(h);
            if (!kids.isEmpty()) out.put(arena.get(h).id, ids(kids));
        }
        return out;
    }

    /** Child ids of {@code parentId} in sibling order; empty when absent or childless. */
    public List<String> childrenOf(String parentId) {
        Integer h = handles.get(parentId);
        return h == null ? List.of() : ids(children.of(h));
    }

    /** The stored active path, as last written; it may not be normalized. */
    public List<String> activePath() { return Collections.unmodifiableList(activePath); }

    public String updatedAt() { return updatedAt; }

    /** Free-form top-level fields (name, description, ...), in insertion order. */
    public Map<String, Object> metadata() { return Collections.unmodifiableMap(metadata); }

    // ---------- handle-level access for the engine ----------

    Integer handleOf(String id) { return handles.get(id); }

    String idOf(int h) { return slot(h).id; }

    int parentOf(int h) { return slot(h).parent; }

    Role roleOf(int h) { return slot(h).role; }

    List<Integer> rootHandles() { return Collections.unmodifiableList(roots); }

    List<Integer> childHandles(int parent) { return children.of(parent); }

    boolean isListedRoot(int h) { return roots.contains(h); }

    /** Siblings of {@code h}: the roots for a root node, otherwise its parent's children. */
    List<Integer> siblingHandles(int h) {
        int p = parentOf(h);
        return p == NO_PARENT ? rootHandles() : children.of(p);
    }

    BranchNode view(int h) {
        Slot s = slot(h);
        return new BranchNode(s.id, s.parent == NO_PARENT ? null : idOf(s.parent), s.role, s.content, s.updatedAt);
    }

    List<String> ids(List<Integer> hs) {
        var out = new ArrayList<String>(hs.size());
        for (int h : hs) out.add(idOf(h));
        return out;
    }

    // ---------- mutation primitives (callers validate first) ----------

    /** Create a node at the end of its sibling group and return its handle. */
    int addNode(String id, int parent, Role role, String content, String nodeUpdatedAt) {
        if (handles.containsKey(id)) {
            throw new BranchException(ErrorKind.DUPLICATE_ID, "Node ID already exists: " + id);
        }
        int h = arena.size();
        arena.add(new Slot(id, parent, role, content, nodeUpdatedAt));
        handles.put(id, h);
        if (parent == NO_PARENT) {
            roots.add(h);
        } else {
            children.append(parent, h);
        }
        return h;
    }

    void setContent(int h, String content, String nodeUpdatedAt) {
        Slot s = slot(h);
        s.content = content;
        s.updatedAt = nodeUpdatedAt;
    }

    /**
     * Collect {@code h} and every descendant, depth first. The visited set
     * keeps the walk finite even if a loaded document smuggled in a cycle.
     */
    Set<Integer> collectSubtree(int h) {
        Set<Integer> seen = new LinkedHashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(h);
        while (!stack.isEmpty()) {
            int cur = stack.pop();
            if (!seen.add(cur)) continue;
            for (int child : children.of(cur)) {
                if (!seen.contains(child)) stack.push(child);
            }
        }
        return seen;
    }

    /** Remove the given handles from the arena, the roots and the child index. */
    void removeAll(Set<Integer> removed) {
        for (int h : removed) {
            Slot s = arena.get(h);
            if (s == null) continue;
            handles.remove(s.id);
            arena.set(h, null);
        }
        roots.removeIf(removed::contains);
        children.removeAll(removed);
    }

    void setActivePath(List<String> path) { this.activePath = new ArrayList<>(path); }

    void touch(String timestamp) { this.updatedAt = timestamp; }

    private Slot slot(int h) {
        Slot s = h >= 0 && h < arena.size() ? arena.get(h) : null;
        if (s == null) throw new IllegalStateException("stale node handle: " + h);
        return s;
    }

    private static final class Slot {
        final String id;
        final int parent;
        final Role role;
        String content;
        String updatedAt;

        Slot(String id, int parent, Role role, String content, String updatedAt) {
            this.id = id;
            this.parent = parent;
            this.role = role;
            this.content = content;
            this.updatedAt = updatedAt;
        }
    }

    /**
     * Assembles a document from its stored form and restores the structural
     * invariants:
     *  - explicit child lists are authoritative for order, but entries naming
     *    missing nodes, nodes with a different parent, or duplicates are dropped;
     *  - edges implied only by a node's parent are appended to that parent's list;
     *  - roots naming missing or parented nodes are dropped, and parentless
     *    nodes that are not listed are appended to the roots.
     * A node whose parent does not exist cannot be repaired and is rejected
     * with {@link ErrorKind#INVALID_DOCUMENT}.
     */
    public static final class Builder {
        private final Map<String, NodeSpec> nodes = new LinkedHashMap<>();
        private final Map<String, List<String>> explicitChildren = new LinkedHashMap<>();
        private final List<String> roots = new ArrayList<>();
        private final List<String> activePath = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String updatedAt;

        private Builder() {}

        public Builder node(String id, String parentId, Role role, String content, String nodeUpdatedAt) {
            Objects.requireNonNull(id, "id");
            if (nodes.containsKey(id)) {
                throw BranchException.invalidDocument("duplicate node id: " + id);
            }
            nodes.put(id, new NodeSpec(id, parentId,
                    role == null ? Role.SYSTEM : role,
                    content == null ? "" : content,
                    nodeUpdatedAt));
            return this;
        }

        public Builder roots(List<String> ids) {
            roots.addAll(ids);
            return this;
        }

        public Builder children(String parentId, List<String> childIds) {
            explicitChildren.computeIfAbsent(parentId, k -> new ArrayList<>()).addAll(childIds);
            return this;
        }

        public Builder activePath(List<String> ids) {
            activePath.clear();
            activePath.addAll(ids);
            return this;
        }

        public Builder updatedAt(String timestamp) {
            this.updatedAt = timestamp;
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public BranchDocument build() {
            var doc = new BranchDocument();

            for (NodeSpec n : nodes.values()) {
                if (n.parentId != null && !nodes.containsKey(n.parentId)) {
                    throw BranchException.invalidDocument(
                            "node '%s' references missing parent '%s'".formatted(n.id, n.parentId));
                }
                if (n.id.equals(n.parentId)) {
                    throw BranchException.invalidDocument("node '%s' is its own parent".formatted(n.id));
                }
            }

            // Allocate handles in declaration order; parents may be declared after children.
            for (NodeSpec n : nodes.values()) {
                int h = doc.arena.size();
                doc.arena.add(new Slot(n.id, NO_PARENT, n.role, n.content, n.updatedAt));
                doc.handles.put(n.id, h);
            }
            for (NodeSpec n : nodes.values()) {
                if (n.parentId == null) continue;
                int h = doc.handles.get(n.id);
                Slot old = doc.arena.get(h);
                doc.arena.set(h, new Slot(old.id, doc.handles.get(n.parentId), old.role, old.content, old.updatedAt));
            }

            for (var e : explicitChildren.entrySet()) {
                Integer p = doc.handles.get(e.getKey());
                if (p == null) continue;
                for (String cid : e.getValue()) {
                    Integer c = doc.handles.get(cid);
                    if (c != null && doc.parentOf(c) == p) doc.children.append(p, c);
                }
            }
            for (NodeSpec n : nodes.values()) {
                if (n.parentId == null) continue;
                doc.children.append(doc.handles.get(n.parentId), doc.handles.get(n.id));
            }

            for (String rid : roots) {
                Integer r = doc.handles.get(rid);
                if (r != null && doc.parentOf(r) == NO_PARENT && !doc.roots.contains(r)) doc.roots.add(r);
            }
            for (NodeSpec n : nodes.values()) {
                int h = doc.handles.get(n.id);
                if (n.parentId == null && !doc.roots.contains(h)) doc.roots.add(h);
            }

            doc.activePath = new ArrayList<>(activePath);
            doc.updatedAt = updatedAt;
            doc.metadata.putAll(metadata);
            return doc;
        }

        private record NodeSpec(String id, String parentId, Role role, String content, String updatedAt) {}
    }
}
