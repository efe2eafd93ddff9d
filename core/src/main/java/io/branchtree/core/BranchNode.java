// file: src/main/java/io/branchtree/core/BranchNode.java
package io.branchtree.core;

import java.util.Objects;

/**
 * Read-only snapshot of one message node.
 * <p>
 * parentId is null only for roots. updatedAt may be null for nodes loaded
 * from documents that never recorded a per-node timestamp.
 */
public record BranchNode(String id, String parentId, Role role, String content, String updatedAt) {
    public BranchNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public boolean isRoot() { return parentId == null; }
}
