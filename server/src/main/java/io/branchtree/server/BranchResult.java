// file: server/src/main/java/io/branchtree/server/BranchResult.java
package io.branchtree.server;

import io.branchtree.core.BranchDocument;
import io.branchtree.core.BranchViews.BranchLevel;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a mutating call, shaped by the caller's {@link ReturnMode}.
 * {@code extras} carries operation-specific fields (switched_to, removed,
 * placeholder_id, ...) in insertion order.
 */
public sealed interface BranchResult permits BranchResult.Full, BranchResult.NodeAndPath, BranchResult.StatusOnly {

    Map<String, Object> extras();

    record Full(BranchDocument doc, List<String> activePath, BranchLevel latest,
                Map<String, Object> extras) implements BranchResult {}

    /**
     * @param node   the affected node, or null when only the path was asked for
     * @param nodeId the id a client acts on next (the placeholder after an append)
     */
    record NodeAndPath(Map<String, Object> node, String nodeId, List<String> activePath, BranchLevel latest,
                       String updatedAt, Map<String, Object> extras) implements BranchResult {}

    record StatusOnly(String nodeId, String updatedAt, Map<String, Object> extras) implements BranchResult {}
}
