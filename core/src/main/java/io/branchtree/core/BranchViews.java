// file: src/main/java/io/branchtree/core/BranchViews.java
package io.branchtree.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only projections of a document. Each one normalizes the active path
 * first and never writes to the document.
 */
public final class BranchViews {

    private BranchViews() {
        // utility
    }

    /**
     * Messages along the active path, in order. A trailing placeholder (empty
     * assistant slot, see {@link Placeholders}) is left out.
     */
    public static MessageExport exportMessages(BranchDocument doc) {
        List<String> path = PathNormalizer.normalize(doc);
        int last = path.size() - 1;
        boolean dropLast = Placeholders.isPlaceholder(doc.node(path.get(last)));

        var messages = new ArrayList<ChatMessage>(path.size());
        for (int i = 0; i < path.size(); i++) {
            if (dropLast && i == last) continue;
            BranchNode n = doc.node(path.get(i));
            messages.add(new ChatMessage(n.role(), n.content()));
        }
        return new MessageExport(List.copyOf(messages), List.copyOf(path));
    }

    /** (depth, node_id, j, n) of the active path's tail. */
    public static BranchLevel latestSummary(BranchDocument doc) {
        List<String> path = PathNormalizer.normalize(doc);
        return level(doc, path, path.size());
    }

    /** One (depth, node_id, j, n) row per depth of the active path, plus the tail's row. */
    public static BranchTable branchTable(BranchDocument doc) {
        List<String> path = PathNormalizer.normalize(doc);
        var levels = new ArrayList<BranchLevel>(path.size());
        for (int depth = 1; depth <= path.size(); depth++) {
            levels.add(level(doc, path, depth));
        }
        return new BranchTable(levels.get(levels.size() - 1), List.copyOf(levels));
    }

    /** The tail node of the active path. */
    public static LatestMessage latestMessage(BranchDocument doc) {
        List<String> path = PathNormalizer.normalize(doc);
        BranchNode n = doc.node(path.get(path.size() - 1));
        return new LatestMessage(n.id(), n.role(), n.content(), path.size());
    }

    private static BranchLevel level(BranchDocument doc, List<String> path, int depth) {
        SiblingPosition pos = SiblingIndexer.at(doc, path, depth);
        return new BranchLevel(depth, path.get(depth - 1), pos.j(), pos.n());
    }

    // ------------ view models ------------

    public record ChatMessage(Role role, String content) {}

    public record MessageExport(List<ChatMessage> messages, List<String> path) {}

    /** j is null when undeterminable. */
    public record BranchLevel(int depth, String nodeId, Integer j, int n) {}

    public record BranchTable(BranchLevel latest, List<BranchLevel> levels) {}

    public record LatestMessage(String nodeId, Role role, String content, int depth) {}
}
