// file: server/src/main/java/io/branchtree/server/BranchService.java
package io.branchtree.server;

import io.branchtree.core.BranchDocument;
import io.branchtree.core.BranchEngine;
import io.branchtree.core.BranchEngine.RetryDecision;
import io.branchtree.core.BranchNode;
import io.branchtree.core.BranchViews;
import io.branchtree.core.PathNormalizer;
import io.branchtree.core.Role;
import io.branchtree.storage.DocumentCodec;
import io.branchtree.storage.DocumentStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Application service for branch operations.
 *
 * Responsibilities:
 *  - Hide storage details from the HTTP layer.
 *  - Load the document named by a {@link DocumentRef}, run one engine
 *    operation on it, and save it back when it came from the store.
 *  - Shape mutation results according to the caller's {@link ReturnMode}.
 *
 * Each call works on its own freshly loaded document, so the service holds
 * no per-document state and is safe to share between request threads.
 * Concurrent writes to the same file are last-write-wins.
 */
public class BranchService {

    private final DocumentStore store;
    private final DocumentCodec codec;
    private final BranchEngine engine;

    public BranchService(DocumentStore store, DocumentCodec codec, BranchEngine engine) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    // ---------- views ----------

    public BranchViews.MessageExport openaiMessages(DocumentRef ref) {
        return BranchViews.exportMessages(load(ref));
    }

    public BranchViews.BranchTable branchTable(DocumentRef ref) {
        return BranchViews.branchTable(load(ref));
    }

    public BranchViews.LatestMessage latestMessage(DocumentRef ref) {
        return BranchViews.latestMessage(load(ref));
    }

    // ---------- mutations ----------

    public BranchResult append(DocumentRef ref, String nodeId, String parentId, Role role, String content, ReturnMode mode) {
        BranchDocument doc = load(ref);
        BranchEngine.Appended r = engine.append(doc, nodeId, parentId, role, content);
        save(ref, doc);

        // path/none answer with the placeholder id: it is the node the caller fills next.
        var extras = new LinkedHashMap<String, Object>();
        extras.put("placeholder_id", r.placeholder().id());
        extras.put("node_updated_at", r.node().updatedAt());
        extras.put("placeholder_updated_at", r.placeholder().updatedAt());
        return shape(mode, doc, nodeView(r.node()), r.placeholder().id(), extras);
    }

    public BranchResult retry(DocumentRef ref, String newId, String targetId, Role role, String content, ReturnMode mode) {
        BranchDocument doc = load(ref);
        BranchNode node = engine.retry(doc, newId, targetId, role, content);
        save(ref, doc);

        var extras = new LinkedHashMap<String, Object>();
        extras.put("new_node_id", node.id());
        extras.put("node_updated_at", node.updatedAt());
        return shape(mode, doc, nodeView(node), node.id(), extras);
    }

    /**
     * When an assistant reply already exists nothing changes and the answer is
     * always status-only; otherwise the new placeholder is shaped by {@code mode}.
     */
    public BranchResult retryUserMessage(DocumentRef ref, String userId, ReturnMode mode) {
        BranchDocument doc = load(ref);
        RetryDecision decision = engine.retryUserMessage(doc, userId);

        var extras = new LinkedHashMap<String, Object>();
        extras.put("assistant_node_id", decision.assistantNodeId());
        extras.put("user_node_id", decision.userNodeId());
        if (decision instanceof RetryDecision.CreateAssistant created) {
            save(ref, doc);
            extras.put("action", "create_assistant");
            return shape(mode, doc, nodeView(created.placeholder()), created.assistantNodeId(), extras);
        }
        extras.put("action", "retry_assistant");
        return new BranchResult.StatusOnly(decision.assistantNodeId(), doc.updatedAt(), extras);
    }

    public BranchResult truncateAfter(DocumentRef ref, String nodeId, ReturnMode mode) {
        BranchDocument doc = load(ref);
        BranchEngine.Pruned r = engine.truncateAfter(doc, nodeId);
        save(ref, doc);

        var extras = new LinkedHashMap<String, Object>();
        extras.put("removed", r.removed());
        return shape(mode, doc, idView(nodeId), nodeId, extras);
    }

    public BranchResult deleteBranch(DocumentRef ref, String nodeId, ReturnMode mode) {
        BranchDocument doc = load(ref);
        BranchEngine.Pruned r = engine.deleteBranch(doc, nodeId);
        save(ref, doc);

        var extras = new LinkedHashMap<String, Object>();
        extras.put("removed", r.removed());
        extras.put("switched_to", r.switchedTo());
        return shape(mode, doc, idView(nodeId), nodeId, extras);
    }

    public BranchResult switchBranch(DocumentRef ref, int targetJ, ReturnMode mode) {
        BranchDocument doc = load(ref);
        BranchEngine.Switched r = engine.switchBranch(doc, targetJ);
        save(ref, doc);

        var node = idView(r.nodeId());
        node.put("j", r.j());
        node.put("n", r.n());
        return shape(mode, doc, node, r.nodeId(), new LinkedHashMap<>());
    }

    public BranchResult updateMessage(DocumentRef ref, String nodeId, String content, ReturnMode mode) {
        BranchDocument doc = load(ref);
        BranchNode node = engine.updateContent(doc, nodeId, content);
        save(ref, doc);

        var extras = new LinkedHashMap<String, Object>();
        extras.put("node_updated_at", node.updatedAt());
        return shape(mode, doc, nodeView(node), node.id(), extras);
    }

    // ---------- helpers ----------

    private BranchDocument load(DocumentRef ref) {
        return ref.persistent() ? store.load(ref.file()) : codec.decode(ref.inline());
    }

    private void save(DocumentRef ref, BranchDocument doc) {
        if (ref.persistent()) store.save(ref.file(), doc);
    }

    private static BranchResult shape(ReturnMode mode, BranchDocument doc, Map<String, Object> node,
                                      String nodeId, Map<String, Object> extras) {
        return switch (mode) {
            case DOC -> new BranchResult.Full(doc, PathNormalizer.normalize(doc), BranchViews.latestSummary(doc), extras);
            case NODE -> new BranchResult.NodeAndPath(node, nodeId, PathNormalizer.normalize(doc),
                    BranchViews.latestSummary(doc), doc.updatedAt(), extras);
            case PATH -> new BranchResult.NodeAndPath(null, nodeId, PathNormalizer.normalize(doc),
                    BranchViews.latestSummary(doc), doc.updatedAt(), extras);
            case NONE -> new BranchResult.StatusOnly(nodeId, doc.updatedAt(), extras);
        };
    }

    private static Map<String, Object> nodeView(BranchNode n) {
        var m = idView(n.id());
        m.put("pid", n.parentId());
        m.put("role", n.role().wire());
        m.put("content", n.content());
        m.put("node_updated_at", n.updatedAt());
        return m;
    }

    private static Map<String, Object> idView(String id) {
        var m = new LinkedHashMap<String, Object>();
        m.put("node_id", id);
        return m;
    }
}
