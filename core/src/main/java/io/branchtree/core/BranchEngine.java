// file: src/main/java/io/branchtree/core/BranchEngine.java
package io.branchtree.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Mutation engine: the state machine over a single {@link BranchDocument}.
 * <p>
 * Every operation follows the same shape:
 *  1) normalize the active path (drift is repaired, never rejected),
 *  2) validate every precondition,
 *  3) apply at most one structural change,
 *  4) commit the new active path and refresh the document timestamp.
 * Because nothing is written before step 3, a thrown {@link BranchException}
 * leaves the document exactly as it was given.
 * <p>
 * The engine holds no per-document state and can be shared; documents
 * themselves are owned by one caller at a time.
 */
public final class BranchEngine {
    private final Clock clock;

    public BranchEngine() {
        this(Clock.systemDefaultZone());
    }

    /** @param clock source of node/document timestamps and placeholder ids */
    public BranchEngine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Append a message under {@code parentId}, plus an empty assistant
     * placeholder under the new message.
     * <p>
     * The new message joins the active path when its parent is the tail; the
     * placeholder joins it when the new message is then the tail.
     */
    public Appended append(BranchDocument doc, String nodeId, String parentId, Role role, String content) {
        Objects.requireNonNull(nodeId, "nodeId");
        List<Integer> path = PathNormalizer.normalizeHandles(doc);
        requireNew(doc, nodeId);
        int parent = require(doc, parentId, "Parent node not found: ");
        requireRole(role);

        String ts = Timestamps.now(clock);
        int node = doc.addNode(nodeId, parent, role, content == null ? "" : content, ts);
        if (tail(path) == parent) path.add(node);

        String slotId = Placeholders.nextId(doc, Placeholders.APPEND_PREFIX, clock);
        int slot = doc.addNode(slotId, node, Role.ASSISTANT, "", ts);
        if (tail(path) == node) path.add(slot);

        commit(doc, path, ts);
        return new Appended(doc.view(node), doc.view(slot));
    }

    /**
     * Create {@code newId} as a new sibling of {@code targetId} at the end of
     * their parent's children.
     * <p>
     * If the target is on the active path, the path is cut there and the new
     * node takes its place; otherwise the new node is appended when the
     * parent is the tail. Roots cannot be retried.
     */
    public BranchNode retry(BranchDocument doc, String newId, String targetId, Role role, String content) {
        Objects.requireNonNull(newId, "newId");
        List<Integer> path = PathNormalizer.normalizeHandles(doc);
        requireNew(doc, newId);
        int target = require(doc, targetId, "Retry node not found: ");
        requireRole(role);
        int parent = doc.parentOf(target);
        if (parent == BranchDocument.NO_PARENT) {
            throw BranchException.invalidOperation("Cannot retry root node: " + targetId);
        }

        String ts = Timestamps.now(clock);
        int node = doc.addNode(newId, parent, role, content == null ? "" : content, ts);

        int at = path.indexOf(target);
        if (at >= 0) {
            path = new ArrayList<>(path.subList(0, at));
            path.add(node);
        } else if (tail(path) == parent) {
            path.add(node);
        }

        commit(doc, path, ts);
        return doc.view(node);
    }

    /**
     * Decide how to regenerate the reply to a user message.
     * <p>
     *  1) The active path already continues with an assistant node: retry it.
     *  2) Otherwise the first assistant child, if any: retry it.
     *  3) Otherwise create an empty assistant placeholder under the user node
     *     (joining the path when the user node is the tail).
     * Only the third outcome changes the document.
     */
    public RetryDecision retryUserMessage(BranchDocument doc, String userId) {
        List<Integer> path = PathNormalizer.normalizeHandles(doc);
        int user = require(doc, userId, "User node not found: ");
        if (doc.roleOf(user) != Role.USER) {
            throw BranchException.invalidOperation("Node " + userId + " is not a user message");
        }

        int at = path.indexOf(user);
        if (at >= 0 && at + 1 < path.size()) {
            int next = path.get(at + 1);
            if (doc.roleOf(next) == Role.ASSISTANT) {
                return new RetryDecision.RetryAssistant(doc.idOf(next), userId);
            }
        }
        for (int child : doc.childHandles(user)) {
            if (doc.roleOf(child) == Role.ASSISTANT) {
                return new RetryDecision.RetryAssistant(doc.idOf(child), userId);
            }
        }

        String ts = Timestamps.now(clock);
        String slotId = Placeholders.nextId(doc, Placeholders.RETRY_PREFIX, clock);
        int slot = doc.addNode(slotId, user, Role.ASSISTANT, "", ts);
        if (tail(path) == user) path.add(slot);

        commit(doc, path, ts);
        return new RetryDecision.CreateAssistant(doc.view(slot), userId);
    }

    /**
     * Delete {@code nodeId} and all of its descendants. The active path
     * collapses to the surviving ancestor; no other branch is selected.
     */
    public Pruned truncateAfter(BranchDocument doc, String nodeId) {
        List<Integer> path = PathNormalizer.normalizeHandles(doc);
        int node = require(doc, nodeId, "Node not found: ");
        requireNotLastRoot(doc, node);

        Set<Integer> doomed = doc.collectSubtree(node);
        List<String> removed = doc.ids(new ArrayList<>(doomed));
        path = cutBeforeFirst(path, doomed);
        doc.removeAll(doomed);

        commit(doc, path, Timestamps.now(clock));
        return new Pruned(nodeId, removed, null);
    }

    /**
     * Delete {@code nodeId} and its descendants, then land on a neighbouring
     * alternative: when the node was on the active path and its sibling group
     * is not empty afterwards, the path continues with the sibling that now
     * holds the deleted node's position, or with the last sibling when the
     * deleted node was last.
     */
    public Pruned deleteBranch(BranchDocument doc, String nodeId) {
        List<Integer> path = PathNormalizer.normalizeHandles(doc);
        int node = require(doc, nodeId, "Node not found: ");
        requireNotLastRoot(doc, node);

        int parent = doc.parentOf(node);
        int oldIndex = doc.siblingHandles(node).indexOf(node);
        int at = path.indexOf(node);

        Set<Integer> doomed = doc.collectSubtree(node);
        List<String> removed = doc.ids(new ArrayList<>(doomed));
        doc.removeAll(doomed);

        String switchedTo = null;
        if (at >= 0) {
            path = new ArrayList<>(path.subList(0, at));
            List<Integer> siblings = parent == BranchDocument.NO_PARENT
                    ? doc.rootHandles()
                    : doc.childHandles(parent);
            if (!siblings.isEmpty()) {
                int pick = oldIndex < siblings.size() ? siblings.get(oldIndex) : siblings.get(siblings.size() - 1);
                path.add(pick);
                switchedTo = doc.idOf(pick);
            }
        }

        commit(doc, path, Timestamps.now(clock));
        return new Pruned(nodeId, removed, switchedTo);
    }

    /**
     * Replace the tail of the active path with its {@code targetJ}-th sibling
     * (1-based). A root tail switches among the roots.
     */
    public Switched switchBranch(BranchDocument doc, int targetJ) {
        List<Integer> path = PathNormalizer.normalizeHandles(doc);
        int tail = tail(path);
        List<Integer> siblings = doc.siblingHandles(tail);
        if (targetJ < 1 || targetJ > siblings.size()) {
            throw new BranchException(ErrorKind.OUT_OF_RANGE,
                    "Invalid target_j=%d, must be between 1 and %d".formatted(targetJ, siblings.size()));
        }
        int target = siblings.get(targetJ - 1);
        path.set(path.size() - 1, target);

        commit(doc, path, Timestamps.now(clock));
        return new Switched(doc.idOf(target), targetJ, siblings.size());
    }

    /** Replace a node's content and refresh its timestamp. No structural change. */
    public BranchNode updateContent(BranchDocument doc, String nodeId, String content) {
        List<Integer> path = PathNormalizer.normalizeHandles(doc);
        int node = require(doc, nodeId, "Node not found: ");

        String ts = Timestamps.now(clock);
        doc.setContent(node, content == null ? "" : content, ts);

        commit(doc, path, ts);
        return doc.view(node);
    }

    // ------------ results ------------

    /** The appended message and the placeholder created under it. */
    public record Appended(BranchNode node, BranchNode placeholder) {}

    /**
     * Outcome of a cascading delete.
     *
     * @param removed    ids of the deleted subtree, the requested node first
     * @param switchedTo sibling the active path re-anchored onto, or null
     */
    public record Pruned(String nodeId, List<String> removed, String switchedTo) {}

    /** The node now at the tail of the active path, with its sibling position. */
    public record Switched(String nodeId, int j, int n) {}

    /**
     * What {@link #retryUserMessage} decided:
     *  - RetryAssistant: an existing assistant reply should be regenerated.
     *  - CreateAssistant: no reply existed, so an empty slot was created.
     */
    public sealed interface RetryDecision permits RetryDecision.RetryAssistant, RetryDecision.CreateAssistant {
        String userNodeId();

        String assistantNodeId();

        record RetryAssistant(String assistantNodeId, String userNodeId) implements RetryDecision {}

        record CreateAssistant(BranchNode placeholder, String userNodeId) implements RetryDecision {
            @Override public String assistantNodeId() { return placeholder.id(); }
        }
    }

    // ------------ helpers ------------

    private static int require(BranchDocument doc, String id, String message) {
        Integer h = id == null ? null : doc.handleOf(id);
        if (h == null) throw BranchException.notFound(message + id);
        return h;
    }

    private static void requireNew(BranchDocument doc, String id) {
        if (doc.contains(id)) {
            throw new BranchException(ErrorKind.DUPLICATE_ID, "Node ID already exists: " + id);
        }
    }

    private static void requireRole(Role role) {
        if (role == null) throw new BranchException(ErrorKind.INVALID_ROLE, "Invalid role: null");
    }

    private static void requireNotLastRoot(BranchDocument doc, int node) {
        if (doc.parentOf(node) == BranchDocument.NO_PARENT && doc.rootHandles().size() == 1) {
            throw BranchException.invalidOperation("Cannot remove the only root node: " + doc.idOf(node));
        }
    }

    private static int tail(List<Integer> path) {
        return path.isEmpty() ? BranchDocument.NO_PARENT : path.get(path.size() - 1);
    }

    private static List<Integer> cutBeforeFirst(List<Integer> path, Set<Integer> doomed) {
        for (int i = 0; i < path.size(); i++) {
            if (doomed.contains(path.get(i))) return new ArrayList<>(path.subList(0, i));
        }
        return path;
    }

    private static void commit(BranchDocument doc, List<Integer> path, String timestamp) {
        doc.setActivePath(doc.ids(path));
        doc.touch(timestamp);
    }
}
