// file: src/main/java/io/branchtree/storage/DocumentCodec.java
package io.branchtree.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.branchtree.core.BranchDocument;
import io.branchtree.core.BranchException;
import io.branchtree.core.BranchNode;
import io.branchtree.core.ErrorKind;
import io.branchtree.core.Role;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON form of a {@link BranchDocument}.
 * <p>
 * Shape:
 * <pre>
 * {
 *   "name": "...", "description": "...",          free-form, preserved as-is
 *   "roots": ["n_root1", ...],
 *   "nodes": { "id": { "pid": "parent|null", "role": "user", "content": "...",
 *                      "node_updated_at": "2025-01-01T08:00:00+08:00" } },
 *   "children": { "parent": ["child", ...] },       optional, derived from pid
 *   "active_path": ["n_root1", ...],
 *   "updated_at": "..."
 * }
 * </pre>
 * Reading is lenient where the engine can repair (partial children, drifted
 * path, missing role/content) and strict where it cannot (wrong JSON types,
 * unknown roles, dangling parents): those fail with INVALID_DOCUMENT.
 * "parent_id" is accepted as an alias of "pid".
 */
public final class DocumentCodec {
    private static final Set<String> STRUCTURAL = Set.of("roots", "nodes", "children", "active_path", "updated_at");

    private final ObjectMapper json;

    public DocumentCodec() {
        this(new ObjectMapper());
    }

    public DocumentCodec(ObjectMapper json) {
        this.json = json;
    }

    public ObjectMapper mapper() { return json; }

    /** Parse raw bytes; malformed JSON is an INVALID_DOCUMENT. */
    public BranchDocument decode(byte[] bytes) {
        JsonNode root;
        try {
            root = json.readTree(bytes);
        } catch (IOException e) {
            throw new BranchException(ErrorKind.INVALID_DOCUMENT, "document is not valid JSON: " + e.getMessage(), e);
        }
        return decode(root);
    }

    public BranchDocument decode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw BranchException.invalidDocument("document must be a JSON object");
        }
        var b = BranchDocument.builder();

        JsonNode nodes = root.get("nodes");
        if (present(nodes)) {
            if (!nodes.isObject()) throw BranchException.invalidDocument("'nodes' must be an object");
            for (var it = nodes.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> e = it.next();
                decodeNode(b, e.getKey(), e.getValue());
            }
        }

        b.roots(stringList(root.get("roots"), "roots"));
        b.activePath(stringList(root.get("active_path"), "active_path"));

        JsonNode children = root.get("children");
        if (present(children)) {
            if (!children.isObject()) throw BranchException.invalidDocument("'children' must be an object");
            for (var it = children.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> e = it.next();
                // Non-list entries carry no ordering; pid links will rebuild them.
                if (!e.getValue().isArray()) continue;
                var ids = new ArrayList<String>();
                for (JsonNode c : e.getValue()) {
                    if (c.isTextual()) ids.add(c.asText());
                }
                b.children(e.getKey(), ids);
            }
        }

        b.updatedAt(text(root.get("updated_at"), "updated_at"));

        for (var it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!STRUCTURAL.contains(e.getKey())) b.metadata(e.getKey(), e.getValue());
        }
        return b.build();
    }

    /** Full document as a JSON tree, metadata first. */
    public ObjectNode encode(BranchDocument doc) {
        ObjectNode out = json.createObjectNode();
        for (Map.Entry<String, Object> e : doc.metadata().entrySet()) {
            out.set(e.getKey(), json.valueToTree(e.getValue()));
        }

        ArrayNode roots = out.putArray("roots");
        doc.roots().forEach(roots::add);

        ObjectNode nodes = out.putObject("nodes");
        for (BranchNode n : doc.nodes()) {
            nodes.set(n.id(), encodeNode(n));
        }

        ObjectNode children = out.putObject("children");
        for (Map.Entry<String, List<String>> e : doc.children().entrySet()) {
            ArrayNode kids = children.putArray(e.getKey());
            e.getValue().forEach(kids::add);
        }

        ArrayNode path = out.putArray("active_path");
        doc.activePath().forEach(path::add);

        if (doc.updatedAt() != null) out.put("updated_at", doc.updatedAt());
        return out;
    }

    /** A single node in its stored shape (without its id). */
    public ObjectNode encodeNode(BranchNode n) {
        ObjectNode node = json.createObjectNode();
        if (n.parentId() == null) node.putNull("pid"); else node.put("pid", n.parentId());
        node.put("role", n.role().wire());
        node.put("content", n.content());
        if (n.updatedAt() != null) node.put("node_updated_at", n.updatedAt());
        return node;
    }

    /** Pretty-printed UTF-8 bytes with a trailing newline, as written to disk. */
    public byte[] toBytes(JsonNode tree) {
        try {
            return (json.writerWithDefaultPrettyPrinter().writeValueAsString(tree) + "\n")
                    .getBytes(java.nio.charset.StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize document", e);
        }
    }

    private static void decodeNode(BranchDocument.Builder b, String id, JsonNode nd) {
        if (nd == null || nd.isNull()) {
            b.node(id, null, null, "", null);
            return;
        }
        if (!nd.isObject()) throw BranchException.invalidDocument("node '" + id + "' must be an object");

        JsonNode pidNode = nd.has("pid") ? nd.get("pid") : nd.get("parent_id");
        String pid = text(pidNode, "nodes." + id + ".pid");

        Role role = null;
        String rawRole = text(nd.get("role"), "nodes." + id + ".role");
        if (rawRole != null) {
            try {
                role = Role.parse(rawRole);
            } catch (BranchException e) {
                throw new BranchException(ErrorKind.INVALID_DOCUMENT,
                        "node '%s' has invalid role '%s'".formatted(id, rawRole), e);
            }
        }

        JsonNode c = nd.get("content");
        String content;
        if (!present(c)) {
            content = "";
        } else if (c.isValueNode()) {
            content = c.asText();
        } else {
            throw BranchException.invalidDocument("node '" + id + "' content must be a string");
        }

        b.node(id, pid, role, content, text(nd.get("node_updated_at"), "nodes." + id + ".node_updated_at"));
    }

    private static List<String> stringList(JsonNode arr, String field) {
        if (!present(arr)) return List.of();
        if (!arr.isArray()) throw BranchException.invalidDocument("'" + field + "' must be an array");
        var out = new ArrayList<String>(arr.size());
        for (JsonNode v : arr) {
            if (!v.isTextual()) throw BranchException.invalidDocument("'" + field + "' must contain only strings");
            out.add(v.asText());
        }
        return out;
    }

    private static String text(JsonNode v, String field) {
        if (!present(v)) return null;
        if (!v.isTextual()) throw BranchException.invalidDocument("'" + field + "' must be a string");
        return v.asText();
    }

    private static boolean present(JsonNode v) {
        return v != null && !v.isNull();
    }
}
