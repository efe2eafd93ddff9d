// file: server/src/main/java/io/branchtree/server/ResponseRenderer.java
package io.branchtree.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.branchtree.core.BranchViews;
import io.branchtree.core.BranchViews.BranchLevel;
import io.branchtree.storage.DocumentCodec;

import java.util.List;
import java.util.Map;

/**
 * Converts service results into the JSON bodies the HTTP API returns.
 * <p>
 * Field names on the wire are snake_case. Node roles use their lower-case
 * wire form.
 */
final class ResponseRenderer {
    private final ObjectMapper json;
    private final DocumentCodec codec;

    ResponseRenderer(DocumentCodec codec) {
        this.codec = codec;
        this.json = codec.mapper();
    }

    ObjectNode render(BranchResult result) {
        ObjectNode out;
        if (result instanceof BranchResult.Full full) {
            out = codec.encode(full.doc());
            out.put("success", true);
            out.set("active_path", path(full.activePath()));
            out.set("latest", level(full.latest()));
        } else if (result instanceof BranchResult.NodeAndPath np) {
            out = json.createObjectNode();
            out.put("success", true);
            if (np.node() != null) {
                out.set("node", json.valueToTree(np.node()));
            } else {
                out.put("node_id", np.nodeId());
            }
            out.set("active_path", path(np.activePath()));
            out.set("latest", level(np.latest()));
            out.put("updated_at", np.updatedAt());
        } else {
            var status = (BranchResult.StatusOnly) result;
            out = json.createObjectNode();
            out.put("success", true);
            out.put("node_id", status.nodeId());
            out.put("updated_at", status.updatedAt());
        }
        for (Map.Entry<String, Object> e : result.extras().entrySet()) {
            out.set(e.getKey(), json.valueToTree(e.getValue()));
        }
        return out;
    }

    ObjectNode render(BranchViews.MessageExport export) {
        ObjectNode out = json.createObjectNode();
        ArrayNode messages = out.putArray("messages");
        for (BranchViews.ChatMessage m : export.messages()) {
            messages.addObject()
                    .put("role", m.role().wire())
                    .put("content", m.content());
        }
        out.set("path", path(export.path()));
        return out;
    }

    ObjectNode render(BranchViews.BranchTable table) {
        ObjectNode out = json.createObjectNode();
        out.set("latest", level(table.latest()));
        ArrayNode levels = out.putArray("levels");
        table.levels().forEach(l -> levels.add(level(l)));
        return out;
    }

    ObjectNode render(BranchViews.LatestMessage latest) {
        ObjectNode out = json.createObjectNode();
        out.put("node_id", latest.nodeId());
        out.put("role", latest.role().wire());
        out.put("content", latest.content());
        out.put("depth", latest.depth());
        return out;
    }

    private ObjectNode level(BranchLevel l) {
        ObjectNode out = json.createObjectNode();
        out.put("depth", l.depth());
        out.put("node_id", l.nodeId());
        if (l.j() == null) out.putNull("j"); else out.put("j", l.j());
        out.put("n", l.n());
        return out;
    }

    private ArrayNode path(List<String> ids) {
        ArrayNode arr = json.createArrayNode();
        ids.forEach(arr::add);
        return arr;
    }
}
