// file: src/main/java/io/branchtree/storage/ConversationStore.java
package io.branchtree.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.branchtree.core.BranchDocument;
import io.branchtree.core.BranchException;
import io.branchtree.core.ErrorKind;
import io.branchtree.core.Role;
import io.branchtree.core.Timestamps;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Conversation directories under a single root:
 * <pre>
 *   &lt;root&gt;/&lt;slug&gt;/conversation.json   branch document (threaded) or header only (sandbox)
 *   &lt;root&gt;/&lt;slug&gt;/settings.json       {"type": "threaded" | "sandbox", preset, character, ...}
 *   &lt;root&gt;/&lt;slug&gt;/variables.json      free-form JSON object
 * </pre>
 * The document id of a conversation, as understood by a
 * {@link FileDocumentStore} on the same root, is {@link #documentId(String)}.
 */
public final class ConversationStore {
    private static final Logger log = Logger.getLogger(ConversationStore.class.getName());

    public static final String DOCUMENT_FILE = "conversation.json";
    public static final String SETTINGS_FILE = "settings.json";
    public static final String VARIABLES_FILE = "variables.json";
    public static final String EMPTY_GREETING = "（空）";

    private static final Pattern UNSAFE = Pattern.compile("[\\\\/:*?\"<>|]");
    private static final Set<String> SETTINGS_TEXT_KEYS = Set.of("preset", "character", "persona", "llm_config");
    private static final Set<String> SETTINGS_LIST_KEYS = Set.of("regex_rules", "world_books");

    private final StoreRoot root;
    private final DocumentCodec codec;
    private final Clock clock;

    public ConversationStore(Path root, DocumentCodec codec, Clock clock) {
        this.root = new StoreRoot(root);
        this.codec = codec;
        this.clock = clock;
    }

    public static String documentId(String slug) {
        return slug + "/" + DOCUMENT_FILE;
    }

    /**
     * Create a new conversation directory.
     *
     * @param greetings opening assistant messages, one root branch each; may be empty
     * @param type      "threaded" or "sandbox"; anything else means threaded
     */
    public Created create(String name, String description, List<String> greetings, String type) {
        ConversationType kind = ConversationType.parse(type);
        String slug = uniqueSlug(sanitize(name));
        String title = name == null || name.isBlank() ? slug : name.strip();
        String desc = description == null ? "" : description.strip();
        String ts = Timestamps.now(clock);

        JsonNode body;
        String rootNodeId = null;
        int nodes = 0;
        if (kind == ConversationType.SANDBOX) {
            ObjectNode header = codec.mapper().createObjectNode();
            header.put("name", title);
            header.put("description", desc);
            header.put("updated_at", ts);
            body = header;
        } else {
            BranchDocument doc = threaded(title, desc, greetings, ts);
            rootNodeId = doc.roots().get(0);
            nodes = doc.size();
            body = codec.encode(doc);
        }

        ObjectNode settings = codec.mapper().createObjectNode();
        settings.put("type", kind.wire());

        write(slug + "/" + DOCUMENT_FILE, body);
        write(slug + "/" + SETTINGS_FILE, settings);
        write(slug + "/" + VARIABLES_FILE, codec.mapper().createObjectNode());
        log.info(() -> "created " + kind.wire() + " conversation '" + slug + "'");

        return new Created(slug, documentId(slug), slug + "/" + SETTINGS_FILE, slug + "/" + VARIABLES_FILE,
                title, kind.wire(), ts, rootNodeId, nodes);
    }

    /**
     * Read or change a conversation's variables.
     * <ul>
     *   <li>get: current object, {} when the file does not exist</li>
     *   <li>set: replace with {@code data}</li>
     *   <li>merge: shallow merge, keys in {@code data} win</li>
     *   <li>reset: replace with {}</li>
     * </ul>
     */
    public Variables variables(String action, String slug, JsonNode data) {
        String op = action == null ? "" : action.strip().toLowerCase(Locale.ROOT);
        String name = requireSlug(slug);
        String id = name + "/" + VARIABLES_FILE;
        Path file = root.resolve(id);

        ObjectNode result;
        switch (op) {
            case "get":
                return new Variables(name, id, readObject(file));
            case "set":
                result = requireObject(data).deepCopy();
                break;
            case "merge":
                result = readObject(file);
                result.setAll(requireObject(data));
                break;
            case "reset":
                result = codec.mapper().createObjectNode();
                break;
            default:
                throw BranchException.invalidOperation("Unsupported action: " + action);
        }
        write(id, result);
        return new Variables(name, id, result);
    }

    /**
     * Read or patch a conversation's settings.
     * <ul>
     *   <li>get: current object, {} when the file does not exist</li>
     *   <li>update: overwrite only the keys present in {@code patch}</li>
     * </ul>
     * Patchable keys are {@code type} ("threaded" or "sandbox"), the resource
     * references {@code preset}, {@code character}, {@code persona} and
     * {@code llm_config} (string or null), and the lists {@code regex_rules}
     * and {@code world_books} (arrays of strings; null means empty, blank
     * entries are dropped). Any other key fails the whole patch.
     */
    public Settings settings(String action, String slug, JsonNode patch) {
        String op = action == null ? "" : action.strip().toLowerCase(Locale.ROOT);
        String name = requireSlug(slug);
        String id = name + "/" + SETTINGS_FILE;
        Path file = root.resolve(id);

        switch (op) {
            case "get":
                return new Settings(name, id, readObject(file));
            case "update":
                break;
            default:
                throw BranchException.invalidOperation("Unsupported action: " + action + " (must be 'get' or 'update')");
        }
        if (patch == null || !patch.isObject()) {
            throw BranchException.invalidOperation("patch must be an object for update");
        }

        for (var it = patch.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            if (!key.equals("type") && !SETTINGS_TEXT_KEYS.contains(key) && !SETTINGS_LIST_KEYS.contains(key)) {
                throw BranchException.invalidOperation("Unsupported settings field: " + key);
            }
        }
        ObjectNode applied = readObject(file);
        for (var it = patch.fields(); it.hasNext(); ) {
            var e = it.next();
            String key = e.getKey();
            JsonNode value = e.getValue();
            if (key.equals("type")) {
                String t = value.isTextual() ? value.asText() : null;
                if (!ConversationType.THREADED.wire().equals(t) && !ConversationType.SANDBOX.wire().equals(t)) {
                    throw BranchException.invalidOperation(
                            "Invalid type value: " + value + " (must be 'threaded' or 'sandbox')");
                }
                applied.put(key, t);
            } else if (SETTINGS_TEXT_KEYS.contains(key)) {
                if (value.isNull()) {
                    applied.putNull(key);
                } else if (value.isTextual()) {
                    applied.put(key, value.asText());
                } else {
                    throw BranchException.invalidOperation(key + " must be a string");
                }
            } else {
                applied.set(key, stringList(key, value));
            }
        }

        write(id, applied);
        return new Settings(name, id, applied);
    }

    static String sanitize(String name) {
        String s = name == null ? "" : name.strip();
        s = UNSAFE.matcher(s).replaceAll("-");
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '.' || s.charAt(end - 1) == ' ')) end--;
        s = s.substring(0, end);
        return s.isEmpty() ? "conversation" : s;
    }

    private String uniqueSlug(String base) {
        String slug = base;
        for (int i = 2; Files.exists(root.resolve(slug)); i++) {
            slug = base + "-" + i;
        }
        return slug;
    }

    private BranchDocument threaded(String title, String description, List<String> greetings, String ts) {
        List<String> contents = new ArrayList<>();
        if (greetings != null) {
            for (String g : greetings) {
                contents.add(g == null || g.isBlank() ? EMPTY_GREETING : g.strip());
            }
        }
        if (contents.isEmpty()) contents.add(EMPTY_GREETING);

        var b = BranchDocument.builder()
                .metadata("name", title)
                .metadata("description", description);
        List<String> roots = new ArrayList<>();
        for (int i = 0; i < contents.size(); i++) {
            String id = "n_root" + (i + 1);
            b.node(id, null, Role.ASSISTANT, contents.get(i), ts);
            roots.add(id);
        }
        return b.roots(roots).activePath(List.of(roots.get(0))).updatedAt(ts).build();
    }

    private ObjectNode readObject(Path file) {
        if (!Files.exists(file)) return codec.mapper().createObjectNode();
        JsonNode tree;
        try {
            tree = codec.mapper().readTree(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new BranchException(ErrorKind.INVALID_DOCUMENT, "Failed to read json: " + file.getFileName(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw BranchException.invalidDocument("Invalid JSON object: " + file.getFileName());
        }
        return (ObjectNode) tree;
    }

    private void write(String id, JsonNode body) {
        Path file = root.resolve(id);
        try {
            AtomicFiles.write(file, codec.toBytes(body));
        } catch (IOException e) {
            throw new BranchException(ErrorKind.WRITE_ERROR, "failed to write " + id, e);
        }
        log.fine(() -> "wrote " + file);
    }

    private static ObjectNode requireObject(JsonNode data) {
        if (data == null || !data.isObject()) {
            throw BranchException.invalidOperation("data must be an object for set/merge");
        }
        return (ObjectNode) data;
    }

    private ArrayNode stringList(String key, JsonNode value) {
        ArrayNode out = codec.mapper().createArrayNode();
        if (value.isNull()) return out;
        if (!value.isArray()) throw BranchException.invalidOperation(key + " must be an array of strings");
        for (JsonNode item : value) {
            if (item.isNull()) continue;
            if (!item.isTextual()) throw BranchException.invalidOperation(key + " must be an array of strings");
            if (!item.asText().isEmpty()) out.add(item.asText());
        }
        return out;
    }

    /** A slug names exactly one directory directly under the root. */
    private static String requireSlug(String slug) {
        if (slug == null || slug.isBlank()) throw BranchException.invalidOperation("slug must not be empty");
        String s = slug.strip();
        if (s.indexOf('/') >= 0 || s.indexOf('\\') >= 0 || s.equals(".") || s.equals("..")) {
            throw BranchException.invalidOperation("slug must be a single directory name: " + slug);
        }
        return s;
    }

    public enum ConversationType {
        THREADED, SANDBOX;

        public String wire() { return name().toLowerCase(Locale.ROOT); }

        static ConversationType parse(String s) {
            return "sandbox".equalsIgnoreCase(s == null ? "" : s.strip()) ? SANDBOX : THREADED;
        }
    }

    /** Paths are ids relative to the store root. rootNodeId is null for sandbox conversations. */
    public record Created(
            String slug,
            String file,
            String settingsFile,
            String variablesFile,
            String name,
            String type,
            String updatedAt,
            String rootNodeId,
            int nodesCount
    ) {}

    public record Variables(String slug, String variablesFile, ObjectNode variables) {}

    public record Settings(String slug, String settingsFile, ObjectNode settings) {}
}
