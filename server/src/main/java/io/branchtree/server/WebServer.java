// file: server/src/main/java/io/branchtree/server/WebServer.java
package io.branchtree.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.branchtree.core.BranchException;
import io.branchtree.core.ErrorKind;
import io.branchtree.core.Role;
import io.branchtree.server.dto.BranchRequest;
import io.branchtree.server.dto.CreateConversationRequest;
import io.branchtree.server.dto.CreateConversationResponse;
import io.branchtree.server.dto.SettingsRequest;
import io.branchtree.server.dto.SettingsResponse;
import io.branchtree.server.dto.VariablesRequest;
import io.branchtree.server.dto.VariablesResponse;
import io.branchtree.storage.ConversationStore;
import io.branchtree.storage.DocumentCodec;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

/**
 * Thin HTTP adapter over {@link BranchService} and {@link ConversationStore}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /branches/{operation}             openai_messages, branch_table, latest_message,
 *                                            append_message, retry_branch, retry_user_message,
 *                                            truncate_after, delete_branch, switch_branch,
 *                                            update_message
 *   - POST /conversations                    create a conversation directory
 *   - POST /conversations/{slug}/variables   get | set | merge | reset
 *   - POST /conversations/{slug}/settings    get | update
 *   - GET  /admin/health                     basic health check
 *
 * Status mapping:
 *   - NOT_FOUND -> 404, DUPLICATE_ID -> 409, WRITE_ERROR -> 500,
 *     every other {@link ErrorKind} -> 400
 *   - malformed JSON or a missing field -> 400
 *   - body over 10 MiB -> 413
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final String BRANCHES = "/branches/";
    private static final String CONVERSATIONS = "/conversations";
    private static final String VARIABLES_SUFFIX = "/variables";
    private static final String SETTINGS_SUFFIX = "/settings";
    private static final Set<String> OPERATIONS = Set.of(
            "openai_messages", "branch_table", "latest_message",
            "append_message", "retry_branch", "retry_user_message",
            "truncate_after", "delete_branch", "switch_branch", "update_message");

    private final Undertow server;
    private final ObjectMapper json;
    private final BranchService branches;
    private final ConversationStore conversations;
    private final ResponseRenderer renderer;

    public WebServer(int port, BranchService branches, ConversationStore conversations, DocumentCodec codec) {
        this.branches = branches;
        this.conversations = conversations;
        this.renderer = new ResponseRenderer(codec);
        this.json = codec.mapper();

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
                    } else if (path.startsWith(BRANCHES)) {
                        String op = path.substring(BRANCHES.length());
                        if (!OPERATIONS.contains(op)) {
                            send(exchange, 404, Map.of("error", "unknown operation: " + op));
                            RequestLogger.logRequest(method, path, 404, 0, -1, null);
                        } else if (requirePost(exchange, method, path)) {
                            receiveJson(exchange, body -> dispatchBranch(op, json.readValue(body, BranchRequest.class)));
                        }
                    } else if (CONVERSATIONS.equals(path)) {
                        if (requirePost(exchange, method, path)) {
                            receiveJson(exchange, body -> createConversation(json.readValue(body, CreateConversationRequest.class)));
                        }
                    } else if (path.startsWith(CONVERSATIONS + "/") && path.endsWith(VARIABLES_SUFFIX)) {
                        String slug = slugOf(path, VARIABLES_SUFFIX);
                        if (requireSlug(exchange, method, path, slug) && requirePost(exchange, method, path)) {
                            receiveJson(exchange, body -> variables(slug, json.readValue(body, VariablesRequest.class)));
                        }
                    } else if (path.startsWith(CONVERSATIONS + "/") && path.endsWith(SETTINGS_SUFFIX)) {
                        String slug = slugOf(path, SETTINGS_SUFFIX);
                        if (requireSlug(exchange, method, path, slug) && requirePost(exchange, method, path)) {
                            receiveJson(exchange, body -> settings(slug, json.readValue(body, SettingsRequest.class)));
                        }
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        RequestLogger.logRequest(method, path, 404, 0, -1, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routes ----------

    private Object dispatchBranch(String op, BranchRequest req) {
        if (req == null) throw new IllegalArgumentException("request body must be a JSON object");
        DocumentRef ref = new DocumentRef(req.doc, req.file);
        ReturnMode mode = ReturnMode.parse(req.returnMode);

        return switch (op) {
            case "openai_messages" -> renderer.render(branches.openaiMessages(ref));
            case "branch_table" -> renderer.render(branches.branchTable(ref));
            case "latest_message" -> renderer.render(branches.latestMessage(ref));
            case "append_message" -> renderer.render(branches.append(ref,
                    required(req.nodeId, "node_id"), required(req.pid, "pid"),
                    Role.parse(req.role), content(req.content), mode));
            case "retry_branch" -> renderer.render(branches.retry(ref,
                    required(req.newNodeId, "new_node_id"), required(req.retryNodeId, "retry_node_id"),
                    Role.parse(req.role), content(req.content), mode));
            case "retry_user_message" -> renderer.render(branches.retryUserMessage(ref,
                    required(req.userNodeId, "user_node_id"), mode));
            case "truncate_after" -> renderer.render(branches.truncateAfter(ref, required(req.nodeId, "node_id"), mode));
            case "delete_branch" -> renderer.render(branches.deleteBranch(ref, required(req.nodeId, "node_id"), mode));
            case "switch_branch" -> {
                if (req.targetJ == null) throw new IllegalArgumentException("missing field: target_j");
                yield renderer.render(branches.switchBranch(ref, req.targetJ, mode));
            }
            case "update_message" -> renderer.render(branches.updateMessage(ref,
                    required(req.nodeId, "node_id"), content(req.content), mode));
            default -> throw new IllegalStateException("unrouted operation: " + op);
        };
    }

    private Object createConversation(CreateConversationRequest req) {
        if (req == null) throw new IllegalArgumentException("request body must be a JSON object");
        ConversationStore.Created c = conversations.create(req.name, req.description, req.greetings, req.type);

        var dto = new CreateConversationResponse();
        dto.success = true;
        dto.slug = c.slug();
        dto.file = c.file();
        dto.settingsFile = c.settingsFile();
        dto.variablesFile = c.variablesFile();
        dto.name = c.name();
        dto.type = c.type();
        dto.updatedAt = c.updatedAt();
        if (c.rootNodeId() != null) {
            dto.rootNodeId = c.rootNodeId();
            dto.nodesCount = c.nodesCount();
        }
        return dto;
    }

    private Object variables(String slug, VariablesRequest req) {
        if (req == null) throw new IllegalArgumentException("request body must be a JSON object");
        ConversationStore.Variables v = conversations.variables(req.action, slug, req.data);

        var dto = new VariablesResponse();
        dto.slug = v.slug();
        dto.variablesFile = v.variablesFile();
        dto.variables = v.variables();
        return dto;
    }

    private Object settings(String slug, SettingsRequest req) {
        if (req == null) throw new IllegalArgumentException("request body must be a JSON object");
        ConversationStore.Settings s = conversations.settings(req.action, slug, req.patch);

        var dto = new SettingsResponse();
        dto.slug = s.slug();
        dto.settingsFile = s.settingsFile();
        dto.settings = s.settings();
        return dto;
    }

    // ---------- plumbing ----------

    @FunctionalInterface
    private interface JsonRoute {
        Object handle(byte[] body) throws Exception;
    }

    /**
     * Read the whole body on the IO thread, then run the route on a worker
     * thread (routes touch the file system) and answer with its result or a
     * mapped error.
     */
    private void receiveJson(HttpServerExchange ex, JsonRoute route) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> exchange.dispatch(() -> {
                    String method = exchange.getRequestMethod().toString();
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    long serviceMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            send(exchange, 413, Map.of("error", "request body too large"));
                        } else {
                            long sStart = System.nanoTime();
                            Object body = route.handle(data);
                            serviceMs = (System.nanoTime() - sStart) / 1_000_000L;
                            send(exchange, 200, body);
                        }
                    } catch (BranchException e) {
                        error = e;
                        send(exchange, statusOf(e.kind()), Map.of(
                                "error", e.kind().name(),
                                "message", String.valueOf(e.getMessage())));
                    } catch (JsonProcessingException e) {
                        error = e;
                        send(exchange, 400, Map.of("error", "invalid JSON"));
                    } catch (IllegalArgumentException e) {
                        error = e;
                        send(exchange, 400, Map.of("error", String.valueOf(e.getMessage())));
                    } catch (Exception e) {
                        error = e;
                        send(exchange, 500, Map.of(
                                "error", e.getClass().getSimpleName(),
                                "message", String.valueOf(e.getMessage())));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest(method, path, exchange.getStatusCode(), totalMs, serviceMs, error);
                    }
                }),
                (exchange, ioEx) -> {
                    String method = exchange.getRequestMethod().toString();
                    String path = exchange.getRequestPath();
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(method, path, 400, 0, -1, ioEx);
                }
        );
    }

    private static String slugOf(String path, String suffix) {
        int start = CONVERSATIONS.length() + 1;
        int end = path.length() - suffix.length();
        return end > start ? path.substring(start, end) : "";
    }

    private boolean requireSlug(HttpServerExchange ex, String method, String path, String slug) {
        if (!slug.isBlank()) return true;
        send(ex, 400, Map.of("error", "slug must not be empty"));
        RequestLogger.logRequest(method, path, 400, 0, -1, null);
        return false;
    }

    private boolean requirePost(HttpServerExchange ex, String method, String path) {
        if ("POST".equals(method)) return true;
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, path, 405, 0, -1, null);
        return false;
    }

    static int statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> 404;
            case DUPLICATE_ID -> 409;
            case WRITE_ERROR -> 500;
            default -> 400;
        };
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("missing field: " + field);
        return value;
    }

    private static String content(String value) {
        return value == null ? "" : value;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
