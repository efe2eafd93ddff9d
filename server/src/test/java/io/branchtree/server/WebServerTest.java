package io.branchtree.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.branchtree.core.BranchEngine;
import io.branchtree.storage.ConversationStore;
import io.branchtree.storage.DocumentCodec;
import io.branchtree.storage.FileDocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over a real Undertow server and on-disk conversation files.
 *
 * Focus:
 *  - Conversation creation followed by branch operations on the created file.
 *  - Inline documents are answered but never written.
 *  - Error kinds map to 400/404/409; bad JSON to 400; oversized bodies to 413.
 */
class WebServerTest {

    private static final int PORT = 18090; // test-only port
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.ofHours(8));

    @TempDir Path dataDir;

    private final ObjectMapper json = new ObjectMapper();
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        var codec = new DocumentCodec(json);
        var service = new BranchService(new FileDocumentStore(dataDir, codec), codec, new BranchEngine(CLOCK));
        server = new WebServer(PORT, service, new ConversationStore(dataDir, codec, CLOCK), codec);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json")
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode ok(HttpResponse<String> resp) throws Exception {
        assertEquals(200, resp.statusCode(), resp.body());
        return json.readTree(resp.body());
    }

    @Test
    void health_check() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + "/admin/health"))
                .GET()
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("ok"));
    }

    @Test
    void create_then_chat_through_the_file() throws Exception {
        JsonNode created = ok(post("/conversations", """
                {"name": "demo", "greetings": ["Welcome!"]}
                """));
        assertEquals("demo/conversation.json", created.get("file").asText());
        assertEquals("n_root1", created.get("root_node_id").asText());

        JsonNode appended = ok(post("/branches/append_message", """
                {"file": "demo/conversation.json", "node_id": "u1", "pid": "n_root1",
                 "role": "user", "content": "hi", "return_mode": "node"}
                """));
        assertTrue(appended.get("success").asBoolean());
        assertEquals("u1", appended.get("node").get("node_id").asText());
        assertEquals(3, appended.get("active_path").size());
        assertEquals(3, appended.get("latest").get("depth").asInt());

        JsonNode retried = ok(post("/branches/retry_branch", """
                {"file": "demo/conversation.json", "new_node_id": "u1b", "retry_node_id": "u1",
                 "role": "user", "content": "hello", "return_mode": "none"}
                """));
        assertEquals("u1b", retried.get("node_id").asText());
        assertFalse(retried.has("nodes"));

        JsonNode table = ok(post("/branches/branch_table", """
                {"file": "demo/conversation.json"}
                """));
        assertEquals(2, table.get("latest").get("j").asInt());
        assertEquals(2, table.get("latest").get("n").asInt());

        JsonNode switched = ok(post("/branches/switch_branch", """
                {"file": "demo/conversation.json", "target_j": 1}
                """));
        assertTrue(switched.has("nodes"));
        assertEquals("u1", switched.get("active_path").get(1).asText());

        JsonNode messages = ok(post("/branches/openai_messages", """
                {"file": "demo/conversation.json"}
                """));
        assertEquals(2, messages.get("messages").size());
        assertEquals("assistant", messages.get("messages").get(0).get("role").asText());
        assertEquals("Welcome!", messages.get("messages").get(0).get("content").asText());

        JsonNode stored = json.readTree(dataDir.resolve("demo/conversation.json").toFile());
        assertTrue(stored.get("nodes").has("u1b"));
        assertEquals("2025-01-01T08:00:00+08:00", stored.get("updated_at").asText());

        JsonNode pathOnly = ok(post("/branches/append_message", """
                {"file": "demo/conversation.json", "node_id": "u2", "pid": "u1b",
                 "role": "user", "content": "again", "return_mode": "path"}
                """));
        assertFalse(pathOnly.has("node"));
        assertEquals(pathOnly.get("placeholder_id").asText(), pathOnly.get("node_id").asText());
    }

    @Test
    void inline_document_is_answered_without_writing() throws Exception {
        JsonNode latest = ok(post("/branches/latest_message", """
                {"doc": {"roots": ["r"], "nodes": {"r": {"role": "assistant", "content": "hey"}},
                         "active_path": ["r"]}}
                """));
        assertEquals("r", latest.get("node_id").asText());
        assertEquals("hey", latest.get("content").asText());
        assertEquals(1, latest.get("depth").asInt());

        JsonNode updated = ok(post("/branches/update_message", """
                {"doc": {"roots": ["r"], "nodes": {"r": {"role": "assistant", "content": "hey"}}},
                 "node_id": "r", "content": "edited"}
                """));
        assertEquals("edited", updated.get("nodes").get("r").get("content").asText());
        try (var files = Files.list(dataDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void variables_round_through_http() throws Exception {
        ok(post("/conversations", "{\"name\": \"vars\"}"));

        ok(post("/conversations/vars/variables", "{\"action\": \"set\", \"data\": {\"hp\": 10}}"));
        JsonNode merged = ok(post("/conversations/vars/variables", "{\"action\": \"merge\", \"data\": {\"mp\": 3}}"));
        assertEquals(10, merged.get("variables").get("hp").asInt());
        assertEquals(3, merged.get("variables").get("mp").asInt());
        assertEquals("vars/variables.json", merged.get("variables_file").asText());

        assertEquals(400, post("/conversations/vars/variables", "{\"action\": \"explode\"}").statusCode());
    }

    @Test
    void settings_round_through_http() throws Exception {
        ok(post("/conversations", "{\"name\": \"cfg\"}"));

        JsonNode got = ok(post("/conversations/cfg/settings", "{\"action\": \"get\"}"));
        assertEquals("threaded", got.get("settings").get("type").asText());
        assertEquals("cfg/settings.json", got.get("settings_file").asText());

        JsonNode updated = ok(post("/conversations/cfg/settings",
                "{\"action\": \"update\", \"patch\": {\"type\": \"sandbox\", \"regex_rules\": [\"rx/a.json\"]}}"));
        assertEquals("sandbox", updated.get("settings").get("type").asText());
        assertEquals("rx/a.json", updated.get("settings").get("regex_rules").get(0).asText());
        assertEquals("sandbox", json.readTree(dataDir.resolve("cfg/settings.json").toFile()).get("type").asText());

        var unknownKey = post("/conversations/cfg/settings", "{\"action\": \"update\", \"patch\": {\"colour\": \"red\"}}");
        assertEquals(400, unknownKey.statusCode());
        assertTrue(unknownKey.body().contains("INVALID_OPERATION"));

        var badType = post("/conversations/cfg/settings", "{\"action\": \"update\", \"patch\": {\"type\": \"tree\"}}");
        assertEquals(400, badType.statusCode());
        assertEquals("sandbox", json.readTree(dataDir.resolve("cfg/settings.json").toFile()).get("type").asText());
    }

    @Test
    void nested_slugs_are_rejected() throws Exception {
        var nested = post("/conversations/cfg/sub/variables", "{\"action\": \"set\", \"data\": {\"k\": 1}}");
        assertEquals(400, nested.statusCode());
        assertTrue(nested.body().contains("INVALID_OPERATION"));
        assertFalse(Files.exists(dataDir.resolve("cfg/sub")));
    }

    @Test
    void error_kinds_map_to_statuses() throws Exception {
        ok(post("/conversations", "{\"name\": \"errs\"}"));

        var notFound = post("/branches/delete_branch", "{\"file\": \"errs/conversation.json\", \"node_id\": \"ghost\"}");
        assertEquals(404, notFound.statusCode());
        assertTrue(notFound.body().contains("NOT_FOUND"));

        var duplicate = post("/branches/append_message",
                "{\"file\": \"errs/conversation.json\", \"node_id\": \"n_root1\", \"pid\": \"n_root1\", \"role\": \"user\"}");
        assertEquals(409, duplicate.statusCode());

        var badRole = post("/branches/append_message",
                "{\"file\": \"errs/conversation.json\", \"node_id\": \"u9\", \"pid\": \"n_root1\", \"role\": \"robot\"}");
        assertEquals(400, badRole.statusCode());
        assertTrue(badRole.body().contains("INVALID_ROLE"));

        var lastRoot = post("/branches/truncate_after", "{\"file\": \"errs/conversation.json\", \"node_id\": \"n_root1\"}");
        assertEquals(400, lastRoot.statusCode());
        assertTrue(lastRoot.body().contains("INVALID_OPERATION"));

        var range = post("/branches/switch_branch", "{\"file\": \"errs/conversation.json\", \"target_j\": 9}");
        assertEquals(400, range.statusCode());
        assertTrue(range.body().contains("OUT_OF_RANGE"));

        var escape = post("/branches/branch_table", "{\"file\": \"../outside.json\"}");
        assertEquals(400, escape.statusCode());

        var missingFile = post("/branches/branch_table", "{\"file\": \"nope/conversation.json\"}");
        assertEquals(404, missingFile.statusCode());
    }

    @Test
    void request_validation() throws Exception {
        var badJson = post("/branches/branch_table", "{ invalid-json");
        assertEquals(400, badJson.statusCode());
        assertTrue(badJson.body().contains("invalid JSON"));

        var noSource = post("/branches/branch_table", "{}");
        assertEquals(400, noSource.statusCode());

        var missingField = post("/branches/switch_branch", "{\"doc\": {\"nodes\": {\"r\": {}}}}");
        assertEquals(400, missingField.statusCode());
        assertTrue(missingField.body().contains("target_j"));

        assertEquals(404, post("/branches/nope", "{}").statusCode());

        HttpRequest get = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + "/branches/branch_table"))
                .GET()
                .build();
        assertEquals(405, client.send(get, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        String big = "x".repeat(11 * 1024 * 1024);
        var resp = post("/branches/branch_table", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }
}
