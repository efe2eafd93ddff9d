package io.branchtree.storage;

import io.branchtree.core.BranchDocument;
import io.branchtree.core.BranchEngine;
import io.branchtree.core.BranchException;
import io.branchtree.core.ErrorKind;
import io.branchtree.core.Role;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileDocumentStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.ofHours(8));

    @TempDir Path dir;

    private static BranchDocument seed() {
        return BranchDocument.builder()
                .node("r", null, Role.ASSISTANT, "hello", null)
                .activePath(List.of("r"))
                .build();
    }

    @Test
    void saved_document_survives_reload() {
        var store = new FileDocumentStore(dir, new DocumentCodec());
        var doc = seed();
        new BranchEngine(CLOCK).append(doc, "u1", "r", Role.USER, "hi");

        store.save("chat/conversation.json", doc);
        var loaded = new FileDocumentStore(dir, new DocumentCodec()).load("chat/conversation.json");

        assertEquals(doc.nodes(), loaded.nodes());
        assertEquals(doc.activePath(), loaded.activePath());
        assertEquals("2025-01-01T08:00:00+08:00", loaded.updatedAt());
    }

    @Test
    void save_replaces_whole_file_and_leaves_no_temp_files() throws Exception {
        var store = new FileDocumentStore(dir, new DocumentCodec());
        store.save("c.json", seed());
        var bigger = seed();
        new BranchEngine(CLOCK).append(bigger, "u1", "r", Role.USER, "hi");
        store.save("c.json", bigger);

        try (var files = Files.list(dir)) {
            assertEquals(List.of("c.json"), files.map(p -> p.getFileName().toString()).toList());
        }
        assertEquals(3, store.load("c.json").size());
        String text = Files.readString(dir.resolve("c.json"), StandardCharsets.UTF_8);
        assertTrue(text.endsWith("\n"));
    }

    @Test
    void missing_file_is_not_found() {
        var store = new FileDocumentStore(dir, new DocumentCodec());
        var ex = assertThrows(BranchException.class, () -> store.load("nope.json"));
        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
    }

    @Test
    void corrupt_file_is_an_invalid_document() throws Exception {
        Files.writeString(dir.resolve("bad.json"), "{ not json");
        var store = new FileDocumentStore(dir, new DocumentCodec());
        var ex = assertThrows(BranchException.class, () -> store.load("bad.json"));
        assertEquals(ErrorKind.INVALID_DOCUMENT, ex.kind());
    }

    @Test
    void paths_escaping_the_root_are_rejected_before_io() throws Exception {
        Path inner = Files.createDirectories(dir.resolve("data"));
        Files.writeString(dir.resolve("secret.json"), "{\"nodes\": {}}");
        var store = new FileDocumentStore(inner, new DocumentCodec());

        for (String id : List.of("../secret.json", "a/../../secret.json", dir.resolve("secret.json").toString(), "", "  ")) {
            var ex = assertThrows(BranchException.class, () -> store.load(id), id);
            assertEquals(ErrorKind.INVALID_OPERATION, ex.kind(), id);
        }
        var ex = assertThrows(BranchException.class, () -> store.save("../out.json", seed()));
        assertEquals(ErrorKind.INVALID_OPERATION, ex.kind());
        assertFalse(Files.exists(dir.resolve("out.json")));
    }

    @Test
    void write_failure_is_a_write_error() throws Exception {
        // A regular file where the parent directory should be.
        Files.writeString(dir.resolve("blocked"), "x");
        var store = new FileDocumentStore(dir, new DocumentCodec());
        var ex = assertThrows(BranchException.class, () -> store.save("blocked/c.json", seed()));
        assertEquals(ErrorKind.WRITE_ERROR, ex.kind());
    }
}
