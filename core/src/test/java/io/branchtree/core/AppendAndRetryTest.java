package io.branchtree.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Append creates a message plus a pending assistant slot; retry creates an
 * alternative sibling without destroying the original.
 */
class AppendAndRetryTest {

    private final BranchEngine engine = TestDocs.engine();

    @Test
    void append_at_tail_extends_path_by_node_and_placeholder() {
        var doc = TestDocs.conversation();
        List<String> before = PathNormalizer.normalize(doc);

        var res = engine.append(doc, "a3", "u2", Role.ASSISTANT, "Reply");

        List<String> after = doc.activePath();
        assertEquals(before.size() + 2, after.size());
        assertEquals(List.of("r1", "u1", "a1", "u2", "a3", TestDocs.APPEND_SLOT), after);

        BranchNode slot = res.placeholder();
        assertEquals(TestDocs.APPEND_SLOT, slot.id());
        assertEquals(Role.ASSISTANT, slot.role());
        assertEquals("", slot.content());
        assertEquals("a3", slot.parentId());
        assertEquals(TestDocs.TS, res.node().updatedAt());
        assertEquals(TestDocs.TS, doc.updatedAt());
    }

    @Test
    void append_off_path_leaves_active_path_alone() {
        var doc = TestDocs.conversation();

        engine.append(doc, "u3", "a2", Role.USER, "Side question");

        assertEquals(List.of("r1", "u1", "a1", "u2"), doc.activePath());
        assertEquals(List.of("u3"), doc.childrenOf("a2"));
        assertEquals(List.of(TestDocs.APPEND_SLOT), doc.childrenOf("u3"));
    }

    @Test
    void placeholder_ids_stay_unique_under_a_frozen_clock() {
        var doc = TestDocs.conversation();

        engine.append(doc, "a3", "u2", Role.ASSISTANT, "one");
        var second = engine.append(doc, "a4", "u2", Role.ASSISTANT, "two");

        assertEquals(TestDocs.APPEND_SLOT + "_2", second.placeholder().id());
        assertEquals(List.of("a3", "a4"), doc.childrenOf("u2"));
    }

    @Test
    void append_rejects_duplicate_id_without_touching_the_document() {
        var doc = TestDocs.conversation();
        int size = doc.size();

        var e = assertThrows(BranchException.class,
                () -> engine.append(doc, "a1", "u2", Role.ASSISTANT, "x"));

        assertEquals(ErrorKind.DUPLICATE_ID, e.kind());
        assertEquals(size, doc.size());
        assertEquals(List.of("r1", "u1", "a1", "u2"), doc.activePath());
        assertNull(doc.updatedAt());
    }

    @Test
    void append_requires_existing_parent_and_role() {
        var doc = TestDocs.conversation();

        var missing = assertThrows(BranchException.class,
                () -> engine.append(doc, "n", "ghost", Role.USER, "x"));
        assertEquals(ErrorKind.NOT_FOUND, missing.kind());

        var noRole = assertThrows(BranchException.class,
                () -> engine.append(doc, "n", "u2", null, "x"));
        assertEquals(ErrorKind.INVALID_ROLE, noRole.kind());
        assertFalse(doc.contains("n"));
    }

    @Test
    void retry_on_path_replaces_target_and_drops_the_rest() {
        var doc = TestDocs.conversation();

        BranchNode node = engine.retry(doc, "a3", "a1", Role.ASSISTANT, "Answer three");

        assertEquals("u1", node.parentId());
        assertEquals(List.of("r1", "u1", "a3"), doc.activePath());
        assertEquals(List.of("a1", "a2", "a3"), doc.childrenOf("u1"));
        assertTrue(doc.contains("u2"), "the old continuation survives");
    }

    @Test
    void retry_off_path_appends_when_parent_is_tail() {
        var doc = TestDocs.conversationBuilder()
                .activePath(List.of("r1", "u1"))
                .build();

        engine.retry(doc, "a3", "a2", Role.ASSISTANT, "again");

        assertEquals(List.of("r1", "u1", "a3"), doc.activePath());
    }

    @Test
    void retry_off_path_keeps_path_when_parent_is_not_tail() {
        var doc = TestDocs.conversation();

        engine.retry(doc, "a3", "a2", Role.ASSISTANT, "x");

        assertEquals(List.of("r1", "u1", "a1", "u2"), doc.activePath());
        assertEquals(List.of("a1", "a2", "a3"), doc.childrenOf("u1"));
    }

    @Test
    void retrying_a_root_is_an_invalid_operation() {
        var doc = TestDocs.conversation();

        var e = assertThrows(BranchException.class,
                () -> engine.retry(doc, "r3", "r1", Role.ASSISTANT, "x"));

        assertEquals(ErrorKind.INVALID_OPERATION, e.kind());
        assertFalse(doc.contains("r3"));
    }

    @Test
    void retry_validates_ids() {
        var doc = TestDocs.conversation();

        assertEquals(ErrorKind.NOT_FOUND, assertThrows(BranchException.class,
                () -> engine.retry(doc, "n", "ghost", Role.USER, "x")).kind());
        assertEquals(ErrorKind.DUPLICATE_ID, assertThrows(BranchException.class,
                () -> engine.retry(doc, "a2", "a1", Role.ASSISTANT, "x")).kind());
    }
}
