package io.branchtree.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The normalizer repairs drift instead of failing, except when no usable
 * root exists.
 */
class PathNormalizerTest {

    @Test
    void connected_path_is_returned_unchanged() {
        var doc = TestDocs.conversation();
        assertEquals(List.of("r1", "u1", "a1", "u2"), PathNormalizer.normalize(doc));
    }

    @Test
    void path_is_cut_at_the_first_disconnected_step() {
        // a2 is not a child of a1's sibling chain: r1 -> u1 -> a2 -> u2 breaks at u2
        var doc = TestDocs.conversationBuilder()
                .activePath(List.of("r1", "u1", "a2", "u2"))
                .build();

        assertEquals(List.of("r1", "u1", "a2"), PathNormalizer.normalize(doc));
    }

    @Test
    void unknown_ids_stop_the_walk() {
        var doc = TestDocs.conversationBuilder()
                .activePath(List.of("r1", "deleted", "a1"))
                .build();

        assertEquals(List.of("r1"), PathNormalizer.normalize(doc));
    }

    @Test
    void empty_path_falls_back_to_first_root() {
        var doc = TestDocs.conversationBuilder().build();
        assertEquals(List.of("r1"), PathNormalizer.normalize(doc));
    }

    @Test
    void missing_first_id_falls_back_to_first_root() {
        var doc = TestDocs.conversationBuilder()
                .activePath(List.of("gone", "u1"))
                .build();

        assertEquals(List.of("r1"), PathNormalizer.normalize(doc));
    }

    @Test
    void second_root_is_a_valid_start() {
        var doc = TestDocs.conversationBuilder()
                .activePath(List.of("r2"))
                .build();

        assertEquals(List.of("r2"), PathNormalizer.normalize(doc));
    }

    @Test
    void path_starting_at_a_non_root_is_invalid() {
        var doc = TestDocs.conversationBuilder()
                .activePath(List.of("u1", "a1"))
                .build();

        var e = assertThrows(BranchException.class, () -> PathNormalizer.normalize(doc));
        assertEquals(ErrorKind.INVALID_DOCUMENT, e.kind());
    }

    @Test
    void document_without_roots_is_invalid() {
        var doc = BranchDocument.builder().activePath(List.of("x")).build();

        var e = assertThrows(BranchException.class, () -> PathNormalizer.normalize(doc));
        assertEquals(ErrorKind.INVALID_DOCUMENT, e.kind());
    }

    @Test
    void normalization_is_idempotent_and_connected() {
        var doc = TestDocs.conversationBuilder()
                .activePath(List.of("r1", "u1", "a2", "u2", "r2"))
                .build();

        List<String> once = PathNormalizer.normalize(doc);
        doc.setActivePath(once);
        List<String> twice = PathNormalizer.normalize(doc);

        assertEquals(once, twice);
        assertTrue(doc.roots().contains(twice.get(0)));
        for (int i = 1; i < twice.size(); i++) {
            assertTrue(doc.childrenOf(twice.get(i - 1)).contains(twice.get(i)),
                    "step " + i + " must follow a parent/child edge");
        }
    }
}
