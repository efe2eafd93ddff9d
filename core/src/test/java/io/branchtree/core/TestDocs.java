package io.branchtree.core;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared fixtures for engine tests.
 */
final class TestDocs {
    static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.ofHours(8));
    static final String TS = "2025-01-01T08:00:00+08:00";
    static final String APPEND_SLOT = "n_append_ass" + CLOCK.millis();
    static final String RETRY_SLOT = "n_retry_ass" + CLOCK.millis();

    private TestDocs() {}

    /**
     * Two openings and one retried reply:
     * <pre>
     *   r1 ── u1 ─┬─ a1 ── u2
     *             └─ a2
     *   r2
     * </pre>
     * Active path: r1, u1, a1, u2.
     */
    static BranchDocument conversation() {
        return conversationBuilder()
                .activePath(List.of("r1", "u1", "a1", "u2"))
                .build();
    }

    static BranchDocument.Builder conversationBuilder() {
        return BranchDocument.builder()
                .node("r1", null, Role.ASSISTANT, "Hello", null)
                .node("r2", null, Role.ASSISTANT, "Hi there", null)
                .node("u1", "r1", Role.USER, "Question", null)
                .node("a1", "u1", Role.ASSISTANT, "Answer one", null)
                .node("a2", "u1", Role.ASSISTANT, "Answer two", null)
                .node("u2", "a1", Role.USER, "Follow-up", null)
                .roots(List.of("r1", "r2"))
                .children("r1", List.of("u1"))
                .children("u1", List.of("a1", "a2"))
                .children("a1", List.of("u2"));
    }

    static BranchEngine engine() {
        return new BranchEngine(CLOCK);
    }
}
