// file: src/main/java/io/branchtree/core/Placeholders.java
package io.branchtree.core;

import java.time.Clock;
import java.util.Locale;

/**
 * Empty assistant nodes created as ready slots for a reply that has not been
 * generated yet.
 * <p>
 * Their ids carry an "append" or "retry" marker so exports can elide them
 * while they are still empty.
 */
public final class Placeholders {
    /** Prefix of the slot created under a freshly appended message. */
    public static final String APPEND_PREFIX = "n_append_ass";
    /** Prefix of the slot created when a user message has no assistant reply to retry. */
    public static final String RETRY_PREFIX = "n_retry_ass";

    private Placeholders() {
        // utility
    }

    /** True when the node is an empty assistant slot with a placeholder marker in its id. */
    public static boolean isPlaceholder(BranchNode node) {
        if (node == null || node.role() != Role.ASSISTANT || !node.content().isBlank()) return false;
        String id = node.id().toLowerCase(Locale.ROOT);
        return id.contains("retry") || id.contains("append");
    }

    /** prefix + epoch millis, with a _2, _3, ... suffix until the id is unused. */
    static String nextId(BranchDocument doc, String prefix, Clock clock) {
        String base = prefix + clock.millis();
        String id = base;
        for (int i = 2; doc.contains(id); i++) {
            id = base + "_" + i;
        }
        return id;
    }
}
