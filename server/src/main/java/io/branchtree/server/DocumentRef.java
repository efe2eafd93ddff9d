// file: server/src/main/java/io/branchtree/server/DocumentRef.java
package io.branchtree.server;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Where a call's document comes from: an inline JSON object (never
 * persisted) or a store id (saved back after a mutation). Exactly one is set.
 */
public record DocumentRef(JsonNode inline, String file) {

    public DocumentRef {
        boolean hasInline = inline != null && !inline.isNull();
        boolean hasFile = file != null && !file.isBlank();
        if (hasInline == hasFile) {
            throw new IllegalArgumentException("exactly one of 'doc' or 'file' must be provided");
        }
        if (!hasInline) inline = null;
        if (!hasFile) file = null;
    }

    public static DocumentRef inline(JsonNode doc) { return new DocumentRef(doc, null); }

    public static DocumentRef file(String id) { return new DocumentRef(null, id); }

    public boolean persistent() { return file != null; }
}
