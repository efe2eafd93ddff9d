// file: server/src/main/java/io/branchtree/server/ReturnMode.java
package io.branchtree.server;

import java.util.Locale;

/**
 * How much of the document a mutating call sends back.
 *
 *  - DOC:  the full document plus active_path/latest (default).
 *  - NODE: the affected node plus active_path/latest.
 *  - PATH: active_path/latest plus the affected id, without the node object.
 *  - NONE: success flag, affected id and updated_at.
 */
public enum ReturnMode {
    DOC, NODE, PATH, NONE;

    /** Case-insensitive; null, blank or unknown values mean DOC. */
    public static ReturnMode parse(String value) {
        if (value == null || value.isBlank()) return DOC;
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "node" -> NODE;
            case "path" -> PATH;
            case "none" -> NONE;
            default -> DOC;
        };
    }
}
