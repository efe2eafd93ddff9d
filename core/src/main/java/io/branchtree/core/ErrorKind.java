// file: src/main/java/io/branchtree/core/ErrorKind.java
package io.branchtree.core;

/**
 * Failure categories reported by the branch-tree engine and its collaborators.
 * <p>
 * Every failed operation surfaces exactly one kind; the HTTP layer maps
 * these to status codes.
 */
public enum ErrorKind {
    /** Malformed structural fields, or no usable root. */
    INVALID_DOCUMENT,
    /** Referenced node, parent, target or stored document does not exist. */
    NOT_FOUND,
    /** A new node id collides with an existing one. */
    DUPLICATE_ID,
    /** Role outside system | user | assistant. */
    INVALID_ROLE,
    /** Structurally disallowed request, e.g. retrying a root. */
    INVALID_OPERATION,
    /** Switch target outside the sibling bounds. */
    OUT_OF_RANGE,
    /** Persistence failure. */
    WRITE_ERROR
}
