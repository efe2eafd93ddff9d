// file: src/main/java/io/branchtree/core/BranchException.java
package io.branchtree.core;

import java.util.Objects;

/**
 * Unchecked failure of a single branch-tree operation.
 * <p>
 * Operations validate before they mutate, so when this is thrown the
 * document the operation was given is unchanged.
 */
public class BranchException extends RuntimeException {
    private final ErrorKind kind;

    public BranchException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public BranchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() { return kind; }

    public static BranchException notFound(String message) {
        return new BranchException(ErrorKind.NOT_FOUND, message);
    }

    public static BranchException invalidDocument(String message) {
        return new BranchException(ErrorKind.INVALID_DOCUMENT, message);
    }

    public static BranchException invalidOperation(String message) {
        return new BranchException(ErrorKind.INVALID_OPERATION, message);
    }
}
