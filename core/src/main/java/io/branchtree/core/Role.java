// file: src/main/java/io/branchtree/core/Role.java
package io.branchtree.core;

/**
 * Author of a message node. The wire form is the lower-case name.
 */
public enum Role {
    SYSTEM("system"), USER("user"), ASSISTANT("assistant");

    private final String wire;

    Role(String wire) { this.wire = wire; }

    public String wire() { return wire; }

    /**
     * Parse a wire value. Matching is exact: "User" is rejected.
     *
     * @throws BranchException with {@link ErrorKind#INVALID_ROLE} for anything else
     */
    public static Role parse(String value) {
        if (value != null) {
            for (Role r : values()) {
                if (r.wire.equals(value)) return r;
            }
        }
        throw new BranchException(ErrorKind.INVALID_ROLE, "Invalid role: " + value);
    }

    @Override public String toString() { return wire; }
}
