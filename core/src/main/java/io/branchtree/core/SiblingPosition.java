// file: src/main/java/io/branchtree/core/SiblingPosition.java
package io.branchtree.core;

/**
 * 1-based position {@code j} of a node among its {@code n} siblings.
 * j is null when the node is missing from its sibling list, which only
 * happens for malformed input.
 */
public record SiblingPosition(Integer j, int n) {}
