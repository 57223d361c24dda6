package com.jsast.ast;

/**
 * Marks nodes that render as a single scalar value (their {@code toString()})
 * instead of a subtree of fields.
 */
public interface ScalarNode {
}
