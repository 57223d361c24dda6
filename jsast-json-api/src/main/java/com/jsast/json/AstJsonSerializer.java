package com.jsast.json;

import com.jsast.ast.Node;

import java.io.Writer;

/**
 * Writes AST nodes as ESTree JSON. Fields appear in the order of {@link Node#fields()};
 * a node without a location has no {@code loc} member.
 */
public interface AstJsonSerializer {

    /**
     * @return the node as a single-line JSON document
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same document as {@link #serialize(Node)}, indented for reading.
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Streams the indented document to {@code out}. The writer is flushed but left open.
     *
     * @throws AstJsonException if the node cannot be written or {@code out} fails
     */
    void write(Node node, Writer out) throws AstJsonException;
}
