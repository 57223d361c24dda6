package com.jsast.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the ordered field mapping of a node: {@code type} and {@code loc} first,
 * then the node's own fields in the order they are added.
 */
public final class NodeFields {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    private NodeFields(Node node) {
        fields.put("type", node.type());
        fields.put("loc", node.loc());
    }

    public static NodeFields of(Node node) {
        return new NodeFields(node);
    }

    public NodeFields put(String name, Object value) {
        fields.put(name, value);
        return this;
    }

    public Map<String, Object> build() {
        return Collections.unmodifiableMap(fields);
    }
}
