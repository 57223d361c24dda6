package com.jsast.printer;

import com.jsast.InvalidNestingLevelException;
import com.jsast.ast.FieldContainer;
import com.jsast.ast.Node;
import com.jsast.ast.ScalarNode;

import java.util.List;
import java.util.Map;

/**
 * Renders AST values as an indented ASCII tree.
 *
 * <p>Nodes are walked through their {@link FieldContainer#fields()} contract, so every
 * node variant renders without printer changes. Each entry below the root is prefixed
 * with {@code "+-- "} and one {@code "|   "} per ancestor level:</p>
 *
 * <pre>
 * Program
 * +-- sourceType: script
 * +-- body: 
 * |   +-- 0: EmptyStatement
 * </pre>
 */
public final class AsciiTreePrinter {

    public enum Mode {
        /** Every field, with node locations. */
        FULL,
        /** Drops {@code type} and {@code loc} entries, for position-independent output. */
        SHORT
    }

    private static final String ENTRY = "+-- ";
    private static final String CONTINUATION = "|   ";

    private AsciiTreePrinter() {
    }

    public static String render(Object value) {
        return render(value, Mode.FULL);
    }

    public static String render(Object value, Mode mode) {
        return render(value, "", 0, mode);
    }

    /**
     * @param namePrefix label printed before the value, e.g. {@code "body: "}
     * @throws InvalidNestingLevelException if {@code nestingLevel} is negative
     */
    public static String render(Object value, String namePrefix, int nestingLevel, Mode mode) {
        if (nestingLevel < 0) {
            throw new InvalidNestingLevelException(nestingLevel);
        }
        StringBuilder out = new StringBuilder();
        render(out, value, namePrefix, nestingLevel, mode);
        return out.toString();
    }

    private static void render(StringBuilder out, Object value, String namePrefix, int level, Mode mode) {
        if (level > 0) {
            out.append(CONTINUATION.repeat(level - 1)).append(ENTRY);
        }
        out.append(namePrefix).append(text(value, mode)).append('\n');

        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                render(out, list.get(i), i + ": ", level + 1, mode);
            }
        } else if (value instanceof FieldContainer container && !(value instanceof ScalarNode)) {
            for (Map.Entry<String, Object> field : container.fields().entrySet()) {
                if (mode == Mode.SHORT && isLocationOrType(field.getKey())) {
                    continue;
                }
                render(out, field.getValue(), field.getKey() + ": ", level + 1, mode);
            }
        }
    }

    private static boolean isLocationOrType(String field) {
        return "type".equals(field) || "loc".equals(field);
    }

    private static String text(Object value, Mode mode) {
        if (value == null) {
            return "null";
        }
        if (value instanceof List<?>) {
            return "";
        }
        if (value instanceof ScalarNode) {
            return value.toString();
        }
        if (value instanceof Node node) {
            if (mode == Mode.FULL && node.loc() != null) {
                return node.type() + " at " + node.loc();
            }
            return node.type();
        }
        return String.valueOf(value);
    }
}
