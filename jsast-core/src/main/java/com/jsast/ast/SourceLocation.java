package com.jsast.ast;

import com.jsast.InvalidPositionException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source region of a node. {@code end} points one past the last character of the region.
 *
 * @param source name of the source the region belongs to, or {@code null} when unknown
 */
public record SourceLocation(String source, Position start, Position end) implements FieldContainer {

    public SourceLocation(Position start, Position end) {
        this(null, start, end);
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("start", start);
        fields.put("end", end);
        return fields;
    }

    @Override
    public String toString() {
        return (source == null ? "" : source + ":") + start;
    }

    /**
     * A line (1-indexed) and column (0-indexed) pair.
     */
    public record Position(int line, int column) {

        public Position {
            if (line < 1 || column < 0) {
                throw new InvalidPositionException(line, column);
            }
        }

        @Override
        public String toString() {
            return line + ":" + column;
        }
    }
}
