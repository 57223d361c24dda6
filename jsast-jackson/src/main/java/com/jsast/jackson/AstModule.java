package com.jsast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.jsast.ast.Node;
import com.jsast.ast.SourceLocation;

import java.io.IOException;
import java.util.Map;

/**
 * Jackson module that writes AST nodes as ESTree JSON.
 *
 * This module handles:
 * - Node serialization through the ordered {@link Node#fields()} mapping
 * - {@code loc} as {@code {source?, start: {line, column}, end: {line, column}}}, omitted when absent
 * - JavaScript-compatible number serialization
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.jsast", "jsast-jackson"));
        addSerializer(Node.class, new NodeSerializer());
        addSerializer(SourceLocation.class, new SourceLocationSerializer());
    }

    static class NodeSerializer extends StdSerializer<Node> {

        private final JavaScriptNumberSerializer numbers = new JavaScriptNumberSerializer();

        NodeSerializer() {
            super(Node.class);
        }

        @Override
        public void serialize(Node node, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            for (Map.Entry<String, Object> field : node.fields().entrySet()) {
                String name = field.getKey();
                Object value = field.getValue();
                if ("loc".equals(name) && value == null) {
                    continue;
                }
                if (value instanceof Number number) {
                    gen.writeFieldName(name);
                    numbers.serialize(number, gen, provider);
                } else {
                    provider.defaultSerializeField(name, value, gen);
                }
            }
            gen.writeEndObject();
        }
    }

    static class SourceLocationSerializer extends StdSerializer<SourceLocation> {

        SourceLocationSerializer() {
            super(SourceLocation.class);
        }

        @Override
        public void serialize(SourceLocation loc, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            if (loc.source() != null) {
                gen.writeStringField("source", loc.source());
            }
            writePosition(gen, "start", loc.start());
            writePosition(gen, "end", loc.end());
            gen.writeEndObject();
        }

        private static void writePosition(JsonGenerator gen, String name, SourceLocation.Position position)
            throws IOException {
            gen.writeObjectFieldStart(name);
            gen.writeNumberField("line", position.line());
            gen.writeNumberField("column", position.column());
            gen.writeEndObject();
        }
    }
}
