package com.jsast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.jsast.ast.Node;
import com.jsast.json.AstJsonException;
import com.jsast.json.AstJsonProvider;
import com.jsast.json.AstJsonSerializer;

import java.io.IOException;
import java.io.Writer;

/**
 * {@link AstJsonProvider} backed by a mapper from {@link JsAstJackson#createObjectMapper()}.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;

    public JacksonAstJsonProvider() {
        this.mapper = JsAstJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * The configured mapper, for callers that want Jackson trees or streaming.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    private static final class JacksonSerializer implements AstJsonSerializer {

        private final ObjectWriter compact;
        private final ObjectWriter pretty;

        JacksonSerializer(ObjectMapper mapper) {
            this.compact = mapper.writer();
            this.pretty = mapper.writerWithDefaultPrettyPrinter();
        }

        @Override
        public String serialize(Node node) {
            return asString(compact, node);
        }

        @Override
        public String serializePretty(Node node) {
            return asString(pretty, node);
        }

        @Override
        public void write(Node node, Writer out) {
            try {
                pretty.without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, node);
                out.flush();
            } catch (IOException e) {
                throw failure(node, e);
            }
        }

        private static String asString(ObjectWriter writer, Node node) {
            try {
                return writer.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw failure(node, e);
            }
        }

        private static AstJsonException failure(Node node, IOException cause) {
            return new AstJsonException("Could not write " + node.type() + " as JSON", cause);
        }
    }
}
