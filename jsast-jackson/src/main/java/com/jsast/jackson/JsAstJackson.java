package com.jsast.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = JsAstJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * </pre>
 */
public final class JsAstJackson {

    private JsAstJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for ESTree output.
     *
     * The returned mapper:
     * - Writes nodes field by field in their declared order
     * - Writes operators and other enums as their source token
     * - Uses JavaScript-compatible number serialization
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
