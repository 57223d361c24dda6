package com.jsast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsast.ast.ArrayExpression;
import com.jsast.ast.BinaryExpression;
import com.jsast.ast.Identifier;
import com.jsast.ast.Literal;
import com.jsast.ast.Node;
import com.jsast.ast.Program;
import com.jsast.ast.SourceLocation;
import com.jsast.ast.SourceLocation.Position;
import com.jsast.ast.UpdateExpression;
import com.jsast.builder.AstBuilder;
import com.jsast.json.AstJsonProvider;
import com.jsast.json.AstJsonSerializer;
import com.jsast.parser.JsSource;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private final AstJsonSerializer serializer = new JacksonAstJsonProvider().getSerializer();

    @Test
    void providerIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    void nodeWithoutLocationOmitsLoc() {
        assertEquals("{\"type\":\"Identifier\",\"name\":\"x\"}", serializer.serialize(new Identifier(null, "x")));
    }

    @Test
    void fieldsAreWrittenInDeclarationOrder() {
        Node sum = new BinaryExpression.AddArithmeticExpression(null,
            new Literal.NumericLiteral(null, 1.0, "1"),
            new Literal.NumericLiteral(null, 2.5, "2.5"));
        assertEquals("{\"type\":\"BinaryExpression\",\"operator\":\"+\","
                + "\"left\":{\"type\":\"Literal\",\"value\":1,\"raw\":\"1\"},"
                + "\"right\":{\"type\":\"Literal\",\"value\":2.5,\"raw\":\"2.5\"}}",
            serializer.serialize(sum));
    }

    @Test
    void locationWithoutSourceName() {
        Identifier a = new Identifier(new SourceLocation(new Position(1, 0), new Position(1, 1)), "a");
        assertEquals("{\"type\":\"Identifier\",\"loc\":{\"start\":{\"line\":1,\"column\":0},"
                + "\"end\":{\"line\":1,\"column\":1}},\"name\":\"a\"}",
            serializer.serialize(a));
    }

    @Test
    void locationWithSourceName() {
        Identifier a = new Identifier(new SourceLocation("lib.js", new Position(2, 3), new Position(2, 4)), "a");
        assertTrue(serializer.serialize(a).contains("\"loc\":{\"source\":\"lib.js\",\"start\":{\"line\":2,\"column\":3}"));
    }

    @Test
    void holesAndNullValues() {
        ArrayExpression array = new ArrayExpression(null, Arrays.<Node>asList(null, new Identifier(null, "a")));
        assertEquals("{\"type\":\"ArrayExpression\",\"elements\":[null,{\"type\":\"Identifier\",\"name\":\"a\"}]}",
            serializer.serialize(array));
        assertEquals("{\"type\":\"Literal\",\"value\":null,\"raw\":\"null\"}",
            serializer.serialize(new Literal.NullLiteral(null, "null")));
    }

    @Test
    void booleansAndStrings() {
        Node update = new UpdateExpression.PostIncrementExpression(null, new Identifier(null, "i"));
        assertEquals("{\"type\":\"UpdateExpression\",\"operator\":\"++\",\"argument\":"
                + "{\"type\":\"Identifier\",\"name\":\"i\"},\"prefix\":false}",
            serializer.serialize(update));
        assertEquals("{\"type\":\"Literal\",\"value\":\"hi\",\"raw\":\"'hi'\"}",
            serializer.serialize(new Literal.StringLiteral(null, "hi", "'hi'")));
    }

    @Test
    void numbersFollowJavaScriptFormatting() {
        assertEquals("100000000000000000000", value(new Literal.NumericLiteral(null, 1e20, "1e20")));
        assertEquals("-3", value(new Literal.NumericLiteral(null, -3.0, "-3")));
        assertEquals("0.1", value(new Literal.NumericLiteral(null, 0.1, "0.1")));
        assertEquals("null", value(new Literal.NumericLiteral(null, Double.NaN, "NaN")));
        assertEquals("null", value(new Literal.NumericLiteral(null, Double.POSITIVE_INFINITY, "Infinity")));
    }

    @Test
    void bigIntCarriesDigits() {
        Literal big = new Literal.BigIntLiteral(null, new BigInteger("12345678901234567890"),
            "12345678901234567890n", "12345678901234567890");
        assertEquals("{\"type\":\"Literal\",\"value\":12345678901234567890,"
                + "\"raw\":\"12345678901234567890n\",\"bigint\":\"12345678901234567890\"}",
            serializer.serialize(big));
    }

    @Test
    void parsedProgramAsTree() throws Exception {
        Program program = AstBuilder.buildAst(JsSource.fromString("a = 2").parse());
        ObjectMapper mapper = new JacksonAstJsonProvider().getObjectMapper();
        JsonNode root = mapper.readTree(serializer.serialize(program));

        assertEquals("Program", root.get("type").asText());
        assertEquals("script", root.get("sourceType").asText());
        assertEquals(List.of("type", "loc", "sourceType", "body"), fieldNames(root));
        assertFalse(root.get("loc").has("source"));

        JsonNode assignment = root.at("/body/0/expression/expressions/0");
        assertEquals("AssignmentExpression", assignment.get("type").asText());
        assertEquals("=", assignment.get("operator").asText());
        assertEquals("a", assignment.at("/left/name").asText());
        assertTrue(assignment.at("/right/value").isIntegralNumber());
        assertEquals(2, assignment.at("/right/value").asInt());
        assertEquals(4, assignment.at("/right/loc/start/column").asInt());
    }

    @Test
    void prettyOutputIsSameDocument() throws Exception {
        Program program = AstBuilder.parse("var a = [1, , 'x'];");
        ObjectMapper mapper = new JacksonAstJsonProvider().getObjectMapper();
        String pretty = serializer.serializePretty(program);
        assertTrue(pretty.contains("\n"));
        assertEquals(mapper.readTree(serializer.serialize(program)), mapper.readTree(pretty));
        assertEquals("<string>", mapper.readTree(pretty).at("/loc/source").asText());
    }

    @Test
    void writesToWriterWithoutClosingIt() throws Exception {
        Program program = AstBuilder.parse("x;");
        StringWriter out = new StringWriter() {
            @Override
            public void close() {
                throw new AssertionError("writer must stay open");
            }
        };
        serializer.write(program, out);
        assertEquals(serializer.serializePretty(program), out.toString());
    }

    private String value(Literal literal) {
        String json = serializer.serialize(literal);
        int start = json.indexOf("\"value\":") + "\"value\":".length();
        return json.substring(start, json.indexOf(",\"raw\"", start));
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
