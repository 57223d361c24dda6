package com.jsast.printer;

import com.jsast.InvalidNestingLevelException;
import com.jsast.ast.BinaryExpression;
import com.jsast.ast.EmptyStatement;
import com.jsast.ast.ExpressionStatement;
import com.jsast.ast.Identifier;
import com.jsast.ast.Literal;
import com.jsast.ast.Program;
import com.jsast.ast.SequenceExpression;
import com.jsast.ast.SourceLocation;
import com.jsast.ast.SourceLocation.Position;
import com.jsast.ast.SourceType;
import com.jsast.ast.VariableDeclaration;
import com.jsast.ast.VariableDeclarator;
import com.jsast.ast.VariableKind;
import com.jsast.printer.AsciiTreePrinter.Mode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AsciiTreePrinterTest {

    private static SourceLocation loc(int line, int start, int end) {
        return new SourceLocation(new Position(line, start), new Position(line, end));
    }

    private static Program varA() {
        Identifier a = new Identifier(loc(1, 4, 5), "a");
        VariableDeclarator declarator = new VariableDeclarator(loc(1, 4, 5), a, null);
        VariableDeclaration declaration = new VariableDeclaration(loc(1, 0, 6), VariableKind.VAR, List.of(declarator));
        return new Program(loc(1, 0, 6), SourceType.SCRIPT, List.of(declaration));
    }

    @Test
    void nullLiteralRendersAsSingleLine() {
        assertEquals("null\n", AsciiTreePrinter.render(new Literal.NullLiteral(loc(1, 0, 4), "null"), Mode.SHORT));
        assertEquals("null\n", AsciiTreePrinter.render(new Literal.NullLiteral(loc(1, 0, 4), "null")));
    }

    @Test
    void negativeNestingLevelIsRejected() {
        assertThrows(InvalidNestingLevelException.class,
            () -> AsciiTreePrinter.render(new EmptyStatement(null), "", -1, Mode.FULL));
    }

    @Test
    void shortModeRendersVariableDeclaration() {
        String expected = """
            Program
            +-- sourceType: script
            +-- body:\s
            |   +-- 0: VariableDeclaration
            |   |   +-- kind: var
            |   |   +-- declarations:\s
            |   |   |   +-- 0: VariableDeclarator
            |   |   |   |   +-- id: Identifier
            |   |   |   |   |   +-- name: a
            |   |   |   |   +-- init: null
            """;
        assertEquals(expected, AsciiTreePrinter.render(varA(), Mode.SHORT));
    }

    @Test
    void fullModeShowsTypesAndLocations() {
        String rendered = AsciiTreePrinter.render(new EmptyStatement(loc(1, 0, 1)), Mode.FULL);
        String expected = """
            EmptyStatement at 1:0
            +-- type: EmptyStatement
            +-- loc: 1:0
            |   +-- start: 1:0
            |   +-- end: 1:1
            """;
        assertEquals(expected, rendered);
    }

    @Test
    void fullModeWithoutLocationPrintsTypeOnly() {
        String rendered = AsciiTreePrinter.render(new Identifier(null, "x"), Mode.FULL);
        assertEquals("""
            Identifier
            +-- type: Identifier
            +-- loc: null
            +-- name: x
            """, rendered);
    }

    @Test
    void shortModeNeverShowsTypeOrLoc() {
        Identifier a = new Identifier(loc(1, 0, 1), "a");
        Literal two = new Literal.NumericLiteral(loc(1, 4, 5), 2.0, "2");
        Program program = new Program(loc(1, 0, 5), SourceType.SCRIPT, List.of(
            new ExpressionStatement(loc(1, 0, 5), new SequenceExpression(loc(1, 0, 5), List.of(
                new BinaryExpression.MulArithmeticExpression(loc(1, 0, 5), a, two))))));

        String rendered = AsciiTreePrinter.render(program, Mode.SHORT);
        assertFalse(rendered.contains("type:"));
        assertFalse(rendered.contains("loc:"));
        assertTrue(rendered.contains("|   |   |   |   +-- 0: BinaryExpression\n"));
        assertTrue(rendered.contains("|   |   |   |   |   +-- operator: *\n"));
        assertTrue(rendered.contains("|   |   |   |   |   +-- right: 2.0\n"));
    }

    @Test
    void renderingIsRepeatable() {
        Program program = varA();
        assertEquals(AsciiTreePrinter.render(program, Mode.FULL), AsciiTreePrinter.render(program, Mode.FULL));
        assertEquals(AsciiTreePrinter.render(program, Mode.SHORT), AsciiTreePrinter.render(program, Mode.SHORT));
    }

    @Test
    void listsUseIndicesAsLabels() {
        String rendered = AsciiTreePrinter.render(List.of(VariableKind.LET, "x"), "items: ", 0, Mode.SHORT);
        assertEquals("""
            items:\s
            +-- 0: let
            +-- 1: x
            """, rendered);
    }

    @Test
    void nestingLevelIndentsTheFirstLine() {
        assertEquals("|   |   +-- kind: const\n", AsciiTreePrinter.render(VariableKind.CONST, "kind: ", 3, Mode.SHORT));
    }
}
