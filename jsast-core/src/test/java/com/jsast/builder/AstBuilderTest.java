package com.jsast.builder;

import com.jsast.MissingResultException;
import com.jsast.ParseException;
import com.jsast.UnsupportedFeatureException;
import com.jsast.ast.AssignmentExpression;
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
import com.jsast.parser.JavaScriptParser;
import com.jsast.parser.JsSource;
import com.jsast.printer.AsciiTreePrinter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AstBuilderTest {

    @Test
    void emptyStatementProgram() {
        Program program = AstBuilder.parse(";");
        assertEquals(1, program.body().size());
        assertInstanceOf(EmptyStatement.class, program.body().get(0));
        assertEquals("""
            Program
            +-- sourceType: script
            +-- body:\s
            |   +-- 0: EmptyStatement
            """, AsciiTreePrinter.render(program, AsciiTreePrinter.Mode.SHORT));
    }

    @Test
    void variableDeclarationWithoutInitializer() {
        Program program = AstBuilder.parse("var a;");
        VariableDeclaration declaration = assertInstanceOf(VariableDeclaration.class, program.body().get(0));
        assertEquals(VariableKind.VAR, declaration.kind());
        assertEquals(1, declaration.declarations().size());
        VariableDeclarator declarator = declaration.declarations().get(0);
        assertEquals("a", ((Identifier) declarator.id()).name());
        assertNull(declarator.init());
    }

    @Test
    void additionWrappedInSequence() {
        ExpressionStatement statement = (ExpressionStatement) AstBuilder.parse("1+2").body().get(0);
        SequenceExpression sequence = assertInstanceOf(SequenceExpression.class, statement.expression());
        assertEquals(1, sequence.expressions().size());
        BinaryExpression.AddArithmeticExpression sum =
            assertInstanceOf(BinaryExpression.AddArithmeticExpression.class, sequence.expressions().get(0));
        assertEquals(1.0, ((Literal.NumericLiteral) sum.left()).value());
        assertEquals(2.0, ((Literal.NumericLiteral) sum.right()).value());
    }

    @Test
    void simpleAssignment() {
        ExpressionStatement statement = (ExpressionStatement) AstBuilder.parse("a=2").body().get(0);
        SequenceExpression sequence = (SequenceExpression) statement.expression();
        AssignmentExpression.SimpleAssignExpression assign =
            assertInstanceOf(AssignmentExpression.SimpleAssignExpression.class, sequence.expressions().get(0));
        assertEquals("a", ((Identifier) assign.left()).name());
        assertEquals(2.0, ((Literal.NumericLiteral) assign.right()).value());
    }

    @Test
    void ifStatementFailsWithoutPartialResult() {
        UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class,
            () -> AstBuilder.parse("if (a) {}"));
        assertEquals("IfStatement", e.feature());
    }

    @Test
    void buildingTwiceGivesEqualTrees() {
        JavaScriptParser.ProgramContext tree = JsSource.fromString("var a = [1,,b], c = -d;").parse();
        Program first = AstBuilder.buildAst(tree);
        Program second = AstBuilder.buildAst(tree);
        assertEquals(first, second);
        assertNotSame(first, second);
        assertEquals(AsciiTreePrinter.render(first), AsciiTreePrinter.render(second));
    }

    @Test
    void emptyProgram() {
        Program program = AstBuilder.parse("");
        assertTrue(program.body().isEmpty());
        assertEquals(new Position(1, 0), program.loc().start());
        assertEquals(new Position(1, 0), program.loc().end());
    }

    @Test
    void commentsOnlyProgram() {
        assertTrue(AstBuilder.parse("// nothing\n/* here */").body().isEmpty());
    }

    @Test
    void hashbangIsSkipped() {
        Program program = AstBuilder.parse("#!/usr/bin/env node\nvar a;");
        assertEquals(1, program.body().size());
        assertEquals(2, program.body().get(0).loc().start().line());
    }

    @Test
    void sourceTypeIsRecorded() {
        assertEquals(SourceType.SCRIPT, AstBuilder.parse(";").sourceType());
        assertEquals(SourceType.MODULE, AstBuilder.parse(";", SourceType.MODULE).sourceType());
        assertEquals("module", AstBuilder.parse(";", SourceType.MODULE).fields().get("sourceType").toString());
    }

    @Test
    void sourceNameIsThreadedIntoLocations() {
        Program fromString = AstBuilder.parse("a;");
        assertEquals(JsSource.STRING_SOURCE_NAME, fromString.loc().source());
        assertEquals(JsSource.STRING_SOURCE_NAME, fromString.body().get(0).loc().source());

        Program named = AstBuilder.parse(JsSource.fromString("a;", "lib.js"), SourceType.SCRIPT);
        assertEquals("lib.js", named.body().get(0).loc().source());
        assertEquals("lib.js:1:0", named.body().get(0).loc().toString());

        Program unnamed = AstBuilder.buildAst(JsSource.fromString("a;").parse());
        assertNull(unnamed.loc().source());
    }

    @Test
    void locationsOfSingleLineDeclaration() {
        Program program = AstBuilder.buildAst(JsSource.fromString("var a = 1;").parse());
        assertEquals(new SourceLocation(new Position(1, 0), new Position(1, 10)), program.loc());

        VariableDeclaration declaration = (VariableDeclaration) program.body().get(0);
        assertEquals(new SourceLocation(new Position(1, 0), new Position(1, 10)), declaration.loc());

        VariableDeclarator declarator = declaration.declarations().get(0);
        assertEquals(new SourceLocation(new Position(1, 4), new Position(1, 9)), declarator.loc());
        assertEquals(new SourceLocation(new Position(1, 4), new Position(1, 5)), declarator.id().loc());
        assertEquals(new SourceLocation(new Position(1, 8), new Position(1, 9)), declarator.init().loc());
    }

    @Test
    void locationsAcrossLines() {
        Program program = AstBuilder.buildAst(JsSource.fromString("a;\n  b +\n c;").parse());
        assertEquals(2, program.body().size());
        ExpressionStatement second = (ExpressionStatement) program.body().get(1);
        assertEquals(new SourceLocation(new Position(2, 2), new Position(3, 3)), second.loc());
        Identifier c = (Identifier) ((BinaryExpression) ((SequenceExpression) second.expression())
            .expressions().get(0)).right();
        assertEquals(new SourceLocation(new Position(3, 1), new Position(3, 2)), c.loc());
    }

    @Test
    void multiLineStringEndsOnItsLastLine() {
        Program program = AstBuilder.buildAst(JsSource.fromString("'a\\\nbc'").parse());
        Literal literal = (Literal) ((SequenceExpression) ((ExpressionStatement) program.body().get(0))
            .expression()).expressions().get(0);
        assertEquals("abc", literal.value());
        assertEquals(new Position(2, 3), literal.loc().end());
    }

    @Test
    void statementEndingAtEofEndsAtEof() {
        Program program = AstBuilder.buildAst(JsSource.fromString("a").parse());
        assertEquals(new SourceLocation(new Position(1, 0), new Position(1, 1)), program.body().get(0).loc());
    }

    @Test
    void syntaxErrorsAreParseExceptions() {
        ParseException e = assertThrows(ParseException.class, () -> AstBuilder.parse("var = ;"));
        assertEquals(1, e.line());
    }

    @Test
    void programBuilderWithoutWalkHasNoResult() {
        ProgramBuilder builder = new ProgramBuilder(SourceType.SCRIPT, null);
        assertThrows(MissingResultException.class, builder::program);
    }

    @Test
    void builderInstanceIsReusable() {
        AstBuilder builder = new AstBuilder(SourceType.MODULE, "m.js");
        Program first = builder.build(JsSource.fromString("a;").parse());
        Program second = builder.build(JsSource.fromString("b;").parse());
        assertEquals(SourceType.MODULE, first.sourceType());
        assertEquals("m.js", second.loc().source());
        assertEquals("b", ((Identifier) ((SequenceExpression) ((ExpressionStatement) second.body().get(0))
            .expression()).expressions().get(0)).name());
    }
}
