package com.jsast.parser;

import com.jsast.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class JsSourceTest {

    @Test
    void stringSourcesHaveDefaultName() {
        assertEquals(JsSource.STRING_SOURCE_NAME, JsSource.fromString("a;").name());
        assertEquals("x.js", JsSource.fromString("a;", "x.js").name());
    }

    @Test
    void parsesProgram() {
        JavaScriptParser.ProgramContext tree = JsSource.fromString("var a = 1; b;").parse();
        assertEquals(2, tree.sourceElements().sourceElement().size());
        assertNotNull(tree.sourceElements().sourceElement(0).statement().variableStatement());
    }

    @Test
    void sourceCanBeParsedAgain() {
        JsSource source = JsSource.fromString("a; b;");
        assertEquals(source.parse().getText(), source.parse().getText());
    }

    @Test
    void firstSyntaxErrorFails() {
        ParseException e = assertThrows(ParseException.class, () -> JsSource.fromString("a;\nvar = ;").parse());
        assertEquals(2, e.line());
        assertTrue(e.getMessage().contains(" at 2:"), e.getMessage());
    }

    @Test
    void loggingListenerLetsParserRecover() {
        LoggingErrorListener listener = new LoggingErrorListener();
        JavaScriptParser.ProgramContext tree = JsSource.fromString("var = ;").withErrorListener(listener).parse();
        assertNotNull(tree);
        assertTrue(listener.errorCount() > 0);
    }

    @Test
    void loggingListenerCountsNothingForValidInput() {
        LoggingErrorListener listener = new LoggingErrorListener();
        JsSource.fromString("var a = [1, 2];").withErrorListener(listener).parse();
        assertEquals(0, listener.errorCount());
    }

    @Test
    void readsFiles(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("input.js");
        Files.writeString(file, "let été = 'café';\n", StandardCharsets.UTF_8);
        JsSource source = JsSource.fromPath(file);
        assertEquals(file.toString(), source.name());
        JavaScriptParser.ProgramContext tree = source.parse();
        assertEquals("letété='café';<EOF>", tree.getText());
    }

    @Test
    void automaticSemicolonInsertionOnLineBreak() {
        JavaScriptParser.ProgramContext tree = JsSource.fromString("a\nb").parse();
        assertEquals(2, tree.sourceElements().sourceElement().size());
    }

    @Test
    void noSemicolonInsertionWithinLine() {
        assertThrows(ParseException.class, () -> JsSource.fromString("a b").parse());
    }

    @Test
    void slashAfterOperandIsDivision() {
        JavaScriptParser.ProgramContext tree = JsSource.fromString("a / b / c").parse();
        JavaScriptParser.ExpressionStatementContext statement =
            tree.sourceElements().sourceElement(0).statement().expressionStatement();
        assertInstanceOf(JavaScriptParser.MultiplicativeExpressionContext.class,
            statement.expressionSequence().singleExpression(0));
    }

    @Test
    void slashAtExpressionStartIsRegularExpression() {
        JavaScriptParser.ProgramContext tree = JsSource.fromString("x = /a+/g").parse();
        JavaScriptParser.AssignmentExpressionContext assignment = (JavaScriptParser.AssignmentExpressionContext)
            tree.sourceElements().sourceElement(0).statement().expressionStatement().expressionSequence().singleExpression(0);
        JavaScriptParser.LiteralExpressionContext literal =
            (JavaScriptParser.LiteralExpressionContext) assignment.singleExpression(1);
        assertNotNull(literal.literal().RegularExpressionLiteral());
    }
}
