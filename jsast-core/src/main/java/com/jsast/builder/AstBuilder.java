package com.jsast.builder;

import com.jsast.ast.Program;
import com.jsast.ast.SourceType;
import com.jsast.parser.JavaScriptParser;
import com.jsast.parser.JsSource;
import org.antlr.v4.runtime.tree.ParseTreeWalker;

/**
 * Converts a JavaScript parse tree into an ESTree {@link Program}.
 *
 * <p>The walk is fail-fast: the first {@link com.jsast.UnsupportedFeatureException},
 * {@link com.jsast.InvalidPositionException} or {@link com.jsast.ParseException}
 * aborts it and no partial tree is returned.</p>
 *
 * <pre>{@code
 * Program program = AstBuilder.parse("var a = 1 + 2;");
 * System.out.println(AsciiTreePrinter.render(program, Mode.SHORT));
 * }</pre>
 */
public final class AstBuilder {

    private final SourceType sourceType;
    private final String sourceName;

    public AstBuilder() {
        this(SourceType.SCRIPT, null);
    }

    public AstBuilder(SourceType sourceType) {
        this(sourceType, null);
    }

    /**
     * @param sourceName name stored in every {@code SourceLocation.source}, or {@code null}
     */
    public AstBuilder(SourceType sourceType, String sourceName) {
        this.sourceType = sourceType;
        this.sourceName = sourceName;
    }

    public Program build(JavaScriptParser.ProgramContext tree) {
        ProgramBuilder builder = new ProgramBuilder(sourceType, sourceName);
        ParseTreeWalker.DEFAULT.walk(builder, tree);
        return builder.program();
    }

    public static Program buildAst(JavaScriptParser.ProgramContext tree) {
        return buildAst(tree, SourceType.SCRIPT);
    }

    public static Program buildAst(JavaScriptParser.ProgramContext tree, SourceType sourceType) {
        return new AstBuilder(sourceType).build(tree);
    }

    public static Program parse(String code) {
        return parse(code, SourceType.SCRIPT);
    }

    /**
     * Parses and converts {@code code}. Locations are attributed to
     * {@value JsSource#STRING_SOURCE_NAME}.
     */
    public static Program parse(String code, SourceType sourceType) {
        JsSource source = JsSource.fromString(code);
        return new AstBuilder(sourceType, source.name()).build(source.parse());
    }

    public static Program parse(JsSource source, SourceType sourceType) {
        return new AstBuilder(sourceType, source.name()).build(source.parse());
    }
}
