package com.jsast.parser;

import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * JavaScript source text together with its name, ready to be parsed into an ANTLR
 * parse tree.
 *
 * <p>By default the first syntax error aborts parsing with a
 * {@link com.jsast.ParseException}. Use {@link #withErrorListener} to install another
 * policy, e.g. {@link LoggingErrorListener}.</p>
 */
public final class JsSource {

    private static final Logger log = LoggerFactory.getLogger(JsSource.class);

    public static final String STRING_SOURCE_NAME = "<string>";
    public static final String STDIN_SOURCE_NAME = "<stdin>";

    private final String name;
    private final CharStream chars;
    private final ANTLRErrorListener errorListener;

    private JsSource(String name, CharStream chars, ANTLRErrorListener errorListener) {
        this.name = name;
        this.chars = chars;
        this.errorListener = errorListener;
    }

    public static JsSource fromString(String code) {
        return fromString(code, STRING_SOURCE_NAME);
    }

    public static JsSource fromString(String code, String name) {
        return new JsSource(name, CharStreams.fromString(code, name), FailFastErrorListener.INSTANCE);
    }

    public static JsSource fromPath(Path path) throws IOException {
        return new JsSource(path.toString(), CharStreams.fromPath(path, StandardCharsets.UTF_8),
            FailFastErrorListener.INSTANCE);
    }

    public static JsSource fromStdin() throws IOException {
        return new JsSource(STDIN_SOURCE_NAME, CharStreams.fromStream(System.in, StandardCharsets.UTF_8),
            FailFastErrorListener.INSTANCE);
    }

    public JsSource withErrorListener(ANTLRErrorListener listener) {
        return new JsSource(name, chars, listener);
    }

    public String name() {
        return name;
    }

    /**
     * Lexes and parses the whole source.
     *
     * @return the root of the parse tree
     * @throws com.jsast.ParseException on the first syntax error, with the default error policy
     */
    public JavaScriptParser.ProgramContext parse() {
        log.debug("Parsing {}", name);
        chars.seek(0);
        JavaScriptLexer lexer = new JavaScriptLexer(chars);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        JavaScriptParser parser = new JavaScriptParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);
        return parser.program();
    }
}
