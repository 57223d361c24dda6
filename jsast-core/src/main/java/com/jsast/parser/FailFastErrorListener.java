package com.jsast.parser;

import com.jsast.ParseException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Turns the first syntax error into a {@link ParseException}, aborting the parse.
 */
public final class FailFastErrorListener extends BaseErrorListener {

    public static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

    private FailFastErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        throw new ParseException(msg, line, charPositionInLine, e);
    }
}
