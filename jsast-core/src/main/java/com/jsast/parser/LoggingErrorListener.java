package com.jsast.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs syntax errors and lets the parser recover. The resulting parse tree may contain
 * error nodes.
 */
public class LoggingErrorListener extends BaseErrorListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorListener.class);

    private int errorCount;

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        errorCount++;
        log.debug("ANTLR syntax error at {}:{}: {}", line, charPositionInLine, msg);
    }

    public int errorCount() {
        return errorCount;
    }
}
