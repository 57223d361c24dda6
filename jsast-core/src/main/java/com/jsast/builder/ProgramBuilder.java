package com.jsast.builder;

import com.jsast.MissingResultException;
import com.jsast.ast.Program;
import com.jsast.ast.SourceType;
import com.jsast.parser.JavaScriptParser;
import com.jsast.parser.JavaScriptParserBaseListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parse-tree listener that builds the {@link Program} root when the walk enters the
 * {@code program} production. A leading hashbang line is accepted and skipped.
 */
public class ProgramBuilder extends JavaScriptParserBaseListener {

    private static final Logger log = LoggerFactory.getLogger(ProgramBuilder.class);

    private final SourceType sourceType;
    private final String source;
    private Program program;

    public ProgramBuilder(SourceType sourceType, String source) {
        this.sourceType = sourceType;
        this.source = source;
    }

    @Override
    public void enterProgram(JavaScriptParser.ProgramContext ctx) {
        log.debug("Building {} program{}", sourceType, source == null ? "" : " from " + source);
        if (ctx.HashBangLine() != null) {
            log.debug("Skipping hashbang line: {}", ctx.HashBangLine().getText());
        }
        program = new Program(
            SourceLocations.of(ctx, source),
            sourceType,
            new SourceElementsBuilder(source).build(ctx.sourceElements())
        );
    }

    /**
     * @throws MissingResultException if no {@code program} production has been walked yet
     */
    public Program program() {
        if (program == null) {
            throw new MissingResultException("Program node is not built yet, walk a parse tree first");
        }
        return program;
    }
}
