package com.pipeduck.parser;

import com.pipeduck.parser.antlr.PPLLexer;
import com.pipeduck.parser.antlr.PPLParser;
import com.pipeduck.ppl.ast.PPLQuery;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsing PPL text into a {@link PPLQuery}.
 *
 * <p>Wraps the ANTLR4-generated parser with:
 * <ul>
 *   <li>SLL-first, LL-fallback two-phase parsing</li>
 *   <li>position-carrying errors via {@link PPLErrorListener}</li>
 *   <li>a ThreadLocal parser pool, so instances are never shared across threads</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 *   PPLQuery query = PPLSyntaxParser.getInstance().parse("source = orders | head 5");
 * </pre>
 */
public class PPLSyntaxParser {

    private static final Logger logger = LoggerFactory.getLogger(PPLSyntaxParser.class);

    private static final ThreadLocal<PPLSyntaxParser> PARSER_POOL =
        ThreadLocal.withInitial(PPLSyntaxParser::new);

    private final PPLLexer lexer;
    private final CommonTokenStream tokens;
    private final PPLParser parser;

    /**
     * Creates a new parser instance. Typically accessed via {@link #getInstance()}.
     */
    public PPLSyntaxParser() {
        this.lexer = new PPLLexer(new UpperCaseCharStream(CharStreams.fromString("")));
        this.lexer.removeErrorListeners();
        this.lexer.addErrorListener(new PPLErrorListener());
        this.tokens = new CommonTokenStream(lexer);
        this.parser = new PPLParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new PPLErrorListener());
    }

    /**
     * Returns the thread-local parser instance.
     */
    public static PPLSyntaxParser getInstance() {
        return PARSER_POOL.get();
    }

    /**
     * Parses a PPL pipeline.
     *
     * @param text the query text
     * @return the query AST
     * @throws PPLParseException if the text is not a valid pipeline
     */
    public PPLQuery parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PPLParseException(0, 0, "", "PPL query must not be null or empty");
        }

        logger.debug("Parsing PPL: {}", text);

        lexer.setInputStream(new UpperCaseCharStream(CharStreams.fromString(text)));
        tokens.setTokenSource(lexer);
        parser.setTokenStream(tokens);

        // Phase 1: SLL
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());

        PPLParser.SingleStatementContext tree;
        try {
            tree = parser.singleStatement();
        } catch (ParseCancellationException e) {
            // Phase 2: LL, reporting the first error through the listener
            logger.debug("SLL parse failed, falling back to LL mode");
            tokens.seek(0);
            parser.reset();
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.removeErrorListeners();
            parser.addErrorListener(new PPLErrorListener());
            parser.setErrorHandler(new DefaultErrorStrategy());

            tree = parser.singleStatement();
        }

        PPLQuery query = new PPLAstBuilder().visitSingleStatement(tree);
        logger.debug("Parsed PPL pipeline: {}", query.canonicalText());
        return query;
    }

    /**
     * Tests whether the given text parses without errors.
     */
    public boolean canParse(String text) {
        try {
            parse(text);
            return true;
        } catch (PPLParseException e) {
            return false;
        }
    }
}
