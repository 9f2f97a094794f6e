package com.pipeduck;

import com.pipeduck.analyzer.PPLAnalyzer;
import com.pipeduck.catalog.Catalog;
import com.pipeduck.config.AnalyzerOptions;
import com.pipeduck.generator.SQLGenerator;
import com.pipeduck.logical.LogicalPlan;
import com.pipeduck.parser.PPLSyntaxParser;
import com.pipeduck.ppl.ast.PPLQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compiles PPL text into a logical plan, and optionally into Spark SQL.
 *
 * <pre>
 *   PPLCompiler compiler = new PPLCompiler(catalog);
 *   LogicalPlan plan = compiler.compile(
 *       "source = orders | where status = 'open' | stats count() as n by region | sort - n | head 5");
 *   String sql = compiler.toSQL("source = orders | fields region, status");
 * </pre>
 *
 * <p>Thread-safe when the catalog is: parsing uses a per-thread parser and analysis keeps
 * no state between calls.
 */
public class PPLCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PPLCompiler.class);

    private final PPLAnalyzer analyzer;

    public PPLCompiler(Catalog catalog) {
        this(catalog, AnalyzerOptions.fromSystemProperties());
    }

    public PPLCompiler(Catalog catalog, AnalyzerOptions options) {
        this.analyzer = new PPLAnalyzer(Objects.requireNonNull(catalog, "catalog must not be null"), options);
    }

    /**
     * Parses PPL text without analyzing it.
     *
     * @throws com.pipeduck.parser.PPLParseException if the text is not valid PPL
     */
    public PPLQuery parse(String text) {
        return PPLSyntaxParser.getInstance().parse(text);
    }

    /**
     * Parses and analyzes PPL text.
     *
     * @throws com.pipeduck.parser.PPLParseException if the text is not valid PPL
     * @throws com.pipeduck.exception.AnalysisException if the pipeline does not resolve
     * @throws com.pipeduck.exception.UnsupportedConstructException for constructs without
     *         implemented semantics
     */
    public LogicalPlan compile(String text) {
        return analyzer.analyze(parse(text));
    }

    /**
     * Compiles PPL text and renders the plan as Spark SQL.
     */
    public String toSQL(String text) {
        LogicalPlan plan = compile(text);
        String sql = new SQLGenerator().generate(plan);
        logger.debug("Compiled PPL '{}' to SQL: {}", text, sql);
        return sql;
    }
}
