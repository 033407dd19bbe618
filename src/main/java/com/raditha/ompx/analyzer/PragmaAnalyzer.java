package com.raditha.ompx.analyzer;

import com.raditha.ompx.analysis.ExpressionPrinter;
import com.raditha.ompx.analysis.LoopIndexer;
import com.raditha.ompx.ast.CompoundStmt;
import com.raditha.ompx.ast.DirectiveStmt;
import com.raditha.ompx.ast.FunctionDecl;
import com.raditha.ompx.ast.LoopStmt;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.ast.TranslationUnit;
import com.raditha.ompx.model.ClauseAccumulator;
import com.raditha.ompx.model.SourceUnit;
import com.raditha.ompx.report.UnitReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main orchestrator for extraction.
 * Indexes each function, dispatches its directives to the association engine,
 * reports the loops no directive claimed and flushes the file reports.
 */
public class PragmaAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(PragmaAnalyzer.class);

    private final ExtractionContext context;
    private final AssociationEngine engine;
    private final LoopIndexer indexer;

    public PragmaAnalyzer(ExtractionContext context) {
        this.context = context;
        this.engine = new AssociationEngine(context);
        this.indexer = new LoopIndexer(new ExpressionPrinter(), context.getSnippetExtractor());
    }

    /**
     * Analyze one translation unit and flush every unit it opened.
     *
     * @param translationUnit the parsed translation unit
     * @return one report per source file touched, in flush order
     */
    public List<UnitReport> analyze(TranslationUnit translationUnit) {
        logger.info("Analyzing translation unit {}", translationUnit.mainFile());
        for (FunctionDecl function : translationUnit.functions()) {
            analyzeFunction(translationUnit, function);
        }
        return context.finish();
    }

    private void analyzeFunction(TranslationUnit translationUnit, FunctionDecl function) {
        if (function.getBody().isEmpty()) {
            return;
        }
        if (function.systemHeader() && context.getConfig().skipSystemHeaders()) {
            logger.debug("Skipping {} from system header {}", function.name(), function.filename());
            return;
        }
        String filename = function.filename() != null ? function.filename() : translationUnit.mainFile();
        SourceUnit unit = context.activate(filename, translationUnit.getBuffer(filename).orElse(null));

        CompoundStmt body = function.getBody().get();
        indexer.index(function, unit);
        visit(body);
    }

    /**
     * Pre-order walk over every node, wrappers included. Directives are
     * visited before the loops they contain, so a loop they claim is already
     * marked when the walk reaches it.
     */
    private void visit(Node node) {
        if (node.getSpan().isPresent()) {
            if (node instanceof DirectiveStmt directive) {
                logger.debug("Dispatching {}", directive);
                engine.associate(directive, new ClauseAccumulator());
            } else if (node instanceof LoopStmt loop) {
                engine.emitPlainLoop(loop);
            }
        }
        for (Node child : node.getChildren()) {
            visit(child);
        }
    }
}
