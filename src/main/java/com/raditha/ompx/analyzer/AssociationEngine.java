package com.raditha.ompx.analyzer;

import com.raditha.ompx.analysis.ClauseResolver;
import com.raditha.ompx.analysis.DirectiveClassifier;
import com.raditha.ompx.analysis.ExpressionPrinter;
import com.raditha.ompx.analysis.StatisticsCollector;
import com.raditha.ompx.ast.DirectiveKind;
import com.raditha.ompx.ast.DirectiveStmt;
import com.raditha.ompx.ast.LoopStmt;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.ast.OmpClause;
import com.raditha.ompx.model.ClauseAccumulator;
import com.raditha.ompx.model.ClauseBucket;
import com.raditha.ompx.model.EntryKind;
import com.raditha.ompx.model.ReportEntry;
import com.raditha.ompx.model.SourceUnit;
import com.raditha.ompx.util.NodeFlattener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Associates directives with the loops they govern.
 * <p>
 * The accumulator passed to {@link #associate(DirectiveStmt, ClauseAccumulator)}
 * is shared by every recursive step started from the same directive. Clause
 * state set while visiting one nested directive is therefore still present
 * when a later sibling is visited.
 */
public class AssociationEngine {

    private static final Logger logger = LoggerFactory.getLogger(AssociationEngine.class);

    private final ExtractionContext context;
    private final EntryRecorder recorder;
    private final ClauseResolver clauseResolver;
    private final StatisticsCollector statistics;

    public AssociationEngine(ExtractionContext context) {
        ExpressionPrinter printer = new ExpressionPrinter();
        this.context = context;
        this.recorder = new EntryRecorder(context, printer);
        this.clauseResolver = new ClauseResolver(printer);
        this.statistics = new StatisticsCollector();
    }

    /**
     * Process a directive and everything nested in it.
     *
     * @param node    the directive
     * @param clauses clause state, mutated in place
     */
    public void associate(DirectiveStmt node, ClauseAccumulator clauses) {
        SourceUnit unit = context.currentUnit();

        // Step 1: flatten and count, even for directives seen before
        List<Node> nodes = NodeFlattener.flatten(node);
        statistics.collect(nodes, unit.getStatistics());

        if (!unit.markEmitted(node)) {
            return;
        }
        DirectiveKind kind = node.getKind();
        logger.debug("Associating {} with {} nested node(s)", node, nodes.size());

        // Step 2: region flags and sub-directive entries
        if (DirectiveClassifier.causesOffload(kind)) {
            clauses.setFlag(ClauseBucket.OFFLOAD, true);
        }
        if (kind == DirectiveKind.PARALLEL) {
            clauses.setFlag(ClauseBucket.PARALLEL, true);
        }
        if (kind == DirectiveKind.ORDERED) {
            recorder.recordSubDirective(node, EntryKind.ORDERED, clauses);
        }
        if (kind == DirectiveKind.ATOMIC) {
            recorder.recordSubDirective(node, atomicKind(node), clauses);
        }

        // Step 3: classification and clauses
        clauses.setScalar(ClauseBucket.PRAGMA_TYPE,
                DirectiveClassifier.classify(kind, clauses.contains(ClauseBucket.PARALLEL)));
        if (kind.isDataEnvironment()) {
            clauses.setFlag(ClauseBucket.OFFLOAD, false);
        }
        for (OmpClause clause : node.getClauses()) {
            clauseResolver.resolve(clause, clauses);
        }

        // Step 4: nested ordered and atomic constructs feed the dependence list
        for (Node nested : nodes) {
            if (nested != node && nested instanceof DirectiveStmt directive
                    && (directive.getKind() == DirectiveKind.ORDERED || directive.getKind() == DirectiveKind.ATOMIC)) {
                associate(directive, clauses);
            }
        }

        // Step 5: carry clause state into collapsed loops and nested regions
        if (clauses.contains(ClauseBucket.COLLAPSE)
                || clauses.contains(ClauseBucket.OFFLOAD)
                || clauses.contains(ClauseBucket.PARALLEL)
                || kind.isDataEnvironment()) {
            propagate(node, nodes, clauses);
        }

        // Step 6: the directive's own loop, unless collapse handling already emitted it
        if (kind.isLoopAssociated()) {
            recorder.recordLoop(node, clauses);
        }
    }

    private void propagate(DirectiveStmt node, List<Node> nodes, ClauseAccumulator clauses) {
        SourceUnit unit = context.currentUnit();
        if (clauses.contains(ClauseBucket.COLLAPSE)) {
            recorder.recordLoop(node, clauses);
            if (collapseCount(clauses).isEmpty()) {
                logger.warn("Ignoring non-numeric collapse count '{}' at {}",
                        clauses.getScalar(ClauseBucket.COLLAPSE).orElse(""), node);
            }
        }

        for (Node nested : nodes) {
            if (unit.isEmitted(nested)) {
                continue;
            }
            if (nested instanceof LoopStmt) {
                OptionalInt remaining = collapseCount(clauses);
                if (remaining.isPresent() && remaining.getAsInt() > 1) {
                    int count = remaining.getAsInt() - 1;
                    clauses.setScalar(ClauseBucket.COLLAPSE, String.valueOf(count));
                    recorder.recordLoop(nested, clauses);
                    if (count == 1) {
                        break;
                    }
                }
            }
            if (nested instanceof DirectiveStmt directive) {
                DirectiveKind nestedKind = directive.getKind();
                if (nestedKind.isLoopAssociated()
                        || nestedKind == DirectiveKind.PARALLEL
                        || nestedKind == DirectiveKind.TARGET) {
                    associate(directive, clauses);
                } else if (nestedKind == DirectiveKind.TARGET_DATA) {
                    associate(node, clauses);
                }
            }
        }
    }

    /**
     * Emit a loop that is not governed by any directive, after counting its subtree.
     * Nodes an enclosing plain loop already counted are not counted again.
     */
    public Optional<ReportEntry> emitPlainLoop(LoopStmt loop) {
        SourceUnit unit = context.currentUnit();
        if (unit.isEmitted(loop)) {
            return Optional.empty();
        }
        List<Node> uncounted = NodeFlattener.flatten(loop).stream()
                .filter(unit::markCounted)
                .toList();
        statistics.collect(uncounted, unit.getStatistics());
        return recorder.recordPlainLoop(loop);
    }

    static EntryKind atomicKind(DirectiveStmt atomic) {
        return atomic.getFirstClause()
                .map(clause -> switch (clause.getKind()) {
                    case CAPTURE -> EntryKind.ATOMIC_CAPTURE;
                    case WRITE -> EntryKind.ATOMIC_WRITE;
                    case READ -> EntryKind.ATOMIC_READ;
                    case UPDATE -> EntryKind.ATOMIC_UPDATE;
                    default -> EntryKind.ATOMIC;
                })
                .orElse(EntryKind.ATOMIC);
    }

    private static OptionalInt collapseCount(ClauseAccumulator clauses) {
        Optional<String> value = clauses.getScalar(ClauseBucket.COLLAPSE);
        if (value.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value.get().trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
