package com.raditha.ompx.analyzer;

import com.raditha.ompx.analysis.DirectiveClassifier;
import com.raditha.ompx.analysis.ExpressionPrinter;
import com.raditha.ompx.ast.DirectiveStmt;
import com.raditha.ompx.ast.LoopStmt;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.extraction.SnippetExtractor;
import com.raditha.ompx.model.ClauseAccumulator;
import com.raditha.ompx.model.ClauseBucket;
import com.raditha.ompx.model.Counter;
import com.raditha.ompx.model.EntryKind;
import com.raditha.ompx.model.LoopRecord;
import com.raditha.ompx.model.OperatorStatistics;
import com.raditha.ompx.model.ReportEntry;
import com.raditha.ompx.model.SourceSpan;
import com.raditha.ompx.model.SourceUnit;
import com.raditha.ompx.model.StatementLocation;
import com.raditha.ompx.util.NodeFlattener;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds report entries and appends them to the current source unit.
 * Every method answers whether the node was processed: an empty result means
 * nothing was emitted.
 */
public class EntryRecorder {

    public static final String NULL_PRAGMA = "NULL";

    private static final List<ClauseBucket> LIST_BUCKETS = List.of(
            ClauseBucket.SHARED,
            ClauseBucket.PRIVATE,
            ClauseBucket.FIRSTPRIVATE,
            ClauseBucket.LASTPRIVATE,
            ClauseBucket.LINEAR,
            ClauseBucket.REDUCTION,
            ClauseBucket.MAP_TO,
            ClauseBucket.MAP_FROM,
            ClauseBucket.MAP_TOFROM,
            ClauseBucket.DEPENDENCE_LIST);

    private final ExtractionContext context;
    private final ExpressionPrinter printer;

    public EntryRecorder(ExtractionContext context, ExpressionPrinter printer) {
        this.context = context;
        this.printer = printer;
    }

    /**
     * Emit the loop governed by a statement.
     * <p>
     * A directive stands for the loop it captures; its pragma type is classified
     * again for the entry. Any other statement must itself be a loop and is
     * reported with the accumulator's pragma type as is.
     *
     * @param statement a loop-associated directive or a loop
     * @param clauses   clause state; the entry gets a copy
     * @return the entry, empty when there is no loop, it has no span or it was
     *         already emitted
     */
    public Optional<ReportEntry> recordLoop(Node statement, ClauseAccumulator clauses) {
        Node target = NodeFlattener.innermostCaptured(statement).orElse(null);
        if (!(target instanceof LoopStmt loop)) {
            return Optional.empty();
        }
        Optional<SourceSpan> span = loop.getSpan();
        SourceUnit unit = context.currentUnit();
        if (span.isEmpty() || !unit.markEmitted(loop)) {
            return Optional.empty();
        }

        ClauseAccumulator snapshot = clauses.snapshot();
        if (statement instanceof DirectiveStmt directive) {
            snapshot.setScalar(ClauseBucket.PRAGMA_TYPE,
                    DirectiveClassifier.classify(directive.getKind(), snapshot.contains(ClauseBucket.PARALLEL)));
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("file", unit.getFilename());
        unit.getFunctionName(loop).ifPresent(name -> fields.put("function", name));
        unit.getLoop(loop).map(LoopRecord::loopId).ifPresent(id -> fields.put("loop id", String.valueOf(id)));
        fields.put("loop line", String.valueOf(span.get().startLine()));
        fields.put("loop column", String.valueOf(span.get().startColumn()));
        fields.put(ClauseBucket.PRAGMA_TYPE.label(), snapshot.getScalar(ClauseBucket.PRAGMA_TYPE).orElse(""));

        OperatorStatistics statistics = unit.getStatistics();
        for (Counter counter : Counter.values()) {
            fields.put(counter.fieldName(), String.valueOf(statistics.get(counter)));
        }
        fields.put("DediDeclRefcount", String.valueOf(statistics.getDistinctReferences()));
        fields.put("TotalDeclRefcount", String.valueOf(statistics.getTotalReferences()));

        fields.put(ClauseBucket.ORDERED.label(), String.valueOf(snapshot.isTrue(ClauseBucket.ORDERED)));
        fields.put(ClauseBucket.OFFLOAD.label(), String.valueOf(snapshot.isTrue(ClauseBucket.OFFLOAD)));
        fields.put(ClauseBucket.MULTIVERSIONED.label(), String.valueOf(snapshot.isTrue(ClauseBucket.MULTIVERSIONED)));

        snapshot.getScalar(ClauseBucket.COLLAPSE).ifPresent(count -> fields.put(ClauseBucket.COLLAPSE.label(), count));
        printer.inductionVariable(loop).ifPresent(variable -> fields.put("induction variable", variable));
        for (ClauseBucket bucket : LIST_BUCKETS) {
            List<String> values = snapshot.getList(bucket);
            if (!values.isEmpty()) {
                fields.put(bucket.label(), List.copyOf(values));
            }
        }
        snippet(unit, loop.getBody()).ifPresent(lines -> fields.put("code snippet", lines));

        return Optional.of(add(unit, EntryKind.LOOP, fields));
    }

    /**
     * Emit a loop that no directive claimed.
     */
    public Optional<ReportEntry> recordPlainLoop(LoopStmt loop) {
        ClauseAccumulator clauses = new ClauseAccumulator();
        clauses.setScalar(ClauseBucket.PRAGMA_TYPE, NULL_PRAGMA);
        return recordLoop(loop, clauses);
    }

    /**
     * Emit an {@code ordered} or {@code atomic} entry and list it in the
     * accumulator's dependence list.
     *
     * @param directive the ordered or atomic directive
     * @param kind      entry kind, also used as pragma type
     * @param clauses   accumulator receiving the dependence
     * @return the entry, empty when the directive has no span
     */
    public Optional<ReportEntry> recordSubDirective(DirectiveStmt directive, EntryKind kind, ClauseAccumulator clauses) {
        Optional<SourceSpan> span = directive.getSpan();
        if (span.isEmpty()) {
            return Optional.empty();
        }
        SourceUnit unit = context.currentUnit();
        Optional<StatementLocation> location = unit.getStatementLocation(directive);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ClauseBucket.PRAGMA_TYPE.label(), kind.label());
        fields.put("file", location.map(StatementLocation::filename).orElse(unit.getFilename()));
        location.map(StatementLocation::functionName)
                .or(() -> unit.getFunctionName(directive))
                .ifPresent(name -> fields.put("function", name));
        location.ifPresent(l -> {
            fields.put("loop id", String.valueOf(l.loopId()));
            fields.put("statement id", String.valueOf(l.statementId()));
        });
        fields.put("snippet line", String.valueOf(span.get().startLine()));
        fields.put("snippet column", String.valueOf(span.get().startColumn()));
        snippet(unit, directive.getInnermostCapturedStmt().orElse(null))
                .ifPresent(lines -> fields.put("code snippet", lines));

        ReportEntry entry = add(unit, kind, fields);
        clauses.append(ClauseBucket.DEPENDENCE_LIST, entry.key());
        return Optional.of(entry);
    }

    private Optional<List<String>> snippet(SourceUnit unit, Node node) {
        if (node == null || node.getSpan().isEmpty() || unit.getBuffer().isEmpty()) {
            return Optional.empty();
        }
        SnippetExtractor extractor = context.getSnippetExtractor();
        List<String> lines = extractor.snippetLines(unit.getBuffer().get(), node.getSpan().get());
        return lines.isEmpty() ? Optional.empty() : Optional.of(lines);
    }

    private ReportEntry add(SourceUnit unit, EntryKind kind, Map<String, Object> fields) {
        ReportEntry entry = new ReportEntry(context.nextObjectId(), kind, fields);
        unit.addEntry(entry);
        return entry;
    }
}
