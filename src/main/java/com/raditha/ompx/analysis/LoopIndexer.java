package com.raditha.ompx.analysis;

import com.raditha.ompx.ast.CompoundStmt;
import com.raditha.ompx.ast.FunctionDecl;
import com.raditha.ompx.ast.LoopStmt;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.extraction.SnippetExtractor;
import com.raditha.ompx.extraction.SourceBuffer;
import com.raditha.ompx.model.LoopRecord;
import com.raditha.ompx.model.SourceSpan;
import com.raditha.ompx.model.SourceUnit;
import com.raditha.ompx.model.StatementLocation;
import com.raditha.ompx.util.NodeFlattener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Numbers the loops of a function and the statements inside each loop body.
 * <p>
 * Loop ids follow source line order. Statement ids are positions relative to
 * the {@code ;} separators found in the raw text of the loop body, which keeps
 * them stable when the same loop is extracted from two versions of a program.
 */
public class LoopIndexer {

    private static final Logger logger = LoggerFactory.getLogger(LoopIndexer.class);

    private final ExpressionPrinter printer;
    private final SnippetExtractor extractor;

    public LoopIndexer(ExpressionPrinter printer, SnippetExtractor extractor) {
        this.printer = printer;
        this.extractor = extractor;
    }

    /**
     * A statement separator position in absolute source coordinates.
     */
    record Checkpoint(int line, int column) {
    }

    /**
     * Index one function into its source unit.
     *
     * @param function function with a body
     * @param unit     the unit of the file the function belongs to
     * @return the loops indexed, in id order
     */
    public List<LoopRecord> index(FunctionDecl function, SourceUnit unit) {
        Optional<CompoundStmt> body = function.getBody();
        if (body.isEmpty()) {
            return List.of();
        }
        String functionName = function.name();

        // Step 1: remember the enclosing function of every node and collect loops by line
        TreeMap<Integer, LoopStmt> loopsByLine = new TreeMap<>();
        for (Node node : NodeFlattener.flatten(body.get())) {
            unit.setFunctionName(node, functionName);
            if (node instanceof LoopStmt loop) {
                loop.getSpan().ifPresent(span -> loopsByLine.put(span.startLine(), loop));
            }
        }

        // Step 2: number loops in line order and number the statements of each body
        List<LoopRecord> records = new ArrayList<>();
        int loopId = 1;
        for (Map.Entry<Integer, LoopStmt> entry : loopsByLine.entrySet()) {
            LoopStmt loop = entry.getValue();
            LoopRecord loopRecord = new LoopRecord(
                    loop,
                    functionName,
                    loopId,
                    loop.getSpan().orElseThrow(),
                    printer.inductionVariable(loop));
            unit.putLoop(loopRecord);
            records.add(loopRecord);
            indexStatements(loopRecord, unit);
            loopId++;
        }
        logger.debug("Indexed {} loop(s) in {}", records.size(), functionName);
        return records;
    }

    private void indexStatements(LoopRecord loopRecord, SourceUnit unit) {
        Node body = loopRecord.loop().getBody();
        if (body == null || body.getSpan().isEmpty()) {
            return;
        }
        Optional<SourceBuffer> buffer = unit.getBuffer();
        if (buffer.isEmpty()) {
            return;
        }
        SourceSpan bodySpan = body.getSpan().get();
        Optional<String> text = extractor.extract(buffer.get(), bodySpan, true);
        if (text.isEmpty()) {
            return;
        }
        List<Checkpoint> checkpoints = checkpoints(text.get(), bodySpan.startLine(), bodySpan.startColumn());

        for (Node node : NodeFlattener.flatten(body)) {
            Optional<SourceSpan> span = node.getSpan();
            if (span.isEmpty()) {
                continue;
            }
            int statementId = statementId(checkpoints, span.get());
            unit.putInstructionId(loopRecord.loop(), node, statementId);
            unit.setStatementLocation(node, new StatementLocation(
                    unit.getFilename(),
                    loopRecord.functionName(),
                    loopRecord.loopId(),
                    statementId));
        }
    }

    /**
     * Positions of every {@code ;} in the text, plus the position of the last
     * character when the text does not end in a separator.
     *
     * @param text        raw text starting at the given position
     * @param startLine   line of the first character
     * @param startColumn column of the first character
     */
    static List<Checkpoint> checkpoints(String text, int startLine, int startColumn) {
        List<Checkpoint> checkpoints = new ArrayList<>();
        int line = startLine;
        int column = startColumn;
        int lastLine = line;
        int lastColumn = column;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ';') {
                checkpoints.add(new Checkpoint(line, column));
            }
            lastLine = line;
            lastColumn = column;
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        if (!text.stripTrailing().endsWith(";")) {
            checkpoints.add(new Checkpoint(lastLine, lastColumn));
        }
        return checkpoints;
    }

    /**
     * 1-based rank of the first checkpoint at or after the end of the span;
     * the number of checkpoints when the span ends after all of them.
     */
    static int statementId(List<Checkpoint> checkpoints, SourceSpan span) {
        for (int j = 0; j < checkpoints.size(); j++) {
            Checkpoint checkpoint = checkpoints.get(j);
            if (checkpoint.line() > span.endLine()
                    || (checkpoint.line() == span.endLine() && checkpoint.column() >= span.endColumn())) {
                return j + 1;
            }
        }
        return checkpoints.size();
    }
}
