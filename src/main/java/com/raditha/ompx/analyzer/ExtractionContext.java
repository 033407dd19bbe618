package com.raditha.ompx.analyzer;

import com.raditha.ompx.config.ExtractorConfig;
import com.raditha.ompx.extraction.SnippetExtractor;
import com.raditha.ompx.extraction.SourceBuffer;
import com.raditha.ompx.model.SourceUnit;
import com.raditha.ompx.report.ReportEmitter;
import com.raditha.ompx.report.UnitReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * State of one extraction run: the object id counter and the stack of open
 * source units. One context may serve several translation units. Not thread-safe.
 */
public class ExtractionContext {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionContext.class);

    private final ExtractorConfig config;
    private final ReportEmitter emitter;
    private final SnippetExtractor snippetExtractor;
    private final Deque<SourceUnit> activeUnits = new ArrayDeque<>();
    private long objectIdCounter;

    public ExtractionContext(ExtractorConfig config, ReportEmitter emitter) {
        this.config = config;
        this.emitter = emitter;
        this.snippetExtractor = new SnippetExtractor(config.codeSnippets());
    }

    public ExtractionContext(ExtractorConfig config) {
        this(config, new ReportEmitter(config.outputDirectory(), config.sourceRoot()));
    }

    public ExtractorConfig getConfig() {
        return config;
    }

    public SnippetExtractor getSnippetExtractor() {
        return snippetExtractor;
    }

    /**
     * Next id of the run. Ids are never reused.
     */
    public long nextObjectId() {
        return objectIdCounter++;
    }

    /**
     * Make the unit of a file the current one, opening it if needed.
     * An already open unit is moved to the top of the stack.
     *
     * @param filename file name as given by the front end
     * @param buffer   raw text of the file, {@code null} if unavailable
     * @return the current unit
     */
    public SourceUnit activate(String filename, SourceBuffer buffer) {
        SourceUnit top = activeUnits.peek();
        if (top != null && top.getFilename().equals(filename)) {
            return top;
        }
        Iterator<SourceUnit> it = activeUnits.iterator();
        while (it.hasNext()) {
            SourceUnit unit = it.next();
            if (unit.getFilename().equals(filename)) {
                it.remove();
                activeUnits.push(unit);
                return unit;
            }
        }
        SourceUnit unit = new SourceUnit(filename, nextObjectId(), buffer);
        activeUnits.push(unit);
        logger.info("Opened {}", unit);
        return unit;
    }

    /**
     * The unit on top of the stack.
     *
     * @throws IllegalStateException if no unit is open
     */
    public SourceUnit currentUnit() {
        SourceUnit unit = activeUnits.peek();
        if (unit == null) {
            throw new IllegalStateException("No source unit is active");
        }
        return unit;
    }

    public boolean hasActiveUnit() {
        return !activeUnits.isEmpty();
    }

    /**
     * Pop and flush every open unit, top first.
     *
     * @return one report per unit, in flush order
     */
    public List<UnitReport> finish() {
        List<UnitReport> reports = new ArrayList<>();
        while (hasActiveUnit()) {
            SourceUnit unit = activeUnits.pop();
            reports.add(emitter.flush(unit));
        }
        return reports;
    }
}
