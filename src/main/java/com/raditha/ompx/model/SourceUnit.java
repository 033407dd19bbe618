package com.raditha.ompx.model;

import com.raditha.ompx.ast.LoopStmt;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.extraction.SourceBuffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything collected for one source file while its translation unit is
 * traversed: identities already emitted, loop numbering, statement positions,
 * running statistics and the entries waiting to be written.
 * <p>
 * All node-keyed maps use identity, never {@code equals}.
 */
public class SourceUnit {

    private final String filename;
    private final long objectId;
    private final SourceBuffer buffer;

    private final Set<Node> emitted = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Node> counted = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Node, String> functionNames = new IdentityHashMap<>();
    private final Map<String, Map<Node, LoopRecord>> functionLoops = new HashMap<>();
    private final Map<Node, Map<Node, Integer>> loopInstructionIds = new IdentityHashMap<>();
    private final Map<Node, StatementLocation> statementLocations = new IdentityHashMap<>();
    private final OperatorStatistics statistics = new OperatorStatistics();
    private final List<ReportEntry> entries = new ArrayList<>();

    /**
     * @param filename file name exactly as the front end reported it
     * @param objectId id reserved for the file scope itself
     * @param buffer   raw text of the file, or {@code null} when it could not be read
     */
    public SourceUnit(String filename, long objectId, SourceBuffer buffer) {
        this.filename = filename;
        this.objectId = objectId;
        this.buffer = buffer;
    }

    public String getFilename() {
        return filename;
    }

    public long getObjectId() {
        return objectId;
    }

    public Optional<SourceBuffer> getBuffer() {
        return Optional.ofNullable(buffer);
    }

    /**
     * Mark a node as processed.
     *
     * @return false if the node had already been marked
     */
    public boolean markEmitted(Node node) {
        return emitted.add(node);
    }

    public boolean isEmitted(Node node) {
        return emitted.contains(node);
    }

    /**
     * Mark a node as folded into the running statistics by a plain loop.
     *
     * @return false if an enclosing plain loop already counted it
     */
    public boolean markCounted(Node node) {
        return counted.add(node);
    }

    public void setFunctionName(Node node, String functionName) {
        functionNames.put(node, functionName);
    }

    public Optional<String> getFunctionName(Node node) {
        return Optional.ofNullable(functionNames.get(node));
    }

    public void putLoop(LoopRecord loop) {
        functionLoops.computeIfAbsent(loop.functionName(), k -> new IdentityHashMap<>())
                .put(loop.loop(), loop);
    }

    /**
     * Loop record of a loop node, looked up in the loop table of its enclosing function.
     */
    public Optional<LoopRecord> getLoop(LoopStmt loop) {
        return getFunctionName(loop)
                .map(functionLoops::get)
                .map(loops -> loops.get(loop));
    }

    /**
     * Loops of one function ordered by id.
     */
    public List<LoopRecord> getLoops(String functionName) {
        Map<Node, LoopRecord> loops = functionLoops.getOrDefault(functionName, Map.of());
        return loops.values().stream()
                .sorted((a, b) -> Integer.compare(a.loopId(), b.loopId()))
                .toList();
    }

    public void putInstructionId(LoopStmt loop, Node statement, int instructionId) {
        loopInstructionIds.computeIfAbsent(loop, k -> new IdentityHashMap<>()).put(statement, instructionId);
    }

    public Map<Node, Integer> getInstructionIds(LoopStmt loop) {
        return Collections.unmodifiableMap(loopInstructionIds.getOrDefault(loop, Map.of()));
    }

    public void setStatementLocation(Node node, StatementLocation location) {
        statementLocations.put(node, location);
    }

    public Optional<StatementLocation> getStatementLocation(Node node) {
        return Optional.ofNullable(statementLocations.get(node));
    }

    public OperatorStatistics getStatistics() {
        return statistics;
    }

    public void addEntry(ReportEntry entry) {
        entries.add(entry);
    }

    public List<ReportEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public String toString() {
        return filename + " (object " + objectId + ", " + entries.size() + " entries)";
    }
}
