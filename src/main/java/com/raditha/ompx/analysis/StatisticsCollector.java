package com.raditha.ompx.analysis;

import com.raditha.ompx.ast.BinaryOpcode;
import com.raditha.ompx.ast.BinaryOperation;
import com.raditha.ompx.ast.DeclRefExpr;
import com.raditha.ompx.ast.FloatingLiteral;
import com.raditha.ompx.ast.IntegerLiteral;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.model.Counter;
import com.raditha.ompx.model.OperatorStatistics;

import java.util.List;
import java.util.Optional;

/**
 * Counts operators, literals and name references over flattened node lists.
 * The same node may be counted more than once when it is reached from several
 * directives; the totals are a running measure, not a census.
 */
public class StatisticsCollector {

    public void collect(List<Node> nodes, OperatorStatistics statistics) {
        for (Node node : nodes) {
            if (node instanceof IntegerLiteral || node instanceof FloatingLiteral) {
                statistics.increment(Counter.CONSTANT);
            } else if (node instanceof BinaryOperation binary) {
                categorize(binary.getOpcode()).ifPresent(statistics::increment);
            } else if (node instanceof DeclRefExpr ref) {
                statistics.recordReference(ref.getName());
            }
        }
    }

    /**
     * Counter a binary operator falls into, empty for shifts, remainder,
     * member pointers and the comma operator.
     */
    public static Optional<Counter> categorize(BinaryOpcode opcode) {
        return switch (opcode) {
            case ADD -> Optional.of(Counter.ADD);
            case SUB -> Optional.of(Counter.SUB);
            case MUL -> Optional.of(Counter.MUL);
            case DIV -> Optional.of(Counter.DIV);
            case CMP, LT, GT, LE, GE, EQ, NE -> Optional.of(Counter.CMP);
            case AND, XOR, OR -> Optional.of(Counter.BIT);
            case LAND, LOR -> Optional.of(Counter.LOG);
            case ASSIGN -> Optional.of(Counter.ASSIGN);
            case MUL_ASSIGN, DIV_ASSIGN, REM_ASSIGN, ADD_ASSIGN, SUB_ASSIGN,
                    SHL_ASSIGN, SHR_ASSIGN, AND_ASSIGN, XOR_ASSIGN, OR_ASSIGN -> Optional.of(Counter.COMPOUND_ASSIGN);
            case PTR_MEM_D, PTR_MEM_I, REM, SHL, SHR, COMMA -> Optional.empty();
        };
    }
}
