package com.raditha.ompx.analysis;

import com.raditha.ompx.ast.BinaryOpcode;
import com.raditha.ompx.ast.BinaryOperation;
import com.raditha.ompx.ast.DeclRefExpr;
import com.raditha.ompx.ast.FloatingLiteral;
import com.raditha.ompx.ast.IntegerLiteral;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.model.Counter;
import com.raditha.ompx.model.OperatorStatistics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsCollectorTest {

    private final StatisticsCollector collector = new StatisticsCollector();

    @Test
    void testCountsLiteralsOperatorsAndReferences() {
        DeclRefExpr x1 = new DeclRefExpr(null, "x");
        DeclRefExpr x2 = new DeclRefExpr(null, "x");
        DeclRefExpr y = new DeclRefExpr(null, "y");
        IntegerLiteral one = new IntegerLiteral(null, 1);
        FloatingLiteral half = new FloatingLiteral(null, "0.5");
        BinaryOperation add = new BinaryOperation(null, BinaryOpcode.ADD, x2, one);
        BinaryOperation assign = new BinaryOperation(null, BinaryOpcode.ASSIGN, x1, add);
        BinaryOperation scale = new BinaryOperation(null, BinaryOpcode.MUL_ASSIGN, y, half);

        OperatorStatistics statistics = new OperatorStatistics();
        List<Node> nodes = List.of(assign, x1, add, x2, one, scale, y, half);
        collector.collect(nodes, statistics);

        assertEquals(1, statistics.get(Counter.ADD));
        assertEquals(1, statistics.get(Counter.ASSIGN));
        assertEquals(1, statistics.get(Counter.COMPOUND_ASSIGN));
        assertEquals(2, statistics.get(Counter.CONSTANT));
        assertEquals(3, statistics.getTotalReferences());
        assertEquals(2, statistics.getDistinctReferences());
    }

    @Test
    void testCountersAccumulateAcrossCalls() {
        OperatorStatistics statistics = new OperatorStatistics();
        List<Node> nodes = List.of(new DeclRefExpr(null, "a"), new IntegerLiteral(null, 7));

        collector.collect(nodes, statistics);
        collector.collect(nodes, statistics);

        assertEquals(2, statistics.get(Counter.CONSTANT));
        assertEquals(2, statistics.getTotalReferences());
        assertEquals(1, statistics.getDistinctReferences());
    }

    @Test
    void testOperatorCategories() {
        assertEquals(Optional.of(Counter.CMP), StatisticsCollector.categorize(BinaryOpcode.CMP));
        assertEquals(Optional.of(Counter.CMP), StatisticsCollector.categorize(BinaryOpcode.NE));
        assertEquals(Optional.of(Counter.BIT), StatisticsCollector.categorize(BinaryOpcode.XOR));
        assertEquals(Optional.of(Counter.LOG), StatisticsCollector.categorize(BinaryOpcode.LOR));
        assertEquals(Optional.of(Counter.SUB), StatisticsCollector.categorize(BinaryOpcode.SUB));
        assertEquals(Optional.of(Counter.DIV), StatisticsCollector.categorize(BinaryOpcode.DIV));
        assertEquals(Optional.empty(), StatisticsCollector.categorize(BinaryOpcode.SHL));
        assertEquals(Optional.empty(), StatisticsCollector.categorize(BinaryOpcode.REM));
        assertEquals(Optional.empty(), StatisticsCollector.categorize(BinaryOpcode.COMMA));
    }

    @ParameterizedTest
    @EnumSource(value = BinaryOpcode.class, names = ".*_ASSIGN", mode = EnumSource.Mode.MATCH_ALL)
    void testEveryCompoundAssignmentIsCombined(BinaryOpcode opcode) {
        assertEquals(Optional.of(Counter.COMPOUND_ASSIGN), StatisticsCollector.categorize(opcode));
    }
}
