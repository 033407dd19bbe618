package com.raditha.ompx.analysis;

import com.raditha.ompx.ast.ArraySectionExpr;
import com.raditha.ompx.ast.ArraySubscriptExpr;
import com.raditha.ompx.ast.BinaryOpcode;
import com.raditha.ompx.ast.BinaryOperation;
import com.raditha.ompx.ast.CastExpr;
import com.raditha.ompx.ast.CompoundStmt;
import com.raditha.ompx.ast.ConstantExpr;
import com.raditha.ompx.ast.DeclRefExpr;
import com.raditha.ompx.ast.FloatingLiteral;
import com.raditha.ompx.ast.ForStmt;
import com.raditha.ompx.ast.IntegerLiteral;
import com.raditha.ompx.ast.UnaryOperation;
import com.raditha.ompx.ast.WhileStmt;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionPrinterTest {

    private final ExpressionPrinter printer = new ExpressionPrinter();

    private static DeclRefExpr ref(String name) {
        return new DeclRefExpr(null, name);
    }

    private static IntegerLiteral lit(long value) {
        return new IntegerLiteral(null, value);
    }

    @Test
    void testPrint_NamesAndLiterals() {
        assertEquals("alpha", printer.print(ref("alpha")));
        assertEquals("42", printer.print(lit(42)));
    }

    @Test
    void testPrint_Subscript() {
        ArraySubscriptExpr subscript = new ArraySubscriptExpr(null,
                new CastExpr(null, true, ref("a")),
                new CastExpr(null, true, ref("i")));
        assertEquals("a[i]", printer.print(subscript));
    }

    @Test
    void testPrint_ArraySection() {
        assertEquals("b[0:n]", printer.print(new ArraySectionExpr(null, ref("b"), lit(0), ref("n"))));
        assertEquals("b[:]", printer.print(new ArraySectionExpr(null, ref("b"), null, null)));
    }

    @Test
    void testPrint_WrappersPassThrough() {
        assertEquals("3", printer.print(new ConstantExpr(null, lit(3))));
        assertEquals("x", printer.print(new UnaryOperation(null, "-", false, ref("x"))));
        assertEquals("y", printer.print(new CastExpr(null, false, ref("y"))));
    }

    @Test
    void testPrint_UnsupportedExpressionsAreEmpty() {
        assertEquals("", printer.print(null));
        assertEquals("", printer.print(new BinaryOperation(null, BinaryOpcode.ADD, ref("a"), ref("b"))));
        assertEquals("", printer.print(new FloatingLiteral(null, "1.5")));
    }

    @Test
    void testInductionVariable_FromUnaryIncrement() {
        ForStmt loop = new ForStmt(null, null, null,
                new UnaryOperation(null, "++", true, ref("i")),
                new CompoundStmt(null, List.of()));
        assertEquals(Optional.of("i"), printer.inductionVariable(loop));
    }

    @Test
    void testInductionVariable_FromCompoundAssignment() {
        ForStmt loop = new ForStmt(null, null, null,
                new BinaryOperation(null, BinaryOpcode.ADD_ASSIGN, ref("k"), lit(2)),
                new CompoundStmt(null, List.of()));
        assertEquals(Optional.of("k"), printer.inductionVariable(loop));
    }

    @Test
    void testInductionVariable_AbsentForOtherLoops() {
        ForStmt noIncrement = new ForStmt(null, null, null, null, new CompoundStmt(null, List.of()));
        WhileStmt whileLoop = new WhileStmt(null, ref("go"), new CompoundStmt(null, List.of()));

        assertTrue(printer.inductionVariable(noIncrement).isEmpty());
        assertTrue(printer.inductionVariable(whileLoop).isEmpty());
    }
}
