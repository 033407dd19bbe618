package com.raditha.ompx.analysis;

import com.raditha.ompx.ast.ArraySectionExpr;
import com.raditha.ompx.ast.ArraySubscriptExpr;
import com.raditha.ompx.ast.BinaryOperation;
import com.raditha.ompx.ast.CastExpr;
import com.raditha.ompx.ast.ConstantExpr;
import com.raditha.ompx.ast.DeclRefExpr;
import com.raditha.ompx.ast.ForStmt;
import com.raditha.ompx.ast.IntegerLiteral;
import com.raditha.ompx.ast.LoopStmt;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.ast.UnaryOperation;

import java.util.Optional;

/**
 * Renders the small set of expressions that appear as clause operands back to
 * source-like text. Anything outside that set prints as the empty string.
 */
public class ExpressionPrinter {

    /**
     * Display string of an expression.
     *
     * @param expression the expression, may be {@code null}
     * @return the rendered text, never {@code null}
     */
    public String print(Node expression) {
        if (expression instanceof DeclRefExpr ref) {
            return ref.getName();
        }
        if (expression instanceof IntegerLiteral literal) {
            return literal.getValue().toString();
        }
        if (expression instanceof ArraySectionExpr section) {
            return print(section.getBase())
                    + "[" + section.getLowerBound().map(this::print).orElse("")
                    + ":" + section.getLength().map(this::print).orElse("") + "]";
        }
        if (expression instanceof ArraySubscriptExpr subscript) {
            return print(subscript.getBase()) + "[" + print(subscript.getIndex()) + "]";
        }
        if (expression instanceof ConstantExpr constant) {
            return print(constant.getOperand());
        }
        if (expression instanceof UnaryOperation unary) {
            return print(unary.getOperand());
        }
        if (expression instanceof CastExpr cast) {
            return print(cast.getOperand());
        }
        return "";
    }

    /**
     * Loop variable of a {@code for} loop, read off its increment expression:
     * the operand of {@code i++} or the left side of {@code i += 2}.
     *
     * @return the variable, empty for other loops or when nothing printable is found
     */
    public Optional<String> inductionVariable(LoopStmt loop) {
        if (!(loop instanceof ForStmt forStmt)) {
            return Optional.empty();
        }
        String variable = forStmt.getIncrement()
                .map(increment -> {
                    if (increment instanceof UnaryOperation unary) {
                        return print(unary);
                    }
                    if (increment instanceof BinaryOperation binary) {
                        return print(binary.getLhs());
                    }
                    return "";
                })
                .orElse("");
        return variable.isEmpty() ? Optional.empty() : Optional.of(variable);
    }
}
