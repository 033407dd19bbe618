package com.raditha.ompx.analysis;

import com.raditha.ompx.ast.MapType;
import com.raditha.ompx.ast.Node;
import com.raditha.ompx.ast.OmpClause;
import com.raditha.ompx.model.ClauseAccumulator;
import com.raditha.ompx.model.ClauseBucket;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns directive clauses into accumulator entries.
 */
public class ClauseResolver {

    private static final String OPERATOR_PREFIX = "operator";

    private final ExpressionPrinter printer;

    public ClauseResolver(ExpressionPrinter printer) {
        this.printer = printer;
    }

    /**
     * Apply one clause to the accumulator. Implicit clauses are ignored, and
     * list clauses replace whatever the bucket held before.
     */
    public void resolve(OmpClause clause, ClauseAccumulator clauses) {
        if (clause.isImplicit()) {
            return;
        }
        switch (clause.getKind()) {
            case IF, FINAL -> clauses.setFlag(ClauseBucket.MULTIVERSIONED, true);
            case COLLAPSE -> clauses.setScalar(ClauseBucket.COLLAPSE, clause.getOperands().isEmpty()
                    ? ""
                    : printer.print(clause.getOperands().get(0)));
            case ORDERED -> clauses.setFlag(ClauseBucket.ORDERED, true);
            case PRIVATE -> clauses.setList(ClauseBucket.PRIVATE, operands(clause, ""));
            case SHARED -> clauses.setList(ClauseBucket.SHARED, operands(clause, ""));
            case FIRSTPRIVATE -> clauses.setList(ClauseBucket.FIRSTPRIVATE, operands(clause, ""));
            case LASTPRIVATE -> clauses.setList(ClauseBucket.LASTPRIVATE, operands(clause, ""));
            case LINEAR -> clauses.setList(ClauseBucket.LINEAR, operands(clause, ""));
            case REDUCTION -> clauses.setList(ClauseBucket.REDUCTION, operands(clause, reductionPrefix(clause)));
            case MAP -> mapBucket(clause.getMapType())
                    .ifPresent(bucket -> clauses.setList(bucket, operands(clause, "")));
            case CAPTURE, WRITE, READ, UPDATE, OTHER -> {
                // no accumulator state
            }
        }
    }

    private List<String> operands(OmpClause clause, String prefix) {
        List<String> result = new ArrayList<>();
        for (Node operand : clause.getOperands()) {
            String text = printer.print(operand);
            if (!text.isEmpty()) {
                result.add(prefix + text);
            }
        }
        return result;
    }

    /**
     * Reduction operands are reported as {@code op:name}; C++ operator names
     * such as {@code operator+} lose their prefix.
     */
    static String reductionPrefix(OmpClause clause) {
        String operator = clause.getReductionOperator().orElse("");
        if (operator.startsWith(OPERATOR_PREFIX)) {
            operator = operator.substring(OPERATOR_PREFIX.length());
        }
        return operator + ":";
    }

    private static Optional<ClauseBucket> mapBucket(Optional<MapType> mapType) {
        return mapType.flatMap(type -> switch (type) {
            case TO -> Optional.of(ClauseBucket.MAP_TO);
            case FROM -> Optional.of(ClauseBucket.MAP_FROM);
            case TOFROM -> Optional.of(ClauseBucket.MAP_TOFROM);
            case ALLOC, DELETE, RELEASE -> Optional.<ClauseBucket>empty();
        });
    }
}
