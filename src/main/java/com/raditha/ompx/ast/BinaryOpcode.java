package com.raditha.ompx.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * C/C++ binary operators, including the compound assignments.
 */
public enum BinaryOpcode {
    PTR_MEM_D(".*"),
    PTR_MEM_I("->*"),
    MUL("*"),
    DIV("/"),
    REM("%"),
    ADD("+"),
    SUB("-"),
    SHL("<<"),
    SHR(">>"),
    CMP("<=>"),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    EQ("=="),
    NE("!="),
    AND("&"),
    XOR("^"),
    OR("|"),
    LAND("&&"),
    LOR("||"),
    ASSIGN("="),
    MUL_ASSIGN("*="),
    DIV_ASSIGN("/="),
    REM_ASSIGN("%="),
    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    SHL_ASSIGN("<<="),
    SHR_ASSIGN(">>="),
    AND_ASSIGN("&="),
    XOR_ASSIGN("^="),
    OR_ASSIGN("|="),
    COMMA(",");

    private static final Map<String, BinaryOpcode> BY_SPELLING = Arrays.stream(values())
            .collect(Collectors.toMap(op -> op.spelling, Function.identity()));

    private final String spelling;

    BinaryOpcode(String spelling) {
        this.spelling = spelling;
    }

    public String spelling() {
        return spelling;
    }

    public static Optional<BinaryOpcode> fromSpelling(String spelling) {
        return Optional.ofNullable(BY_SPELLING.get(spelling));
    }
}
