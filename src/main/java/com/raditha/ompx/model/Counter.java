package com.raditha.ompx.model;

/**
 * The running operator and literal counters kept per source file.
 * Each constant carries the field name used in the report.
 */
public enum Counter {
    ADD("Addcount"),
    SUB("Subcount"),
    MUL("Mulcount"),
    DIV("Divcount"),
    CMP("Cmpcount"),
    BIT("Bitcount"),
    LOG("Logcount"),
    ASSIGN("Assigncount"),
    COMPOUND_ASSIGN("Combcount"),
    CONSTANT("Constcount");

    private final String fieldName;

    Counter(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
