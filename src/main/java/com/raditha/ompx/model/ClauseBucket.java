package com.raditha.ompx.model;

/**
 * Named slots of the clause accumulator. The label is the key used in the
 * report for the buckets that are written out.
 */
public enum ClauseBucket {
    PRAGMA_TYPE("pragma type"),
    PARALLEL("parallel"),
    OFFLOAD("offload"),
    ORDERED("ordered"),
    MULTIVERSIONED("multiversioned"),
    COLLAPSE("collapse"),
    SHARED("shared"),
    PRIVATE("private"),
    FIRSTPRIVATE("firstprivate"),
    LASTPRIVATE("lastprivate"),
    LINEAR("linear"),
    REDUCTION("reduction"),
    MAP_TO("map to"),
    MAP_FROM("map from"),
    MAP_TOFROM("map tofrom"),
    DEPENDENCE_LIST("dependence list");

    private final String label;

    ClauseBucket(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
