package com.raditha.ompx.model;

/**
 * Kinds of report entries. The label prefixes the entry key and doubles as the
 * pragma type of sub-directive entries.
 */
public enum EntryKind {
    LOOP("loop"),
    ORDERED("ordered"),
    ATOMIC_CAPTURE("atomic capture"),
    ATOMIC_WRITE("atomic write"),
    ATOMIC_READ("atomic read"),
    ATOMIC_UPDATE("atomic update"),
    ATOMIC("atomic");

    private final String label;

    EntryKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
