package com.raditha.ompx.model;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Running totals for one source file. Nothing here is ever reset: a loop entry
 * samples the values accumulated since the start of the file.
 */
public class OperatorStatistics {

    private final Map<Counter, Integer> counts = new EnumMap<>(Counter.class);
    private final Set<String> referencedNames = new HashSet<>();
    private int distinctReferences;
    private int totalReferences;

    public OperatorStatistics() {
        for (Counter counter : Counter.values()) {
            counts.put(counter, 0);
        }
    }

    public void increment(Counter counter) {
        counts.merge(counter, 1, Integer::sum);
    }

    /**
     * Record one reference to a declared name.
     */
    public void recordReference(String name) {
        totalReferences++;
        if (referencedNames.add(name)) {
            distinctReferences++;
        }
    }

    public int get(Counter counter) {
        return counts.get(counter);
    }

    public int getDistinctReferences() {
        return distinctReferences;
    }

    public int getTotalReferences() {
        return totalReferences;
    }
}
