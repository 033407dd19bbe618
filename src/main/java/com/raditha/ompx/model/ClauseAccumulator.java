package com.raditha.ompx.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Clause state threaded through one association walk.
 * <p>
 * A single instance is shared and mutated by every recursive step that starts
 * from the same top-level directive, so values set while visiting one nested
 * directive remain visible to siblings visited afterwards.
 * <p>
 * Presence and value are separate: a flag explicitly set to {@code false} is
 * still present, which matters when deciding whether clause state propagates.
 */
public class ClauseAccumulator {

    private final Map<ClauseBucket, Object> values;

    public ClauseAccumulator() {
        this.values = new EnumMap<>(ClauseBucket.class);
    }

    private ClauseAccumulator(Map<ClauseBucket, Object> values) {
        this.values = values;
    }

    public boolean contains(ClauseBucket bucket) {
        return values.containsKey(bucket);
    }

    public void setFlag(ClauseBucket bucket, boolean value) {
        values.put(bucket, value);
    }

    /**
     * Flag value, {@code false} when the bucket is absent or not a flag.
     */
    public boolean isTrue(ClauseBucket bucket) {
        return Boolean.TRUE.equals(values.get(bucket));
    }

    public void setScalar(ClauseBucket bucket, String value) {
        values.put(bucket, value);
    }

    public Optional<String> getScalar(ClauseBucket bucket) {
        Object value = values.get(bucket);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /**
     * Replace the list held by a bucket.
     */
    public void setList(ClauseBucket bucket, List<String> items) {
        values.put(bucket, new ArrayList<>(items));
    }

    /**
     * Append one item, creating the list if the bucket is empty.
     */
    public void append(ClauseBucket bucket, String item) {
        Object current = values.get(bucket);
        if (current instanceof List<?>) {
            @SuppressWarnings("unchecked")
            List<String> list = (List<String>) current;
            list.add(item);
        } else {
            List<String> list = new ArrayList<>();
            list.add(item);
            values.put(bucket, list);
        }
    }

    public List<String> getList(ClauseBucket bucket) {
        Object value = values.get(bucket);
        if (value instanceof List<?>) {
            @SuppressWarnings("unchecked")
            List<String> list = (List<String>) value;
            return Collections.unmodifiableList(list);
        }
        return List.of();
    }

    /**
     * Independent copy, used when an entry is emitted so that later changes do
     * not reach an entry already written.
     */
    public ClauseAccumulator snapshot() {
        Map<ClauseBucket, Object> copy = new EnumMap<>(ClauseBucket.class);
        values.forEach((bucket, value) -> {
            if (value instanceof List<?> list) {
                copy.put(bucket, new ArrayList<>(list));
            } else {
                copy.put(bucket, value);
            }
        });
        return new ClauseAccumulator(copy);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
