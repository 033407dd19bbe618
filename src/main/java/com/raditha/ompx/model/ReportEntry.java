package com.raditha.ompx.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One emitted entry of a file report.
 *
 * @param objectId run-wide unique id, assigned at emission time
 * @param kind     entry kind
 * @param fields   ordered payload; each value is a {@code String} or a {@code List<String>}
 */
public record ReportEntry(
        long objectId,
        EntryKind kind,
        Map<String, Object> fields) {

    public ReportEntry {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Key of the entry in the report, also used to reference it from a
     * dependence list.
     */
    public String key() {
        return kind.label() + " - object id : " + objectId;
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value instanceof String s ? s : null;
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(String field) {
        Object value = fields.get(field);
        return value instanceof List<?> ? (List<String>) value : List.of();
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }
}
