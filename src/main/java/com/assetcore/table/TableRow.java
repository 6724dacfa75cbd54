package com.assetcore.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TableRow(int rowNumber, Map<String, String> values) {

    public TableRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String value(String columnKey) {
        return values.getOrDefault(columnKey, "");
    }

    public TableRow with(String columnKey, String value) {
        if (!values.containsKey(columnKey)) {
            throw new IllegalArgumentException("Unknown column key: " + columnKey);
        }
        Map<String, String> updated = new LinkedHashMap<>(values);
        updated.put(columnKey, value == null ? "" : value);
        return new TableRow(rowNumber, updated);
    }
}
