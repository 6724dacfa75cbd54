package com.assetcore.table;

import java.util.Objects;

public record TableColumn(String key, String name) {
    public static final String ROW_NUMBER_KEY = "rowNum";
    public static final String ROW_NUMBER_NAME = "#";

    public TableColumn {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(name, "name");
    }

    public static TableColumn rowNumber() {
        return new TableColumn(ROW_NUMBER_KEY, ROW_NUMBER_NAME);
    }

    public static TableColumn data(int index, String name) {
        return new TableColumn("col_" + index, name);
    }

    public boolean isRowNumber() {
        return ROW_NUMBER_KEY.equals(key);
    }
}
