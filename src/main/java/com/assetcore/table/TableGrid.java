package com.assetcore.table;

import java.util.ArrayList;
import java.util.List;

public record TableGrid(List<TableColumn> columns, List<TableRow> rows, char sourceDelimiter) {

    public TableGrid {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
        if (columns.isEmpty() || !columns.get(0).isRowNumber()) {
            throw new IllegalArgumentException("First column must be the row-number column");
        }
    }

    public List<TableColumn> dataColumns() {
        return columns.subList(1, columns.size());
    }

    public int rowCount() {
        return rows.size();
    }

    public TableGrid withCell(int rowIndex, String columnKey, String value) {
        if (rowIndex < 0 || rowIndex >= rows.size()) {
            throw new IndexOutOfBoundsException("Row index " + rowIndex + " outside 0.." + (rows.size() - 1));
        }
        if (TableColumn.ROW_NUMBER_KEY.equals(columnKey)) {
            throw new IllegalArgumentException("Row-number column is read-only");
        }
        List<TableRow> updated = new ArrayList<>(rows);
        updated.set(rowIndex, rows.get(rowIndex).with(columnKey, value));
        return new TableGrid(columns, updated, sourceDelimiter);
    }
}
