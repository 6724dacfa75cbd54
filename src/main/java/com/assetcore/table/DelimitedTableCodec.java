package com.assetcore.table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DelimitedTableCodec {
    static final char[] CANDIDATE_DELIMITERS = { ',', ';', '\t', '|' };
    static final char OUTPUT_DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private DelimitedTableCodec() {
    }

    public static char sniffDelimiter(String firstLine) {
        if (firstLine == null || firstLine.isEmpty()) {
            return OUTPUT_DELIMITER;
        }
        char best = CANDIDATE_DELIMITERS[0];
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = splitFields(firstLine, candidate).size();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    public static TableGrid parse(String text) {
        if (text == null) {
            throw new EmptyInputException("No table data: input is null");
        }
        List<String> records = splitRecords(stripByteOrderMark(text));
        if (records.isEmpty()) {
            throw new EmptyInputException("No table data: input contains no non-blank lines");
        }

        char delimiter = sniffDelimiter(records.get(0));
        List<String> header = splitFields(records.get(0), delimiter);

        List<TableColumn> columns = new ArrayList<>(header.size() + 1);
        columns.add(TableColumn.rowNumber());
        for (int i = 0; i < header.size(); i++) {
            columns.add(TableColumn.data(i, header.get(i).trim()));
        }

        List<TableRow> rows = new ArrayList<>(records.size() - 1);
        for (int r = 1; r < records.size(); r++) {
            List<String> cells = splitFields(records.get(r), delimiter);
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                values.put(columns.get(c + 1).key(), c < cells.size() ? cells.get(c) : "");
            }
            rows.add(new TableRow(r, values));
        }
        return new TableGrid(columns, rows, delimiter);
    }

    public static String serialize(TableGrid grid) {
        List<TableColumn> dataColumns = grid.dataColumns();
        List<String> lines = new ArrayList<>(grid.rowCount() + 1);

        List<String> header = new ArrayList<>(dataColumns.size());
        for (TableColumn column : dataColumns) {
            header.add(quote(column.name()));
        }
        lines.add(String.join(String.valueOf(OUTPUT_DELIMITER), header));

        for (TableRow row : grid.rows()) {
            List<String> cells = new ArrayList<>(dataColumns.size());
            for (TableColumn column : dataColumns) {
                cells.add(escape(row.value(column.key())));
            }
            String line = String.join(String.valueOf(OUTPUT_DELIMITER), cells);
            if (line.isBlank() && !cells.isEmpty()) {
                // a blank line would be dropped on the way back in
                cells.set(0, quote(row.value(dataColumns.get(0).key())));
                line = String.join(String.valueOf(OUTPUT_DELIMITER), cells);
            }
            lines.add(line);
        }
        return String.join("\n", lines);
    }

    static List<String> splitRecords(String text) {
        List<String> records = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == QUOTE) {
                inQuotes = !inQuotes;
                current.append(c);
            } else if (c == '\n' && !inQuotes) {
                addRecord(records, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addRecord(records, current);
        return records;
    }

    static List<String> splitFields(String line, char delimiter) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == QUOTE) {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                    current.append(QUOTE);
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == delimiter && !inQuotes) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    private static void addRecord(List<String> records, StringBuilder current) {
        int end = current.length();
        if (end > 0 && current.charAt(end - 1) == '\r') {
            end--;
        }
        String record = current.substring(0, end);
        if (!record.isBlank()) {
            records.add(record);
        }
    }

    private static String escape(String value) {
        if (value.indexOf(OUTPUT_DELIMITER) >= 0
                || value.indexOf(QUOTE) >= 0
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0) {
            return quote(value);
        }
        return value;
    }

    private static String quote(String value) {
        return QUOTE + value.replace("\"", "\"\"") + QUOTE;
    }

    private static String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }
}
