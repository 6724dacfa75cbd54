package com.assetcore.table;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TableEditSession {
    private static final Logger log = LoggerFactory.getLogger(TableEditSession.class);

    private final String originalText;
    private TableGrid current;
    private boolean changed;

    public TableEditSession(String originalText) {
        this.originalText = originalText;
        this.current = DelimitedTableCodec.parse(originalText);
    }

    public TableGrid grid() {
        return current;
    }

    public boolean hasChanges() {
        return changed;
    }

    public void editCell(int rowIndex, String columnKey, String value) {
        TableGrid updated = current.withCell(rowIndex, columnKey, value);
        if (!updated.equals(current)) {
            current = updated;
            changed = true;
        }
    }

    public void discard() {
        current = DelimitedTableCodec.parse(originalText);
        changed = false;
    }

    public String exportText() {
        return changed ? DelimitedTableCodec.serialize(current) : originalText;
    }

    public Path exportTo(Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, exportText(), StandardCharsets.UTF_8);
        log.info("table.export path={} rows={} changed={}", target, current.rowCount(), changed);
        return target;
    }
}
