package com.example.importer.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fully read input file. Rows hold scalar cell values in file order and are never modified.
 */
@Value
public class DataFile {
    Path path;
    FileFormat format;
    List<List<Object>> rows;

    public DataFile(Path path, FileFormat format, List<List<Object>> rows) {
        this.path = path;
        this.format = format;
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public String getFileName() {
        return path.getFileName().toString();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> firstRowAsText() {
        if (rows.isEmpty()) {
            return List.of();
        }
        List<String> cells = new ArrayList<>();
        for (Object value : rows.get(0)) {
            cells.add(value == null ? "" : value.toString());
        }
        return cells;
    }
}
