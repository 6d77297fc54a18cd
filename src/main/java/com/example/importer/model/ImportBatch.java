package com.example.importer.model;

import lombok.Value;

import java.util.List;

@Value
public class ImportBatch {
    int number;
    /** Zero-based index of the first row of this batch among the file's data rows. */
    int firstRowIndex;
    List<List<Object>> rows;

    public int size() {
        return rows.size();
    }
}
