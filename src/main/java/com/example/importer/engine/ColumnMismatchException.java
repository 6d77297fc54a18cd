package com.example.importer.engine;

import lombok.Getter;

/**
 * No usable column mapping between a file and its table. Fatal to that file only.
 */
@Getter
public class ColumnMismatchException extends RuntimeException {

    private final String tableName;
    private final String fileName;

    public ColumnMismatchException(String tableName, String fileName, String detail) {
        super("Cannot map columns of " + fileName + " to table " + tableName + ": " + detail);
        this.tableName = tableName;
        this.fileName = fileName;
    }
}
