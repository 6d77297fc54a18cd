package com.example.importer.processor;

import java.util.Locale;
import java.util.Set;

public enum ValueType {
    STRING,
    NUMBER,
    DATE,
    TIMESTAMP,
    RAW;

    private static final Set<String> STRING_TYPES = Set.of(
            "VARCHAR2", "VARCHAR", "NVARCHAR2", "CHAR", "NCHAR", "CLOB", "NCLOB", "TEXT", "STRING", "CHARACTER", "LONG");
    private static final Set<String> NUMBER_TYPES = Set.of(
            "NUMBER", "NUMERIC", "DECIMAL", "INTEGER", "INT", "SMALLINT", "BIGINT", "FLOAT", "REAL",
            "DOUBLE", "BINARY_FLOAT", "BINARY_DOUBLE");

    /**
     * Maps a declared base type such as {@code VARCHAR2} or {@code NUMBER} to the value type written to the database.
     */
    public static ValueType fromDeclaredType(String baseType) {
        String type = baseType == null ? "" : baseType.trim().toUpperCase(Locale.ROOT);
        if (type.startsWith("TIMESTAMP")) {
            return TIMESTAMP;
        }
        if (type.equals("DATE")) {
            return DATE;
        }
        if (NUMBER_TYPES.contains(type)) {
            return NUMBER;
        }
        if (STRING_TYPES.contains(type) || type.startsWith("CHARACTER")) {
            return STRING;
        }
        return RAW;
    }
}
