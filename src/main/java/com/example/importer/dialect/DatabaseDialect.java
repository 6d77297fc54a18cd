package com.example.importer.dialect;

import com.example.importer.model.SchemaDocument;

import java.util.List;

public interface DatabaseDialect {

    String insertSql(String table, List<String> columns);

    String createTableSql(SchemaDocument schema);

    /**
     * Renders a bound value as an SQL literal for generated scripts.
     */
    String literal(Object value);

    String getName();
}
