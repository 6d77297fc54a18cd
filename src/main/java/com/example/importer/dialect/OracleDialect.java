package com.example.importer.dialect;

import com.example.importer.model.ColumnDefinition;
import com.example.importer.model.SchemaDocument;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

public class OracleDialect implements DatabaseDialect {

    protected static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    @Override
    public String insertSql(String table, List<String> columns) {
        String cols = String.join(", ", columns);
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + cols + ") VALUES (" + placeholders + ")";
    }

    @Override
    public String createTableSql(SchemaDocument schema) {
        StringBuilder sb = new StringBuilder();
        sb.append("CREATE TABLE ").append(schema.getTableName()).append(" (\n");
        List<String> colDefs = schema.getColumns().stream()
                .map(this::columnSql)
                .collect(Collectors.toList());
        sb.append(String.join(",\n", colDefs));
        List<String> primaryKeys = schema.getColumns().stream()
                .filter(ColumnDefinition::isPrimaryKey)
                .map(ColumnDefinition::getName)
                .collect(Collectors.toList());
        if (!primaryKeys.isEmpty()) {
            sb.append(",\n    PRIMARY KEY (").append(String.join(", ", primaryKeys)).append(")");
        }
        sb.append("\n)");
        return sb.toString();
    }

    private String columnSql(ColumnDefinition column) {
        StringBuilder sb = new StringBuilder("    ").append(column.getName()).append(' ').append(column.getType());
        if (column.getDefaultValue() != null) {
            sb.append(" DEFAULT ").append(column.getDefaultValue());
        }
        if (!column.isNullable()) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }

    @Override
    public String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Timestamp) {
            return timestampLiteral((Timestamp) value);
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    protected String timestampLiteral(Timestamp value) {
        return "TO_TIMESTAMP('" + value.toLocalDateTime().format(TIMESTAMP_FORMAT) + "', 'YYYY-MM-DD HH24:MI:SS.FF6')";
    }

    @Override
    public String getName() {
        return "oracle";
    }
}
