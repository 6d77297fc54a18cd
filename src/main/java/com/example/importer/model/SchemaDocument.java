package com.example.importer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Column metadata recovered from one externally supplied DDL document.
 */
@Value
@Builder
public class SchemaDocument implements Serializable {

    public static final Set<String> DEFAULT_AUDIT_COLUMNS =
            Set.of("CREATED_BY", "CREATE_TIMESTAMP", "UPDATED_BY", "UPDATE_TIMESTAMP");

    String tableName;
    String sourcePath;
    SchemaFormat format;
    @Singular
    List<ColumnDefinition> columns;
    @Builder.Default
    Set<String> auditColumns = DEFAULT_AUDIT_COLUMNS;

    public List<String> columnNames() {
        return columns.stream().map(ColumnDefinition::getName).collect(Collectors.toList());
    }

    public boolean isAuditColumn(String columnName) {
        return columnName != null && auditColumns.contains(columnName.toUpperCase(Locale.ROOT));
    }

    /**
     * Non-audit column names in declaration order.
     */
    public List<String> dataColumnNames() {
        return columns.stream()
                .map(ColumnDefinition::getName)
                .filter(name -> !isAuditColumn(name))
                .collect(Collectors.toList());
    }

    public Optional<ColumnDefinition> findColumn(String columnName) {
        return columns.stream()
                .filter(col -> col.getName().equalsIgnoreCase(columnName))
                .findFirst();
    }

    public SchemaDocument withAuditColumns(Set<String> names) {
        Set<String> upper = names.stream()
                .map(name -> name.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        return new SchemaDocument(tableName, sourcePath, format, columns, upper);
    }
}
