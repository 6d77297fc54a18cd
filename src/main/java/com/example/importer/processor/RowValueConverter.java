package com.example.importer.processor;

import com.example.importer.model.ColumnDefinition;
import com.example.importer.model.SchemaDocument;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Converts raw cell values of one row into the values bound to the INSERT statement.
 * <p>
 * With a matched schema each cell follows the declared type of its column; columns the schema does not declare,
 * and all columns when no schema is known, are written as trimmed strings. Null markers become SQL NULL.
 */
public class RowValueConverter {

    private static final Set<String> NULL_MARKERS = Set.of("", "NULL", "NAN", "NONE", "N/A");

    private final List<String> columns;
    private final List<ValueType> types;
    private final List<ColumnDefinition> definitions;

    public RowValueConverter(List<String> columns, Optional<SchemaDocument> schema) {
        this.columns = List.copyOf(columns);
        this.types = new ArrayList<>(columns.size());
        this.definitions = new ArrayList<>(columns.size());
        for (String column : columns) {
            ColumnDefinition definition = schema.flatMap(doc -> doc.findColumn(column)).orElse(null);
            definitions.add(definition);
            types.add(definition == null ? ValueType.STRING : ValueType.fromDeclaredType(definition.getBaseType()));
        }
    }

    /**
     * @throws ValueConversionException when a cell cannot be converted or a mandatory column is empty
     */
    public List<Object> convert(List<Object> row) {
        List<Object> converted = new ArrayList<>(row.size());
        for (int i = 0; i < row.size(); i++) {
            Object value = convert(row.get(i), types.get(i), columns.get(i));
            ColumnDefinition definition = definitions.get(i);
            if (value == null && definition != null && !definition.isNullable() && !definition.isHasDefault()) {
                throw new ValueConversionException("column " + columns.get(i) + " is NOT NULL but the value is empty");
            }
            converted.add(value);
        }
        return converted;
    }

    private Object convert(Object raw, ValueType type, String column) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number && type == ValueType.NUMBER) {
            return new BigDecimal(raw.toString());
        }
        if (raw instanceof Date && (type == ValueType.DATE || type == ValueType.TIMESTAMP)) {
            return new Timestamp(((Date) raw).getTime());
        }
        String text = raw.toString().trim();
        if (NULL_MARKERS.contains(text.toUpperCase(Locale.ROOT))) {
            return null;
        }
        return switch (type) {
            case NUMBER -> toNumber(text, column);
            case DATE, TIMESTAMP -> toTimestamp(text, column);
            case STRING, RAW -> text;
        };
    }

    private BigDecimal toNumber(String text, String column) {
        try {
            return new BigDecimal(text.replace(",", ""));
        } catch (NumberFormatException e) {
            throw new ValueConversionException("column " + column + ": '" + text + "' is not a number");
        }
    }

    private Timestamp toTimestamp(String text, String column) {
        LocalDateTime parsed = DateTimeParser.parse(text)
                .orElseThrow(() -> new ValueConversionException("column " + column + ": '" + text + "' is not a date"));
        return Timestamp.valueOf(parsed);
    }
}
