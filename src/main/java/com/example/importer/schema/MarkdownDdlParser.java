package com.example.importer.schema;

import com.example.importer.model.ColumnDefinition;
import com.example.importer.model.SchemaDocument;
import com.example.importer.model.SchemaFormat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the first pipe-delimited table of a markdown document.
 * <p>
 * The header row must name a column and a type; optional nullable, default and primary-key columns are read when
 * present. The table name comes from a {@code Table: NAME} line or heading, else from a heading that is a single
 * identifier, else from the file stem. Headings with prose, such as document titles, never name the table.
 */
class MarkdownDdlParser {

    private static final Set<String> NAME_HEADERS = Set.of("NAME", "COLUMN", "COLUMN_NAME", "FIELD");
    private static final Set<String> TYPE_HEADERS = Set.of("TYPE", "DATA_TYPE", "DATATYPE");
    private static final Set<String> NULLABLE_HEADERS = Set.of("NULLABLE", "NULL", "NULLS");
    private static final Set<String> DEFAULT_HEADERS = Set.of("DEFAULT", "DEFAULT_VALUE");
    private static final Set<String> KEY_HEADERS = Set.of("PRIMARY_KEY", "PK", "KEY");
    private static final Set<String> TRUE_VALUES = Set.of("Y", "YES", "TRUE", "X", "PK", "1");

    private static final Pattern TABLE_HEADING = Pattern.compile(
            "^#+\\s*TABLE(?:\\s*[:：]\\s*|\\s+)`?([A-Za-z0-9_.\"$]+)`?(?:\\s.*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_LINE = Pattern.compile(
            "^(?:\\*\\*)?TABLE(?:\\*\\*)?\\s*[:：]\\s*(?:\\*\\*)?`?([A-Za-z0-9_.\"$]+)`?(?:\\s.*|\\*\\*.*)?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAIN_HEADING = Pattern.compile("^#+\\s*`?([A-Za-z0-9_.\"$]+)`?\\s*$");
    private static final Pattern SEPARATOR_CELL = Pattern.compile("^:?-{3,}:?$");

    SchemaDocument parse(String text, String sourcePath, String fallbackTableName) throws DdlParseException {
        String declaredName = null;
        String headingName = null;
        List<List<String>> tableRows = new ArrayList<>();
        boolean inTable = false;
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (line.startsWith("|")) {
                inTable = true;
                tableRows.add(cells(line));
                continue;
            }
            if (inTable) {
                break;
            }
            if (declaredName == null) {
                declaredName = declaredTableName(line);
            }
            if (headingName == null) {
                Matcher heading = PLAIN_HEADING.matcher(line);
                if (heading.matches()) {
                    headingName = SqlDdlParser.unqualify(heading.group(1));
                }
            }
        }
        if (tableRows.isEmpty()) {
            throw new DdlParseException(sourcePath, "no pipe table found");
        }
        String tableName = declaredName != null ? declaredName : headingName;
        if (tableName == null || tableName.isEmpty()) {
            tableName = fallbackTableName;
        }

        List<String> header = normalizeHeader(tableRows.get(0));
        int nameIdx = indexOf(header, NAME_HEADERS);
        int typeIdx = indexOf(header, TYPE_HEADERS);
        if (nameIdx < 0 || typeIdx < 0) {
            throw new DdlParseException(sourcePath, "table header must name at least 'name' and 'type' columns, found " + header);
        }
        int nullableIdx = indexOf(header, NULLABLE_HEADERS);
        int defaultIdx = indexOf(header, DEFAULT_HEADERS);
        int keyIdx = indexOf(header, KEY_HEADERS);

        List<ColumnDefinition> columns = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (List<String> row : tableRows.subList(1, tableRows.size())) {
            if (isSeparator(row)) {
                continue;
            }
            String name = SqlDdlParser.unquote(cell(row, nameIdx).replace("`", "")).toUpperCase(Locale.ROOT);
            String type = cell(row, typeIdx).replace("`", "").toUpperCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            if (type.isEmpty()) {
                throw new DdlParseException(sourcePath, "column " + name + " has no type");
            }
            if (!seen.add(name)) {
                throw new DdlParseException(sourcePath, "duplicate column " + name + " in " + tableName);
            }
            boolean primaryKey = keyIdx >= 0 && isTrue(cell(row, keyIdx));
            String defaultValue = defaultIdx >= 0 && hasValue(cell(row, defaultIdx))
                    ? cell(row, defaultIdx).replace("`", "")
                    : null;
            columns.add(ColumnDefinition.builder()
                    .name(name)
                    .type(type)
                    .nullable(!primaryKey && (nullableIdx < 0 || isNullable(cell(row, nullableIdx))))
                    .hasDefault(defaultValue != null)
                    .defaultValue(defaultValue)
                    .primaryKey(primaryKey)
                    .ordinal(columns.size() + 1)
                    .build());
        }
        if (columns.isEmpty()) {
            throw new DdlParseException(sourcePath, "no column rows in markdown table");
        }
        return SchemaDocument.builder()
                .tableName(tableName)
                .sourcePath(sourcePath)
                .format(SchemaFormat.MARKDOWN)
                .columns(columns)
                .build();
    }

    private static String declaredTableName(String line) {
        Matcher heading = TABLE_HEADING.matcher(line);
        if (heading.matches()) {
            return SqlDdlParser.unqualify(heading.group(1));
        }
        Matcher tableLine = TABLE_LINE.matcher(line);
        if (tableLine.matches()) {
            return SqlDdlParser.unqualify(tableLine.group(1));
        }
        return null;
    }

    private static List<String> cells(String line) {
        String body = line.substring(1);
        if (body.endsWith("|")) {
            body = body.substring(0, body.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        for (String cell : body.split("\\|", -1)) {
            cells.add(cell.trim());
        }
        return cells;
    }

    private static List<String> normalizeHeader(List<String> header) {
        List<String> normalized = new ArrayList<>();
        for (String cell : header) {
            normalized.add(cell.replace("*", "").trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_"));
        }
        return normalized;
    }

    private static int indexOf(List<String> header, Set<String> aliases) {
        for (int i = 0; i < header.size(); i++) {
            if (aliases.contains(header.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isSeparator(List<String> row) {
        return row.stream().allMatch(cell -> cell.isEmpty() || SEPARATOR_CELL.matcher(cell).matches());
    }

    private static String cell(List<String> row, int index) {
        return index < row.size() ? row.get(index).trim() : "";
    }

    private static boolean isTrue(String value) {
        return TRUE_VALUES.contains(value.toUpperCase(Locale.ROOT));
    }

    private static boolean isNullable(String value) {
        String upper = value.toUpperCase(Locale.ROOT);
        if (upper.isEmpty()) {
            return true;
        }
        return !(upper.equals("N") || upper.equals("NO") || upper.equals("FALSE") || upper.equals("NOT NULL"));
    }

    private static boolean hasValue(String value) {
        return !value.isEmpty() && !value.equals("-") && !value.equalsIgnoreCase("NONE");
    }
}
