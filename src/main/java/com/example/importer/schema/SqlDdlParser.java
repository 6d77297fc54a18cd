package com.example.importer.schema;

import com.example.importer.model.ColumnDefinition;
import com.example.importer.model.SchemaDocument;
import com.example.importer.model.SchemaFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a single {@code CREATE TABLE} statement into ordered column metadata.
 * <p>
 * Comments are ignored, string literals and quoted identifiers are respected while scanning, and table-level
 * {@code PRIMARY KEY} constraints (named or not) flag the referenced columns. Other statements in the document,
 * such as {@code COMMENT ON} or {@code CREATE INDEX}, are ignored.
 */
class SqlDdlParser {

    private static final Pattern CREATE_TABLE = Pattern.compile(
            "\\bCREATE\\s+(?:GLOBAL\\s+TEMPORARY\\s+)?TABLE\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_CONSTRAINT = Pattern.compile(
            "^(CONSTRAINT\\s+\\S+\\s+)?(PRIMARY\\s+KEY|UNIQUE|FOREIGN\\s+KEY|CHECK)\\b.*", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern PRIMARY_KEY_CONSTRAINT = Pattern.compile(
            "^(?:CONSTRAINT\\s+\\S+\\s+)?PRIMARY\\s+KEY\\s*\\((.*)\\).*$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern NOT_NULL = Pattern.compile("\\bNOT\\s+NULL\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFAULT = Pattern.compile("\\bDEFAULT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFAULT_END = Pattern.compile(
            "\\b(?:NOT\\s+NULL|NULL|PRIMARY\\s+KEY|CONSTRAINT|CHECK|UNIQUE|REFERENCES|ENABLE|DISABLE)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern INLINE_PRIMARY_KEY = Pattern.compile("\\bPRIMARY\\s+KEY\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TYPE_SUFFIX = Pattern.compile(
            "^\\s*(WITH\\s+LOCAL\\s+TIME\\s+ZONE|WITH\\s+TIME\\s+ZONE|VARYING(?:\\s*\\([^)]*\\))?)", Pattern.CASE_INSENSITIVE);

    SchemaDocument parse(String text, String sourcePath) throws DdlParseException {
        String sql = stripComments(text);
        Matcher create = CREATE_TABLE.matcher(sql);
        if (!create.find()) {
            throw new DdlParseException(sourcePath, "no CREATE TABLE statement found");
        }
        int nameStart = create.end();
        if (create.find()) {
            throw new DdlParseException(sourcePath, "more than one CREATE TABLE statement found");
        }
        int open = sql.indexOf('(', nameStart);
        if (open < 0) {
            throw new DdlParseException(sourcePath, "no column list found");
        }
        String tableName = unqualify(sql.substring(nameStart, open).trim());
        if (tableName.isEmpty()) {
            throw new DdlParseException(sourcePath, "missing table name");
        }
        int close = findClosingParen(sql, open);
        if (close < 0 || !balancedUpToStatementEnd(sql, close + 1)) {
            throw new DdlParseException(sourcePath, "unbalanced parentheses in CREATE TABLE " + tableName);
        }
        List<String> definitions = splitTopLevel(sql.substring(open + 1, close));
        if (definitions.isEmpty()) {
            throw new DdlParseException(sourcePath, "no column list found in CREATE TABLE " + tableName);
        }

        Map<String, ColumnDefinition> columns = new LinkedHashMap<>();
        Set<String> constraintKeys = new LinkedHashSet<>();
        for (String definition : definitions) {
            if (TABLE_CONSTRAINT.matcher(definition).matches()) {
                Matcher pk = PRIMARY_KEY_CONSTRAINT.matcher(definition);
                if (pk.matches()) {
                    for (String column : pk.group(1).split(",")) {
                        constraintKeys.add(unquote(column.trim()).toUpperCase(Locale.ROOT));
                    }
                }
                continue;
            }
            ColumnDefinition column = parseColumn(definition, columns.size() + 1, sourcePath);
            String key = column.getName().toUpperCase(Locale.ROOT);
            if (columns.containsKey(key)) {
                throw new DdlParseException(sourcePath, "duplicate column " + column.getName() + " in " + tableName);
            }
            columns.put(key, column);
        }
        if (columns.isEmpty()) {
            throw new DdlParseException(sourcePath, "no column definitions in CREATE TABLE " + tableName);
        }
        for (String key : constraintKeys) {
            ColumnDefinition column = columns.get(key);
            if (column == null) {
                throw new DdlParseException(sourcePath, "primary key references unknown column " + key);
            }
            column.setPrimaryKey(true);
            column.setNullable(false);
        }
        return SchemaDocument.builder()
                .tableName(tableName)
                .sourcePath(sourcePath)
                .format(SchemaFormat.SQL)
                .columns(new ArrayList<>(columns.values()))
                .build();
    }

    private ColumnDefinition parseColumn(String definition, int ordinal, String sourcePath) throws DdlParseException {
        String text = definition.trim();
        int nameEnd = identifierEnd(text);
        String name = unquote(text.substring(0, nameEnd));
        String rest = text.substring(nameEnd).trim();
        if (name.isEmpty() || rest.isEmpty()) {
            throw new DdlParseException(sourcePath, "column definition without a type: " + text);
        }
        String type = readType(rest);
        String rawConstraints = rest.substring(type.length());
        String constraints = maskLiterals(rawConstraints);
        boolean primaryKey = INLINE_PRIMARY_KEY.matcher(constraints).find();
        String defaultValue = defaultExpression(rawConstraints, constraints);
        return ColumnDefinition.builder()
                .name(name.toUpperCase(Locale.ROOT))
                .type(type.replaceAll("\\s+", " ").toUpperCase(Locale.ROOT))
                .nullable(!primaryKey && !NOT_NULL.matcher(constraints).find())
                .hasDefault(defaultValue != null)
                .defaultValue(defaultValue)
                .primaryKey(primaryKey)
                .ordinal(ordinal)
                .build();
    }

    private String readType(String rest) {
        int i = 0;
        while (i < rest.length() && (Character.isLetterOrDigit(rest.charAt(i)) || rest.charAt(i) == '_')) {
            i++;
        }
        int j = i;
        while (j < rest.length() && Character.isWhitespace(rest.charAt(j))) {
            j++;
        }
        if (j < rest.length() && rest.charAt(j) == '(') {
            int close = rest.indexOf(')', j);
            i = close < 0 ? rest.length() : close + 1;
        }
        Matcher suffix = TYPE_SUFFIX.matcher(rest.substring(i));
        if (suffix.find()) {
            i += suffix.end();
        }
        return rest.substring(0, i);
    }

    private static int identifierEnd(String text) {
        if (text.startsWith("\"")) {
            int close = text.indexOf('"', 1);
            return close < 0 ? text.length() : close + 1;
        }
        int i = 0;
        while (i < text.length() && !Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    static String unqualify(String name) {
        String trimmed = name.trim();
        int dot = trimmed.lastIndexOf('.');
        return unquote(dot >= 0 ? trimmed.substring(dot + 1) : trimmed);
    }

    static String unquote(String identifier) {
        String trimmed = identifier.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String stripComments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                int end = text.indexOf(c, i + 1);
                end = end < 0 ? text.length() : end + 1;
                out.append(text, i, end);
                i = end;
            } else if (c == '-' && i + 1 < text.length() && text.charAt(i + 1) == '-') {
                int end = text.indexOf('\n', i);
                i = end < 0 ? text.length() : end;
            } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                i = end < 0 ? text.length() : end + 2;
                out.append(' ');
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int findClosingParen(String sql, int open) {
        int depth = 0;
        for (int i = open; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = sql.indexOf(c, i + 1);
                if (end < 0) {
                    return -1;
                }
                i = end;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // table options after the column list, up to the terminating semicolon
    private static boolean balancedUpToStatementEnd(String sql, int from) {
        int depth = 0;
        for (int i = from; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = sql.indexOf(c, i + 1);
                if (end < 0) {
                    return false;
                }
                i = end;
            } else if (c == ';') {
                break;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth < 0) {
                return false;
            }
        }
        return depth == 0;
    }

    private static List<String> splitTopLevel(String body) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\'' || c == '"') {
                int end = body.indexOf(c, i + 1);
                i = end < 0 ? body.length() - 1 : end;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addIfPresent(parts, body.substring(start, i));
                start = i + 1;
            }
        }
        addIfPresent(parts, body.substring(start));
        return parts;
    }

    private static void addIfPresent(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }

    /**
     * Replaces the characters inside string literals with {@code x}, keeping every offset of the text.
     */
    private static String maskLiterals(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean inLiteral = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                inLiteral = !inLiteral;
                out.append(c);
            } else {
                out.append(inLiteral ? 'x' : c);
            }
        }
        return out.toString();
    }

    /**
     * The text between {@code DEFAULT} and the next top-level column constraint, or null without a default.
     * The first token of the expression is never taken as a constraint, so {@code DEFAULT NULL} keeps its value.
     */
    private static String defaultExpression(String raw, String masked) {
        Matcher keyword = DEFAULT.matcher(masked);
        if (!keyword.find()) {
            return null;
        }
        int start = keyword.end();
        int first = start;
        while (first < masked.length() && Character.isWhitespace(masked.charAt(first))) {
            first++;
        }
        int stop = masked.length();
        Matcher end = DEFAULT_END.matcher(masked);
        int from = first;
        while (from < masked.length() && end.find(from)) {
            if (end.start() > first && depth(masked, start, end.start()) == 0) {
                stop = end.start();
                break;
            }
            from = end.end();
        }
        String expression = raw.substring(start, stop).trim();
        return expression.isEmpty() ? null : expression;
    }

    private static int depth(String text, int from, int to) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
        }
        return depth;
    }
}
