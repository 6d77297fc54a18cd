package com.example.importer.header;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Sum-of-products keyword expression such as {@code id,name|code,type}, meaning
 * {@code (id AND name) OR (code AND type)}.
 * <p>
 * Parsed once from configuration; keywords are stored upper-cased and blank items are dropped.
 */
public final class KeywordExpression {

    public static final char GROUP_SEPARATOR = '|';
    public static final char ITEM_SEPARATOR = ',';

    private static final KeywordExpression EMPTY = new KeywordExpression(List.of());

    private final List<List<String>> groups;

    private KeywordExpression(List<List<String>> groups) {
        this.groups = groups;
    }

    public static KeywordExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return EMPTY;
        }
        List<List<String>> groups = new ArrayList<>();
        for (String group : split(expression, GROUP_SEPARATOR)) {
            List<String> keywords = split(group, ITEM_SEPARATOR).stream()
                    .map(String::trim)
                    .filter(keyword -> !keyword.isEmpty())
                    .map(keyword -> keyword.toUpperCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableList());
            if (!keywords.isEmpty()) {
                groups.add(keywords);
            }
        }
        return new KeywordExpression(Collections.unmodifiableList(groups));
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public List<List<String>> getGroups() {
        return groups;
    }

    /**
     * True iff every keyword of at least one group matches some cell.
     */
    public boolean evaluate(List<String> cells, KeywordMatchPolicy policy) {
        List<String> normalized = cells.stream()
                .map(cell -> cell == null ? "" : cell.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());
        for (List<String> group : groups) {
            if (group.stream().allMatch(keyword -> anyCellMatches(keyword, normalized, policy))) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyCellMatches(String keyword, List<String> cells, KeywordMatchPolicy policy) {
        for (String cell : cells) {
            if (policy.matches(keyword, cell)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> split(String value, char separator) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == separator) {
                parts.add(value.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(value.substring(start));
        return parts;
    }

    @Override
    public String toString() {
        return groups.stream()
                .map(group -> group.size() == 1 ? group.get(0) : "(" + String.join(" AND ", group) + ")")
                .collect(Collectors.joining(" OR "));
    }
}
