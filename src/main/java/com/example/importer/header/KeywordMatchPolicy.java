package com.example.importer.header;

import java.util.Locale;

/**
 * How a configured keyword is compared with a cell of the first row. Both sides are compared case-insensitively.
 */
public enum KeywordMatchPolicy {
    /** The keyword must equal a whole trimmed cell. */
    EXACT,
    /** The keyword may appear anywhere inside a cell. */
    CONTAINS;

    public boolean matches(String keyword, String cell) {
        return this == EXACT ? cell.equals(keyword) : cell.contains(keyword);
    }

    public static KeywordMatchPolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return EXACT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown keyword match policy: " + value
                    + " (expected exact or contains)", e);
        }
    }
}
