package com.example.importer.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Character-level cleanup shared by table names and header cells.
 * <p>
 * Every character outside {@code [A-Za-z0-9_]} becomes {@code _} and runs of {@code _} collapse into one.
 */
public final class IdentifierSanitizer {

    private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_{2,}");

    private IdentifierSanitizer() {
    }

    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String replaced = INVALID_CHARS.matcher(raw.trim()).replaceAll("_");
        return UNDERSCORE_RUN.matcher(replaced).replaceAll("_").toUpperCase(Locale.ROOT);
    }

    public static String collapse(String value) {
        return UNDERSCORE_RUN.matcher(value).replaceAll("_");
    }

    /**
     * Column-name form of a header cell: sanitized, uppercased, without leading or trailing underscores.
     */
    public static String columnName(String rawHeader) {
        String cleaned = sanitize(rawHeader);
        int start = 0;
        int end = cleaned.length();
        while (start < end && cleaned.charAt(start) == '_') {
            start++;
        }
        while (end > start && cleaned.charAt(end - 1) == '_') {
            end--;
        }
        return cleaned.substring(start, end);
    }
}
