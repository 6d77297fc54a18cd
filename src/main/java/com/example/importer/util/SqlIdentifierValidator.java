package com.example.importer.util;

import java.util.regex.Pattern;

public final class SqlIdentifierValidator {

    public static final int MAX_IDENTIFIER_LENGTH = 30;

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    private SqlIdentifierValidator() {
    }

    public static boolean isValid(String identifier) {
        return identifier != null
                && identifier.length() <= MAX_IDENTIFIER_LENGTH
                && IDENTIFIER_PATTERN.matcher(identifier).matches();
    }

    public static void validate(String identifier) {
        if (!isValid(identifier)) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
    }
}
