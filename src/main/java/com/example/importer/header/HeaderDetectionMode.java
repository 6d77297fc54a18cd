package com.example.importer.header;

import java.util.Locale;

public enum HeaderDetectionMode {
    AUTO("auto"),
    FORCE_HEADER("force_header"),
    FORCE_NO_HEADER("force_no_header");

    private final String value;

    HeaderDetectionMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static HeaderDetectionMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (HeaderDetectionMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown header detection mode: " + value
                + " (expected auto, force_header or force_no_header)");
    }
}
