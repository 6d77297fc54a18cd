package com.example.importer.model;

import java.util.Locale;
import java.util.Optional;

public enum FileFormat {
    CSV("csv"),
    XLS("xls"),
    XLSX("xlsx");

    private final String extension;

    FileFormat(String extension) {
        this.extension = extension;
    }

    public boolean isSpreadsheet() {
        return this != CSV;
    }

    public static Optional<FileFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        for (FileFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
