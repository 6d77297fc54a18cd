package com.example.importer.engine;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one file import. Once writing has begun the file never returns to {@link #VALIDATING}.
 */
public enum FileImportState {
    PENDING,
    VALIDATING,
    WRITING,
    RETRYING,
    SUCCEEDED,
    PARTIALLY_FAILED,
    FAILED,
    SKIPPED;

    public boolean canMoveTo(FileImportState next) {
        return allowedNext().contains(next);
    }

    private Set<FileImportState> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(VALIDATING, FAILED);
            case VALIDATING:
                return EnumSet.of(WRITING, SKIPPED, SUCCEEDED, FAILED);
            case WRITING:
                return EnumSet.of(RETRYING, SUCCEEDED, PARTIALLY_FAILED, FAILED);
            case RETRYING:
                return EnumSet.of(WRITING, PARTIALLY_FAILED, FAILED);
            default:
                return EnumSet.noneOf(FileImportState.class);
        }
    }
}
