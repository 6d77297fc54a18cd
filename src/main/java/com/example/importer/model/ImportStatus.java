package com.example.importer.model;

public enum ImportStatus {
    SUCCEEDED,
    PARTIALLY_FAILED,
    FAILED,
    SKIPPED_DRY_RUN;

    public boolean isFailure() {
        return this == FAILED || this == PARTIALLY_FAILED;
    }
}
