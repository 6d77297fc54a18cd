package com.example.importer.model;

import lombok.Getter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-file outcome. Counters only grow while batches are processed; {@link #finish} fixes the status.
 */
@Getter
public class ImportResult implements Serializable {

    private final String fileName;
    private final String tableName;
    private int rowsAttempted;
    private int rowsCommitted;
    private int rowsFailed;
    private int batchesSucceeded;
    private int batchesFailed;
    private final Map<Integer, Integer> batchRetries = new LinkedHashMap<>();
    private final List<RowFailure> rowFailures = new ArrayList<>();
    private final List<String> messages = new ArrayList<>();
    private boolean duplicateImport;
    private ImportStatus status;

    public ImportResult(String fileName, String tableName) {
        this.fileName = fileName;
        this.tableName = tableName;
    }

    public static ImportResult failed(String fileName, String tableName, String message) {
        ImportResult result = new ImportResult(fileName, tableName);
        result.addMessage(message);
        result.status = ImportStatus.FAILED;
        return result;
    }

    public void recordAttempted(int rows) {
        rowsAttempted += rows;
    }

    public void recordRowFailure(RowFailure failure) {
        rowFailures.add(failure);
        rowsFailed++;
    }

    public void recordBatchWritten(int rows) {
        batchesSucceeded++;
        rowsCommitted += rows;
    }

    public void recordBatchFailed(int rows, String message) {
        batchesFailed++;
        rowsFailed += rows;
        addMessage(message);
    }

    public void recordRetry(int batchNumber) {
        batchRetries.merge(batchNumber, 1, Integer::sum);
    }

    /**
     * Moves rows counted as committed to failed, used when uncommitted work is rolled back.
     */
    public void revokeCommitted(int rows, String message) {
        int revoked = Math.min(rows, rowsCommitted);
        rowsCommitted -= revoked;
        rowsFailed += revoked;
        batchesFailed += batchesSucceeded;
        batchesSucceeded = 0;
        addMessage(message);
    }

    public void markDuplicateImport(String message) {
        duplicateImport = true;
        addMessage(message);
    }

    public void addMessage(String message) {
        if (message != null && !message.isBlank()) {
            messages.add(message);
        }
    }

    public int getTotalRetries() {
        return batchRetries.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<Integer, Integer> getBatchRetries() {
        return Collections.unmodifiableMap(batchRetries);
    }

    public List<RowFailure> getRowFailures() {
        return Collections.unmodifiableList(rowFailures);
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public ImportStatus finish(boolean dryRun) {
        if (dryRun) {
            status = ImportStatus.SKIPPED_DRY_RUN;
        } else if (rowsFailed == 0 && batchesFailed == 0) {
            status = ImportStatus.SUCCEEDED;
        } else if (rowsCommitted > 0) {
            status = ImportStatus.PARTIALLY_FAILED;
        } else {
            status = ImportStatus.FAILED;
        }
        return status;
    }

    @Override
    public String toString() {
        return String.format("%s -> %s: %s (attempted=%d, committed=%d, failed=%d, retries=%d)",
                fileName, tableName, status, rowsAttempted, rowsCommitted, rowsFailed, getTotalRetries());
    }
}
