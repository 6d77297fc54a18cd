package com.example.importer.model;

import lombok.Getter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
public class ImportRunSummary implements Serializable {

    private final List<ImportResult> results = new ArrayList<>();
    private final List<String> schemaErrors = new ArrayList<>();

    public synchronized void add(ImportResult result) {
        results.add(result);
    }

    public void addSchemaErrors(List<String> errors) {
        schemaErrors.addAll(errors);
    }

    public synchronized List<ImportResult> getResults() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    public List<String> getSchemaErrors() {
        return Collections.unmodifiableList(schemaErrors);
    }

    public synchronized long count(ImportStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    public synchronized int totalRowsAttempted() {
        return results.stream().mapToInt(ImportResult::getRowsAttempted).sum();
    }

    public synchronized int totalRowsCommitted() {
        return results.stream().mapToInt(ImportResult::getRowsCommitted).sum();
    }

    public synchronized int totalRowsFailed() {
        return results.stream().mapToInt(ImportResult::getRowsFailed).sum();
    }

    public synchronized boolean hasFailures() {
        return results.stream().anyMatch(r -> r.getStatus() != null && r.getStatus().isFailure());
    }
}
